package org.kleis.verify.verifier;

import org.kleis.verify.KleisException;

/**
 * 编排层的错误，例如已加载公理互相矛盾。
 */
public class VerifierException extends KleisException {

    public VerifierException(String message) {
        super(message);
    }

    public VerifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
