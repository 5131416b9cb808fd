package org.kleis.verify.solvers.capabilities;

import org.kleis.verify.KleisException;

/**
 * 能力清单缺失或格式错误。
 */
public class CapabilityException extends KleisException {

    public CapabilityException(String message) {
        super(message);
    }

    public CapabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
