package org.kleis.verify.solvers;

import org.kleis.verify.KleisException;

/**
 * 求解器值无法转换为所要求的 Java 类型。
 */
public class ConversionException extends KleisException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
