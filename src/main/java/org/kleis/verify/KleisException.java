package org.kleis.verify;

/**
 * 验证核心所有领域异常的基类。
 * 求解器返回 Unknown 不是异常，只有显式错误才会抛出此类异常。
 */
public class KleisException extends RuntimeException {

    public KleisException(String message) {
        super(message);
    }

    public KleisException(String message, Throwable cause) {
        super(message, cause);
    }
}
