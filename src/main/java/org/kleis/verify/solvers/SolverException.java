package org.kleis.verify.solvers;

import lombok.Getter;
import org.kleis.verify.KleisException;

/**
 * 求解器后端的显式错误。Kind 区分超时、未定义符号、类型错误和一般证明失败，
 * 便于调用方决定重试、补充公理或放弃。
 */
@Getter
public class SolverException extends KleisException {

    public enum Kind {
        TIMEOUT,
        UNDEFINED_SYMBOL,
        TYPE_ERROR,
        PROOF_FAILED,
        SYNTAX_ERROR,
        CONNECTION,
        PROTOCOL,
        UNSUPPORTED,
        INTERNAL
    }

    private final Kind kind;

    public SolverException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SolverException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    @Override
    public String toString() {
        return "SolverException[" + kind + "]: " + getMessage();
    }
}
