package org.kleis.verify.solvers;

import lombok.Getter;
import org.kleis.verify.KleisException;

/**
 * 表达式翻译失败。只影响当前调用，不会留下半更新的后端状态。
 */
@Getter
public class TranslationException extends KleisException {

    public enum Kind {
        UNDEFINED_SYMBOL,
        TYPE_MISMATCH,
        ARITY_MISMATCH,
        UNSUPPORTED,
        MALFORMED_LITERAL
    }

    private final Kind kind;

    public TranslationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public static TranslationException undefinedSymbol(String name) {
        return new TranslationException(Kind.UNDEFINED_SYMBOL, "Undefined symbol '" + name
                + "': not a bound variable, identity element or data constructor");
    }

    public static TranslationException typeMismatch(String message) {
        return new TranslationException(Kind.TYPE_MISMATCH, message);
    }

    public static TranslationException arity(String operation, int expected, int actual) {
        return new TranslationException(Kind.ARITY_MISMATCH,
                operation + " requires " + expected + " argument(s), got " + actual);
    }

    public static TranslationException unsupported(String message) {
        return new TranslationException(Kind.UNSUPPORTED, message);
    }
}
