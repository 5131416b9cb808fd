package org.kleis.verify.ast;

import lombok.Getter;

import java.util.Objects;

/**
 * 编辑器中尚未填写的占位符 □。不能被任何求解器翻译。
 */
@Getter
public final class Placeholder extends Expression {

    private final int id;
    private final String hint;

    private Placeholder(int id, String hint) {
        this.id = id;
        this.hint = hint == null ? "" : hint;
    }

    public static Placeholder of(int id, String hint) {
        return new Placeholder(id, hint);
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.PLACEHOLDER;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Placeholder that = (Placeholder) o;
        return id == that.id && hint.equals(that.hint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ExpressionKind.PLACEHOLDER, id, hint);
    }

    @Override
    public String toString() {
        return "□";
    }
}
