package org.kleis.verify.ast;

import lombok.Getter;

import java.util.Objects;

@Getter
public final class StringLiteral extends Expression {

    private final String value;

    private StringLiteral(String value) {
        this.value = Objects.requireNonNull(value, "StringLiteral-构造函数: value 不能为 null");
    }

    public static StringLiteral of(String value) {
        return new StringLiteral(value);
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.STRING;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value.equals(((StringLiteral) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ExpressionKind.STRING, value);
    }

    @Override
    public String toString() {
        return "\"" + value.replace("\"", "\\\"") + "\"";
    }
}
