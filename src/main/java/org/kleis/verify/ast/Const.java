package org.kleis.verify.ast;

import lombok.Getter;

import java.util.Objects;

/**
 * 数值常量，以文本形式保存（例如 "0"、"42"、"1.5"、"-3"）。
 */
@Getter
public final class Const extends Expression {

    private final String value;

    private Const(String value) {
        this.value = Objects.requireNonNull(value, "Const-构造函数: value 不能为 null");
    }

    public static Const of(String value) {
        return new Const(value);
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.CONST;
    }

    /**
     * @return 是否为整数字面量（可带负号）。
     */
    public boolean isInteger() {
        return value.matches("-?\\d+");
    }

    /**
     * @return 是否为十进制小数字面量。
     */
    public boolean isDecimal() {
        return value.matches("-?\\d+\\.\\d+");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value.equals(((Const) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ExpressionKind.CONST, value);
    }

    @Override
    public String toString() {
        return value;
    }
}
