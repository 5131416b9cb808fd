package org.kleis.verify.ast;

import lombok.Getter;

import java.util.Objects;

/**
 * 类型标注 (expr : T)。对求解器透明。
 */
@Getter
public final class Ascription extends Expression {

    private final Expression expression;
    private final String typeAnnotation;

    private Ascription(Expression expression, String typeAnnotation) {
        this.expression = Objects.requireNonNull(expression, "Ascription-构造函数: expression 不能为 null");
        this.typeAnnotation = Objects.requireNonNull(typeAnnotation, "Ascription-构造函数: typeAnnotation 不能为 null");
    }

    public static Ascription of(Expression expression, String typeAnnotation) {
        return new Ascription(expression, typeAnnotation);
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.ASCRIPTION;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Ascription that = (Ascription) o;
        return expression.equals(that.expression) && typeAnnotation.equals(that.typeAnnotation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ExpressionKind.ASCRIPTION, expression, typeAnnotation);
    }

    @Override
    public String toString() {
        return "(" + expression + " : " + typeAnnotation + ")";
    }
}
