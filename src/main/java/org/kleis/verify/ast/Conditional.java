package org.kleis.verify.ast;

import lombok.Getter;

import java.util.Objects;

@Getter
public final class Conditional extends Expression {

    private final Expression condition;
    private final Expression thenBranch;
    private final Expression elseBranch;

    private Conditional(Expression condition, Expression thenBranch, Expression elseBranch) {
        this.condition = Objects.requireNonNull(condition, "Conditional-构造函数: condition 不能为 null");
        this.thenBranch = Objects.requireNonNull(thenBranch, "Conditional-构造函数: then 分支不能为 null");
        this.elseBranch = Objects.requireNonNull(elseBranch, "Conditional-构造函数: else 分支不能为 null");
    }

    public static Conditional of(Expression condition, Expression thenBranch, Expression elseBranch) {
        return new Conditional(condition, thenBranch, elseBranch);
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.CONDITIONAL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Conditional that = (Conditional) o;
        return condition.equals(that.condition) && thenBranch.equals(that.thenBranch) && elseBranch.equals(that.elseBranch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ExpressionKind.CONDITIONAL, condition, thenBranch, elseBranch);
    }

    @Override
    public String toString() {
        return "if " + condition + " then " + thenBranch + " else " + elseBranch;
    }
}
