package org.kleis.verify.ast;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 量词表达式 ∀/∃，可带 where 子句限定定义域。
 * where 子句在翻译时变为 cond ⟹ body，而不是合取。
 */
@Getter
public final class Quantifier extends Expression {

    private final QuantifierKind quantifier;
    private final List<QuantifiedVar> variables;
    private final Expression whereClause; // 可为 null
    private final Expression body;
    private final int hashCode;

    private Quantifier(QuantifierKind quantifier, List<QuantifiedVar> variables, Expression whereClause, Expression body) {
        Objects.requireNonNull(quantifier, "Quantifier-构造函数: quantifier 不能为 null");
        Objects.requireNonNull(variables, "Quantifier-构造函数: variables 不能为 null");
        Objects.requireNonNull(body, "Quantifier-构造函数: body 不能为 null");
        if (variables.isEmpty()) {
            throw new IllegalArgumentException("Quantifier-构造函数: 至少需要一个绑定变量");
        }
        this.quantifier = quantifier;
        this.variables = List.copyOf(variables);
        this.whereClause = whereClause;
        this.body = body;
        this.hashCode = Objects.hash(ExpressionKind.QUANTIFIER, quantifier, this.variables, whereClause, body);
    }

    public static Quantifier of(QuantifierKind quantifier, List<QuantifiedVar> variables, Expression whereClause, Expression body) {
        return new Quantifier(quantifier, variables, whereClause, body);
    }

    public boolean hasWhereClause() {
        return whereClause != null;
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.QUANTIFIER;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Quantifier that = (Quantifier) o;
        return quantifier == that.quantifier
                && variables.equals(that.variables)
                && Objects.equals(whereClause, that.whereClause)
                && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        String vars = variables.stream().map(QuantifiedVar::toString).collect(Collectors.joining(", "));
        String where = whereClause == null ? "" : " where " + whereClause;
        return quantifier.getSymbol() + "(" + vars + ")" + where + ". " + body;
    }
}
