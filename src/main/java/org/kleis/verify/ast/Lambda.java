package org.kleis.verify.ast;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Getter
public final class Lambda extends Expression {

    private final List<QuantifiedVar> params;
    private final Expression body;

    private Lambda(List<QuantifiedVar> params, Expression body) {
        this.params = List.copyOf(Objects.requireNonNull(params, "Lambda-构造函数: params 不能为 null"));
        this.body = Objects.requireNonNull(body, "Lambda-构造函数: body 不能为 null");
    }

    public static Lambda of(List<QuantifiedVar> params, Expression body) {
        return new Lambda(params, body);
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.LAMBDA;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Lambda that = (Lambda) o;
        return params.equals(that.params) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ExpressionKind.LAMBDA, params, body);
    }

    @Override
    public String toString() {
        return "λ " + params.stream().map(QuantifiedVar::toString).collect(Collectors.joining(" ")) + " . " + body;
    }
}
