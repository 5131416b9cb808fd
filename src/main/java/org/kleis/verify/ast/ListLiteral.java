package org.kleis.verify.ast;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Getter
public final class ListLiteral extends Expression {

    private final List<Expression> elements;

    private ListLiteral(List<Expression> elements) {
        this.elements = List.copyOf(Objects.requireNonNull(elements, "ListLiteral-构造函数: elements 不能为 null"));
    }

    public static ListLiteral of(List<Expression> elements) {
        return new ListLiteral(elements);
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.LIST;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return elements.equals(((ListLiteral) o).elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ExpressionKind.LIST, elements);
    }

    @Override
    public String toString() {
        return elements.stream().map(Expression::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
