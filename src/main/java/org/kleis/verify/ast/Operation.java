package org.kleis.verify.ast;

import lombok.Getter;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * n 元运算应用，例如 plus(x, y) 或用户自定义的 mul(a, b)。
 * 运算名不做任何领域限定，翻译器按名字动态解析。
 */
@Getter
public final class Operation extends Expression {

    // 渲染为中缀形式的二元运算
    private static final Map<String, String> INFIX_SYMBOLS = Map.ofEntries(
            Map.entry("plus", "+"),
            Map.entry("minus", "-"),
            Map.entry("times", "*"),
            Map.entry("divide", "/"),
            Map.entry("equals", "="),
            Map.entry("eq", "="),
            Map.entry("neq", "≠"),
            Map.entry("lt", "<"),
            Map.entry("less_than", "<"),
            Map.entry("gt", ">"),
            Map.entry("greater_than", ">"),
            Map.entry("leq", "≤"),
            Map.entry("geq", "≥"),
            Map.entry("and", "∧"),
            Map.entry("or", "∨"),
            Map.entry("implies", "⟹"),
            Map.entry("iff", "⟺")
    );

    private final String name;
    private final List<Expression> args;
    private final int hashCode;

    private Operation(String name, List<Expression> args) {
        Objects.requireNonNull(name, "Operation-构造函数: name 不能为 null");
        Objects.requireNonNull(args, "Operation-构造函数: args 不能为 null");
        this.name = name;
        this.args = List.copyOf(args);
        this.hashCode = Objects.hash(ExpressionKind.OPERATION, name, this.args);
    }

    public static Operation of(String name, List<Expression> args) {
        return new Operation(name, args);
    }

    public int arity() {
        return args.size();
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.OPERATION;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Operation that = (Operation) o;
        return name.equals(that.name) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        String symbol = INFIX_SYMBOLS.get(name);
        if (symbol != null && args.size() == 2) {
            return "(" + args.get(0) + " " + symbol + " " + args.get(1) + ")";
        }
        if ("negate".equals(name) && args.size() == 1) {
            return "-" + args.get(0);
        }
        if ("not".equals(name) && args.size() == 1) {
            return "¬" + args.get(0);
        }
        if (args.isEmpty()) {
            return name;
        }
        return name + args.stream().map(Expression::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
