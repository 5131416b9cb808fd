package org.kleis.verify.ast;

import lombok.Getter;

import java.util.Objects;

/**
 * let pattern = value in body
 */
@Getter
public final class Let extends Expression {

    private final Pattern pattern;
    private final Expression value;
    private final Expression body;

    private Let(Pattern pattern, Expression value, Expression body) {
        this.pattern = Objects.requireNonNull(pattern, "Let-构造函数: pattern 不能为 null");
        this.value = Objects.requireNonNull(value, "Let-构造函数: value 不能为 null");
        this.body = Objects.requireNonNull(body, "Let-构造函数: body 不能为 null");
    }

    public static Let of(Pattern pattern, Expression value, Expression body) {
        return new Let(pattern, value, body);
    }

    public static Let of(String name, Expression value, Expression body) {
        return new Let(Pattern.variable(name), value, body);
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.LET;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Let that = (Let) o;
        return pattern.equals(that.pattern) && value.equals(that.value) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ExpressionKind.LET, pattern, value, body);
    }

    @Override
    public String toString() {
        return "let " + pattern + " = " + value + " in " + body;
    }
}
