package org.kleis.verify.ast;

import lombok.Getter;

import java.util.Objects;

@Getter
public final class MatchCase {

    private final Pattern pattern;
    private final Expression body;

    private MatchCase(Pattern pattern, Expression body) {
        this.pattern = Objects.requireNonNull(pattern, "MatchCase-构造函数: pattern 不能为 null");
        this.body = Objects.requireNonNull(body, "MatchCase-构造函数: body 不能为 null");
    }

    public static MatchCase of(Pattern pattern, Expression body) {
        return new MatchCase(pattern, body);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MatchCase that = (MatchCase) o;
        return pattern.equals(that.pattern) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern, body);
    }

    @Override
    public String toString() {
        return pattern + " => " + body;
    }
}
