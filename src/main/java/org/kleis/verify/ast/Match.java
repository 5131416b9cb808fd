package org.kleis.verify.ast;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Getter
public final class Match extends Expression {

    private final Expression scrutinee;
    private final List<MatchCase> cases;

    private Match(Expression scrutinee, List<MatchCase> cases) {
        this.scrutinee = Objects.requireNonNull(scrutinee, "Match-构造函数: scrutinee 不能为 null");
        Objects.requireNonNull(cases, "Match-构造函数: cases 不能为 null");
        if (cases.isEmpty()) {
            throw new IllegalArgumentException("Match-构造函数: 至少需要一个分支");
        }
        this.cases = List.copyOf(cases);
    }

    public static Match of(Expression scrutinee, List<MatchCase> cases) {
        return new Match(scrutinee, cases);
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.MATCH;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Match that = (Match) o;
        return scrutinee.equals(that.scrutinee) && cases.equals(that.cases);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ExpressionKind.MATCH, scrutinee, cases);
    }

    @Override
    public String toString() {
        return "match " + scrutinee + " { " + cases.stream().map(MatchCase::toString).collect(Collectors.joining(" | ")) + " }";
    }
}
