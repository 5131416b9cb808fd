package org.kleis.verify.ast;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * match / let 中使用的模式。
 */
public abstract class Pattern {

    public enum Kind {
        WILDCARD,
        VARIABLE,
        CONSTANT,
        CONSTRUCTOR,
        AS
    }

    public abstract Kind getKind();

    public static Pattern wildcard() {
        return Wildcard.INSTANCE;
    }

    public static Pattern variable(String name) {
        return new Variable(name);
    }

    public static Pattern constant(String value) {
        return new Constant(value);
    }

    public static Pattern constructor(String name, List<Pattern> args) {
        return new Constructor(name, args);
    }

    public static Pattern as(Pattern pattern, String binding) {
        return new As(pattern, binding);
    }

    public static final class Wildcard extends Pattern {

        private static final Wildcard INSTANCE = new Wildcard();

        private Wildcard() {
        }

        @Override
        public Kind getKind() {
            return Kind.WILDCARD;
        }

        @Override
        public String toString() {
            return "_";
        }
    }

    @Getter
    public static final class Variable extends Pattern {

        private final String name;

        private Variable(String name) {
            this.name = Objects.requireNonNull(name, "Pattern.Variable: name 不能为 null");
        }

        @Override
        public Kind getKind() {
            return Kind.VARIABLE;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Variable that && name.equals(that.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.VARIABLE, name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    @Getter
    public static final class Constant extends Pattern {

        private final String value;

        private Constant(String value) {
            this.value = Objects.requireNonNull(value, "Pattern.Constant: value 不能为 null");
        }

        @Override
        public Kind getKind() {
            return Kind.CONSTANT;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Constant that && value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.CONSTANT, value);
        }

        @Override
        public String toString() {
            return value;
        }
    }

    @Getter
    public static final class Constructor extends Pattern {

        private final String name;
        private final List<Pattern> args;

        private Constructor(String name, List<Pattern> args) {
            this.name = Objects.requireNonNull(name, "Pattern.Constructor: name 不能为 null");
            this.args = List.copyOf(Objects.requireNonNull(args, "Pattern.Constructor: args 不能为 null"));
        }

        @Override
        public Kind getKind() {
            return Kind.CONSTRUCTOR;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Constructor that && name.equals(that.name) && args.equals(that.args);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.CONSTRUCTOR, name, args);
        }

        @Override
        public String toString() {
            if (args.isEmpty()) {
                return name;
            }
            return name + args.stream().map(Pattern::toString).collect(Collectors.joining(", ", "(", ")"));
        }
    }

    @Getter
    public static final class As extends Pattern {

        private final Pattern pattern;
        private final String binding;

        private As(Pattern pattern, String binding) {
            this.pattern = Objects.requireNonNull(pattern, "Pattern.As: pattern 不能为 null");
            this.binding = Objects.requireNonNull(binding, "Pattern.As: binding 不能为 null");
        }

        @Override
        public Kind getKind() {
            return Kind.AS;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof As that && pattern.equals(that.pattern) && binding.equals(that.binding);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.AS, pattern, binding);
        }

        @Override
        public String toString() {
            return pattern + " as " + binding;
        }
    }
}
