package org.kleis.verify.ast;

import lombok.Getter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 类型表达式：结构的类型签名、extends/over 子句和数据类型字段都用它描述。
 */
public abstract class TypeExpr {

    public enum Kind {
        NAMED,
        PARAMETRIC,
        FUNCTION,
        PRODUCT,
        VAR,
        FOR_ALL
    }

    public abstract Kind getKind();

    /**
     * 类型的头部名字：Named/Parametric/Var 返回其名字，其余返回 null。
     * 用于把 extends/over 子句解析为结构名。
     */
    public abstract String headName();

    /**
     * @return 是否为函数类型。非函数类型签名的运算是零元运算（单位元）。
     */
    public boolean isFunction() {
        return getKind() == Kind.FUNCTION;
    }

    public static TypeExpr named(String name) {
        return new Named(name);
    }

    public static TypeExpr parametric(String name, List<TypeExpr> args) {
        return new Parametric(name, args);
    }

    public static TypeExpr function(TypeExpr from, TypeExpr to) {
        return new Function(from, to);
    }

    public static TypeExpr product(List<TypeExpr> types) {
        return new Product(types);
    }

    public static TypeExpr var(String name) {
        return new Var(name);
    }

    public static TypeExpr forAll(List<String> vars, TypeExpr body) {
        return new ForAll(vars, body);
    }

    /**
     * 便捷方法：二元运算签名 T × T → T。
     */
    public static TypeExpr binaryOp(String carrier) {
        TypeExpr t = var(carrier);
        return function(product(List.of(t, t)), t);
    }

    @Getter
    public static final class Named extends TypeExpr {

        private final String name;

        private Named(String name) {
            this.name = Objects.requireNonNull(name, "TypeExpr.Named: name 不能为 null");
        }

        @Override
        public Kind getKind() {
            return Kind.NAMED;
        }

        @Override
        public String headName() {
            return name;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Named that && name.equals(that.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.NAMED, name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    @Getter
    public static final class Parametric extends TypeExpr {

        private final String name;
        private final List<TypeExpr> args;

        private Parametric(String name, List<TypeExpr> args) {
            this.name = Objects.requireNonNull(name, "TypeExpr.Parametric: name 不能为 null");
            this.args = List.copyOf(Objects.requireNonNull(args, "TypeExpr.Parametric: args 不能为 null"));
        }

        @Override
        public Kind getKind() {
            return Kind.PARAMETRIC;
        }

        @Override
        public String headName() {
            return name;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Parametric that && name.equals(that.name) && args.equals(that.args);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.PARAMETRIC, name, args);
        }

        @Override
        public String toString() {
            return name + args.stream().map(TypeExpr::toString).collect(Collectors.joining(", ", "(", ")"));
        }
    }

    @Getter
    public static final class Function extends TypeExpr {

        private final TypeExpr from;
        private final TypeExpr to;

        private Function(TypeExpr from, TypeExpr to) {
            this.from = Objects.requireNonNull(from, "TypeExpr.Function: from 不能为 null");
            this.to = Objects.requireNonNull(to, "TypeExpr.Function: to 不能为 null");
        }

        /**
         * @return 参数个数：积类型按分量计数，否则为 1。
         */
        public int arity() {
            return from instanceof Product p ? p.getTypes().size() : 1;
        }

        @Override
        public Kind getKind() {
            return Kind.FUNCTION;
        }

        @Override
        public String headName() {
            return null;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Function that && from.equals(that.from) && to.equals(that.to);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.FUNCTION, from, to);
        }

        @Override
        public String toString() {
            return from + " → " + to;
        }
    }

    @Getter
    public static final class Product extends TypeExpr {

        private final List<TypeExpr> types;

        private Product(List<TypeExpr> types) {
            this.types = List.copyOf(Objects.requireNonNull(types, "TypeExpr.Product: types 不能为 null"));
        }

        @Override
        public Kind getKind() {
            return Kind.PRODUCT;
        }

        @Override
        public String headName() {
            return null;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Product that && types.equals(that.types);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.PRODUCT, types);
        }

        @Override
        public String toString() {
            return types.stream().map(TypeExpr::toString).collect(Collectors.joining(" × "));
        }
    }

    @Getter
    public static final class Var extends TypeExpr {

        private final String name;

        private Var(String name) {
            this.name = Objects.requireNonNull(name, "TypeExpr.Var: name 不能为 null");
        }

        @Override
        public Kind getKind() {
            return Kind.VAR;
        }

        @Override
        public String headName() {
            return name;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Var that && name.equals(that.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.VAR, name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    @Getter
    public static final class ForAll extends TypeExpr {

        private final List<String> vars;
        private final TypeExpr body;

        private ForAll(List<String> vars, TypeExpr body) {
            this.vars = List.copyOf(Objects.requireNonNull(vars, "TypeExpr.ForAll: vars 不能为 null"));
            this.body = Objects.requireNonNull(body, "TypeExpr.ForAll: body 不能为 null");
        }

        @Override
        public Kind getKind() {
            return Kind.FOR_ALL;
        }

        @Override
        public String headName() {
            return body.headName();
        }

        @Override
        public boolean isFunction() {
            return body.isFunction();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ForAll that && vars.equals(that.vars) && body.equals(that.body);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Kind.FOR_ALL, vars, body);
        }

        @Override
        public String toString() {
            return "∀" + String.join(" ", vars) + ". " + body;
        }
    }
}
