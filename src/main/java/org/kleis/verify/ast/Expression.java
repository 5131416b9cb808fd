package org.kleis.verify.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Kleis 表达式树的根类型。
 * 所有子类都是不可变的；求解器层只接收和返回此类型，从不暴露求解器内部类型。
 * @author Ayalyt
 */
public abstract class Expression {

    /**
     * @return 节点种类，用于 switch 分派。
     */
    public abstract ExpressionKind getKind();

    // --- 便捷工厂方法 ---

    public static Const constant(String value) {
        return Const.of(value);
    }

    public static Const constant(long value) {
        return Const.of(Long.toString(value));
    }

    public static NamedObject object(String name) {
        return NamedObject.of(name);
    }

    public static Operation op(String name, Expression... args) {
        return Operation.of(name, Arrays.asList(args));
    }

    public static Operation op(String name, List<Expression> args) {
        return Operation.of(name, args);
    }

    public static Quantifier forAll(List<QuantifiedVar> vars, Expression body) {
        return Quantifier.of(QuantifierKind.FOR_ALL, vars, null, body);
    }

    public static Quantifier exists(List<QuantifiedVar> vars, Expression body) {
        return Quantifier.of(QuantifierKind.EXISTS, vars, null, body);
    }

    /**
     * 便捷方法：构造 equals(left, right)。
     */
    public static Operation eq(Expression left, Expression right) {
        return op("equals", left, right);
    }
}
