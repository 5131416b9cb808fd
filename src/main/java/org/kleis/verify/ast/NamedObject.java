package org.kleis.verify.ast;

import lombok.Getter;

import java.util.Objects;

/**
 * 命名对象：变量、单位元（如 zero、e）或无参构造子（如 Red）。
 */
@Getter
public final class NamedObject extends Expression {

    private final String name;

    private NamedObject(String name) {
        Objects.requireNonNull(name, "NamedObject-构造函数: name 不能为 null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("NamedObject-构造函数: name 不能为空");
        }
        this.name = name;
    }

    public static NamedObject of(String name) {
        return new NamedObject(name);
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.OBJECT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return name.equals(((NamedObject) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ExpressionKind.OBJECT, name);
    }

    @Override
    public String toString() {
        return name;
    }
}
