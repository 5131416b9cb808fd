package org.kleis.verify.ast;

import lombok.Getter;

import java.util.Objects;

/**
 * 量词或 lambda 绑定的变量，带可选类型标注（例如 "ℝ"、"Bool"、"Color"）。
 */
@Getter
public final class QuantifiedVar {

    private final String name;
    private final String typeAnnotation; // 可为 null

    private QuantifiedVar(String name, String typeAnnotation) {
        this.name = Objects.requireNonNull(name, "QuantifiedVar-构造函数: name 不能为 null");
        this.typeAnnotation = typeAnnotation;
    }

    public static QuantifiedVar of(String name) {
        return new QuantifiedVar(name, null);
    }

    public static QuantifiedVar of(String name, String typeAnnotation) {
        return new QuantifiedVar(name, typeAnnotation);
    }

    public boolean hasTypeAnnotation() {
        return typeAnnotation != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        QuantifiedVar that = (QuantifiedVar) o;
        return name.equals(that.name) && Objects.equals(typeAnnotation, that.typeAnnotation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typeAnnotation);
    }

    @Override
    public String toString() {
        return typeAnnotation == null ? name : name + " : " + typeAnnotation;
    }
}
