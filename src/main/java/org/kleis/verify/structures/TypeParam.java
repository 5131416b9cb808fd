package org.kleis.verify.structures;

import lombok.Getter;

import java.util.Objects;

@Getter
public final class TypeParam {

    private final String name;
    private final String kind; // 可为 null，例如 "Type"

    private TypeParam(String name, String kind) {
        this.name = Objects.requireNonNull(name, "TypeParam-构造函数: name 不能为 null");
        this.kind = kind;
    }

    public static TypeParam of(String name) {
        return new TypeParam(name, null);
    }

    public static TypeParam of(String name, String kind) {
        return new TypeParam(name, kind);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TypeParam that = (TypeParam) o;
        return name.equals(that.name) && Objects.equals(kind, that.kind);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind);
    }

    @Override
    public String toString() {
        return kind == null ? name : name + " : " + kind;
    }
}
