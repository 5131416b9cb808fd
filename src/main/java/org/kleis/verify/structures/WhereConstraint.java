package org.kleis.verify.structures;

import lombok.Getter;
import org.kleis.verify.ast.TypeExpr;

import java.util.List;
import java.util.Objects;

/**
 * implements 块上的 where 约束，例如 where Semiring(T)。
 */
@Getter
public final class WhereConstraint {

    private final String structureName;
    private final List<TypeExpr> typeArgs;

    private WhereConstraint(String structureName, List<TypeExpr> typeArgs) {
        this.structureName = Objects.requireNonNull(structureName, "WhereConstraint-构造函数: structureName 不能为 null");
        this.typeArgs = List.copyOf(Objects.requireNonNull(typeArgs, "WhereConstraint-构造函数: typeArgs 不能为 null"));
    }

    public static WhereConstraint of(String structureName, List<TypeExpr> typeArgs) {
        return new WhereConstraint(structureName, typeArgs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        WhereConstraint that = (WhereConstraint) o;
        return structureName.equals(that.structureName) && typeArgs.equals(that.typeArgs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(structureName, typeArgs);
    }

    @Override
    public String toString() {
        return structureName + typeArgs.stream().map(TypeExpr::toString).toList().toString()
                .replace('[', '(').replace(']', ')');
    }
}
