package org.kleis.verify.structures;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.kleis.verify.ast.TypeExpr;

import java.util.List;
import java.util.Objects;

/**
 * implements 块：implements Monoid(ℤ) where Semiring(ℤ) { ... }
 */
@Getter
public final class ImplementsDef {

    private final String structureName;
    private final List<TypeExpr> typeArgs;
    private final List<StructureMember> members;
    private final TypeExpr overClause; // 可为 null
    private final List<WhereConstraint> whereClause;

    @Builder
    private ImplementsDef(String structureName,
                          @Singular List<TypeExpr> typeArgs,
                          @Singular List<StructureMember> members,
                          TypeExpr overClause,
                          @Singular("where") List<WhereConstraint> whereClause) {
        this.structureName = Objects.requireNonNull(structureName, "ImplementsDef-构造函数: structureName 不能为 null");
        this.typeArgs = List.copyOf(typeArgs);
        this.members = List.copyOf(members);
        this.overClause = overClause;
        this.whereClause = List.copyOf(whereClause);
    }

    /**
     * @return 第一个类型实参的头部名字（实现该结构的具体类型），没有则为 null。
     */
    public String concreteTypeName() {
        return typeArgs.isEmpty() ? null : typeArgs.get(0).headName();
    }

    @Override
    public String toString() {
        String where = whereClause.isEmpty() ? "" : " where " + whereClause;
        return "implements " + structureName + typeArgs + where;
    }
}
