package org.kleis.verify.structures;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.apache.commons.lang3.tuple.Pair;
import org.kleis.verify.ast.Expression;
import org.kleis.verify.ast.TypeExpr;

import java.util.List;
import java.util.Objects;

/**
 * 代数结构定义：类型参数、运算、公理，以及 extends / over 关系与嵌套结构。
 * 程序加载时创建一次，之后不可变，由 {@link StructureRegistry} 持有。
 * @author Ayalyt
 */
@Getter
public final class StructureDef {

    private final String name;
    private final List<TypeParam> typeParams;
    private final List<StructureMember> members;
    private final TypeExpr extendsClause; // 可为 null
    private final TypeExpr overClause;    // 可为 null

    @Builder
    private StructureDef(String name,
                         @Singular List<TypeParam> typeParams,
                         @Singular List<StructureMember> members,
                         TypeExpr extendsClause,
                         TypeExpr overClause) {
        Objects.requireNonNull(name, "StructureDef-构造函数: name 不能为 null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("StructureDef-构造函数: name 不能为空");
        }
        this.name = name;
        this.typeParams = List.copyOf(typeParams);
        this.members = List.copyOf(members);
        this.extendsClause = extendsClause;
        this.overClause = overClause;
    }

    // --- 关系查询 ---

    /**
     * @return extends 父结构名，没有则为 null。
     */
    public String extendsName() {
        return extendsClause == null ? null : extendsClause.headName();
    }

    /**
     * @return over 域结构名，没有则为 null。
     */
    public String overName() {
        return overClause == null ? null : overClause.headName();
    }

    // --- 成员查询 ---

    /**
     * @return 直接声明的公理 (名字, 命题)，按声明顺序。不含嵌套结构中的公理。
     */
    public List<Pair<String, Expression>> axioms() {
        return members.stream()
                .filter(m -> m.getKind() == StructureMember.Kind.AXIOM)
                .map(m -> Pair.of(m.getName(), ((StructureMember.Axiom) m).getProposition()))
                .toList();
    }

    public List<StructureMember.OperationDecl> operations() {
        return members.stream()
                .filter(m -> m.getKind() == StructureMember.Kind.OPERATION)
                .map(m -> (StructureMember.OperationDecl) m)
                .toList();
    }

    public List<StructureMember.NestedStructure> nestedStructures() {
        return members.stream()
                .filter(m -> m.getKind() == StructureMember.Kind.NESTED_STRUCTURE)
                .map(m -> (StructureMember.NestedStructure) m)
                .toList();
    }

    public List<StructureMember.FunctionDef> functionDefs() {
        return members.stream()
                .filter(m -> m.getKind() == StructureMember.Kind.FUNCTION_DEF)
                .map(m -> (StructureMember.FunctionDef) m)
                .toList();
    }

    public boolean hasAxioms() {
        return members.stream().anyMatch(m -> m.getKind() == StructureMember.Kind.AXIOM);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StructureDef that = (StructureDef) o;
        return name.equals(that.name)
                && typeParams.equals(that.typeParams)
                && Objects.equals(extendsClause, that.extendsClause)
                && Objects.equals(overClause, that.overClause);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typeParams, extendsClause, overClause);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("structure ").append(name);
        if (!typeParams.isEmpty()) {
            sb.append(typeParams.stream().map(TypeParam::toString).toList().toString()
                    .replace('[', '(').replace(']', ')'));
        }
        if (extendsClause != null) {
            sb.append(" extends ").append(extendsClause);
        }
        if (overClause != null) {
            sb.append(" over ").append(overClause);
        }
        return sb.toString();
    }
}
