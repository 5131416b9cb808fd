package org.kleis.verify.structures;

import lombok.Getter;
import org.kleis.verify.ast.Expression;
import org.kleis.verify.ast.TypeExpr;

import java.util.List;
import java.util.Objects;

/**
 * 结构体成员：字段、运算签名、公理、嵌套结构或函数定义。
 */
public abstract class StructureMember {

    public enum Kind {
        FIELD,
        OPERATION,
        AXIOM,
        NESTED_STRUCTURE,
        FUNCTION_DEF
    }

    @Getter
    private final String name;

    protected StructureMember(String name) {
        this.name = Objects.requireNonNull(name, "StructureMember-构造函数: name 不能为 null");
    }

    public abstract Kind getKind();

    public static Field field(String name, TypeExpr type) {
        return new Field(name, type);
    }

    public static OperationDecl operation(String name, TypeExpr typeSignature) {
        return new OperationDecl(name, typeSignature);
    }

    public static Axiom axiom(String name, Expression proposition) {
        return new Axiom(name, proposition);
    }

    public static NestedStructure nested(String name, TypeExpr structureType, List<StructureMember> members) {
        return new NestedStructure(name, structureType, members);
    }

    public static FunctionDef function(String name, List<String> params, Expression body) {
        return new FunctionDef(name, params, body);
    }

    @Getter
    public static final class Field extends StructureMember {

        private final TypeExpr type;

        private Field(String name, TypeExpr type) {
            super(name);
            this.type = Objects.requireNonNull(type, "Field: type 不能为 null");
        }

        @Override
        public Kind getKind() {
            return Kind.FIELD;
        }

        @Override
        public String toString() {
            return "field " + getName() + " : " + type;
        }
    }

    /**
     * 运算签名。类型签名不是函数类型时，该运算是零元运算，即单位元（zero、one、e）。
     */
    @Getter
    public static final class OperationDecl extends StructureMember {

        private final TypeExpr typeSignature;

        private OperationDecl(String name, TypeExpr typeSignature) {
            super(name);
            this.typeSignature = Objects.requireNonNull(typeSignature, "OperationDecl: typeSignature 不能为 null");
        }

        public boolean isNullary() {
            return !typeSignature.isFunction();
        }

        @Override
        public Kind getKind() {
            return Kind.OPERATION;
        }

        @Override
        public String toString() {
            return "operation " + getName() + " : " + typeSignature;
        }
    }

    @Getter
    public static final class Axiom extends StructureMember {

        private final Expression proposition;

        private Axiom(String name, Expression proposition) {
            super(name);
            this.proposition = Objects.requireNonNull(proposition, "Axiom: proposition 不能为 null");
        }

        @Override
        public Kind getKind() {
            return Kind.AXIOM;
        }

        @Override
        public String toString() {
            return "axiom " + getName() + " : " + proposition;
        }
    }

    /**
     * 嵌套结构，例如 Ring 中的 structure additive : AbelianGroup(R) { ... }。
     */
    @Getter
    public static final class NestedStructure extends StructureMember {

        private final TypeExpr structureType;
        private final List<StructureMember> members;

        private NestedStructure(String name, TypeExpr structureType, List<StructureMember> members) {
            super(name);
            this.structureType = Objects.requireNonNull(structureType, "NestedStructure: structureType 不能为 null");
            this.members = List.copyOf(Objects.requireNonNull(members, "NestedStructure: members 不能为 null"));
        }

        @Override
        public Kind getKind() {
            return Kind.NESTED_STRUCTURE;
        }

        @Override
        public String toString() {
            return "structure " + getName() + " : " + structureType + " { " + members.size() + " members }";
        }
    }

    @Getter
    public static final class FunctionDef extends StructureMember {

        private final List<String> params;
        private final Expression body;

        private FunctionDef(String name, List<String> params, Expression body) {
            super(name);
            this.params = List.copyOf(Objects.requireNonNull(params, "FunctionDef: params 不能为 null"));
            this.body = Objects.requireNonNull(body, "FunctionDef: body 不能为 null");
        }

        @Override
        public Kind getKind() {
            return Kind.FUNCTION_DEF;
        }

        @Override
        public String toString() {
            return "define " + getName() + "(" + String.join(", ", params) + ") = " + body;
        }
    }
}
