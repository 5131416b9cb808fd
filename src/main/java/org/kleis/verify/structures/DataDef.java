package org.kleis.verify.structures;

import lombok.Getter;
import org.kleis.verify.ast.TypeExpr;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 代数数据类型：data Color = Red | Green | Blue，
 * 或 data Tree = Leaf | Node(left : Tree, value : ℤ, right : Tree)。
 */
@Getter
public final class DataDef {

    private final String name;
    private final List<TypeParam> typeParams;
    private final List<Variant> variants;

    private DataDef(String name, List<TypeParam> typeParams, List<Variant> variants) {
        this.name = Objects.requireNonNull(name, "DataDef-构造函数: name 不能为 null");
        this.typeParams = List.copyOf(Objects.requireNonNull(typeParams, "DataDef-构造函数: typeParams 不能为 null"));
        Objects.requireNonNull(variants, "DataDef-构造函数: variants 不能为 null");
        if (variants.isEmpty()) {
            throw new IllegalArgumentException("DataDef-构造函数: 数据类型 " + name + " 至少需要一个构造子");
        }
        this.variants = List.copyOf(variants);
    }

    public static DataDef of(String name, List<Variant> variants) {
        return new DataDef(name, List.of(), variants);
    }

    public static DataDef of(String name, List<TypeParam> typeParams, List<Variant> variants) {
        return new DataDef(name, typeParams, variants);
    }

    /**
     * 便捷方法：只含无参构造子的枚举式数据类型。
     */
    public static DataDef enumeration(String name, String... constructors) {
        return new DataDef(name, List.of(), java.util.Arrays.stream(constructors).map(c -> Variant.of(c, List.of())).toList());
    }

    @Override
    public String toString() {
        return "data " + name + " = " + variants.stream().map(Variant::toString).collect(Collectors.joining(" | "));
    }

    @Getter
    public static final class Variant {

        private final String name;
        private final List<Field> fields;

        private Variant(String name, List<Field> fields) {
            this.name = Objects.requireNonNull(name, "DataDef.Variant: name 不能为 null");
            this.fields = List.copyOf(Objects.requireNonNull(fields, "DataDef.Variant: fields 不能为 null"));
        }

        public static Variant of(String name, List<Field> fields) {
            return new Variant(name, fields);
        }

        @Override
        public String toString() {
            if (fields.isEmpty()) {
                return name;
            }
            return name + fields.stream().map(Field::toString).collect(Collectors.joining(", ", "(", ")"));
        }
    }

    @Getter
    public static final class Field {

        private final String name; // 可为 null，求解器中默认命名为 field_i
        private final TypeExpr type;

        private Field(String name, TypeExpr type) {
            this.name = name;
            this.type = Objects.requireNonNull(type, "DataDef.Field: type 不能为 null");
        }

        public static Field of(String name, TypeExpr type) {
            return new Field(name, type);
        }

        public static Field positional(TypeExpr type) {
            return new Field(null, type);
        }

        @Override
        public String toString() {
            return name == null ? type.toString() : name + " : " + type;
        }
    }
}
