package org.kleis.verify.structures;

import org.kleis.verify.ast.Expression;
import org.kleis.verify.ast.QuantifiedVar;
import org.kleis.verify.ast.TypeExpr;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StructureRegistryTest {

    private StructureRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new StructureRegistry();
    }

    private static StructureDef semigroup() {
        return StructureDef.builder()
                .name("Semigroup")
                .typeParam(TypeParam.of("S"))
                .member(StructureMember.operation("mul", TypeExpr.binaryOp("S")))
                .member(StructureMember.axiom("associativity", Expression.forAll(
                        List.of(QuantifiedVar.of("x"), QuantifiedVar.of("y"), QuantifiedVar.of("z")),
                        Expression.eq(
                                Expression.op("mul", Expression.op("mul", Expression.object("x"), Expression.object("y")), Expression.object("z")),
                                Expression.op("mul", Expression.object("x"), Expression.op("mul", Expression.object("y"), Expression.object("z")))))))
                .build();
    }

    @Nested
    @DisplayName("注册 (Registration)")
    class RegistrationTests {

        @Test
        @DisplayName("重复注册同名结构应被拒绝")
        void testRegister_DuplicateName_ShouldThrow() {
            registry.registerStructure(semigroup());
            StructureException e = assertThrows(StructureException.class, () -> registry.registerStructure(semigroup()));
            assertTrue(e.getMessage().contains("Semigroup"), "Message should name the structure");
            assertEquals(1, registry.size());
        }

        @Test
        @DisplayName("extends 链回到自身应被拒绝")
        void testRegister_SelfExtends_ShouldThrow() {
            StructureDef loop = StructureDef.builder()
                    .name("Loop")
                    .extendsClause(TypeExpr.named("Loop"))
                    .build();
            assertThrows(StructureException.class, () -> registry.registerStructure(loop));
            assertFalse(registry.hasStructure("Loop"));
        }

        @Test
        @DisplayName("over 指向自身应被拒绝")
        void testRegister_SelfOver_ShouldThrow() {
            StructureDef def = StructureDef.builder()
                    .name("VectorSpace")
                    .overClause(TypeExpr.named("VectorSpace"))
                    .build();
            assertThrows(StructureException.class, () -> registry.registerStructure(def));
        }

        @Test
        @DisplayName("嵌套自身类型的结构应被拒绝")
        void testRegister_SelfNested_ShouldThrow() {
            StructureDef def = StructureDef.builder()
                    .name("S")
                    .member(StructureMember.nested("inner", TypeExpr.named("S"), List.of()))
                    .build();
            assertThrows(StructureException.class, () -> registry.registerStructure(def));
            assertFalse(registry.hasStructure("S"));
        }

        @Test
        @DisplayName("深层嵌套中引用自身也应被拒绝")
        void testRegister_DeepNestedSelf_ShouldThrow() {
            StructureDef def = StructureDef.builder()
                    .name("Outer")
                    .member(StructureMember.nested("a", TypeExpr.named("Monoid"), List.of(
                            StructureMember.nested("b", TypeExpr.named("Outer"), List.of()))))
                    .build();
            assertThrows(StructureException.class, () -> registry.registerStructure(def));
        }

        @Test
        @DisplayName("over 循环 A→B→A 应被拒绝")
        void testRegister_OverCycle_ShouldThrow() {
            registry.registerStructure(StructureDef.builder().name("A").overClause(TypeExpr.named("B")).build());
            StructureDef b = StructureDef.builder().name("B").overClause(TypeExpr.named("A")).build();

            StructureException e = assertThrows(StructureException.class, () -> registry.registerStructure(b));
            assertAll("Over cycle",
                    () -> assertTrue(e.getMessage().contains("'B'")),
                    () -> assertTrue(registry.hasStructure("A")),
                    () -> assertFalse(registry.hasStructure("B"))
            );
        }

        @Test
        @DisplayName("经过 extends、嵌套和 over 混合的循环应被拒绝")
        void testRegister_MixedCycle_ShouldThrow() {
            registry.registerStructure(StructureDef.builder().name("A").extendsClause(TypeExpr.named("B")).build());
            registry.registerStructure(StructureDef.builder().name("B")
                    .member(StructureMember.nested("c", TypeExpr.named("C"), List.of())).build());
            StructureDef c = StructureDef.builder().name("C").overClause(TypeExpr.named("A")).build();
            assertThrows(StructureException.class, () -> registry.registerStructure(c));
        }

        @Test
        @DisplayName("共享依赖（菱形）不是循环")
        void testRegister_Diamond_Accepted() {
            registry.registerStructure(semigroup());
            registry.registerStructure(StructureDef.builder().name("Left").extendsClause(TypeExpr.named("Semigroup")).build());
            registry.registerStructure(StructureDef.builder().name("Right").overClause(TypeExpr.named("Semigroup")).build());
            assertDoesNotThrow(() -> registry.registerStructure(StructureDef.builder().name("Both")
                    .extendsClause(TypeExpr.named("Left"))
                    .member(StructureMember.nested("r", TypeExpr.named("Right"), List.of()))
                    .build()));
            assertEquals(4, registry.size());
        }

        @Test
        @DisplayName("重复的数据类型应被拒绝")
        void testRegisterDataType_Duplicate_ShouldThrow() {
            registry.registerDataType(DataDef.enumeration("Color", "Red", "Green"));
            assertThrows(StructureException.class,
                    () -> registry.registerDataType(DataDef.enumeration("Color", "Blue")));
        }
    }

    @Nested
    @DisplayName("查询 (Queries)")
    class QueryTests {

        @Test
        @DisplayName("公理、运算与所属结构查询")
        void testQueries_AfterRegistration() {
            registry.registerStructure(semigroup());

            assertAll("Semigroup queries",
                    () -> assertEquals(1, registry.getAxioms("Semigroup").size()),
                    () -> assertTrue(registry.hasAxiom("Semigroup", "associativity")),
                    () -> assertEquals(List.of("Semigroup"), registry.getOperationOwners("mul")),
                    () -> assertTrue(registry.getOperationOwners("plus").isEmpty()),
                    () -> assertEquals(List.of("Semigroup"), registry.structuresWithAxioms()),
                    () -> assertTrue(registry.getAxioms("Missing").isEmpty()),
                    () -> assertNotNull(registry.getOperationSignature("mul"))
            );
        }

        @Test
        @DisplayName("嵌套结构中的运算归属于外层结构")
        void testOperationOwners_NestedMembers() {
            StructureDef ring = StructureDef.builder()
                    .name("Ring")
                    .member(StructureMember.nested("additive", TypeExpr.named("AbelianGroup"), List.of(
                            StructureMember.operation("plus", TypeExpr.binaryOp("R")),
                            StructureMember.operation("zero", TypeExpr.var("R")))))
                    .build();
            registry.registerStructure(ring);

            assertEquals(List.of("Ring"), registry.getOperationOwners("zero"));
            assertEquals(TypeExpr.var("R"), registry.getOperationSignature("zero"));
        }

        @Test
        @DisplayName("构造子反查数据类型")
        void testDataTypeOfConstructor() {
            registry.registerDataType(DataDef.enumeration("Color", "Red", "Green"));
            assertEquals("Color", registry.dataTypeOfConstructor("Green").getName());
            assertNull(registry.dataTypeOfConstructor("Purple"));
        }

        @Test
        @DisplayName("删除结构同时删除其 implements 块")
        void testRemoveStructure() {
            registry.registerStructure(semigroup());
            registry.registerImplements(ImplementsDef.builder()
                    .structureName("Semigroup")
                    .typeArg(TypeExpr.named("ℤ"))
                    .build());

            assertTrue(registry.removeStructure("Semigroup"));
            assertFalse(registry.removeStructure("Semigroup"));
            assertTrue(registry.getImplements("Semigroup").isEmpty());
        }
    }

    @Nested
    @DisplayName("运算注册表 (Operation registry)")
    class OperationRegistryTests {

        @Test
        @DisplayName("implements 块把具体类型关联到结构")
        void testBuildOperationRegistry() {
            registry.registerStructure(semigroup());
            registry.registerImplements(ImplementsDef.builder()
                    .structureName("Semigroup")
                    .typeArg(TypeExpr.named("ℤ"))
                    .build());

            OperationRegistry ops = registry.buildOperationRegistry();

            assertAll("Operation registry",
                    () -> assertTrue(ops.owners("mul").contains("Semigroup")),
                    () -> assertTrue(ops.implementsStructure("ℤ", "Semigroup")),
                    () -> assertTrue(ops.supportsOperation("ℤ", "mul")),
                    () -> assertFalse(ops.supportsOperation("ℝ", "mul"))
            );
        }
    }
}
