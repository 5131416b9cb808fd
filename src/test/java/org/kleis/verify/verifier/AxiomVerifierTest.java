package org.kleis.verify.verifier;

import org.kleis.verify.ast.Expression;
import org.kleis.verify.ast.QuantifiedVar;
import org.kleis.verify.ast.TypeExpr;
import org.kleis.verify.config.KleisConfig;
import org.kleis.verify.solvers.TranslationException;
import org.kleis.verify.solvers.VerificationResult;
import org.kleis.verify.solvers.z3.Z3Backend;
import org.kleis.verify.structures.DataDef;
import org.kleis.verify.structures.ImplementsDef;
import org.kleis.verify.structures.StructureDef;
import org.kleis.verify.structures.StructureException;
import org.kleis.verify.structures.StructureMember;
import org.kleis.verify.structures.StructureRegistry;
import org.kleis.verify.structures.TopLevelFunction;
import org.kleis.verify.structures.TypeParam;
import org.kleis.verify.structures.WhereConstraint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AxiomVerifierTest {

    private StructureRegistry registry;
    private Z3Backend backend;

    @BeforeEach
    void setUp() {
        registry = new StructureRegistry();
        backend = new Z3Backend(registry, KleisConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    // --- 表达式构造 ---

    private static Expression v(String name) {
        return Expression.object(name);
    }

    private static Expression mul(Expression a, Expression b) {
        return Expression.op("mul", a, b);
    }

    private static Expression forAll(List<String> names, Expression body) {
        List<QuantifiedVar> vars = new ArrayList<>();
        for (String name : names) {
            vars.add(QuantifiedVar.of(name, "M"));
        }
        return Expression.forAll(vars, body);
    }

    private static StructureDef semigroup() {
        return StructureDef.builder()
                .name("Semigroup")
                .typeParam(TypeParam.of("M"))
                .member(StructureMember.operation("mul", TypeExpr.binaryOp("M")))
                .member(StructureMember.axiom("associativity", forAll(List.of("x", "y", "z"),
                        Expression.eq(mul(mul(v("x"), v("y")), v("z")), mul(v("x"), mul(v("y"), v("z")))))))
                .build();
    }

    private static StructureDef monoid() {
        return StructureDef.builder()
                .name("Monoid")
                .typeParam(TypeParam.of("M"))
                .extendsClause(TypeExpr.parametric("Semigroup", List.of(TypeExpr.var("M"))))
                .member(StructureMember.operation("e", TypeExpr.var("M")))
                .member(StructureMember.axiom("left_identity", forAll(List.of("x"), Expression.eq(mul(v("e"), v("x")), v("x")))))
                .member(StructureMember.axiom("right_identity", forAll(List.of("x"), Expression.eq(mul(v("x"), v("e")), v("x")))))
                .build();
    }

    @Nested
    @DisplayName("结构加载 (Structure loading)")
    class LoadingTests {

        @Test
        @DisplayName("Monoid 的目标会先加载 Semigroup")
        void testVerify_LoadsExtendsChain() {
            registry.registerStructure(semigroup());
            registry.registerStructure(monoid());

            try (AxiomVerifier verifier = new AxiomVerifier(registry, backend)) {
                VerificationResult result = verifier.verify(forAll(List.of("a", "b"),
                        Expression.eq(mul(mul(v("e"), v("a")), mul(v("b"), v("e"))), mul(v("a"), v("b")))));

                assertAll("Monoid verification",
                        () -> assertTrue(result.isValid(), "Identity and associativity prove the goal"),
                        () -> assertTrue(verifier.isStructureLoaded("Semigroup")),
                        () -> assertTrue(verifier.isStructureLoaded("Monoid")),
                        () -> assertTrue(verifier.stats().getLoadedStructures() >= 2),
                        () -> assertEquals(1, verifier.stats().getDeclaredOperations(), "mul is the only function"),
                        () -> assertEquals(0, backend.scopeDepth(), "Trial scopes are popped")
                );
            }
        }

        @Test
        @DisplayName("不成立的目标给出反例")
        void testVerify_Invalid() {
            registry.registerStructure(StructureDef.builder()
                    .name("Bounded")
                    .member(StructureMember.operation("bound", TypeExpr.named("ℤ")))
                    .member(StructureMember.axiom("positive", Expression.op("gt", v("bound"), Expression.constant(0))))
                    .build());

            try (AxiomVerifier verifier = new AxiomVerifier(registry, backend)) {
                VerificationResult result = verifier.verify(Expression.forAll(List.of(QuantifiedVar.of("a", "ℤ")),
                        Expression.op("gt", v("a"), v("bound"))));

                assertTrue(result.isInvalid(), "Not every integer exceeds the bound");
                assertTrue(result.getWitness().get("a").isPresent());
                assertTrue(verifier.isStructureLoaded("Bounded"));
            }
        }

        @Test
        @DisplayName("over 域结构与 where 约束的公理在加载后可用于证明")
        void testEnsureStructureLoaded_OverAndWhere() {
            registry.registerStructure(StructureDef.builder()
                    .name("Field")
                    .member(StructureMember.operation("one", TypeExpr.var("F")))
                    .member(StructureMember.operation("zero", TypeExpr.var("F")))
                    .member(StructureMember.operation("inv", TypeExpr.function(TypeExpr.var("F"), TypeExpr.var("F"))))
                    .member(StructureMember.axiom("involution", Expression.forAll(List.of(QuantifiedVar.of("x", "F")),
                            Expression.eq(Expression.op("inv", Expression.op("inv", v("x"))), v("x")))))
                    .build());
            registry.registerStructure(semigroup());
            registry.registerStructure(StructureDef.builder()
                    .name("VectorSpace")
                    .overClause(TypeExpr.parametric("Field", List.of(TypeExpr.var("F"))))
                    .member(StructureMember.operation("scale", TypeExpr.function(
                            TypeExpr.product(List.of(TypeExpr.var("F"), TypeExpr.var("V"))), TypeExpr.var("V"))))
                    .build());
            registry.registerImplements(ImplementsDef.builder()
                    .structureName("VectorSpace")
                    .typeArg(TypeExpr.named("ℝ"))
                    .where(WhereConstraint.of("Semigroup", List.of(TypeExpr.named("ℝ"))))
                    .build());

            // 只能由 Field 的对合公理推出
            Expression overGoal = Expression.forAll(List.of(QuantifiedVar.of("a", "F")),
                    Expression.eq(Expression.op("inv", Expression.op("inv", Expression.op("inv", v("a")))),
                            Expression.op("inv", v("a"))));
            // 需要两次使用 Semigroup 的结合律
            Expression whereGoal = forAll(List.of("a", "b", "c", "d"),
                    Expression.eq(mul(mul(mul(v("a"), v("b")), v("c")), v("d")),
                            mul(v("a"), mul(v("b"), mul(v("c"), v("d"))))));

            try (AxiomVerifier verifier = new AxiomVerifier(registry, backend)) {
                assertAll("Before loading",
                        () -> assertFalse(backend.verifyAxiom(overGoal).isValid()),
                        () -> assertFalse(backend.verifyAxiom(whereGoal).isValid())
                );

                verifier.ensureStructureLoaded("VectorSpace");

                assertAll("Loaded dependencies",
                        () -> assertTrue(verifier.isStructureLoaded("Field")),
                        () -> assertTrue(verifier.isStructureLoaded("Semigroup")),
                        () -> assertTrue(verifier.isStructureLoaded("VectorSpace")),
                        () -> assertTrue(backend.verifyAxiom(overGoal).isValid(), "Field axioms come with over"),
                        () -> assertTrue(backend.verifyAxiom(whereGoal).isValid(), "Semigroup axioms come with where"),
                        () -> assertTrue(backend.checkSatisfiability(
                                Expression.eq(v("zero"), v("one"))).isUnsatisfiable(), "Identity elements are distinct")
                );
                assertTrue(verifier.verify(overGoal).isValid());
                assertTrue(verifier.verify(whereGoal).isValid());
            }
        }

        @Test
        @DisplayName("嵌套结构中的单位元与公理被加载")
        void testEnsureStructureLoaded_Nested() {
            registry.registerStructure(StructureDef.builder()
                    .name("Ring")
                    .member(StructureMember.nested("additive", TypeExpr.named("AbelianGroup"), List.of(
                            StructureMember.operation("plus_r", TypeExpr.binaryOp("R")),
                            StructureMember.operation("zero_r", TypeExpr.var("R")),
                            StructureMember.axiom("identity", forAll(List.of("x"),
                                    Expression.eq(Expression.op("plus_r", v("x"), v("zero_r")), v("x")))))))
                    .build());

            try (AxiomVerifier verifier = new AxiomVerifier(registry, backend)) {
                VerificationResult result = verifier.verify(forAll(List.of("y"),
                        Expression.eq(Expression.op("plus_r", Expression.op("plus_r", v("y"), v("zero_r")), v("zero_r")), v("y"))));

                assertTrue(result.isValid());
                assertTrue(verifier.isStructureLoaded("Ring"));
            }
        }

        @Test
        @DisplayName("未注册的结构应抛出 StructureException")
        void testEnsureStructureLoaded_Unknown() {
            try (AxiomVerifier verifier = new AxiomVerifier(registry, backend)) {
                assertThrows(StructureException.class, () -> verifier.ensureStructureLoaded("Missing"));
            }
        }

        @Test
        @DisplayName("加载失败时不留下部分断言")
        void testEnsureStructureLoaded_FailureRollsBack() {
            registry.registerStructure(StructureDef.builder()
                    .name("Broken")
                    .member(StructureMember.operation("unit", TypeExpr.var("B")))
                    .member(StructureMember.axiom("uses_free", Expression.eq(v("unit"), v("undeclared"))))
                    .build());

            try (AxiomVerifier verifier = new AxiomVerifier(registry, backend)) {
                TranslationException e = assertThrows(TranslationException.class,
                        () -> verifier.ensureStructureLoaded("Broken"));

                assertAll("Rolled back",
                        () -> assertEquals(TranslationException.Kind.UNDEFINED_SYMBOL, e.getKind()),
                        () -> assertFalse(verifier.isStructureLoaded("Broken")),
                        () -> assertFalse(backend.isStructureLoaded("Broken")),
                        () -> assertEquals(0, backend.scopeDepth()),
                        () -> assertEquals(0, verifier.stats().getLoadedStructures())
                );
            }
        }

        @Test
        @DisplayName("与目标无关的结构加载失败只产生警告")
        void testVerify_UnrelatedFailureIsSkipped() {
            registry.registerStructure(semigroup());
            registry.registerStructure(StructureDef.builder()
                    .name("Broken")
                    .member(StructureMember.axiom("uses_free", Expression.eq(v("nothing"), v("nothing"))))
                    .build());

            try (AxiomVerifier verifier = new AxiomVerifier(registry, backend)) {
                VerificationResult result = verifier.verify(forAll(List.of("a"),
                        Expression.eq(mul(v("a"), v("a")), mul(v("a"), v("a")))));

                assertTrue(result.isValid());
                assertTrue(verifier.isStructureLoaded("Semigroup"));
                assertFalse(verifier.isStructureLoaded("Broken"));
            }
        }
    }

    @Nested
    @DisplayName("一致性与程序函数 (Consistency and program functions)")
    class ConsistencyTests {

        @Test
        @DisplayName("矛盾的公理应抛出 VerifierException")
        void testVerify_InconsistentAxioms() {
            registry.registerStructure(StructureDef.builder()
                    .name("Absurd")
                    .member(StructureMember.operation("c", TypeExpr.var("A")))
                    .member(StructureMember.axiom("pos", Expression.op("gt", v("c"), Expression.constant(0))))
                    .member(StructureMember.axiom("neg", Expression.op("lt", v("c"), Expression.constant(0))))
                    .build());

            try (AxiomVerifier verifier = new AxiomVerifier(registry, backend)) {
                assertThrows(VerifierException.class, () -> verifier.verify(Expression.eq(v("c"), v("c"))));
                assertThrows(VerifierException.class, () -> verifier.verify(Expression.eq(v("c"), v("c"))),
                        "The inconsistency is remembered");
            }
        }

        @Test
        @DisplayName("顶层函数作为全称定义等式加载")
        void testLoadProgramFunctions() {
            registry.registerFunction(TopLevelFunction.of("twice", List.of("n"), Expression.op("plus", v("n"), v("n"))));

            try (AxiomVerifier verifier = new AxiomVerifier(registry, backend)) {
                verifier.loadProgramFunctions();
                VerificationResult result = verifier.verify(Expression.forAll(List.of(QuantifiedVar.of("k", "ℤ")),
                        Expression.eq(Expression.op("twice", v("k")), Expression.op("times", Expression.constant(2), v("k")))));

                assertTrue(result.isValid());
            }
        }

        @Test
        @DisplayName("构造时声明数据类型，其余名字作为常量加载")
        void testDataTypesAndConstructorConstants() {
            registry.registerDataType(DataDef.enumeration("Color", "Red", "Green"));

            try (AxiomVerifier verifier = new AxiomVerifier(registry, backend)) {
                verifier.loadConstructorConstants(List.of("Red", "Alpha", "Beta"));

                assertAll("Declarations",
                        () -> assertTrue(backend.isDeclaredConstructor("Red")),
                        () -> assertTrue(verifier.checkSatisfiability(
                                Expression.eq(v("Alpha"), v("Beta"))).isUnsatisfiable(), "Constants are distinct"),
                        () -> assertFalse(verifier.areEquivalent(v("Red"), v("Green")))
                );
            }
        }

        @Test
        @DisplayName("自带后端的验证器关闭时关闭后端")
        void testOwnedBackend() {
            registry.registerStructure(semigroup());
            try (AxiomVerifier verifier = new AxiomVerifier(registry)) {
                assertEquals("Z3", verifier.getBackend().name());
                assertEquals(Expression.constant(4),
                        verifier.simplify(Expression.op("plus", Expression.constant(1), Expression.constant(3))));
            }
        }
    }
}
