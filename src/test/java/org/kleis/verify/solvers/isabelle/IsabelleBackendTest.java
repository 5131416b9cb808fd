package org.kleis.verify.solvers.isabelle;

import org.apache.commons.lang3.tuple.Pair;
import org.kleis.verify.ast.Expression;
import org.kleis.verify.ast.QuantifiedVar;
import org.kleis.verify.ast.TypeExpr;
import org.kleis.verify.config.KleisConfig;
import org.kleis.verify.solvers.SolverException;
import org.kleis.verify.structures.DataDef;
import org.kleis.verify.structures.TypeParam;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 不需要 Isabelle 服务器的部分：理论文本、会话记录和作用域。
 */
class IsabelleBackendTest {

    private IsabelleBackend backend;

    @BeforeEach
    void setUp() {
        backend = new IsabelleBackend(KleisConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    @Nested
    @DisplayName("理论文本 (Theory text)")
    class TheoryTextTests {

        @Test
        @DisplayName("上下文公理与待证引理")
        void testBuildTheory() {
            String theory = IsabelleBackend.buildTheory("Kleis_1", List.of("Main"),
                    List.of("datatype Color = Red | Green"), List.of("(∀x. (f x) = x)"), "(f a = a)");

            assertAll("Theory text",
                    () -> assertTrue(theory.startsWith("theory Kleis_1\nimports Main\nbegin\n")),
                    () -> assertTrue(theory.contains("datatype Color = Red | Green\n")),
                    () -> assertTrue(theory.contains("axiomatization where ctx_0: \"(∀x. (f x) = x)\"")),
                    () -> assertTrue(theory.contains("lemma kleis_axiom: \"(f a = a)\"\n  by auto\n")),
                    () -> assertTrue(theory.endsWith("end\n"))
            );
        }

        @Test
        @DisplayName("没有上下文公理时不输出 axiomatization")
        void testBuildTheory_NoContext() {
            String theory = IsabelleBackend.buildTheory("Kleis_2", List.of("Main", "Groups"), List.of(), List.of(), "True");
            assertFalse(theory.contains("axiomatization"));
            assertTrue(theory.contains("imports Main Groups"));
        }

        @Test
        @DisplayName("数据类型声明带类型参数和字段类型")
        void testDatatypeDeclaration() {
            DataDef option = DataDef.of("Maybe", List.of(TypeParam.of("T")), List.of(
                    DataDef.Variant.of("Nothing", List.of()),
                    DataDef.Variant.of("Just", List.of(DataDef.Field.positional(TypeExpr.var("T"))))));
            DataDef point = DataDef.of("Point", List.of(
                    DataDef.Variant.of("Pt", List.of(DataDef.Field.of("x", TypeExpr.named("ℝ")),
                            DataDef.Field.of("y", TypeExpr.named("ℝ"))))));

            assertEquals("datatype 'T Maybe = Nothing | Just \"'T\"", backend.datatypeDeclaration(option));
            assertEquals("datatype Point = Pt \"real\" \"real\"", backend.datatypeDeclaration(point));
        }
    }

    @Nested
    @DisplayName("单位元与函数定义 (Identity elements and definitions)")
    class IdentityTests {

        private final Expression leftIdentity = Expression.forAll(List.of(QuantifiedVar.of("x", "ℝ")),
                Expression.eq(Expression.op("plus", Expression.object("zero"), Expression.object("x")),
                        Expression.object("x")));

        @Test
        @DisplayName("单位元声明为 consts，同类型的单位元两两不同")
        void testIdentityElementsDeclaredAndDistinct() {
            backend.loadIdentityElement("zero", TypeExpr.named("ℝ"));
            backend.loadIdentityElement("one", TypeExpr.named("ℝ"));
            backend.loadIdentityElement("e", TypeExpr.named("Int"));
            backend.loadStructureAxioms("Monoid", List.of(Pair.of("left_identity", leftIdentity)));

            String theory = backend.buildTheoryFor("Kleis_Identity", "(zero ≠ one)");

            assertAll("Identity declarations",
                    () -> assertTrue(theory.contains("consts zero :: \"real\"\n")),
                    () -> assertTrue(theory.contains("consts one :: \"real\"\n")),
                    () -> assertTrue(theory.contains("consts e :: \"int\"\n")),
                    () -> assertTrue(theory.contains("axiomatization where ctx_0: \"(zero ≠ one)\"")),
                    () -> assertTrue(theory.contains("axiomatization where ctx_1: \"(∀(x :: real). ((zero + x) = x))\"")),
                    () -> assertFalse(theory.contains("≠ e)")),
                    () -> assertTrue(theory.indexOf("consts zero") < theory.indexOf("axiomatization"))
            );
        }

        @Test
        @DisplayName("重复加载单位元不重复声明")
        void testIdentityElementIdempotent() {
            backend.loadIdentityElement("zero", TypeExpr.named("ℝ"));
            backend.loadIdentityElement("one", TypeExpr.named("ℝ"));
            backend.loadIdentityElement("zero", TypeExpr.named("ℝ"));

            String theory = backend.buildTheoryFor("Kleis_Idem", "True");
            assertEquals(theory.indexOf("consts zero"), theory.lastIndexOf("consts zero"));
            assertFalse(theory.contains("ctx_1"));
        }

        @Test
        @DisplayName("类型变量和未知载体按 int 声明，无参数据类型保留原名")
        void testIdentityTypes() {
            backend.declareDataTypes(List.of(DataDef.enumeration("Color", "Red", "Green")));

            assertAll("HOL types",
                    () -> assertEquals("int", backend.holTypeOf(null)),
                    () -> assertEquals("int", backend.holTypeOf(TypeExpr.var("T"))),
                    () -> assertEquals("int", backend.holTypeOf(TypeExpr.named("M"))),
                    () -> assertEquals("Color", backend.holTypeOf(TypeExpr.named("Color"))),
                    () -> assertEquals("real list",
                            backend.holTypeOf(TypeExpr.parametric("List", List.of(TypeExpr.named("ℝ")))))
            );
        }

        @Test
        @DisplayName("函数写成 definition 而不是上下文公理")
        void testFunctionDefinition() {
            backend.defineFunction("double", List.of("n"),
                    Expression.op("plus", Expression.object("n"), Expression.object("n")));

            String theory = backend.buildTheoryFor("Kleis_Def", "(double 2 = 4)");
            assertAll("Definition",
                    () -> assertTrue(theory.contains("definition double where \"double n = (n + n)\"\n")),
                    () -> assertFalse(theory.contains("axiomatization"))
            );
        }

        @Test
        @DisplayName("pop 撤销作用域内声明的单位元、函数和互异公理")
        void testPushPopRestoresDeclarations() {
            backend.loadIdentityElement("zero", TypeExpr.named("ℝ"));
            backend.push();
            backend.loadIdentityElement("one", TypeExpr.named("ℝ"));
            backend.defineFunction("double", List.of("n"),
                    Expression.op("plus", Expression.object("n"), Expression.object("n")));
            assertTrue(backend.buildTheoryFor("Kleis_Inner", "True").contains("consts one"));

            backend.pop();
            String theory = backend.buildTheoryFor("Kleis_Outer", "True");
            assertAll("After pop",
                    () -> assertTrue(theory.contains("consts zero :: \"real\"")),
                    () -> assertFalse(theory.contains("consts one")),
                    () -> assertFalse(theory.contains("definition double")),
                    () -> assertFalse(theory.contains("axiomatization")),
                    () -> assertEquals(0, backend.declaredOperationCount())
            );
        }

        @Test
        @DisplayName("reset 清空单位元声明")
        void testResetClearsIdentities() {
            backend.loadIdentityElement("zero", TypeExpr.named("ℝ"));
            backend.reset();
            assertFalse(backend.buildTheoryFor("Kleis_Reset", "True").contains("consts"));
        }
    }

    @Nested
    @DisplayName("会话记录 (Session bookkeeping)")
    class BookkeepingTests {

        @Test
        @DisplayName("构造子与函数计入声明数")
        void testDeclarations() {
            backend.declareDataTypes(List.of(DataDef.enumeration("Color", "Red", "Green")));
            backend.defineFunction("double", List.of("n"),
                    Expression.op("plus", Expression.object("n"), Expression.object("n")));

            assertAll("Declarations",
                    () -> assertTrue(backend.isDeclaredConstructor("Red")),
                    () -> assertFalse(backend.isDeclaredConstructor("Blue")),
                    () -> assertEquals(3, backend.declaredOperationCount())
            );
        }

        @Test
        @DisplayName("pop 撤销作用域内加载的结构")
        void testPushPop() {
            Expression axiom = Expression.forAll(List.of(QuantifiedVar.of("x")),
                    Expression.eq(Expression.op("mul", Expression.object("e"), Expression.object("x")), Expression.object("x")));

            backend.loadStructureAxioms("Base", List.of());
            backend.push();
            backend.loadStructureAxioms("Monoid", List.of(Pair.of("left_identity", axiom)));
            assertEquals(2, backend.loadedStructureCount());

            backend.pop();
            assertAll("After pop",
                    () -> assertTrue(backend.isStructureLoaded("Base")),
                    () -> assertFalse(backend.isStructureLoaded("Monoid")),
                    () -> assertEquals(0, backend.scopeDepth())
            );
            assertThrows(IllegalArgumentException.class, () -> backend.pop(1));
        }

        @Test
        @DisplayName("不支持具体求值，化简原样返回")
        void testEvaluateAndSimplify() {
            Expression expr = Expression.op("plus", Expression.constant(1), Expression.constant(2));

            SolverException e = assertThrows(SolverException.class, () -> backend.evaluate(expr));
            assertEquals(SolverException.Kind.UNSUPPORTED, e.getKind());
            assertSame(expr, backend.simplify(expr));
            assertEquals("Isabelle", backend.name());
            assertFalse(backend.capabilities().features().isEvaluation());
        }

        @Test
        @DisplayName("未连接时没有会话，关闭是安全的")
        void testNotConnected() {
            assertFalse(backend.isConnected());
            assertFalse(backend.hasSession());
            backend.close();
        }
    }
}
