package org.kleis.verify.solvers.isabelle;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.kleis.verify.solvers.SolverException;
import org.kleis.verify.solvers.VerificationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IsabelleResultsTest {

    private static JsonObject json(String text) {
        return JsonParser.parseString(text).getAsJsonObject();
    }

    @Nested
    @DisplayName("FINISHED 回复 (Finished replies)")
    class FinishedTests {

        @Test
        @DisplayName("所有节点完成且无错误时有效")
        void testFinished_Valid() {
            JsonObject reply = json("{\"ok\":true,\"nodes\":[{\"node_name\":\"Kleis_1\","
                    + "\"status\":{\"finished\":true,\"failed\":false},\"messages\":[]}]}");
            assertTrue(IsabelleResults.fromFinished(reply).isValid());
        }

        @Test
        @DisplayName("节点失败或未完成时无效")
        void testFinished_FailedOrIncomplete() {
            VerificationResult failed = IsabelleResults.fromFinished(
                    json("{\"nodes\":[{\"status\":{\"failed\":true}}]}"));
            VerificationResult incomplete = IsabelleResults.fromFinished(
                    json("{\"nodes\":[{\"status\":{\"finished\":false}}]}"));

            assertTrue(failed.isInvalid());
            assertTrue(incomplete.isInvalid());
            assertEquals("Proof incomplete", incomplete.getCounterexample());
        }

        @Test
        @DisplayName("收集到的证明错误优先")
        void testFinished_ProofError() {
            JsonObject reply = json("{\"nodes\":[]}");
            reply.addProperty(IsabelleResults.PROOF_ERROR, "Failed to finish proof");

            VerificationResult result = IsabelleResults.fromFinished(reply);
            assertTrue(result.isInvalid());
            assertTrue(result.getCounterexample().contains("Failed to finish proof"));
        }

        @Test
        @DisplayName("没有节点时按 errors 数组判断")
        void testFinished_ErrorsArray() {
            assertTrue(IsabelleResults.fromFinished(json("{\"errors\":[]}")).isValid());
            assertTrue(IsabelleResults.fromFinished(
                    json("{\"errors\":[{\"kind\":\"error\",\"message\":\"Bad theory\"}]}")).isInvalid());
        }
    }

    @Nested
    @DisplayName("错误文本分类 (Error classification)")
    class ErrorTests {

        @Test
        @DisplayName("证明失败、未定义符号与类型错误都是 Invalid")
        void testFromError_Invalid() {
            assertAll("Invalid classifications",
                    () -> assertTrue(IsabelleResults.fromError("Failed to finish proof: goal (1 subgoal)").isInvalid()),
                    () -> assertTrue(IsabelleResults.fromError("Undefined constant: \"mul\"").getCounterexample()
                            .startsWith("Undefined symbol or type")),
                    () -> assertTrue(IsabelleResults.fromError("Type unification failed: Clash of types").getCounterexample()
                            .startsWith("Type error in formula")),
                    () -> assertTrue(IsabelleResults.fromError("Something else went wrong").isInvalid())
            );
        }

        @Test
        @DisplayName("超时是 Unknown")
        void testFromError_Timeout() {
            assertTrue(IsabelleResults.fromError("Timeout after 30s").isUnknown());
        }

        @Test
        @DisplayName("语法错误应抛出 SYNTAX_ERROR")
        void testFromError_Syntax() {
            SolverException e = assertThrows(SolverException.class,
                    () -> IsabelleResults.fromError("Inner syntax error at \"⟶ )\""));
            assertEquals(SolverException.Kind.SYNTAX_ERROR, e.getKind());
        }

        @Test
        @DisplayName("status 字段分类")
        void testFromStatus() {
            assertTrue(IsabelleResults.fromStatus(json("{\"status\":\"ok\"}")).isValid());
            assertTrue(IsabelleResults.fromStatus(json("{\"status\":\"failed\",\"message\":\"x\"}")).isInvalid());
            assertTrue(IsabelleResults.fromStatus(json("{\"status\":\"pending\"}")).isUnknown());
        }
    }
}
