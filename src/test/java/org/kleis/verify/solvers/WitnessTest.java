package org.kleis.verify.solvers;

import org.kleis.verify.ast.Const;
import org.kleis.verify.ast.NamedObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WitnessTest {

    @Test
    @DisplayName("绑定渲染为 x = 0, y = 42")
    void testRendering_WithBindings() {
        Witness witness = Witness.of(List.of(
                WitnessBinding.of("x", Const.of("0")),
                WitnessBinding.of("y", Const.of("42"))), "(model)");

        assertAll("Rendering",
                () -> assertEquals("x = 0, y = 42", witness.toString()),
                () -> assertEquals(Const.of("42"), witness.get("y").orElseThrow()),
                () -> assertTrue(witness.get("z").isEmpty()),
                () -> assertEquals("(model)", witness.getRawModel())
        );
    }

    @Test
    @DisplayName("没有绑定时退回原始模型文本")
    void testRendering_RawOnly() {
        Witness witness = Witness.rawOnly("(define-fun x () Int 3)");

        assertTrue(witness.isEmpty());
        assertEquals("(define-fun x () Int 3)", witness.toString());
        assertEquals("", Witness.rawOnly(null).getRawModel());
    }

    @Test
    @DisplayName("结果的文本形式")
    void testResultRendering() {
        Witness witness = Witness.of(List.of(WitnessBinding.of("c", NamedObject.of("Red"))), "");

        assertAll("Result rendering",
                () -> assertEquals("Valid", VerificationResult.valid().toString()),
                () -> assertEquals("Invalid { counterexample: c = Red }", VerificationResult.invalid(witness).toString()),
                () -> assertEquals("c = Red", VerificationResult.invalid(witness).getCounterexample()),
                () -> assertNull(VerificationResult.valid().getCounterexample()),
                () -> assertEquals("Unknown (timeout)", VerificationResult.unknown("timeout").toString()),
                () -> assertEquals("Unsatisfiable", SatisfiabilityResult.unsatisfiable().toString()),
                () -> assertEquals("c = Red", SatisfiabilityResult.satisfiable(witness).getExample()),
                () -> assertThrows(NullPointerException.class, () -> VerificationResult.invalid(null))
        );
    }
}
