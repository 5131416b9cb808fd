package org.kleis.verify.solvers.isabelle;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CompanionTheoryTest {

    private static final String THEORY = String.join("\n",
            "theory Groups",
            "imports Main",
            "begin",
            "",
            "lemma left_identity: \"e * x = x\"",
            "  by simp",
            "",
            "lemma associativity: \"(a * b) * c = a * (b * c)\"",
            "proof -",
            "  show ?thesis by (simp add: mult.assoc)",
            "qed",
            "",
            "lemma inverse_unique: \"a * b = e ⟹ b = inv a\"",
            "  sorry",
            "",
            "theorem abandoned: \"False\"",
            "oops",
            "",
            "end");

    @Test
    @DisplayName("区分已证明、sorry 和 oops 的引理")
    void testParse() {
        CompanionTheory theory = CompanionTheory.parse(Path.of("Groups.thy"), THEORY);

        assertAll("Lemma classification",
                () -> assertEquals(Set.of("left_identity", "associativity"), theory.getProvenLemmas()),
                () -> assertEquals(List.of("inverse_unique"), theory.getSorryLemmas()),
                () -> assertFalse(theory.getProvenLemmas().contains("abandoned"), "oops does not count as proven"),
                () -> assertEquals("Groups", theory.theoryName())
        );
    }

    @Test
    @DisplayName("查找源文件旁边的 .thy 文件")
    void testCompanionOf(@TempDir Path dir) throws IOException {
        Path source = Files.writeString(dir.resolve("groups.kleis"), "structure Group(G) {}");
        Path lonely = Files.writeString(dir.resolve("rings.kleis"), "structure Ring(R) {}");
        Path thy = Files.writeString(dir.resolve("groups.thy"), THEORY);

        assertEquals(thy, CompanionTheory.companionOf(source));
        assertNull(CompanionTheory.companionOf(lonely));
        assertEquals(2, CompanionTheory.read(thy).getProvenLemmas().size());
    }
}
