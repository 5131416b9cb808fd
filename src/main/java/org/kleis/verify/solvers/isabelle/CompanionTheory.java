package org.kleis.verify.solvers.isabelle;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.kleis.verify.solvers.SolverException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 与 .kleis 源文件同名的手写 .thy 伴随理论。
 * 逐行扫描 lemma / theorem 声明，证明中出现 sorry 的引理不计入已证明集合。
 * 这只是启发式的信任信号：只有整个理论经 Isabelle 校验通过后，已证明集合才会被采信。
 */
@Getter
public final class CompanionTheory {

    private final Path path;
    private final Set<String> provenLemmas;
    private final List<String> sorryLemmas;

    private CompanionTheory(Path path, Set<String> provenLemmas, List<String> sorryLemmas) {
        this.path = path;
        this.provenLemmas = Collections.unmodifiableSet(provenLemmas);
        this.sorryLemmas = Collections.unmodifiableList(sorryLemmas);
    }

    /**
     * @return 源文件的 .thy 兄弟文件；不存在时返回 null。
     */
    public static Path companionOf(Path kleisFile) {
        Objects.requireNonNull(kleisFile, "CompanionTheory-companionOf: kleisFile 不能为 null");
        String fileName = kleisFile.getFileName().toString();
        Path thy = kleisFile.resolveSibling(StringUtils.substringBeforeLast(fileName, ".") + ".thy");
        return Files.isRegularFile(thy) ? thy : null;
    }

    public static CompanionTheory read(Path thyFile) {
        try {
            return parse(thyFile, Files.readString(thyFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new SolverException(SolverException.Kind.INTERNAL,
                    "Failed to read theory file " + thyFile + ": " + e.getMessage(), e);
        }
    }

    static CompanionTheory parse(Path path, String content) {
        Set<String> proven = new LinkedHashSet<>();
        List<String> sorry = new ArrayList<>();
        String current = null;
        for (String raw : content.split("\\R")) {
            String line = raw.trim();
            String declared = lemmaName(line);
            if (declared != null) {
                current = declared;
            }
            if (current != null && line.contains("sorry") && !sorry.contains(current)) {
                sorry.add(current);
            }
            if (endsProof(line)) {
                // oops 放弃证明
                if (current != null && !sorry.contains(current) && !line.equals("oops")) {
                    proven.add(current);
                }
                current = null;
            }
        }
        return new CompanionTheory(path, proven, sorry);
    }

    private static String lemmaName(String line) {
        String rest;
        if (line.startsWith("lemma ")) {
            rest = line.substring("lemma ".length());
        } else if (line.startsWith("theorem ")) {
            rest = line.substring("theorem ".length());
        } else {
            return null;
        }
        String name = StringUtils.substringBefore(rest, ":").trim();
        return name.isEmpty() || name.contains(" ") ? null : name;
    }

    private static boolean endsProof(String line) {
        return line.equals("qed") || line.startsWith("by ") || line.contains(" by ")
                || line.equals("done") || line.equals("oops");
    }

    /**
     * @return 理论名，即去掉 .thy 的文件名。
     */
    public String theoryName() {
        return StringUtils.removeEnd(path.getFileName().toString(), ".thy");
    }
}
