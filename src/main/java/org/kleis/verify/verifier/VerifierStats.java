package org.kleis.verify.verifier;

import lombok.Getter;

import java.util.Objects;

@Getter
public final class VerifierStats {

    private final int loadedStructures;
    private final int declaredOperations;

    private VerifierStats(int loadedStructures, int declaredOperations) {
        this.loadedStructures = loadedStructures;
        this.declaredOperations = declaredOperations;
    }

    public static VerifierStats of(int loadedStructures, int declaredOperations) {
        return new VerifierStats(loadedStructures, declaredOperations);
    }

    // --- Object 方法 ---
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        VerifierStats that = (VerifierStats) o;
        return loadedStructures == that.loadedStructures && declaredOperations == that.declaredOperations;
    }

    @Override
    public int hashCode() {
        return Objects.hash(loadedStructures, declaredOperations);
    }

    @Override
    public String toString() {
        return "VerifierStats{loadedStructures=" + loadedStructures + ", declaredOperations=" + declaredOperations + "}";
    }
}
