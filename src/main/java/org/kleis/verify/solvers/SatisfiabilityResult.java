package org.kleis.verify.solvers;

import lombok.Getter;

import java.util.Objects;

@Getter
public final class SatisfiabilityResult {

    public enum Kind {
        SATISFIABLE,
        UNSATISFIABLE,
        UNKNOWN
    }

    private static final SatisfiabilityResult UNSAT = new SatisfiabilityResult(Kind.UNSATISFIABLE, null, null);

    private final Kind kind;
    private final Witness witness; // 仅 SATISFIABLE
    private final String reason;   // 仅 UNKNOWN

    private SatisfiabilityResult(Kind kind, Witness witness, String reason) {
        this.kind = kind;
        this.witness = witness;
        this.reason = reason;
    }

    public static SatisfiabilityResult satisfiable(Witness example) {
        Objects.requireNonNull(example, "SatisfiabilityResult-satisfiable: example 不能为 null");
        return new SatisfiabilityResult(Kind.SATISFIABLE, example, null);
    }

    public static SatisfiabilityResult unsatisfiable() {
        return UNSAT;
    }

    public static SatisfiabilityResult unknown(String reason) {
        return new SatisfiabilityResult(Kind.UNKNOWN, null, reason == null ? "unknown" : reason);
    }

    public boolean isSatisfiable() {
        return kind == Kind.SATISFIABLE;
    }

    public boolean isUnsatisfiable() {
        return kind == Kind.UNSATISFIABLE;
    }

    public boolean isUnknown() {
        return kind == Kind.UNKNOWN;
    }

    public String getExample() {
        return witness == null ? null : witness.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SatisfiabilityResult that = (SatisfiabilityResult) o;
        return kind == that.kind && Objects.equals(witness, that.witness) && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, witness, reason);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case SATISFIABLE -> "Satisfiable { example: " + witness + " }";
            case UNSATISFIABLE -> "Unsatisfiable";
            case UNKNOWN -> "Unknown (" + reason + ")";
        };
    }
}
