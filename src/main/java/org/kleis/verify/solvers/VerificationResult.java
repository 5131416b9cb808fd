package org.kleis.verify.solvers;

import lombok.Getter;

import java.util.Objects;

/**
 * 有效性检查的结果：Valid、Invalid（带反例）或 Unknown。
 * Unknown 是合法的终止结果，不是错误。
 */
@Getter
public final class VerificationResult {

    public enum Kind {
        VALID,
        INVALID,
        UNKNOWN
    }

    private static final VerificationResult VALID = new VerificationResult(Kind.VALID, null, null);

    private final Kind kind;
    private final Witness witness; // 仅 INVALID
    private final String reason;   // 仅 UNKNOWN

    private VerificationResult(Kind kind, Witness witness, String reason) {
        this.kind = kind;
        this.witness = witness;
        this.reason = reason;
    }

    public static VerificationResult valid() {
        return VALID;
    }

    public static VerificationResult invalid(Witness counterexample) {
        Objects.requireNonNull(counterexample, "VerificationResult-invalid: counterexample 不能为 null");
        return new VerificationResult(Kind.INVALID, counterexample, null);
    }

    public static VerificationResult unknown(String reason) {
        return new VerificationResult(Kind.UNKNOWN, null, reason == null ? "unknown" : reason);
    }

    public boolean isValid() {
        return kind == Kind.VALID;
    }

    public boolean isInvalid() {
        return kind == Kind.INVALID;
    }

    public boolean isUnknown() {
        return kind == Kind.UNKNOWN;
    }

    /**
     * @return 反例文本；非 INVALID 时为 null。
     */
    public String getCounterexample() {
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
        VerificationResult that = (VerificationResult) o;
        return kind == that.kind && Objects.equals(witness, that.witness) && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, witness, reason);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case VALID -> "Valid";
            case INVALID -> "Invalid { counterexample: " + witness + " }";
            case UNKNOWN -> "Unknown (" + reason + ")";
        };
    }
}
