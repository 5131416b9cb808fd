package org.kleis.verify.solvers.capabilities;

import com.google.gson.annotations.SerializedName;
import lombok.Getter;

@Getter
public final class PerformanceHints {

    public static final int DEFAULT_MAX_AXIOMS = 10_000;
    public static final long DEFAULT_TIMEOUT_MS = 5_000L;

    @SerializedName("max_axioms")
    private int maxAxioms = DEFAULT_MAX_AXIOMS;
    @SerializedName("timeout_ms")
    private long timeoutMs = DEFAULT_TIMEOUT_MS;

    private PerformanceHints() {
        // Gson
    }

    static PerformanceHints defaults() {
        return new PerformanceHints();
    }
}
