package org.kleis.verify.solvers.capabilities;

import com.google.gson.annotations.SerializedName;
import lombok.Getter;

@Getter
public final class FeatureFlags {

    private boolean quantifiers;
    @SerializedName("uninterpreted_functions")
    private boolean uninterpretedFunctions;
    @SerializedName("recursive_functions")
    private boolean recursiveFunctions;
    private boolean evaluation;
    private boolean simplification;
    @SerializedName("proof_generation")
    private boolean proofGeneration;

    private FeatureFlags() {
        // Gson
    }
}
