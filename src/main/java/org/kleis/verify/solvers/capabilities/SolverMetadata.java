package org.kleis.verify.solvers.capabilities;

import com.google.gson.annotations.SerializedName;
import lombok.Getter;

/**
 * 求解器身份：名字、版本、种类（smt / interactive_prover）和描述。
 */
@Getter
public final class SolverMetadata {

    private String name;
    private String version;
    @SerializedName("type")
    private String solverType;
    private String description;

    private SolverMetadata() {
        // Gson
    }

    @Override
    public String toString() {
        return name + " " + version + " (" + solverType + ")";
    }
}
