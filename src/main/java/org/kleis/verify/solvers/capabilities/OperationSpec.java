package org.kleis.verify.solvers.capabilities;

import com.google.gson.annotations.SerializedName;
import lombok.Getter;

import java.util.List;

/**
 * 单个运算的能力描述。native 为 false 表示该运算以未解释函数处理，
 * reason / alternatives 说明原因与替代方案。
 */
@Getter
public final class OperationSpec {

    private int arity;
    private String theory;
    @SerializedName("native")
    private boolean nativeSupport;
    private String reason;
    private List<String> alternatives;

    private OperationSpec() {
        // Gson
    }

    public List<String> getAlternatives() {
        return alternatives == null ? List.of() : alternatives;
    }

    @Override
    public String toString() {
        return "OperationSpec{arity=" + arity + ", theory=" + theory + ", native=" + nativeSupport + "}";
    }
}
