package org.kleis.verify.solvers.capabilities;

import lombok.Getter;

import java.util.Map;
import java.util.Set;

/**
 * 清单的 capabilities 部分：理论、运算表、特性开关和性能提示。
 */
@Getter
public final class Capabilities {

    private Set<String> theories;
    private Map<String, OperationSpec> operations;
    private FeatureFlags features;
    private PerformanceHints performance;

    private Capabilities() {
        // Gson
    }

    /**
     * 加载后冻结集合，补齐缺省部分。
     */
    void freeze() {
        theories = theories == null ? Set.of() : Set.copyOf(theories);
        operations = operations == null ? Map.of() : Map.copyOf(operations);
        if (performance == null) {
            performance = PerformanceHints.defaults();
        }
    }
}
