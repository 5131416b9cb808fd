package org.kleis.verify.solvers.capabilities;

import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * 后端的声明式能力清单。构造后端时加载一次，之后只读。
 * 翻译器通过它询问"运算 X 是否原生支持"，而不是判断自己属于哪个引擎。
 * @author Ayalyt
 */
@Getter
public final class SolverCapabilities {

    private SolverMetadata solver;
    private Capabilities capabilities;

    private SolverCapabilities() {
        // Gson
    }

    void validate(String source) {
        if (solver == null || solver.getName() == null || solver.getName().isBlank()) {
            throw new CapabilityException("Capability manifest " + source + " has no solver name");
        }
        if (capabilities == null) {
            throw new CapabilityException("Capability manifest " + source + " has no capabilities section");
        }
        if (capabilities.getFeatures() == null) {
            throw new CapabilityException("Capability manifest " + source + " has no features section");
        }
        capabilities.freeze();
        for (Map.Entry<String, OperationSpec> entry : capabilities.getOperations().entrySet()) {
            if (entry.getValue() == null || entry.getValue().getArity() < 0) {
                throw new CapabilityException("Capability manifest " + source
                        + ": invalid arity for operation '" + entry.getKey() + "'");
            }
        }
    }

    // --- 查询 ---

    public boolean hasOperation(String operation) {
        return capabilities.getOperations().containsKey(operation);
    }

    public OperationSpec getOperation(String operation) {
        return capabilities.getOperations().get(operation);
    }

    /**
     * @return 运算是否被声明为原生支持。未声明的运算按未解释函数处理。
     */
    public boolean isNative(String operation) {
        OperationSpec spec = getOperation(operation);
        return spec != null && spec.isNativeSupport();
    }

    public List<String> nativeOperations() {
        return capabilities.getOperations().entrySet().stream()
                .filter(e -> e.getValue().isNativeSupport())
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    public List<String> allOperations() {
        return capabilities.getOperations().keySet().stream().sorted().toList();
    }

    public boolean hasTheory(String theory) {
        return capabilities.getTheories().contains(theory);
    }

    public FeatureFlags features() {
        return capabilities.getFeatures();
    }

    public PerformanceHints performance() {
        return capabilities.getPerformance();
    }

    @Override
    public String toString() {
        return "SolverCapabilities{" + solver + ", operations=" + capabilities.getOperations().size()
                + ", theories=" + capabilities.getTheories() + "}";
    }
}
