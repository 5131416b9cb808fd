package org.kleis.verify.structures;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 运算名 ↔ 所属结构、具体类型 ↔ 已实现结构的双向映射。
 * 由 {@link StructureRegistry#buildOperationRegistry()} 一次性构建。
 */
public class OperationRegistry {

    private static final Logger logger = LoggerFactory.getLogger(OperationRegistry.class);

    private final Map<String, Set<String>> operationToStructures = new LinkedHashMap<>();
    private final Map<String, Set<String>> structureToOperations = new LinkedHashMap<>();
    private final Map<String, Set<String>> typeToStructures = new LinkedHashMap<>();
    private final Map<String, Set<String>> structureToTypes = new LinkedHashMap<>();

    void registerOperation(String operation, String structure) {
        operationToStructures.computeIfAbsent(operation, k -> new LinkedHashSet<>()).add(structure);
        structureToOperations.computeIfAbsent(structure, k -> new LinkedHashSet<>()).add(operation);
    }

    void registerImplementation(String type, String structure) {
        typeToStructures.computeIfAbsent(type, k -> new LinkedHashSet<>()).add(structure);
        structureToTypes.computeIfAbsent(structure, k -> new LinkedHashSet<>()).add(type);
    }

    public Set<String> owners(String operation) {
        return Collections.unmodifiableSet(operationToStructures.getOrDefault(operation, Set.of()));
    }

    public Set<String> operationsOf(String structure) {
        return Collections.unmodifiableSet(structureToOperations.getOrDefault(structure, Set.of()));
    }

    public Set<String> structuresImplementedBy(String type) {
        return Collections.unmodifiableSet(typeToStructures.getOrDefault(type, Set.of()));
    }

    public Set<String> typesImplementing(String structure) {
        return Collections.unmodifiableSet(structureToTypes.getOrDefault(structure, Set.of()));
    }

    public boolean implementsStructure(String type, String structure) {
        return structuresImplementedBy(type).contains(structure);
    }

    /**
     * @return 具体类型是否通过某个 implements 块支持该运算。
     */
    public boolean supportsOperation(String type, String operation) {
        for (String owner : owners(operation)) {
            if (implementsStructure(type, owner)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 校验运算作用于具体类型时确有实现支撑。
     * @throws StructureException 如果没有任何实现。
     */
    public void validateOperation(String type, String operation) {
        if (!supportsOperation(type, operation)) {
            logger.warn("类型 {} 没有实现提供运算 {}", type, operation);
            throw new StructureException("Operation '" + operation + "' is not implemented for type '" + type
                    + "' (owners: " + owners(operation) + ")");
        }
    }

    @Override
    public String toString() {
        return "OperationRegistry{operations=" + operationToStructures.size()
                + ", implementedTypes=" + typeToStructures.size() + "}";
    }
}
