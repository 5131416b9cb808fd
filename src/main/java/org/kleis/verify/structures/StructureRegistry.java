package org.kleis.verify.structures;

import org.apache.commons.lang3.tuple.Pair;
import org.kleis.verify.ast.Expression;
import org.kleis.verify.ast.TypeExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 结构注册表：以名字为键保存结构定义、implements 块、数据类型、类型别名和顶层函数。
 * 会话期间由验证器持有。注册时拒绝重复名字和结构引用循环。
 * @author Ayalyt
 */
public class StructureRegistry {

    private static final Logger logger = LoggerFactory.getLogger(StructureRegistry.class);

    private final Map<String, StructureDef> structures = new LinkedHashMap<>();
    // 结构名 -> 该结构的所有 implements 块
    private final Map<String, List<ImplementsDef>> implementsBlocks = new LinkedHashMap<>();
    private final Map<String, DataDef> dataTypes = new LinkedHashMap<>();
    private final Map<String, TypeExpr> typeAliases = new LinkedHashMap<>();
    private final Map<String, TopLevelFunction> functions = new LinkedHashMap<>();

    // --- 注册 ---

    /**
     * 注册一个结构定义。
     * @param def 结构定义。
     * @throws StructureException 如果名字已注册，或沿 extends、over、嵌套结构类型的引用回到自身。
     */
    public void registerStructure(StructureDef def) {
        String name = def.getName();
        if (structures.containsKey(name)) {
            throw new StructureException("Structure '" + name + "' is already registered");
        }
        checkAcyclic(def);
        structures.put(name, def);
        logger.debug("注册结构: {}", def);
    }

    /**
     * 从新结构出发沿结构引用（extends、over、嵌套结构类型）深度优先遍历，若回到新结构则拒绝。
     * 未注册的引用不展开。
     */
    private void checkAcyclic(StructureDef def) {
        String name = def.getName();
        Set<String> visited = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>(structuralReferences(def));
        while (!pending.isEmpty()) {
            String ref = pending.pop();
            if (ref.equals(name)) {
                logger.warn("检测到结构引用循环: {} -> ... -> {}", name, name);
                throw new StructureException("Cyclic structure reference: structure '" + name
                        + "' refers back to itself through extends, over or nested structures");
            }
            StructureDef refDef = structures.get(ref);
            if (visited.add(ref) && refDef != null) {
                pending.addAll(structuralReferences(refDef));
            }
        }
    }

    /**
     * @return 结构直接引用的结构名：extends、over 和（递归的）嵌套结构类型。
     */
    private static Set<String> structuralReferences(StructureDef def) {
        Set<String> refs = new LinkedHashSet<>();
        if (def.extendsName() != null) {
            refs.add(def.extendsName());
        }
        if (def.overName() != null) {
            refs.add(def.overName());
        }
        collectNestedTypes(def.getMembers(), refs);
        return refs;
    }

    private static void collectNestedTypes(List<StructureMember> members, Set<String> refs) {
        for (StructureMember member : members) {
            if (member instanceof StructureMember.NestedStructure nested) {
                String head = nested.getStructureType().headName();
                if (head != null) {
                    refs.add(head);
                }
                collectNestedTypes(nested.getMembers(), refs);
            }
        }
    }

    public void registerImplements(ImplementsDef impl) {
        implementsBlocks.computeIfAbsent(impl.getStructureName(), k -> new ArrayList<>()).add(impl);
        logger.debug("注册 implements 块: {}", impl);
    }

    public void registerDataType(DataDef def) {
        if (dataTypes.containsKey(def.getName())) {
            throw new StructureException("Data type '" + def.getName() + "' is already registered");
        }
        dataTypes.put(def.getName(), def);
        logger.debug("注册数据类型: {}", def);
    }

    public void registerTypeAlias(String name, TypeExpr type) {
        typeAliases.put(name, type);
    }

    public void registerFunction(TopLevelFunction function) {
        functions.put(function.getName(), function);
    }

    // --- 查询 ---

    public StructureDef getStructure(String name) {
        return structures.get(name);
    }

    public boolean hasStructure(String name) {
        return structures.containsKey(name);
    }

    public Set<String> structureNames() {
        return Collections.unmodifiableSet(structures.keySet());
    }

    /**
     * @return 结构直接声明的公理；结构未注册时返回空列表。
     */
    public List<Pair<String, Expression>> getAxioms(String name) {
        StructureDef def = structures.get(name);
        return def == null ? List.of() : def.axioms();
    }

    public List<StructureMember.OperationDecl> getOperations(String name) {
        StructureDef def = structures.get(name);
        return def == null ? List.of() : def.operations();
    }

    /**
     * 查找声明了某运算的结构（嵌套结构中的运算归属于外层结构）。
     */
    public List<String> getOperationOwners(String operation) {
        List<String> owners = new ArrayList<>();
        for (StructureDef def : structures.values()) {
            if (declaresOperation(def.getMembers(), operation)) {
                owners.add(def.getName());
            }
        }
        return owners;
    }

    /**
     * @return 第一个声明该运算的结构中的类型签名（含嵌套结构）；没有声明时返回 null。
     */
    public TypeExpr getOperationSignature(String operation) {
        for (StructureDef def : structures.values()) {
            StructureMember.OperationDecl decl = findOperation(def.getMembers(), operation);
            if (decl != null) {
                return decl.getTypeSignature();
            }
        }
        return null;
    }

    private static StructureMember.OperationDecl findOperation(List<StructureMember> members, String operation) {
        for (StructureMember member : members) {
            if (member instanceof StructureMember.OperationDecl decl && decl.getName().equals(operation)) {
                return decl;
            }
            if (member instanceof StructureMember.NestedStructure nested) {
                StructureMember.OperationDecl found = findOperation(nested.getMembers(), operation);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    private static boolean declaresOperation(List<StructureMember> members, String operation) {
        for (StructureMember member : members) {
            if (member.getKind() == StructureMember.Kind.OPERATION && member.getName().equals(operation)) {
                return true;
            }
            if (member instanceof StructureMember.NestedStructure nested
                    && declaresOperation(nested.getMembers(), operation)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 收集该结构所有 implements 块上的 where 约束。
     */
    public List<WhereConstraint> getWhereConstraints(String name) {
        List<WhereConstraint> result = new ArrayList<>();
        for (ImplementsDef impl : implementsBlocks.getOrDefault(name, List.of())) {
            result.addAll(impl.getWhereClause());
        }
        return result;
    }

    public List<ImplementsDef> getImplements(String name) {
        return Collections.unmodifiableList(implementsBlocks.getOrDefault(name, List.of()));
    }

    public List<ImplementsDef> allImplements() {
        List<ImplementsDef> result = new ArrayList<>();
        implementsBlocks.values().forEach(result::addAll);
        return result;
    }

    public List<String> structuresWithAxioms() {
        return structures.values().stream()
                .filter(StructureDef::hasAxioms)
                .map(StructureDef::getName)
                .toList();
    }

    public boolean hasAxiom(String structure, String axiomName) {
        return getAxioms(structure).stream().anyMatch(p -> p.getLeft().equals(axiomName));
    }

    /**
     * 删除一个结构及其 implements 块。
     * @return 是否存在并被删除。
     */
    public boolean removeStructure(String name) {
        implementsBlocks.remove(name);
        boolean removed = structures.remove(name) != null;
        if (removed) {
            logger.debug("删除结构: {}", name);
        }
        return removed;
    }

    public DataDef getDataType(String name) {
        return dataTypes.get(name);
    }

    public List<DataDef> dataTypes() {
        return List.copyOf(dataTypes.values());
    }

    /**
     * @return 声明某构造子的数据类型，没有则为 null。
     */
    public DataDef dataTypeOfConstructor(String constructor) {
        for (DataDef def : dataTypes.values()) {
            for (DataDef.Variant variant : def.getVariants()) {
                if (variant.getName().equals(constructor)) {
                    return def;
                }
            }
        }
        return null;
    }

    public TypeExpr resolveTypeAlias(String name) {
        return typeAliases.get(name);
    }

    public List<TopLevelFunction> functions() {
        return List.copyOf(functions.values());
    }

    /**
     * 在全部结构与 implements 块注册完成后构建运算注册表。
     */
    public OperationRegistry buildOperationRegistry() {
        OperationRegistry registry = new OperationRegistry();
        for (StructureDef def : structures.values()) {
            collectOperations(def.getName(), def.getMembers(), registry, new LinkedHashSet<>());
        }
        for (ImplementsDef impl : allImplements()) {
            String type = impl.concreteTypeName();
            if (type != null) {
                registry.registerImplementation(type, impl.getStructureName());
            }
        }
        logger.debug("构建运算注册表: {}", registry);
        return registry;
    }

    private static void collectOperations(String owner, List<StructureMember> members, OperationRegistry registry, Set<String> seen) {
        for (StructureMember member : members) {
            if (member.getKind() == StructureMember.Kind.OPERATION && seen.add(member.getName())) {
                registry.registerOperation(member.getName(), owner);
            } else if (member instanceof StructureMember.NestedStructure nested) {
                collectOperations(owner, nested.getMembers(), registry, seen);
            }
        }
    }

    public int size() {
        return structures.size();
    }
}
