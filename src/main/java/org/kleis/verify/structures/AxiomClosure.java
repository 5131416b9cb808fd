package org.kleis.verify.structures;

import org.apache.commons.lang3.tuple.Pair;
import org.kleis.verify.ast.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 公理闭包：从一个结构出发，沿 where 约束、extends 父结构、over 域结构和嵌套结构做带访问集的深度优先遍历，
 * 收集该结构传递依赖的全部公理。
 * 已访问的名字不会再次进入，因此环和重复都会被截断。
 * @author Ayalyt
 */
public final class AxiomClosure {

    private static final Logger logger = LoggerFactory.getLogger(AxiomClosure.class);

    private final StructureRegistry registry;

    public AxiomClosure(StructureRegistry registry) {
        this.registry = registry;
    }

    /**
     * 直接依赖，顺序与加载顺序一致：where 约束、extends、over、嵌套结构类型。
     * 只返回已注册的结构名。
     */
    public List<String> directDependencies(String name) {
        StructureDef def = registry.getStructure(name);
        if (def == null) {
            return List.of();
        }
        Set<String> deps = new LinkedHashSet<>();
        for (WhereConstraint constraint : registry.getWhereConstraints(name)) {
            deps.add(constraint.getStructureName());
        }
        if (def.extendsName() != null) {
            deps.add(def.extendsName());
        }
        if (def.overName() != null) {
            deps.add(def.overName());
        }
        for (StructureMember.NestedStructure nested : def.nestedStructures()) {
            String head = nested.getStructureType().headName();
            if (head != null) {
                deps.add(head);
            }
        }
        List<String> known = new ArrayList<>();
        for (String dep : deps) {
            if (registry.hasStructure(dep)) {
                known.add(dep);
            } else {
                logger.debug("结构 {} 引用了未注册的结构 {}，跳过", name, dep);
            }
        }
        return known;
    }

    /**
     * @return 传递依赖的结构名，依赖在前、自身在最后。
     * @throws StructureException 如果起点结构未注册。
     */
    public List<String> requiredStructures(String name) {
        if (!registry.hasStructure(name)) {
            throw new StructureException("Unknown structure '" + name + "'");
        }
        Set<String> visited = new LinkedHashSet<>();
        List<String> order = new ArrayList<>();
        visit(name, visited, order);
        logger.debug("结构 {} 的闭包: {}", name, order);
        return order;
    }

    private void visit(String name, Set<String> visited, List<String> order) {
        if (!visited.add(name)) {
            return;
        }
        for (String dep : directDependencies(name)) {
            visit(dep, visited, order);
        }
        order.add(name);
    }

    /**
     * @return 闭包内所有结构的公理（含嵌套结构内联公理），依赖结构的公理在前。
     */
    public List<Pair<String, Expression>> closureAxioms(String name) {
        List<Pair<String, Expression>> result = new ArrayList<>();
        for (String structure : requiredStructures(name)) {
            StructureDef def = registry.getStructure(structure);
            result.addAll(def.axioms());
            result.addAll(nestedAxioms(def.getMembers(), ""));
        }
        return result;
    }

    /**
     * 递归收集嵌套结构中内联声明的公理，名字以 "嵌套名." 为前缀。
     */
    public static List<Pair<String, Expression>> nestedAxioms(List<StructureMember> members, String prefix) {
        List<Pair<String, Expression>> result = new ArrayList<>();
        for (StructureMember member : members) {
            if (member instanceof StructureMember.NestedStructure nested) {
                String nestedPrefix = prefix + nested.getName() + ".";
                for (StructureMember inner : nested.getMembers()) {
                    if (inner instanceof StructureMember.Axiom axiom) {
                        result.add(Pair.of(nestedPrefix + axiom.getName(), axiom.getProposition()));
                    }
                }
                result.addAll(nestedAxioms(nested.getMembers(), nestedPrefix));
            }
        }
        return result;
    }
}
