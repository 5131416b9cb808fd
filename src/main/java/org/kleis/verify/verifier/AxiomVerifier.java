package org.kleis.verify.verifier;

import org.apache.commons.lang3.tuple.Pair;
import org.kleis.verify.KleisException;
import org.kleis.verify.ast.Ascription;
import org.kleis.verify.ast.Conditional;
import org.kleis.verify.ast.Expression;
import org.kleis.verify.ast.Lambda;
import org.kleis.verify.ast.Let;
import org.kleis.verify.ast.ListLiteral;
import org.kleis.verify.ast.Match;
import org.kleis.verify.ast.MatchCase;
import org.kleis.verify.ast.NamedObject;
import org.kleis.verify.ast.Operation;
import org.kleis.verify.ast.Quantifier;
import org.kleis.verify.ast.TypeExpr;
import org.kleis.verify.config.KleisConfig;
import org.kleis.verify.solvers.SatisfiabilityResult;
import org.kleis.verify.solvers.SolverBackend;
import org.kleis.verify.solvers.VerificationResult;
import org.kleis.verify.solvers.z3.Z3Backend;
import org.kleis.verify.structures.AxiomClosure;
import org.kleis.verify.structures.StructureDef;
import org.kleis.verify.structures.StructureException;
import org.kleis.verify.structures.StructureMember;
import org.kleis.verify.structures.StructureRegistry;
import org.kleis.verify.structures.TopLevelFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 验证编排器：分析目标依赖的结构，按需把结构公理加载到求解后端，再把目标交给后端。
 * <p>
 * 结构加载先在试验作用域中进行，失败时弹出作用域，不留下部分断言；
 * 成功后弹出试验作用域并在基础层重新断言，避免作用域层数随加载的结构数增长。
 * @author Ayalyt
 */
public class AxiomVerifier implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(AxiomVerifier.class);

    private final StructureRegistry registry;
    private final SolverBackend backend;
    private final AxiomClosure closure;
    private final boolean ownsBackend;

    private final Set<String> loadedStructures = new LinkedHashSet<>();
    private final Set<String> loading = new LinkedHashSet<>();
    private boolean consistencyChecked = false;
    // null 表示未检查或检查结果未知
    private Boolean axiomsConsistent = null;

    /**
     * 使用新建的 Z3 后端，关闭验证器时一并关闭。
     */
    public AxiomVerifier(StructureRegistry registry) {
        this(registry, new Z3Backend(registry, KleisConfig.load()), true);
    }

    /**
     * 使用调用方提供的后端，关闭验证器时不关闭后端。
     */
    public AxiomVerifier(StructureRegistry registry, SolverBackend backend) {
        this(registry, backend, false);
    }

    private AxiomVerifier(StructureRegistry registry, SolverBackend backend, boolean ownsBackend) {
        this.registry = Objects.requireNonNull(registry, "AxiomVerifier-构造函数: registry 不能为 null");
        this.backend = Objects.requireNonNull(backend, "AxiomVerifier-构造函数: backend 不能为 null");
        this.closure = new AxiomClosure(registry);
        this.ownsBackend = ownsBackend;
        if (!registry.dataTypes().isEmpty()) {
            backend.declareDataTypes(registry.dataTypes());
            logger.info("声明 {} 个数据类型", registry.dataTypes().size());
        }
    }

    public SolverBackend getBackend() {
        return backend;
    }

    // --- 验证入口 ---

    /**
     * 验证目标的有效性。
     * @throws VerifierException 已加载的公理互相矛盾。
     */
    public VerificationResult verify(Expression goal) {
        Objects.requireNonNull(goal, "AxiomVerifier-verify: goal 不能为 null");
        prepare(List.of(goal));
        checkConsistencyOnce();
        VerificationResult result = backend.verifyAxiom(goal);
        logger.info("验证 {}: {}", goal, result);
        return result;
    }

    public SatisfiabilityResult checkSatisfiability(Expression goal) {
        Objects.requireNonNull(goal, "AxiomVerifier-checkSatisfiability: goal 不能为 null");
        prepare(List.of(goal));
        return backend.checkSatisfiability(goal);
    }

    public boolean areEquivalent(Expression left, Expression right) {
        Objects.requireNonNull(left, "AxiomVerifier-areEquivalent: left 不能为 null");
        Objects.requireNonNull(right, "AxiomVerifier-areEquivalent: right 不能为 null");
        for (String structure : dependencies(List.of(left, right))) {
            ensureStructureLoaded(structure);
        }
        return backend.areEquivalent(left, right);
    }

    public Expression simplify(Expression expression) {
        return backend.simplify(expression);
    }

    /**
     * 加载目标直接依赖的结构（失败则抛出），再尽力加载其余带公理的结构（失败只记录警告），
     * 使未解释函数受到所有已知公理的约束。
     */
    private void prepare(List<Expression> goals) {
        for (String structure : dependencies(goals)) {
            ensureStructureLoaded(structure);
        }
        for (String structure : registry.structuresWithAxioms()) {
            if (loadedStructures.contains(structure)) {
                continue;
            }
            try {
                ensureStructureLoaded(structure);
            } catch (KleisException e) {
                logger.warn("结构 {} 加载失败，跳过: {}", structure, e.getMessage());
            }
        }
    }

    private void checkConsistencyOnce() {
        if (!consistencyChecked) {
            consistencyChecked = true;
            SatisfiabilityResult consistency = backend.checkConsistency();
            axiomsConsistent = consistency.isUnsatisfiable() ? Boolean.FALSE
                    : consistency.isSatisfiable() ? Boolean.TRUE : null;
            logger.info("公理一致性检查: {}", consistency);
        }
        if (Boolean.FALSE.equals(axiomsConsistent)) {
            throw new VerifierException("Loaded axioms are inconsistent: every goal would be trivially valid");
        }
    }

    // --- 依赖分析 ---

    /**
     * @return 目标中出现的运算和对象名所属的结构。
     */
    Set<String> dependencies(List<Expression> goals) {
        Set<String> names = new LinkedHashSet<>();
        for (Expression goal : goals) {
            collectNames(goal, names);
        }
        Set<String> structures = new LinkedHashSet<>();
        for (String name : names) {
            structures.addAll(registry.getOperationOwners(name));
        }
        logger.debug("依赖结构: {}", structures);
        return structures;
    }

    private static void collectNames(Expression expr, Set<String> names) {
        switch (expr.getKind()) {
            case OBJECT -> names.add(((NamedObject) expr).getName());
            case OPERATION -> {
                Operation op = (Operation) expr;
                names.add(op.getName());
                op.getArgs().forEach(arg -> collectNames(arg, names));
            }
            case QUANTIFIER -> {
                Quantifier q = (Quantifier) expr;
                if (q.hasWhereClause()) {
                    collectNames(q.getWhereClause(), names);
                }
                collectNames(q.getBody(), names);
            }
            case CONDITIONAL -> {
                Conditional c = (Conditional) expr;
                collectNames(c.getCondition(), names);
                collectNames(c.getThenBranch(), names);
                collectNames(c.getElseBranch(), names);
            }
            case LET -> {
                Let let = (Let) expr;
                collectNames(let.getValue(), names);
                collectNames(let.getBody(), names);
            }
            case MATCH -> {
                Match match = (Match) expr;
                collectNames(match.getScrutinee(), names);
                for (MatchCase c : match.getCases()) {
                    collectNames(c.getBody(), names);
                }
            }
            case LIST -> ((ListLiteral) expr).getElements().forEach(e -> collectNames(e, names));
            case ASCRIPTION -> collectNames(((Ascription) expr).getExpression(), names);
            case LAMBDA -> collectNames(((Lambda) expr).getBody(), names);
            case CONST, STRING, PLACEHOLDER -> {
                // 不引入依赖
            }
        }
    }

    // --- 结构加载 ---

    /**
     * 加载结构及其依赖（where 约束、extends、over、嵌套结构）。已加载或正在加载时直接返回。
     * @throws StructureException 结构未注册。
     */
    public void ensureStructureLoaded(String name) {
        if (loadedStructures.contains(name) || loading.contains(name)) {
            return;
        }
        StructureDef def = registry.getStructure(name);
        if (def == null) {
            throw new StructureException("Structure not found: " + name);
        }
        loading.add(name);
        try {
            for (String dependency : closure.directDependencies(name)) {
                logger.debug("{} 依赖 {}", name, dependency);
                ensureStructureLoaded(dependency);
            }
            backend.push();
            try {
                loadMembers(def);
            } finally {
                backend.pop();
            }
            loadMembers(def);
            loadedStructures.add(name);
            logger.info("结构 {} 已加载", name);
        } finally {
            loading.remove(name);
        }
    }

    /**
     * 单位元、公理（含嵌套结构中的公理）和函数定义。
     */
    private void loadMembers(StructureDef def) {
        loadIdentityElements(def.getMembers());
        List<Pair<String, Expression>> axioms = new ArrayList<>(def.axioms());
        axioms.addAll(AxiomClosure.nestedAxioms(def.getMembers(), ""));
        backend.loadStructureAxioms(def.getName(), axioms);
        defineFunctions(def.getMembers());
    }

    private void loadIdentityElements(List<StructureMember> members) {
        for (StructureMember member : members) {
            if (member instanceof StructureMember.OperationDecl decl && decl.isNullary()) {
                backend.loadIdentityElement(decl.getName(), decl.getTypeSignature());
            } else if (member instanceof StructureMember.NestedStructure nested) {
                loadIdentityElements(nested.getMembers());
            }
        }
    }

    private void defineFunctions(List<StructureMember> members) {
        for (StructureMember member : members) {
            if (member instanceof StructureMember.FunctionDef fn) {
                backend.defineFunction(fn.getName(), fn.getParams(), fn.getBody());
            } else if (member instanceof StructureMember.NestedStructure nested) {
                defineFunctions(nested.getMembers());
            }
        }
    }

    /**
     * 把注册表中的顶层函数定义为全称量化的定义等式。
     */
    public void loadProgramFunctions() {
        List<TopLevelFunction> functions = registry.functions();
        for (TopLevelFunction function : functions) {
            backend.defineFunction(function.getName(), function.getParams(), function.getBody());
            logger.info("顶层函数 {} 已加载", function.getName());
        }
    }

    /**
     * 把没有声明为数据类型构造子的名字作为 Int 常量加载。
     */
    public void loadConstructorConstants(Collection<String> names) {
        TypeExpr defaultType = TypeExpr.named("Int");
        for (String name : names) {
            if (!backend.isDeclaredConstructor(name)) {
                backend.loadIdentityElement(name, defaultType);
            }
        }
    }

    public boolean isStructureLoaded(String name) {
        return loadedStructures.contains(name);
    }

    public VerifierStats stats() {
        return VerifierStats.of(loadedStructures.size(), backend.declaredOperationCount());
    }

    @Override
    public void close() {
        if (ownsBackend) {
            backend.close();
        }
    }
}
