package org.kleis.verify.solvers.z3;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.kleis.verify.ast.Expression;
import org.kleis.verify.ast.QuantifierKind;
import org.kleis.verify.ast.TypeExpr;
import org.kleis.verify.config.KleisConfig;
import org.kleis.verify.solvers.SatisfiabilityResult;
import org.kleis.verify.solvers.SolverBackend;
import org.kleis.verify.solvers.SolverException;
import org.kleis.verify.solvers.VerificationResult;
import org.kleis.verify.solvers.Witness;
import org.kleis.verify.solvers.capabilities.CapabilityLoader;
import org.kleis.verify.solvers.capabilities.SolverCapabilities;
import org.kleis.verify.structures.DataDef;
import org.kleis.verify.structures.StructureRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 基于 Z3 的 {@link SolverBackend}。
 * <p>
 * 每个实例拥有自己的 {@link Context} 和 {@link Solver}。push 时同时保存已加载结构集合和单位元集合的快照，
 * pop 时恢复，使会话记录与求解器中实际存在的断言保持一致。
 * 不支持并发调用。
 * @author Ayalyt
 */
public class Z3Backend implements SolverBackend {

    private static final Logger logger = LoggerFactory.getLogger(Z3Backend.class);

    private final Context ctx;
    private final Solver solver;
    private final SolverCapabilities capabilities;
    private final Z3DeclarationManager decls;
    private final Z3Translator translator;
    private final Z3ResultConverter converter;
    private final Z3WitnessExtractor witnessExtractor;
    @Getter
    private final long timeoutMs;

    private final Set<String> loadedStructures = new LinkedHashSet<>();
    private final Deque<ScopeFrame> scopes = new ArrayDeque<>();
    private int assertedAxiomCount = 0;
    private boolean closed = false;

    public Z3Backend() {
        this(null, KleisConfig.load());
    }

    public Z3Backend(StructureRegistry registry) {
        this(registry, KleisConfig.load());
    }

    /**
     * @param registry 用于查询运算签名和类型别名，可以为 null（此时所有运算按观察到的参数声明）。
     * @param config   运行配置，提供单次检查的超时。
     */
    public Z3Backend(StructureRegistry registry, KleisConfig config) {
        Objects.requireNonNull(config, "Z3Backend-构造函数: config 不能为 null");
        this.capabilities = CapabilityLoader.load(CapabilityLoader.Z3_MANIFEST);
        this.timeoutMs = config.getZ3TimeoutMs();
        Map<String, String> cfg = new HashMap<>();
        cfg.put("model", "true");
        this.ctx = new Context(cfg);
        this.solver = ctx.mkSolver();
        Params params = ctx.mkParams();
        params.add("timeout", (int) Math.min(Integer.MAX_VALUE, timeoutMs));
        solver.setParameters(params);
        this.decls = new Z3DeclarationManager(ctx, registry == null ? null : registry::resolveTypeAlias);
        this.translator = new Z3Translator(ctx, decls, capabilities,
                registry == null ? null : registry::getOperationSignature);
        this.converter = new Z3ResultConverter();
        this.witnessExtractor = new Z3WitnessExtractor(ctx, decls, converter);
        logger.info("创建 Z3 后端: {} (超时 {} ms)", capabilities, timeoutMs);
    }

    @Override
    public String name() {
        return "Z3";
    }

    @Override
    public SolverCapabilities capabilities() {
        return capabilities;
    }

    // --- 证明与检查 ---

    @Override
    public VerificationResult verifyAxiom(Expression axiom) {
        Objects.requireNonNull(axiom, "Z3Backend-verifyAxiom: axiom 不能为 null");
        TranslatedGoal goal = translator.translateGoal(axiom, QuantifierKind.FOR_ALL);
        solver.push();
        try {
            solver.add(ctx.mkNot(goal.getFormula()));
            Status status = check();
            logger.debug("验证 {}: 否定的检查结果 {}", axiom, status);
            return switch (status) {
                case UNSATISFIABLE -> VerificationResult.valid();
                case SATISFIABLE -> VerificationResult.invalid(
                        witnessExtractor.modelToWitness(solver.getModel(), goal.getTrackedVariables()));
                case UNKNOWN -> VerificationResult.unknown(reasonUnknown());
            };
        } finally {
            solver.pop();
        }
    }

    @Override
    public SatisfiabilityResult checkSatisfiability(Expression expression) {
        Objects.requireNonNull(expression, "Z3Backend-checkSatisfiability: expression 不能为 null");
        TranslatedGoal goal = translator.translateGoal(expression, QuantifierKind.EXISTS);
        solver.push();
        try {
            solver.add(goal.getFormula());
            Status status = check();
            logger.debug("可满足性 {}: {}", expression, status);
            return switch (status) {
                case SATISFIABLE -> SatisfiabilityResult.satisfiable(
                        witnessExtractor.modelToWitness(solver.getModel(), goal.getTrackedVariables()));
                case UNSATISFIABLE -> SatisfiabilityResult.unsatisfiable();
                case UNKNOWN -> SatisfiabilityResult.unknown(reasonUnknown());
            };
        } finally {
            solver.pop();
        }
    }

    @Override
    public Expression evaluate(Expression expression) {
        Objects.requireNonNull(expression, "Z3Backend-evaluate: expression 不能为 null");
        Expr<?> term = translator.translate(expression, new HashMap<>());
        solver.push();
        try {
            Status status = check();
            if (status == Status.UNSATISFIABLE) {
                throw new SolverException(SolverException.Kind.PROOF_FAILED,
                        "Cannot evaluate " + expression + ": the current assertions are inconsistent");
            }
            if (status == Status.UNKNOWN) {
                throw new SolverException(SolverException.Kind.TIMEOUT,
                        "Cannot evaluate " + expression + ": " + reasonUnknown());
            }
            Model model = solver.getModel();
            Expr<?> value = model.eval(term, true);
            Expression datatype = witnessExtractor.reverseMapDatatype(model, value);
            return datatype != null ? datatype : converter.toExpression(value);
        } finally {
            solver.pop();
        }
    }

    @Override
    public Expression simplify(Expression expression) {
        Objects.requireNonNull(expression, "Z3Backend-simplify: expression 不能为 null");
        Expr<?> term = translator.translate(expression, new HashMap<>());
        return converter.toExpression(term.simplify());
    }

    @Override
    public boolean areEquivalent(Expression left, Expression right) {
        Objects.requireNonNull(left, "Z3Backend-areEquivalent: left 不能为 null");
        Objects.requireNonNull(right, "Z3Backend-areEquivalent: right 不能为 null");
        Map<String, Expr<?>> env = new HashMap<>();
        BoolExpr equality = translator.mkEquality(translator.translate(left, env), translator.translate(right, env));
        solver.push();
        try {
            solver.add(ctx.mkNot(equality));
            Status status = check();
            return switch (status) {
                case UNSATISFIABLE -> true;
                case SATISFIABLE -> false;
                case UNKNOWN -> throw new SolverException(SolverException.Kind.TIMEOUT,
                        "Equivalence of " + left + " and " + right + " is undecided: " + reasonUnknown());
            };
        } finally {
            solver.pop();
        }
    }

    // --- 结构与声明 ---

    @Override
    public void loadStructureAxioms(String structureName, List<Pair<String, Expression>> axioms) {
        Objects.requireNonNull(structureName, "Z3Backend-loadStructureAxioms: structureName 不能为 null");
        if (loadedStructures.contains(structureName)) {
            logger.debug("结构 {} 已加载，跳过", structureName);
            return;
        }
        // 先全部翻译，翻译失败时不留下部分断言
        List<BoolExpr> translated = new ArrayList<>(axioms.size());
        for (Pair<String, Expression> axiom : axioms) {
            translated.add(translator.translateBool(axiom.getRight(), new HashMap<>()));
            logger.debug("翻译公理 {}.{}: {}", structureName, axiom.getLeft(), axiom.getRight());
        }
        for (BoolExpr formula : translated) {
            solver.add(formula);
        }
        assertedAxiomCount += translated.size();
        loadedStructures.add(structureName);
        int maxAxioms = capabilities.performance().getMaxAxioms();
        if (assertedAxiomCount > maxAxioms) {
            logger.warn("已断言 {} 条公理，超过建议上限 {}", assertedAxiomCount, maxAxioms);
        }
        logger.info("加载结构 {} 的 {} 条公理", structureName, translated.size());
    }

    @Override
    public boolean isStructureLoaded(String structureName) {
        return loadedStructures.contains(structureName);
    }

    @Override
    public int loadedStructureCount() {
        return loadedStructures.size();
    }

    @Override
    public void loadIdentityElement(String name, TypeExpr type) {
        Objects.requireNonNull(name, "Z3Backend-loadIdentityElement: name 不能为 null");
        Sort sort = type == null ? ctx.getIntSort() : decls.sortFor(type);
        BoolExpr distinct = decls.declareIdentity(name, sort);
        if (distinct != null) {
            solver.add(distinct);
        }
    }

    @Override
    public boolean isDeclaredConstructor(String name) {
        return decls.isConstructor(name);
    }

    @Override
    public void declareDataTypes(List<DataDef> dataTypes) {
        decls.declareDataTypes(dataTypes);
    }

    @Override
    public void assertExpression(Expression expression) {
        Objects.requireNonNull(expression, "Z3Backend-assertExpression: expression 不能为 null");
        solver.add(translator.translateBool(expression, new HashMap<>()));
    }

    /**
     * 参数声明为 Int，值域取函数体的 Sort。函数体中递归调用自身时，函数已在翻译时按调用声明。
     */
    @Override
    public void defineFunction(String name, List<String> params, Expression body) {
        Objects.requireNonNull(name, "Z3Backend-defineFunction: name 不能为 null");
        Map<String, Expr<?>> env = new LinkedHashMap<>();
        Expr<?>[] bound = new Expr<?>[params.size()];
        Sort[] domain = new Sort[params.size()];
        for (int i = 0; i < params.size(); i++) {
            bound[i] = ctx.mkFreshConst(params.get(i), ctx.getIntSort());
            domain[i] = ctx.getIntSort();
            env.put(params.get(i), bound[i]);
        }
        Expr<?> bodyTerm = translator.translate(body, env);
        FuncDecl<?> decl = decls.getOrDeclareFunction(name, domain, bodyTerm.getSort());
        BoolExpr definition = translator.mkEquality(ctx.mkApp(decl, bound), bodyTerm);
        solver.add(bound.length == 0 ? definition
                : ctx.mkForall(bound, definition, 0, null, null, null, null));
        logger.info("定义函数 {}({})", name, String.join(", ", params));
    }

    @Override
    public SatisfiabilityResult checkConsistency() {
        Status status = check();
        return switch (status) {
            case SATISFIABLE -> SatisfiabilityResult.satisfiable(Witness.rawOnly(solver.getModel().toString()));
            case UNSATISFIABLE -> SatisfiabilityResult.unsatisfiable();
            case UNKNOWN -> SatisfiabilityResult.unknown(reasonUnknown());
        };
    }

    @Override
    public int declaredOperationCount() {
        return decls.getFunctions().size();
    }

    // --- 作用域 ---

    @Override
    public void push() {
        scopes.push(new ScopeFrame(new LinkedHashSet<>(loadedStructures), decls.snapshot(), assertedAxiomCount));
        solver.push();
        logger.debug("push: 深度 {}", scopes.size());
    }

    @Override
    public void pop(int levels) {
        if (levels < 0 || levels > scopes.size()) {
            throw new IllegalArgumentException("Z3Backend-pop: cannot pop " + levels
                    + " level(s) at depth " + scopes.size());
        }
        if (levels == 0) {
            return;
        }
        solver.pop(levels);
        ScopeFrame frame = null;
        for (int i = 0; i < levels; i++) {
            frame = scopes.pop();
        }
        loadedStructures.clear();
        loadedStructures.addAll(frame.loadedStructures);
        decls.restore(frame.declarations);
        assertedAxiomCount = frame.assertedAxiomCount;
        logger.debug("pop {}: 深度 {}", levels, scopes.size());
    }

    @Override
    public int scopeDepth() {
        return scopes.size();
    }

    @Override
    public void reset() {
        solver.reset();
        decls.clear();
        translator.clearWarnings();
        loadedStructures.clear();
        scopes.clear();
        assertedAxiomCount = 0;
        logger.info("重置 Z3 后端");
    }

    /**
     * @return 翻译过程中产生的警告（无签名的运算、未知类型标注等）。
     */
    public List<String> getWarnings() {
        return List.copyOf(translator.getWarnings());
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        ctx.close();
        logger.debug("关闭 Z3 上下文");
    }

    private Status check() {
        try {
            return solver.check();
        } catch (Z3Exception e) {
            throw new SolverException(SolverException.Kind.INTERNAL, "Z3 check failed: " + e.getMessage(), e);
        }
    }

    private String reasonUnknown() {
        String reason = solver.getReasonUnknown();
        return reason == null || reason.isEmpty() ? "unknown" : reason;
    }

    /**
     * push 时保存的会话记录。
     */
    private static final class ScopeFrame {

        private final Set<String> loadedStructures;
        private final Z3DeclarationManager.Snapshot declarations;
        private final int assertedAxiomCount;

        private ScopeFrame(Set<String> loadedStructures, Z3DeclarationManager.Snapshot declarations,
                           int assertedAxiomCount) {
            this.loadedStructures = loadedStructures;
            this.declarations = declarations;
            this.assertedAxiomCount = assertedAxiomCount;
        }
    }
}
