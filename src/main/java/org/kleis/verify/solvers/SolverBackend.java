package org.kleis.verify.solvers;

import org.apache.commons.lang3.tuple.Pair;
import org.kleis.verify.ast.Expression;
import org.kleis.verify.ast.TypeExpr;
import org.kleis.verify.solvers.capabilities.SolverCapabilities;
import org.kleis.verify.structures.DataDef;

import java.util.List;

/**
 * 证明引擎的能力契约。每种引擎（SMT 求解器、交互式证明器）各实现一次，在会话构造时选定。
 * 所有方法只接收和返回 {@link Expression} 及其派生结果类型，从不暴露引擎内部类型。
 * <p>
 * 一个实例持有一个引擎连接及其会话状态（已加载结构、已声明运算、单位元、作用域深度），
 * 不支持并发调用；并行验证应使用相互独立的实例。
 * @author Ayalyt
 */
public interface SolverBackend extends AutoCloseable {

    /**
     * @return 后端名字，与能力清单中的 solver.name 一致。
     */
    String name();

    /**
     * @return 构造时加载的能力清单，之后只读。
     */
    SolverCapabilities capabilities();

    default boolean supportsOperation(String operation) {
        return capabilities().hasOperation(operation);
    }

    /**
     * 检查命题的有效性：在独立作用域中断言其否定。
     * 否定不可满足则 Valid，可满足则 Invalid 并附带反例，超时或不完备则 Unknown。
     *
     * @throws TranslationException 表达式无法翻译。
     * @throws SolverException      引擎报告显式错误。
     */
    VerificationResult verifyAxiom(Expression axiom);

    /**
     * 直接断言表达式并检查可满足性，可满足时附带见证。
     */
    SatisfiabilityResult checkSatisfiability(Expression expression);

    /**
     * 在当前断言下求一个封闭表达式的具体值。
     * @throws SolverException 引擎不支持具体求值时（Kind.UNSUPPORTED）。
     */
    Expression evaluate(Expression expression);

    Expression simplify(Expression expression);

    /**
     * 在作用域中断言 a ≠ b 并检查不可满足性。
     * 混合数值类型先提升到较宽的类型；无法比较时抛出异常，而不是给出错误答案。
     */
    boolean areEquivalent(Expression left, Expression right);

    /**
     * 加载结构的公理。已加载的结构直接返回（幂等）。
     * 失败时已加载集合保持不变。
     */
    void loadStructureAxioms(String structureName, List<Pair<String, Expression>> axioms);

    boolean isStructureLoaded(String structureName);

    int loadedStructureCount();

    void push();

    void pop(int levels);

    default void pop() {
        pop(1);
    }

    int scopeDepth();

    /**
     * 丢弃全部声明、断言和会话状态。
     */
    void reset();

    /**
     * 声明一个新的单位元常量，并断言它与所有已加载的同类单位元两两不同。
     */
    void loadIdentityElement(String name, TypeExpr type);

    boolean isDeclaredConstructor(String name);

    /**
     * 声明代数数据类型，使其构造子可以在表达式中使用并在见证中反向映射。
     */
    void declareDataTypes(List<DataDef> dataTypes);

    void assertExpression(Expression expression);

    /**
     * 声明函数并断言其全称量化的定义等式 ∀params. f(params) = body。
     */
    void defineFunction(String name, List<String> params, Expression body);

    /**
     * 检查当前已断言的公理是否一致。
     * @return 不可满足时返回 UNSATISFIABLE。
     */
    SatisfiabilityResult checkConsistency();

    /**
     * @return 当前已声明的（未解释）运算个数。
     */
    int declaredOperationCount();

    @Override
    void close();
}
