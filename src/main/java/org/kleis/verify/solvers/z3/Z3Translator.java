package org.kleis.verify.solvers.z3;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.RealSort;
import com.microsoft.z3.Sort;
import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.kleis.verify.ast.Ascription;
import org.kleis.verify.ast.Conditional;
import org.kleis.verify.ast.Const;
import org.kleis.verify.ast.Expression;
import org.kleis.verify.ast.Lambda;
import org.kleis.verify.ast.Let;
import org.kleis.verify.ast.Match;
import org.kleis.verify.ast.MatchCase;
import org.kleis.verify.ast.NamedObject;
import org.kleis.verify.ast.Operation;
import org.kleis.verify.ast.Pattern;
import org.kleis.verify.ast.Placeholder;
import org.kleis.verify.ast.QuantifiedVar;
import org.kleis.verify.ast.Quantifier;
import org.kleis.verify.ast.QuantifierKind;
import org.kleis.verify.ast.StringLiteral;
import org.kleis.verify.ast.TypeExpr;
import org.kleis.verify.solvers.TranslationException;
import org.kleis.verify.solvers.capabilities.SolverCapabilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 通用翻译器：把 Kleis 表达式树翻译为 Z3 项。
 * <p>
 * 运算名按名字动态解析：能力清单标记为原生、且在已知映射表中的运算（相等、比较、布尔联结词、算术）
 * 直接翻译；其余任何名字都按观察到的参数个数惰性声明为未解释函数并缓存。
 * 翻译器中没有任何针对具体结构或用户函数的代码。
 * @author Ayalyt
 */
public class Z3Translator {

    private static final Logger logger = LoggerFactory.getLogger(Z3Translator.class);

    private final Context ctx;
    private final Z3DeclarationManager decls;
    private final SolverCapabilities capabilities;
    // 运算名 -> 注册表中的类型签名，没有时返回 null
    private final Function<String, TypeExpr> signatureLookup;

    @Getter
    private final List<String> warnings = new ArrayList<>();
    private final Set<String> warnedNames = new LinkedHashSet<>();

    public Z3Translator(Context ctx, Z3DeclarationManager decls, SolverCapabilities capabilities,
                        Function<String, TypeExpr> signatureLookup) {
        this.ctx = ctx;
        this.decls = decls;
        this.capabilities = capabilities;
        this.signatureLookup = signatureLookup == null ? name -> null : signatureLookup;
    }

    // --- 入口 ---

    public Expr<?> translate(Expression expr, Map<String, Expr<?>> vars) {
        return switch (expr.getKind()) {
            case CONST -> translateConst((Const) expr);
            case STRING -> ctx.mkString(((StringLiteral) expr).getValue());
            case OBJECT -> resolveObject(((NamedObject) expr).getName(), vars);
            case OPERATION -> translateOperation((Operation) expr, vars);
            case QUANTIFIER -> translateQuantifier((Quantifier) expr, vars);
            case CONDITIONAL -> translateConditional((Conditional) expr, vars);
            case LET -> translateLet((Let) expr, vars);
            case MATCH -> translateMatch((Match) expr, vars);
            case ASCRIPTION -> translate(((Ascription) expr).getExpression(), vars);
            case LAMBDA -> translateLambda((Lambda) expr, vars);
            case LIST -> throw TranslationException.unsupported("List literals cannot be translated to Z3: " + expr);
            case PLACEHOLDER -> throw TranslationException.unsupported("Placeholder #" + ((Placeholder) expr).getId()
                    + " cannot be verified - fill in all slots first");
        };
    }

    public BoolExpr translateBool(Expression expr, Map<String, Expr<?>> vars) {
        return asBool(translate(expr, vars), "Expression must be boolean: " + expr);
    }

    /**
     * 翻译证明目标。连续的顶层 skolemKind 量词变量被替换为新常量并加入跟踪列表：
     * ∀ 目标得到 cond ⟹ body，∃ 目标得到 cond ∧ body。
     */
    public TranslatedGoal translateGoal(Expression goal, QuantifierKind skolemKind) {
        Map<String, Expr<?>> env = new LinkedHashMap<>();
        List<Pair<String, Expr<?>>> tracked = new ArrayList<>();
        List<BoolExpr> conditions = new ArrayList<>();
        Expression current = goal;
        while (current instanceof Quantifier q && q.getQuantifier() == skolemKind) {
            for (QuantifiedVar var : q.getVariables()) {
                Expr<?> constant = ctx.mkFreshConst(var.getName(), sortForAnnotation(var.getTypeAnnotation(), var.getName()));
                env.put(var.getName(), constant);
                tracked.add(Pair.of(var.getName(), constant));
            }
            if (q.hasWhereClause()) {
                conditions.add(translateBool(q.getWhereClause(), env));
            }
            current = q.getBody();
        }
        BoolExpr body = translateBool(current, env);
        BoolExpr formula;
        if (conditions.isEmpty()) {
            formula = body;
        } else {
            BoolExpr cond = conditions.size() == 1 ? conditions.get(0) : ctx.mkAnd(conditions.toArray(new BoolExpr[0]));
            formula = skolemKind == QuantifierKind.FOR_ALL ? ctx.mkImplies(cond, body) : ctx.mkAnd(cond, body);
        }
        logger.debug("翻译目标 {} -> {}，跟踪 {} 个变量", goal, formula, tracked.size());
        return new TranslatedGoal(formula, tracked);
    }

    // --- 叶子 ---

    private Expr<?> translateConst(Const c) {
        if (c.isInteger()) {
            return ctx.mkInt(c.getValue());
        }
        if (c.isDecimal()) {
            return ctx.mkReal(c.getValue());
        }
        throw new TranslationException(TranslationException.Kind.MALFORMED_LITERAL,
                "Cannot convert constant to Z3: " + c.getValue());
    }

    /**
     * 名字解析顺序：绑定变量 → 单位元 → 无参构造子 → 零元函数 → 布尔字面量，否则报 UndefinedSymbol。
     */
    private Expr<?> resolveObject(String name, Map<String, Expr<?>> vars) {
        Expr<?> bound = vars.get(name);
        if (bound != null) {
            return bound;
        }
        Expr<?> identity = decls.getIdentity(name);
        if (identity != null) {
            return identity;
        }
        Expr<?> constructor = decls.nullaryConstructor(name);
        if (constructor != null) {
            return constructor;
        }
        FuncDecl<?> nullary = decls.getFunction(name);
        if (nullary != null && nullary.getDomainSize() == 0) {
            return ctx.mkApp(nullary);
        }
        if ("true".equals(name) || "false".equals(name)) {
            return ctx.mkBool(Boolean.parseBoolean(name));
        }
        throw TranslationException.undefinedSymbol(name);
    }

    // --- 运算 ---

    private Expr<?> translateOperation(Operation op, Map<String, Expr<?>> vars) {
        String name = op.getName();
        if (op.getArgs().isEmpty()) {
            Expr<?> identity = decls.getIdentity(name);
            if (identity != null) {
                return identity;
            }
        }
        List<Expr<?>> args = new ArrayList<>(op.arity());
        for (Expression arg : op.getArgs()) {
            args.add(translate(arg, vars));
        }
        if (decls.isConstructor(name)) {
            return applyConstructor(name, args);
        }
        if (capabilities.isNative(name)) {
            Expr<?> nativeTerm = translateNative(name, args);
            if (nativeTerm != null) {
                return nativeTerm;
            }
        }
        return applyUninterpreted(name, args);
    }

    /**
     * 已知运算表。参数不适用于原生翻译时（例如算术作用于非数值载体）返回 null，改用未解释函数。
     */
    private Expr<?> translateNative(String name, List<Expr<?>> args) {
        return switch (name) {
            case "equals", "eq" -> {
                requireArity(name, args, 2);
                yield mkEquality(args.get(0), args.get(1));
            }
            case "neq" -> {
                requireArity(name, args, 2);
                yield ctx.mkNot(mkEquality(args.get(0), args.get(1)));
            }
            case "lt", "less_than", "gt", "greater_than", "leq", "geq" -> {
                requireArity(name, args, 2);
                yield compare(name, args.get(0), args.get(1));
            }
            case "and" -> {
                requireArity(name, args, 2);
                yield ctx.mkAnd(asBool(args.get(0), "and"), asBool(args.get(1), "and"));
            }
            case "or" -> {
                requireArity(name, args, 2);
                yield ctx.mkOr(asBool(args.get(0), "or"), asBool(args.get(1), "or"));
            }
            case "not" -> {
                requireArity(name, args, 1);
                yield ctx.mkNot(asBool(args.get(0), "not"));
            }
            case "implies" -> {
                requireArity(name, args, 2);
                yield ctx.mkImplies(asBool(args.get(0), "implies"), asBool(args.get(1), "implies"));
            }
            case "iff" -> {
                requireArity(name, args, 2);
                yield ctx.mkIff(asBool(args.get(0), "iff"), asBool(args.get(1), "iff"));
            }
            case "plus", "minus", "times" -> {
                requireArity(name, args, 2);
                yield arithmetic(name, args.get(0), args.get(1));
            }
            case "divide" -> {
                requireArity(name, args, 2);
                if (!isArith(args.get(0)) || !isArith(args.get(1))) {
                    yield null;
                }
                yield ctx.mkDiv((ArithExpr) toReal(args.get(0)), (ArithExpr) toReal(args.get(1)));
            }
            case "negate" -> {
                requireArity(name, args, 1);
                yield isArith(args.get(0)) ? ctx.mkUnaryMinus((ArithExpr) args.get(0)) : null;
            }
            default -> null;
        };
    }

    private Expr<?> arithmetic(String name, Expr<?> left, Expr<?> right) {
        if (!isArith(left) || !isArith(right)) {
            logger.debug("{} 作用于非数值项，按未解释函数处理", name);
            return null;
        }
        ArithExpr a = (ArithExpr) left;
        ArithExpr b = (ArithExpr) right;
        if (isInt(a) != isInt(b)) {
            a = (ArithExpr) toReal(a);
            b = (ArithExpr) toReal(b);
        }
        return switch (name) {
            case "plus" -> ctx.mkAdd(a, b);
            case "minus" -> ctx.mkSub(a, b);
            default -> ctx.mkMul(a, b);
        };
    }

    private BoolExpr compare(String name, Expr<?> left, Expr<?> right) {
        if (!isArith(left) || !isArith(right)) {
            throw TranslationException.typeMismatch(name + " requires numeric arguments, got "
                    + left.getSort() + " and " + right.getSort());
        }
        ArithExpr a = (ArithExpr) left;
        ArithExpr b = (ArithExpr) right;
        if (isInt(a) != isInt(b)) {
            a = (ArithExpr) toReal(a);
            b = (ArithExpr) toReal(b);
        }
        return switch (name) {
            case "lt", "less_than" -> ctx.mkLt(a, b);
            case "gt", "greater_than" -> ctx.mkGt(a, b);
            case "leq" -> ctx.mkLe(a, b);
            default -> ctx.mkGe(a, b);
        };
    }

    /**
     * 相同 Sort 直接比较；Int 与 Real 混合时提升为 Real；其它组合报类型错误。
     */
    public BoolExpr mkEquality(Expr<?> left, Expr<?> right) {
        if (left.getSort().equals(right.getSort())) {
            return ctx.mkEq((Expr) left, (Expr) right);
        }
        if (isArith(left) && isArith(right)) {
            return ctx.mkEq((Expr) toReal(left), (Expr) toReal(right));
        }
        throw TranslationException.typeMismatch("Cannot compare values of incompatible types "
                + left.getSort() + " and " + right.getSort());
    }

    private Expr<?> applyConstructor(String name, List<Expr<?>> args) {
        Z3DeclarationManager.ConstructorRef ref = decls.getConstructorRef(name);
        FuncDecl<?> decl = decls.constructorDecl(ref);
        if (args.size() != ref.getArity()) {
            throw TranslationException.arity(name, ref.getArity(), args.size());
        }
        return ctx.mkApp(decl, coerceArgs(name, decl, args));
    }

    private Expr<?> applyUninterpreted(String name, List<Expr<?>> args) {
        FuncDecl<?> decl = decls.getFunction(name);
        if (decl == null) {
            decl = declareFromSignature(name, args);
        }
        return ctx.mkApp(decl, coerceArgs(name, decl, args));
    }

    /**
     * 有注册表签名时按签名声明，否则以观察到的参数 Sort 为定义域、Int 为值域。
     */
    private FuncDecl<?> declareFromSignature(String name, List<Expr<?>> args) {
        TypeExpr signature = signatureLookup.apply(name);
        if (signature != null) {
            List<TypeExpr> argTypes = new ArrayList<>();
            TypeExpr range = uncurry(signature, argTypes);
            if (argTypes.size() == args.size()) {
                Sort[] domain = argTypes.stream().map(decls::sortFor).toArray(Sort[]::new);
                return decls.getOrDeclareFunction(name, domain, decls.sortFor(range));
            }
            logger.debug("运算 {} 的签名 {} 与调用参数个数 {} 不一致，使用无类型声明", name, signature, args.size());
        } else {
            warnOnce(name, "Operation '" + name + "' has no type signature; declared as uninterpreted "
                    + args.size() + "-ary function returning Int");
        }
        Sort[] domain = args.stream().map(e -> (Sort) e.getSort()).toArray(Sort[]::new);
        return decls.getOrDeclareFunction(name, domain, ctx.getIntSort());
    }

    private static TypeExpr uncurry(TypeExpr signature, List<TypeExpr> argTypes) {
        TypeExpr current = signature instanceof TypeExpr.ForAll forAll ? forAll.getBody() : signature;
        while (current instanceof TypeExpr.Function fn) {
            if (fn.getFrom() instanceof TypeExpr.Product product) {
                argTypes.addAll(product.getTypes());
            } else {
                argTypes.add(fn.getFrom());
            }
            current = fn.getTo();
        }
        return current;
    }

    private Expr<?>[] coerceArgs(String name, FuncDecl<?> decl, List<Expr<?>> args) {
        if (decl.getDomainSize() != args.size()) {
            throw TranslationException.arity(name, decl.getDomainSize(), args.size());
        }
        Sort[] domain = decl.getDomain();
        Expr<?>[] result = new Expr<?>[args.size()];
        for (int i = 0; i < args.size(); i++) {
            result[i] = coerce(args.get(i), domain[i], name);
        }
        return result;
    }

    private Expr<?> coerce(Expr<?> value, Sort target, String context) {
        if (value.getSort().equals(target)) {
            return value;
        }
        if (target instanceof RealSort && isInt(value)) {
            return toReal(value);
        }
        throw TranslationException.typeMismatch(context + ": expected argument of sort " + target
                + " but got " + value.getSort());
    }

    // --- 量词与绑定 ---

    private Expr<?> translateQuantifier(Quantifier q, Map<String, Expr<?>> vars) {
        Map<String, Expr<?>> extended = new HashMap<>(vars);
        Expr<?>[] bound = new Expr<?>[q.getVariables().size()];
        for (int i = 0; i < bound.length; i++) {
            QuantifiedVar var = q.getVariables().get(i);
            bound[i] = ctx.mkFreshConst(var.getName(), sortForAnnotation(var.getTypeAnnotation(), var.getName()));
            extended.put(var.getName(), bound[i]);
        }
        BoolExpr body = translateBool(q.getBody(), extended);
        if (q.hasWhereClause()) {
            // 限定定义域的全称量词：cond ⟹ body
            body = ctx.mkImplies(translateBool(q.getWhereClause(), extended), body);
        }
        return q.getQuantifier() == QuantifierKind.FOR_ALL
                ? ctx.mkForall(bound, body, 0, null, null, null, null)
                : ctx.mkExists(bound, body, 0, null, null, null, null);
    }

    /**
     * 类型标注 → Sort：Bool、实数、整数、已声明数据类型、类型别名；其它类型按 Int 处理并记录警告。
     */
    public Sort sortForAnnotation(String annotation, String varName) {
        if (annotation == null) {
            return ctx.getIntSort();
        }
        Sort builtin = decls.builtinSort(annotation);
        if (builtin != null) {
            return builtin;
        }
        if (decls.getDataTypeSorts().containsKey(annotation) || decls.getAliasResolver().apply(annotation) != null) {
            return decls.sortForName(annotation);
        }
        warnOnce("type:" + annotation, "Unknown type '" + annotation + "' for variable '" + varName
                + "'. Treating as Int.");
        return ctx.getIntSort();
    }

    private Expr<?> translateConditional(Conditional c, Map<String, Expr<?>> vars) {
        BoolExpr cond = asBool(translate(c.getCondition(), vars), "Conditional condition must be a boolean expression");
        Expr<?> thenTerm = translate(c.getThenBranch(), vars);
        Expr<?> elseTerm = translate(c.getElseBranch(), vars);
        return ite(cond, thenTerm, elseTerm);
    }

    private Expr<?> ite(BoolExpr cond, Expr<?> thenTerm, Expr<?> elseTerm) {
        if (!thenTerm.getSort().equals(elseTerm.getSort())) {
            if (isArith(thenTerm) && isArith(elseTerm)) {
                thenTerm = toReal(thenTerm);
                elseTerm = toReal(elseTerm);
            } else {
                throw TranslationException.typeMismatch("Branches have incompatible types "
                        + thenTerm.getSort() + " and " + elseTerm.getSort());
            }
        }
        return ctx.mkITE(cond, (Expr) thenTerm, (Expr) elseTerm);
    }

    private Expr<?> translateLet(Let let, Map<String, Expr<?>> vars) {
        Expr<?> value = translate(let.getValue(), vars);
        Map<String, Expr<?>> extended = new HashMap<>(vars);
        bindPattern(let.getPattern(), value, extended);
        return translate(let.getBody(), extended);
    }

    /**
     * 把 match 翻译为嵌套 ite。最后一个分支作为默认分支。
     */
    private Expr<?> translateMatch(Match match, Map<String, Expr<?>> vars) {
        Expr<?> scrutinee = translate(match.getScrutinee(), vars);
        List<MatchCase> cases = match.getCases();
        MatchCase last = cases.get(cases.size() - 1);
        Map<String, Expr<?>> lastEnv = new HashMap<>(vars);
        bindPattern(last.getPattern(), scrutinee, lastEnv);
        Expr<?> result = translate(last.getBody(), lastEnv);
        for (int i = cases.size() - 2; i >= 0; i--) {
            MatchCase matchCase = cases.get(i);
            Map<String, Expr<?>> env = new HashMap<>(vars);
            BoolExpr cond = bindPattern(matchCase.getPattern(), scrutinee, env);
            Expr<?> body = translate(matchCase.getBody(), env);
            result = cond == null ? body : ite(cond, body, result);
        }
        return result;
    }

    /**
     * 绑定模式变量，返回模式匹配条件；总能匹配时返回 null。
     */
    private BoolExpr bindPattern(Pattern pattern, Expr<?> scrutinee, Map<String, Expr<?>> env) {
        return switch (pattern.getKind()) {
            case WILDCARD -> null;
            case VARIABLE -> {
                String name = ((Pattern.Variable) pattern).getName();
                Expr<?> constructor = decls.nullaryConstructor(name);
                if (constructor != null && constructor.getSort().equals(scrutinee.getSort())) {
                    yield ctx.mkEq((Expr) scrutinee, (Expr) constructor);
                }
                env.put(name, scrutinee);
                yield null;
            }
            case CONSTANT -> {
                String value = ((Pattern.Constant) pattern).getValue();
                Expr<?> literal = "true".equals(value) || "false".equals(value)
                        ? ctx.mkBool(Boolean.parseBoolean(value))
                        : translateConst(Const.of(value));
                yield mkEquality(scrutinee, literal);
            }
            case CONSTRUCTOR -> bindConstructorPattern((Pattern.Constructor) pattern, scrutinee, env);
            case AS -> {
                Pattern.As as = (Pattern.As) pattern;
                env.put(as.getBinding(), scrutinee);
                yield bindPattern(as.getPattern(), scrutinee, env);
            }
        };
    }

    private BoolExpr bindConstructorPattern(Pattern.Constructor pattern, Expr<?> scrutinee, Map<String, Expr<?>> env) {
        Z3DeclarationManager.ConstructorRef ref = decls.getConstructorRef(pattern.getName());
        if (ref == null) {
            throw TranslationException.unsupported("Unknown constructor '" + pattern.getName() + "' in pattern");
        }
        if (!scrutinee.getSort().equals(decls.getDataTypeSorts().get(ref.getDataType()))) {
            throw TranslationException.typeMismatch("Pattern " + pattern + " does not match value of sort "
                    + scrutinee.getSort());
        }
        if (pattern.getArgs().size() != ref.getArity()) {
            throw TranslationException.arity(pattern.getName(), ref.getArity(), pattern.getArgs().size());
        }
        BoolExpr cond = (BoolExpr) ctx.mkApp(decls.testerDecl(ref), scrutinee);
        FuncDecl<?>[] accessors = decls.accessorDecls(ref);
        for (int i = 0; i < accessors.length; i++) {
            Expr<?> field = ctx.mkApp(accessors[i], scrutinee);
            BoolExpr sub = bindPattern(pattern.getArgs().get(i), field, env);
            if (sub != null) {
                cond = ctx.mkAnd(cond, sub);
            }
        }
        return cond;
    }

    private Expr<?> translateLambda(Lambda lambda, Map<String, Expr<?>> vars) {
        Map<String, Expr<?>> extended = new HashMap<>(vars);
        for (QuantifiedVar param : lambda.getParams()) {
            extended.put(param.getName(), ctx.mkFreshConst(param.getName(),
                    sortForAnnotation(param.getTypeAnnotation(), param.getName())));
        }
        return translate(lambda.getBody(), extended);
    }

    // --- Sort 工具 ---

    public BoolExpr asBool(Expr<?> term, String message) {
        if (term.getSort() instanceof BoolSort && term instanceof BoolExpr b) {
            return b;
        }
        throw TranslationException.typeMismatch(message + " (got sort " + term.getSort() + ")");
    }

    static boolean isInt(Expr<?> term) {
        return term.getSort() instanceof IntSort;
    }

    static boolean isArith(Expr<?> term) {
        return term.getSort() instanceof IntSort || term.getSort() instanceof RealSort;
    }

    public Expr<?> toReal(Expr<?> term) {
        return isInt(term) ? ctx.mkInt2Real((Expr<IntSort>) term) : term;
    }

    private static void requireArity(String name, List<Expr<?>> args, int expected) {
        if (args.size() != expected) {
            throw TranslationException.arity(name, expected, args.size());
        }
    }

    private void warnOnce(String key, String message) {
        if (warnedNames.add(key)) {
            warnings.add(message);
            logger.warn(message);
        }
    }

    public void clearWarnings() {
        warnings.clear();
        warnedNames.clear();
    }
}
