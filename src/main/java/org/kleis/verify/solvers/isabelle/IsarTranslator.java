package org.kleis.verify.solvers.isabelle;

import org.apache.commons.lang3.StringUtils;
import org.kleis.verify.ast.Ascription;
import org.kleis.verify.ast.Conditional;
import org.kleis.verify.ast.Const;
import org.kleis.verify.ast.Expression;
import org.kleis.verify.ast.Lambda;
import org.kleis.verify.ast.Let;
import org.kleis.verify.ast.ListLiteral;
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
import org.kleis.verify.solvers.TranslationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 把 Kleis 表达式翻译为 Isabelle/HOL 的内层语法（Isar 命题文本）。
 * 已知运算映射为中缀算子或 HOL 常量，其余运算按函数应用 {@code (f a b)} 输出。
 * @author Ayalyt
 */
public class IsarTranslator {

    private static final Map<String, String> INFIX = Map.ofEntries(
            Map.entry("plus", "+"), Map.entry("add", "+"),
            Map.entry("times", "*"), Map.entry("multiply", "*"),
            Map.entry("divide", "/"), Map.entry("div", "/"),
            Map.entry("mod", "mod"), Map.entry("modulo", "mod"),
            Map.entry("power", "^"), Map.entry("pow", "^"),
            Map.entry("equals", "="), Map.entry("eq", "="),
            Map.entry("neq", "≠"), Map.entry("not_equals", "≠"),
            Map.entry("lt", "<"), Map.entry("less_than", "<"),
            Map.entry("gt", ">"), Map.entry("greater_than", ">"),
            Map.entry("leq", "≤"), Map.entry("le", "≤"),
            Map.entry("geq", "≥"), Map.entry("ge", "≥"),
            Map.entry("and", "∧"), Map.entry("or", "∨"),
            Map.entry("implies", "⟶"), Map.entry("iff", "⟷"),
            Map.entry("cons", "#"), Map.entry("Cons", "#"),
            Map.entry("append", "@"), Map.entry("nth", "!"),
            Map.entry("member", "∈"), Map.entry("elem", "∈"), Map.entry("not_member", "∉"),
            Map.entry("union", "∪"), Map.entry("intersect", "∩"), Map.entry("inter", "∩"),
            Map.entry("intersection", "∩"), Map.entry("subset", "⊆"));

    // Kleis 名字 -> HOL 常量名
    private static final Map<String, String> FUNCTIONS = Map.ofEntries(
            Map.entry("abs", "abs"), Map.entry("sqrt", "sqrt"), Map.entry("floor", "floor"),
            Map.entry("ceiling", "ceiling"), Map.entry("max", "max"), Map.entry("min", "min"),
            Map.entry("length", "length"), Map.entry("len", "length"),
            Map.entry("hd", "hd"), Map.entry("head", "hd"), Map.entry("tl", "tl"), Map.entry("tail", "tl"),
            Map.entry("rev", "rev"), Map.entry("reverse", "rev"), Map.entry("map", "map"),
            Map.entry("filter", "filter"), Map.entry("fold", "foldl"), Map.entry("foldl", "foldl"),
            Map.entry("foldr", "foldr"), Map.entry("the", "the"), Map.entry("fromJust", "the"),
            Map.entry("fst", "fst"), Map.entry("snd", "snd"));

    public String translate(Expression expr) {
        return switch (expr.getKind()) {
            case CONST -> translateConst((Const) expr);
            case STRING -> "''" + ((StringLiteral) expr).getValue().replace("'", "\\'") + "''";
            case OBJECT -> translateObject(((NamedObject) expr).getName());
            case OPERATION -> translateOperation((Operation) expr);
            case QUANTIFIER -> translateQuantifier((Quantifier) expr);
            case CONDITIONAL -> {
                Conditional c = (Conditional) expr;
                yield "(if " + translate(c.getCondition()) + " then " + translate(c.getThenBranch())
                        + " else " + translate(c.getElseBranch()) + ")";
            }
            case LET -> {
                Let let = (Let) expr;
                yield "(let " + translatePattern(let.getPattern()) + " = " + translate(let.getValue())
                        + " in " + translate(let.getBody()) + ")";
            }
            case MATCH -> translateMatch((Match) expr);
            case LIST -> ((ListLiteral) expr).getElements().stream().map(this::translate)
                    .collect(Collectors.joining(", ", "[", "]"));
            case ASCRIPTION -> {
                Ascription a = (Ascription) expr;
                yield "(" + translate(a.getExpression()) + " :: " + translateType(a.getTypeAnnotation()) + ")";
            }
            case LAMBDA -> {
                Lambda lambda = (Lambda) expr;
                yield "(λ" + declareVars(lambda.getParams()) + ". " + translate(lambda.getBody()) + ")";
            }
            case PLACEHOLDER -> {
                Placeholder p = (Placeholder) expr;
                throw TranslationException.unsupported("Cannot translate placeholder to Isar: id="
                        + p.getId() + ", hint='" + p.getHint() + "'");
            }
        };
    }

    private static String translateConst(Const c) {
        String value = c.getValue();
        return value.length() > 1 && value.startsWith("-") ? "(- " + value.substring(1) + ")" : value;
    }

    private static String translateObject(String name) {
        return switch (name) {
            case "ℕ" -> "nat";
            case "ℤ" -> "int";
            case "ℝ" -> "real";
            case "ℂ" -> "complex";
            case "ℚ" -> "rat";
            case "Bool", "Boolean" -> "bool";
            case "True", "true" -> "True";
            case "False", "false" -> "False";
            default -> name;
        };
    }

    private String translateOperation(Operation op) {
        String name = op.getName();
        List<String> args = new ArrayList<>(op.arity());
        for (Expression arg : op.getArgs()) {
            args.add(translate(arg));
        }
        if ((name.equals("negate") || name.equals("minus")) && args.size() == 1) {
            return "(- " + args.get(0) + ")";
        }
        if (name.equals("minus") || name.equals("subtract")) {
            return infix(name, "-", args);
        }
        if (name.equals("not")) {
            requireArgs(name, args, 1);
            return "(¬ " + args.get(0) + ")";
        }
        String infix = INFIX.get(name);
        if (infix != null) {
            return infix(name, infix, args);
        }
        switch (name) {
            case "nil", "Nil" -> {
                return "[]";
            }
            case "empty_set" -> {
                return "{}";
            }
            case "pair", "Pair" -> {
                requireArgs(name, args, 2);
                return "(" + args.get(0) + ", " + args.get(1) + ")";
            }
            default -> {
                // 未知运算按函数应用输出
            }
        }
        String function = FUNCTIONS.getOrDefault(name, name);
        return args.isEmpty() ? function : "(" + function + " " + String.join(" ", args) + ")";
    }

    private String translateQuantifier(Quantifier q) {
        String symbol = q.getQuantifier() == QuantifierKind.FOR_ALL ? "∀" : "∃";
        String body = translate(q.getBody());
        if (q.hasWhereClause()) {
            String cond = translate(q.getWhereClause());
            body = q.getQuantifier() == QuantifierKind.FOR_ALL ? cond + " ⟶ " + body : cond + " ∧ " + body;
        }
        return "(" + symbol + declareVars(q.getVariables()) + ". " + body + ")";
    }

    private String translateMatch(Match match) {
        List<String> cases = new ArrayList<>(match.getCases().size());
        for (MatchCase c : match.getCases()) {
            cases.add(translatePattern(c.getPattern()) + " ⇒ " + translate(c.getBody()));
        }
        return "(case " + translate(match.getScrutinee()) + " of " + String.join(" | ", cases) + ")";
    }

    private String translatePattern(Pattern pattern) {
        return switch (pattern.getKind()) {
            case WILDCARD -> "_";
            case VARIABLE -> ((Pattern.Variable) pattern).getName();
            case CONSTANT -> ((Pattern.Constant) pattern).getValue();
            case CONSTRUCTOR -> {
                Pattern.Constructor c = (Pattern.Constructor) pattern;
                yield c.getArgs().isEmpty() ? c.getName()
                        : "(" + c.getName() + " " + c.getArgs().stream().map(this::translatePattern)
                        .collect(Collectors.joining(" ")) + ")";
            }
            // HOL 没有 as 模式，绑定名覆盖整个值
            case AS -> ((Pattern.As) pattern).getBinding();
        };
    }

    private String declareVars(List<QuantifiedVar> vars) {
        return vars.stream()
                .map(v -> v.hasTypeAnnotation() ? "(" + v.getName() + " :: " + translateType(v.getTypeAnnotation()) + ")"
                        : v.getName())
                .collect(Collectors.joining(" "));
    }

    /**
     * 翻译类型标注：ℕ→nat、ℤ→int、ℝ→real、ℂ→complex、ℚ→rat、Bool→bool，
     * {@code List(T)} 等参数化类型写成后缀形式，函数箭头写成 ⇒。未知类型原样保留。
     */
    public String translateType(String type) {
        String ty = StringUtils.trimToEmpty(type);
        if (ty.contains("→")) {
            String[] parts = ty.split("→");
            List<String> translated = new ArrayList<>(parts.length);
            for (String part : parts) {
                translated.add(translateType(part));
            }
            return String.join(" ⇒ ", translated);
        }
        return switch (ty) {
            case "ℕ", "Nat", "Natural" -> "nat";
            case "ℤ", "Int", "Integer" -> "int";
            case "ℝ", "Real" -> "real";
            case "ℂ", "Complex" -> "complex";
            case "ℚ", "Rational" -> "rat";
            case "Bool", "Boolean", "bool" -> "bool";
            case "String" -> "string";
            case "Unit", "()" -> "unit";
            default -> translateParametric(ty);
        };
    }

    private String translateParametric(String ty) {
        for (String head : new String[]{"List", "Option", "Set"}) {
            if (ty.startsWith(head + "(") && ty.endsWith(")")) {
                String inner = ty.substring(head.length() + 1, ty.length() - 1);
                return translateType(inner) + " " + head.toLowerCase();
            }
        }
        return ty;
    }

    private static String infix(String name, String op, List<String> args) {
        requireArgs(name, args, 2);
        return "(" + args.get(0) + " " + op + " " + args.get(1) + ")";
    }

    private static void requireArgs(String name, List<String> args, int expected) {
        if (args.size() != expected) {
            throw TranslationException.arity(name, expected, args.size());
        }
    }
}
