package org.kleis.verify.solvers.z3;

import com.microsoft.z3.AlgebraicNum;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.RatNum;
import com.microsoft.z3.Z3Exception;
import com.microsoft.z3.enumerations.Z3_decl_kind;
import org.apache.commons.lang3.StringUtils;
import org.kleis.verify.ast.Conditional;
import org.kleis.verify.ast.Const;
import org.kleis.verify.ast.Expression;
import org.kleis.verify.ast.NamedObject;
import org.kleis.verify.ast.StringLiteral;
import org.kleis.verify.solvers.ConversionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * 把 Z3 的值和项转换回 Kleis 表达式。不支持的种类退回为文本常量，而不是报错。
 * @author Ayalyt
 */
public class Z3ResultConverter {

    private static final Logger logger = LoggerFactory.getLogger(Z3ResultConverter.class);

    private static final int DECIMAL_PRECISION = 10;

    /**
     * 按值的运行时种类转换：整数、布尔、有理数、代数数、字符串、数据类型值，其余按应用结构递归转换。
     */
    public Expression toExpression(Expr<?> value) {
        if (value instanceof IntNum intNum) {
            return Const.of(intNum.getBigInteger().toString());
        }
        if (value instanceof RatNum ratNum) {
            return rational(ratNum);
        }
        if (value instanceof AlgebraicNum algebraic) {
            return Const.of(StringUtils.removeEnd(algebraic.toDecimal(DECIMAL_PRECISION), "?"));
        }
        if (value.getSort() instanceof BoolSort) {
            if (value.isTrue()) {
                return NamedObject.of("true");
            }
            if (value.isFalse()) {
                return NamedObject.of("false");
            }
        }
        if (value.isString()) {
            return StringLiteral.of(value.getString());
        }
        if (value.isApp()) {
            Expression converted = convertApplication(value);
            if (converted != null) {
                return converted;
            }
        }
        logger.debug("无法结构化转换 Z3 值，退回文本: {}", value);
        return Const.of(value.toString());
    }

    private static Expression rational(RatNum ratNum) {
        BigInteger numerator = ratNum.getBigIntNumerator();
        BigInteger denominator = ratNum.getBigIntDenominator();
        if (BigInteger.ONE.equals(denominator)) {
            return Const.of(numerator.toString());
        }
        return Expression.op("divide", Const.of(numerator.toString()), Const.of(denominator.toString()));
    }

    /**
     * 按声明种类把函数应用转换为 Kleis 运算；不认识的种类返回 null。
     */
    private Expression convertApplication(Expr<?> value) {
        FuncDecl<?> decl = value.getFuncDecl();
        Z3_decl_kind kind = decl.getDeclKind();
        Expr<?>[] args = value.getArgs();
        return switch (kind) {
            case Z3_OP_DT_CONSTRUCTOR, Z3_OP_UNINTERPRETED -> {
                String name = symbolName(decl);
                yield args.length == 0 ? NamedObject.of(name) : Expression.op(name, convertAll(args));
            }
            case Z3_OP_ADD -> foldLeft("plus", args);
            case Z3_OP_SUB -> foldLeft("minus", args);
            case Z3_OP_MUL -> foldLeft("times", args);
            case Z3_OP_DIV, Z3_OP_IDIV -> foldLeft("divide", args);
            case Z3_OP_UMINUS -> Expression.op("negate", toExpression(args[0]));
            case Z3_OP_TO_REAL -> toExpression(args[0]);
            case Z3_OP_EQ -> foldLeft("equals", args);
            case Z3_OP_LT -> foldLeft("lt", args);
            case Z3_OP_GT -> foldLeft("gt", args);
            case Z3_OP_LE -> foldLeft("leq", args);
            case Z3_OP_GE -> foldLeft("geq", args);
            case Z3_OP_AND -> foldLeft("and", args);
            case Z3_OP_OR -> foldLeft("or", args);
            case Z3_OP_IMPLIES -> foldLeft("implies", args);
            case Z3_OP_NOT -> Expression.op("not", toExpression(args[0]));
            case Z3_OP_ITE -> Conditional.of(toExpression(args[0]), toExpression(args[1]), toExpression(args[2]));
            default -> null;
        };
    }

    private Expression foldLeft(String name, Expr<?>[] args) {
        if (args.length == 1) {
            return toExpression(args[0]);
        }
        Expression acc = toExpression(args[0]);
        for (int i = 1; i < args.length; i++) {
            acc = Expression.op(name, acc, toExpression(args[i]));
        }
        return acc;
    }

    private List<Expression> convertAll(Expr<?>[] args) {
        List<Expression> result = new ArrayList<>(args.length);
        for (Expr<?> arg : args) {
            result.add(toExpression(arg));
        }
        return result;
    }

    /**
     * 新建常量名形如 "x!3"，去掉后缀还原为 Kleis 名字。
     */
    static String symbolName(FuncDecl<?> decl) {
        String name = decl.getName().toString();
        int bang = name.indexOf('!');
        return bang > 0 ? name.substring(0, bang) : name;
    }

    // --- 基本类型提取 ---

    /**
     * @throws ConversionException 如果值不是整数，或超出 long 范围。
     */
    public long toLong(Expr<?> value) {
        try {
            if (value instanceof IntNum intNum) {
                return intNum.getBigInteger().longValueExact();
            }
            if (value instanceof RatNum ratNum && BigInteger.ONE.equals(ratNum.getBigIntDenominator())) {
                return ratNum.getBigIntNumerator().longValueExact();
            }
        } catch (ArithmeticException | Z3Exception e) {
            throw new ConversionException("Integer value does not fit in a long: " + value, e);
        }
        throw new ConversionException("Value is not an integer: " + value);
    }

    public boolean toBoolean(Expr<?> value) {
        if (value.isTrue()) {
            return true;
        }
        if (value.isFalse()) {
            return false;
        }
        throw new ConversionException("Value is not a boolean literal: " + value);
    }

    public double toDouble(Expr<?> value) {
        if (value instanceof IntNum intNum) {
            return intNum.getBigInteger().doubleValue();
        }
        if (value instanceof RatNum ratNum) {
            return ratNum.getBigIntNumerator().doubleValue() / ratNum.getBigIntDenominator().doubleValue();
        }
        if (value instanceof AlgebraicNum algebraic) {
            return Double.parseDouble(StringUtils.removeEnd(algebraic.toDecimal(DECIMAL_PRECISION), "?"));
        }
        throw new ConversionException("Value is not numeric: " + value);
    }
}
