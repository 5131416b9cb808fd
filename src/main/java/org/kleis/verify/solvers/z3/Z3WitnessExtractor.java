package org.kleis.verify.solvers.z3;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Model;
import com.microsoft.z3.Z3Exception;
import org.apache.commons.lang3.tuple.Pair;
import org.kleis.verify.ast.Const;
import org.kleis.verify.ast.Expression;
import org.kleis.verify.ast.NamedObject;
import org.kleis.verify.solvers.ConversionException;
import org.kleis.verify.solvers.Witness;
import org.kleis.verify.solvers.WitnessBinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 把 Z3 模型转换为结构化 {@link Witness}。
 * 对每个跟踪变量先尝试数据类型反向映射（逐个测试构造子判别函数），再退回基本类型转换。
 * @author Ayalyt
 */
public class Z3WitnessExtractor {

    private static final Logger logger = LoggerFactory.getLogger(Z3WitnessExtractor.class);

    static final String UNKNOWN_VALUE = "<unknown: see raw model>";

    private final Context ctx;
    private final Z3DeclarationManager decls;
    private final Z3ResultConverter converter;

    public Z3WitnessExtractor(Context ctx, Z3DeclarationManager decls, Z3ResultConverter converter) {
        this.ctx = ctx;
        this.decls = decls;
        this.converter = converter;
    }

    /**
     * @param model   求解器给出的模型。
     * @param tracked 需要报告的 (变量名, Z3 常量)。为空时见证只含原始模型文本。
     */
    public Witness modelToWitness(Model model, List<Pair<String, Expr<?>>> tracked) {
        String raw = model.toString();
        if (tracked.isEmpty()) {
            return Witness.rawOnly(raw);
        }
        List<WitnessBinding> bindings = new ArrayList<>(tracked.size());
        for (Pair<String, Expr<?>> var : tracked) {
            bindings.add(WitnessBinding.of(var.getLeft(), extract(model, var.getLeft(), var.getRight())));
        }
        Witness witness = Witness.of(bindings, raw);
        logger.debug("提取见证: {}", witness);
        return witness;
    }

    private Expression extract(Model model, String name, Expr<?> handle) {
        try {
            // 模型补全：无关变量也给出具体值
            Expr<?> value = model.eval(handle, true);
            Expression datatype = reverseMapDatatype(model, value);
            return datatype != null ? datatype : converter.toExpression(value);
        } catch (Z3Exception | ConversionException e) {
            logger.warn("变量 {} 的值无法提取: {}", name, e.getMessage());
            return Const.of(UNKNOWN_VALUE);
        }
    }

    /**
     * 用构造子判别函数识别数据类型值：无字段构造子得到构造子名，有字段构造子递归转换每个字段。
     * @return 不是已声明数据类型的值时返回 null。
     */
    Expression reverseMapDatatype(Model model, Expr<?> value) {
        if (!decls.isDataTypeSort(value.getSort())) {
            return null;
        }
        String dataType = decls.dataTypeNameOf(value.getSort());
        for (String constructor : decls.constructorNames(dataType)) {
            Z3DeclarationManager.ConstructorRef ref = decls.getConstructorRef(constructor);
            Expr<?> test = model.eval(ctx.mkApp(decls.testerDecl(ref), value), true);
            if (!test.isTrue()) {
                continue;
            }
            if (ref.getArity() == 0) {
                return NamedObject.of(constructor);
            }
            FuncDecl<?>[] accessors = decls.accessorDecls(ref);
            List<Expression> fields = new ArrayList<>(accessors.length);
            for (FuncDecl<?> accessor : accessors) {
                Expr<?> field = model.eval(ctx.mkApp(accessor, value), true);
                Expression nested = reverseMapDatatype(model, field);
                fields.add(nested != null ? nested : converter.toExpression(field));
            }
            return Expression.op(constructor, fields);
        }
        logger.debug("数据类型 {} 的值 {} 没有匹配的构造子", dataType, value);
        return null;
    }
}
