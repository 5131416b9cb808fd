package org.kleis.verify.solvers.z3;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;

import java.util.List;

/**
 * 翻译后的证明目标：顶层量词变量被替换为跟踪常量，用于从模型中提取见证。
 */
@Getter
public final class TranslatedGoal {

    private final BoolExpr formula;
    private final List<Pair<String, Expr<?>>> trackedVariables;

    TranslatedGoal(BoolExpr formula, List<Pair<String, Expr<?>>> trackedVariables) {
        this.formula = formula;
        this.trackedVariables = List.copyOf(trackedVariables);
    }

    @Override
    public String toString() {
        return formula.toString();
    }
}
