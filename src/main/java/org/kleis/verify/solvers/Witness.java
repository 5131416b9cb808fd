package org.kleis.verify.solvers;

import lombok.Getter;
import org.kleis.verify.ast.Expression;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 结构化的反例或可满足赋值：变量名 → Kleis 表达式 的有序绑定，加上求解器原始模型文本。
 * 绑定为空时（没有跟踪变量或提取失败）显示原始模型。
 * @author Ayalyt
 */
@Getter
public final class Witness {

    private final List<WitnessBinding> bindings;
    private final String rawModel;

    private Witness(List<WitnessBinding> bindings, String rawModel) {
        this.bindings = List.copyOf(Objects.requireNonNull(bindings, "Witness-构造函数: bindings 不能为 null"));
        this.rawModel = rawModel == null ? "" : rawModel;
    }

    public static Witness of(List<WitnessBinding> bindings, String rawModel) {
        return new Witness(bindings, rawModel);
    }

    public static Witness rawOnly(String rawModel) {
        return new Witness(List.of(), rawModel);
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    /**
     * @return 指定变量的绑定值。
     */
    public Optional<Expression> get(String name) {
        return bindings.stream()
                .filter(b -> b.getName().equals(name))
                .map(WitnessBinding::getValue)
                .findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Witness that = (Witness) o;
        return bindings.equals(that.bindings) && rawModel.equals(that.rawModel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bindings, rawModel);
    }

    /**
     * 非空时渲染为 "x = 0, y = 42"，否则原样返回原始模型。
     */
    @Override
    public String toString() {
        if (bindings.isEmpty()) {
            return rawModel;
        }
        return bindings.stream().map(WitnessBinding::toString).collect(Collectors.joining(", "));
    }
}
