package org.kleis.verify.solvers;

import lombok.Getter;
import org.kleis.verify.ast.Expression;

import java.util.Objects;

@Getter
public final class WitnessBinding {

    private final String name;
    private final Expression value;

    private WitnessBinding(String name, Expression value) {
        this.name = Objects.requireNonNull(name, "WitnessBinding-构造函数: name 不能为 null");
        this.value = Objects.requireNonNull(value, "WitnessBinding-构造函数: value 不能为 null");
    }

    public static WitnessBinding of(String name, Expression value) {
        return new WitnessBinding(name, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        WitnessBinding that = (WitnessBinding) o;
        return name.equals(that.name) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value);
    }

    @Override
    public String toString() {
        return name + " = " + value;
    }
}
