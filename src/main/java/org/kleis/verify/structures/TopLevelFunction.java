package org.kleis.verify.structures;

import lombok.Getter;
import org.kleis.verify.ast.Expression;

import java.util.List;
import java.util.Objects;

/**
 * 程序顶层的 define f(x, y) = body。
 */
@Getter
public final class TopLevelFunction {

    private final String name;
    private final List<String> params;
    private final Expression body;

    private TopLevelFunction(String name, List<String> params, Expression body) {
        this.name = Objects.requireNonNull(name, "TopLevelFunction-构造函数: name 不能为 null");
        this.params = List.copyOf(Objects.requireNonNull(params, "TopLevelFunction-构造函数: params 不能为 null"));
        this.body = Objects.requireNonNull(body, "TopLevelFunction-构造函数: body 不能为 null");
    }

    public static TopLevelFunction of(String name, List<String> params, Expression body) {
        return new TopLevelFunction(name, params, body);
    }

    @Override
    public String toString() {
        return "define " + name + "(" + String.join(", ", params) + ") = " + body;
    }
}
