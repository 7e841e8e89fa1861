package com.miniformula.parser.expressions;

import com.miniformula.parser.Expression;

import java.util.List;
import java.util.stream.Collectors;

/**
 * FunctionCallExpression - 函数调用表达式
 *
 * 表示 name(arg1, arg2, ...), 参数按出现顺序保存。
 * 函数本身由上下文提供, 语法树不关心它是普通函数还是聚合函数。
 *
 * 设计原则:
 * - 不可变对象, 参数列表拷贝一份
 * - 无参调用用空列表表示, 不用null
 */
public final class FunctionCallExpression implements Expression {

    /** 函数名 */
    private final String name;

    /** 参数列表 */
    private final List<Expression> arguments;

    public FunctionCallExpression(String name, List<Expression> arguments) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Function name cannot be empty");
        }
        this.name = name;
        this.arguments = List.copyOf(arguments);
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.FUNCTION_CALL;
    }

    @Override
    public String toString() {
        return name + arguments.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
