package com.miniformula.parser.expressions;

import com.miniformula.parser.Expression;

/**
 * VariableExpression - 变量引用表达式
 *
 * 变量的值由上下文解析, 语法树只记录名字。
 * 反引号括起来的名字(`Body Mass`)在解析时已经去掉反引号。
 */
public final class VariableExpression implements Expression {

    /** 变量名 */
    private final String name;

    public VariableExpression(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Variable name cannot be empty");
        }
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.VARIABLE;
    }

    @Override
    public String toString() {
        return name;
    }
}
