package com.miniformula.parser.expressions;

import com.miniformula.parser.Expression;

import java.util.Objects;

/**
 * UnaryExpression - 一元运算表达式
 *
 * 表示前缀运算, 如:
 * - -x (取负)
 * - +"3" (转为数值)
 * - !done (逻辑取反)
 *
 * 运算符保存为符号字符串, 不认识的符号留到求值时报错。
 */
public final class UnaryExpression implements Expression {

    /** 运算符符号 */
    private final String operator;

    /** 操作数 */
    private final Expression operand;

    public UnaryExpression(String operator, Expression operand) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public String getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.UNARY;
    }

    @Override
    public String toString() {
        return "(" + operator + operand + ")";
    }
}
