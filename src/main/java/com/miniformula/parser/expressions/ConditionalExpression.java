package com.miniformula.parser.expressions;

import com.miniformula.parser.Expression;

import java.util.Objects;

/**
 * ConditionalExpression - 条件表达式
 *
 * condition ? whenTrue : whenFalse, 求值时只计算被选中的分支。
 */
public final class ConditionalExpression implements Expression {

    private final Expression condition;

    private final Expression whenTrue;

    private final Expression whenFalse;

    public ConditionalExpression(Expression condition, Expression whenTrue, Expression whenFalse) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.whenTrue = Objects.requireNonNull(whenTrue, "whenTrue");
        this.whenFalse = Objects.requireNonNull(whenFalse, "whenFalse");
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getWhenTrue() {
        return whenTrue;
    }

    public Expression getWhenFalse() {
        return whenFalse;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.CONDITIONAL;
    }

    @Override
    public String toString() {
        return "(" + condition + " ? " + whenTrue + " : " + whenFalse + ")";
    }
}
