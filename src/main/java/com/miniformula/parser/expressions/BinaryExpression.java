package com.miniformula.parser.expressions;

import com.miniformula.parser.Expression;

import java.util.Objects;

/**
 * BinaryExpression - 二元运算表达式
 *
 * 表示需要两个操作数的运算,包括:
 * - 算术运算: x + 1, price * quantity, 2 ^ 10
 * - 比较运算: age > 18, name == "John"
 * - 逻辑运算: age > 18 && age < 65
 *
 * 设计原则:
 * - 不可变对象
 * - 左操作数、运算符、右操作数, 都不能为null
 * - 运算符用符号字符串表示(见 {@link Operator}), 未知符号在求值时报错
 */
public final class BinaryExpression implements Expression {

    /** 运算符符号 */
    private final String operator;

    /** 左操作数 */
    private final Expression left;

    /** 右操作数 */
    private final Expression right;

    public BinaryExpression(String operator, Expression left, Expression right) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public BinaryExpression(Operator operator, Expression left, Expression right) {
        this(operator.getSymbol(), left, right);
    }

    public String getOperator() {
        return operator;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.BINARY;
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
