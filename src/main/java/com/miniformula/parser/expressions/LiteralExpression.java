package com.miniformula.parser.expressions;

import com.miniformula.parser.Expression;

/**
 * LiteralExpression - 字面量表达式
 *
 * 三种字面量共用一个类, 类型标签由工厂方法决定:
 * - 布尔值: true, false → Boolean
 * - 数值: 42, 3.14, .5, 1e3 → Double
 * - 字符串: "hello", 'it\'s' → String
 *
 * 设计原则:
 * - 不可变对象
 * - 构造函数私有, 标签和值的类型不可能不一致
 */
public final class LiteralExpression implements Expression {

    /** 类型标签 */
    private final ExpressionType type;

    /** 字面量值(Boolean, Double 或 String) */
    private final Object value;

    private LiteralExpression(ExpressionType type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static LiteralExpression ofBoolean(boolean value) {
        return new LiteralExpression(ExpressionType.BOOLEAN_LITERAL, value);
    }

    public static LiteralExpression ofNumber(double value) {
        return new LiteralExpression(ExpressionType.NUMERIC_LITERAL, value);
    }

    public static LiteralExpression ofString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("String literal cannot be null");
        }
        return new LiteralExpression(ExpressionType.STRING_LITERAL, value);
    }

    public Object getValue() {
        return value;
    }

    @Override
    public ExpressionType getType() {
        return type;
    }

    @Override
    public String toString() {
        if (type == ExpressionType.STRING_LITERAL) {
            return "\"" + value + "\"";
        }
        return String.valueOf(value);
    }
}
