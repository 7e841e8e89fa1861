package com.miniformula.parser;

/**
 * Expression - 公式语法树节点接口
 *
 * 表示公式中的各种表达式,包括:
 * - 字面量: 42, "hello", true
 * - 变量引用: x, `Body Mass`
 * - 函数调用: mean(x), round(x, 2)
 * - 一元运算: -x, !done
 * - 二元运算: a + b, x > 18, a && b
 * - 条件表达式: x > 0 ? "pos" : "neg"
 *
 * 设计原则:
 * - "Good taste": 所有节点都是Expression, 求值器按类型分发, 没有if-else链
 * - 不可变: 解析完成后节点不再修改, 求值可以安全地重入
 * - 单一所有权: 一棵树只属于一个Formula, 没有共享和环
 *
 * 使用示例:
 * <pre>
 * Expression expr = new BinaryExpression(
 *     "+",
 *     new VariableExpression("x"),
 *     LiteralExpression.ofNumber(1)
 * );
 * </pre>
 */
public interface Expression {

    /**
     * 获取节点类型
     *
     * @return 节点类型枚举
     */
    ExpressionType getType();

    /**
     * 公式节点类型枚举
     */
    enum ExpressionType {
        /** 布尔字面量 */
        BOOLEAN_LITERAL,
        /** 数值字面量 */
        NUMERIC_LITERAL,
        /** 字符串字面量 */
        STRING_LITERAL,
        /** 变量引用 */
        VARIABLE,
        /** 函数调用 */
        FUNCTION_CALL,
        /** 一元运算 */
        UNARY,
        /** 二元运算 */
        BINARY,
        /** 条件表达式 */
        CONDITIONAL
    }
}
