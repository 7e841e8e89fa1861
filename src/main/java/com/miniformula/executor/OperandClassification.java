package com.miniformula.executor;

/**
 * OperandClassification - 一对运算数的分类结果
 *
 * 由 {@link FormulaRuntime#arithmeticStarter(Object, Object)} 每次调用时重新计算, 不缓存。
 * 如果某个运算数是错误值或NaN, propagated保存需要直接返回的结果, 其余字段无意义。
 */
final class OperandClassification {

    final boolean empty1;
    final boolean empty2;
    final boolean date1;
    final boolean date2;
    final double num1;
    final double num2;

    /** 需要直接传播的结果(错误值或NaN), 正常分类时为null */
    private final Object propagated;

    OperandClassification(boolean empty1, boolean empty2, boolean date1, boolean date2,
                          double num1, double num2) {
        this.empty1 = empty1;
        this.empty2 = empty2;
        this.date1 = date1;
        this.date2 = date2;
        this.num1 = num1;
        this.num2 = num2;
        this.propagated = null;
    }

    private OperandClassification(Object propagated) {
        this.empty1 = false;
        this.empty2 = false;
        this.date1 = false;
        this.date2 = false;
        this.num1 = Double.NaN;
        this.num2 = Double.NaN;
        this.propagated = propagated;
    }

    static OperandClassification propagate(Object value) {
        return new OperandClassification(value);
    }

    boolean hasPropagated() {
        return propagated != null;
    }

    Object getPropagated() {
        return propagated;
    }

    boolean isNumeric1() {
        return !Double.isNaN(num1);
    }

    boolean isNumeric2() {
        return !Double.isNaN(num2);
    }
}
