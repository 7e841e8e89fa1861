package com.miniformula.formula;

/**
 * 公式变化事件
 *
 * 由公式转发给自己的监听器, 来源是公式上下文的变化通知。
 */
public final class FormulaChangeEvent {

    /**
     * 变化类型
     */
    public enum Kind {
        /** 命名空间变化: 名字被加入、删除或重新定义, 公式已重新编译 */
        NAMESPACE,
        /** 依赖的值变化: 公式的结果可能不同了 */
        DEPENDENT
    }

    private final Formula formula;
    private final Kind kind;
    private final String name;

    public FormulaChangeEvent(Formula formula, Kind kind, String name) {
        this.formula = formula;
        this.kind = kind;
        this.name = name;
    }

    public Formula getFormula() {
        return formula;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * 发生变化的名字
     */
    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "FormulaChangeEvent{" + kind + ", name=" + name + "}";
    }
}
