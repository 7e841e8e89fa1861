package com.miniformula.context;

/**
 * FormulaContextListener - 上下文变化通知
 *
 * 两类事件:
 * - 命名空间变化: 名字被添加、删除或改名, 已编译的公式需要重新编译
 * - 依赖值变化: 被引用的值变了, 编译结果仍然有效, 只需要重新求值
 */
public interface FormulaContextListener {

    /**
     * 命名空间变化
     *
     * @param name 变化的名字
     */
    void namespaceChanged(String name);

    /**
     * 依赖值变化
     *
     * @param name 变化的名字
     */
    void dependentChanged(String name);
}
