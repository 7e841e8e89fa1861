package com.miniformula.context;

import java.util.List;

/**
 * FormulaFunction - 注册到上下文的普通函数
 */
@FunctionalInterface
public interface FormulaFunction {

    /**
     * 调用函数
     *
     * @param arguments 已求值的参数, 按出现顺序
     * @return 函数结果
     */
    Object apply(List<Object> arguments);
}
