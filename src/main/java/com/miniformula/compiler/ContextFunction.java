package com.miniformula.compiler;

import com.miniformula.context.EvalContext;
import com.miniformula.context.FormulaContext;

/**
 * ContextFunction - 编译后的公式
 *
 * 公式脚本编译成的可调用对象, 每次调用时传入上下文和求值上下文。
 */
@FunctionalInterface
public interface ContextFunction {

    /**
     * 求值
     *
     * @param context 公式上下文, 变量和函数在调用时才解析
     * @param evalContext 求值上下文
     * @return 结果
     */
    Object apply(FormulaContext context, EvalContext evalContext);
}
