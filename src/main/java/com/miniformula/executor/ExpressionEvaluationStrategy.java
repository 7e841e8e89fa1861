package com.miniformula.executor;

import com.miniformula.context.EvalContext;
import com.miniformula.context.FormulaContext;
import com.miniformula.parser.Expression;

/**
 * 语法树求值器的公共接口
 */
public interface ExpressionEvaluationStrategy {

    /**
     * 求值
     *
     * @param expression 语法树根
     * @param context 变量和函数的来源
     * @param evalContext 求值上下文, 可以为null
     * @return 结果
     */
    Object evaluate(Expression expression, FormulaContext context, EvalContext evalContext);
}
