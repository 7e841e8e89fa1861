package com.miniformula.compiler;

import com.miniformula.context.EvalContext;
import com.miniformula.context.FormulaContext;
import com.miniformula.executor.ExpressionEvaluationStrategy;
import com.miniformula.parser.Expression;

/**
 * 编译求值: 每次调用都重新生成并编译公式脚本
 *
 * 需要缓存编译结果时用 {@link com.miniformula.formula.Formula}。
 */
public class CompiledEvaluator implements ExpressionEvaluationStrategy {

    private final CodeGenerator codeGenerator = new CodeGenerator();

    @Override
    public Object evaluate(Expression expression, FormulaContext context, EvalContext evalContext) {
        String code = codeGenerator.compile(expression, context);
        return context.createContextFunction(code).apply(context, EvalContext.orEmpty(evalContext));
    }
}
