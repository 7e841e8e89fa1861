package com.miniformula.executor;

import com.miniformula.compiler.CompiledEvaluator;

/**
 * EvaluatorFactory - 求值器工厂
 *
 * 根据 {@link EvaluationStrategy} 创建对应的求值器。
 *
 * 使用示例:
 * <pre>
 * ExpressionEvaluationStrategy evaluator = EvaluatorFactory.create(EvaluationStrategy.POSTFIX);
 * Object result = evaluator.evaluate(expr, context, EvalContext.empty());
 * </pre>
 */
public final class EvaluatorFactory {

    private EvaluatorFactory() {
    }

    /**
     * 创建求值器
     *
     * @param strategy 求值策略
     * @return 求值器实例
     * @throws IllegalArgumentException 不支持的策略
     */
    public static ExpressionEvaluationStrategy create(EvaluationStrategy strategy) {
        if (strategy == null) {
            throw new IllegalArgumentException("Evaluation strategy cannot be null");
        }
        switch (strategy) {
            case COMPILED:
                return new CompiledEvaluator();
            case DIRECT:
                return new ExpressionEvaluator();
            case POSTFIX:
                return new PostfixEvaluator();
            default:
                throw new IllegalArgumentException("Unsupported evaluation strategy: " + strategy);
        }
    }
}
