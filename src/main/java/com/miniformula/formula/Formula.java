package com.miniformula.formula;

import com.miniformula.compiler.CodeGenerator;
import com.miniformula.compiler.ContextFunction;
import com.miniformula.context.BasicFormulaContext;
import com.miniformula.context.EvalContext;
import com.miniformula.context.FormulaContext;
import com.miniformula.context.FormulaContextListener;
import com.miniformula.error.FormulaException;
import com.miniformula.executor.EvaluationStrategy;
import com.miniformula.executor.ExpressionEvaluator;
import com.miniformula.executor.PostfixConverter;
import com.miniformula.executor.PostfixEvaluator;
import com.miniformula.parser.Expression;
import com.miniformula.parser.ExpressionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Formula - 公式
 *
 * 持有公式源文本和上下文, 按需解析和编译, 并缓存结果:
 * <pre>
 * 无源文本 ──setSource──→ 已解析/未编译 ──getCompiled──→ 已解析/已编译
 *                     └──→ 解析失败(缓存错误, 每次读取都重新抛出)
 * </pre>
 *
 * 缓存失效:
 * - setSource / invalidate: 丢弃语法树和编译结果, 下次读取重新解析
 * - setContext / invalidateContext / 上下文命名空间变化: 只丢弃编译结果
 * - 上下文依赖值变化: 不失效, 只转发通知
 *
 * 公式在上下文上注册监听器, 使用完毕必须 close() 注销。
 *
 * 使用示例:
 * <pre>
 * MapFormulaContext context = new MapFormulaContext();
 * context.setVariable("x", 3);
 * try (Formula formula = new Formula("x * 2 + 1", context)) {
 *     Object result = formula.evaluate(EvalContext.empty());
 *     // result = 7.0
 * }
 * </pre>
 *
 * 不是线程安全的。
 */
public class Formula implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Formula.class);

    private final ExpressionParser parser;
    private final CodeGenerator codeGenerator = new CodeGenerator();
    private final ExpressionEvaluator expressionEvaluator = new ExpressionEvaluator();
    private final PostfixEvaluator postfixEvaluator = new PostfixEvaluator();

    private final ContextListener contextListener = new ContextListener();
    private final List<FormulaChangeListener> changeListeners = new ArrayList<>();

    private String source;
    private FormulaContext context;

    /** 上下文是否由公式自己创建(关闭公式时一并关闭) */
    private boolean ownsContext;

    // 解析缓存
    private boolean parsedValid;
    private Expression parsed;
    private RuntimeException parseError;
    private List<Expression> postfix;

    // 编译缓存
    private boolean compiledValid;
    private ContextFunction compiled;
    private boolean compiledHasAggregates;

    private int parseCount;
    private int compileCount;

    public Formula() {
        this(null, null, new ExpressionParser());
    }

    public Formula(String source) {
        this(source, null, new ExpressionParser());
    }

    public Formula(String source, FormulaContext context) {
        this(source, context, new ExpressionParser());
    }

    /**
     * @param source 公式源文本, 可以为null
     * @param context 上下文, 为null时第一次编译前创建默认上下文
     * @param parser 解析器
     */
    public Formula(String source, FormulaContext context, ExpressionParser parser) {
        if (parser == null) {
            throw new IllegalArgumentException("Parser cannot be null");
        }
        this.parser = parser;
        this.source = source;
        if (context != null) {
            attach(context);
        }
    }

    // ==================== 属性 ====================

    public String getSource() {
        return source;
    }

    /**
     * 设置源文本, 丢弃所有缓存
     */
    public void setSource(String source) {
        this.source = source;
        invalidate();
    }

    /**
     * 当前上下文, 还没有创建默认上下文时为null
     */
    public FormulaContext getContext() {
        return context;
    }

    /**
     * 替换上下文
     *
     * 从旧上下文注销监听器, 在新上下文上注册, 丢弃编译结果。
     */
    public void setContext(FormulaContext newContext) {
        if (newContext == context) {
            return;
        }
        detach();
        if (newContext != null) {
            attach(newContext);
        }
        invalidateContext();
    }

    /**
     * 语法树
     *
     * @return 语法树, 源文本为空时返回null
     * @throws com.miniformula.error.FormulaSyntaxException 源文本有语法错误(每次读取都会抛出)
     */
    public Expression getParsed() {
        if (!parsedValid) {
            reparse();
        }
        if (parseError != null) {
            throw parseError;
        }
        return parsed;
    }

    /**
     * 编译结果
     *
     * @return 可调用对象, 源文本为空时返回null
     */
    public ContextFunction getCompiled() {
        if (!compiledValid) {
            recompile();
        }
        return compiled;
    }

    /**
     * 公式是否包含聚合函数
     *
     * 会触发编译。解析或编译失败时返回false。
     */
    public boolean hasAggregates() {
        try {
            getCompiled();
            return compiledHasAggregates;
        } catch (FormulaException e) {
            logger.debug("公式 [{}] 无法编译, 视为不含聚合函数: {}", source, e.getMessage());
            return false;
        }
    }

    // ==================== 求值 ====================

    /**
     * 编译求值
     *
     * @param evalContext 求值上下文, 可以为null
     * @return 结果, 源文本为空时返回null
     */
    public Object evaluate(EvalContext evalContext) {
        ContextFunction function = getCompiled();
        if (function == null) {
            return null;
        }
        return function.apply(context, EvalContext.orEmpty(evalContext));
    }

    /**
     * 直接遍历语法树求值, 不编译
     *
     * 适合只求值一两次的公式。聚合函数不能用这种方式求值。
     */
    public Object evaluateDirect(EvalContext evalContext) {
        Expression expression = getParsed();
        if (expression == null) {
            return null;
        }
        return expressionEvaluator.evaluate(expression, ensureContext(), evalContext);
    }

    /**
     * 后缀序列求值, 后缀序列和语法树一起缓存
     */
    public Object evaluatePostfix(EvalContext evalContext) {
        Expression expression = getParsed();
        if (expression == null) {
            return null;
        }
        if (postfix == null) {
            postfix = PostfixConverter.toPostfix(expression);
        }
        return postfixEvaluator.evaluate(postfix, ensureContext(), evalContext);
    }

    /**
     * 按指定策略求值
     */
    public Object evaluate(EvalContext evalContext, EvaluationStrategy strategy) {
        switch (strategy) {
            case COMPILED:
                return evaluate(evalContext);
            case DIRECT:
                return evaluateDirect(evalContext);
            case POSTFIX:
                return evaluatePostfix(evalContext);
            default:
                throw new IllegalArgumentException("Unsupported evaluation strategy: " + strategy);
        }
    }

    // ==================== 缓存失效 ====================

    /**
     * 丢弃语法树和编译结果, 下次读取时重新解析
     */
    public void invalidate() {
        parsedValid = false;
        parsed = null;
        parseError = null;
        postfix = null;
        invalidateContext();
    }

    /**
     * 只丢弃编译结果, 保留语法树
     */
    public void invalidateContext() {
        compiledValid = false;
        compiled = null;
        compiledHasAggregates = false;
    }

    private void reparse() {
        parseCount++;
        parsed = null;
        parseError = null;
        postfix = null;
        parsedValid = true;

        if (source == null || source.trim().isEmpty()) {
            return;
        }
        logger.debug("解析公式: {}", source);
        try {
            parsed = parser.parse(source);
        } catch (FormulaException e) {
            parseError = e;
        }
    }

    private void recompile() {
        Expression expression = getParsed();
        compileCount++;
        if (expression == null) {
            compiled = null;
            compiledHasAggregates = false;
            compiledValid = true;
            return;
        }

        FormulaContext ctx = ensureContext();
        String code = codeGenerator.compile(expression, ctx);
        logger.debug("编译公式 [{}] → {}", source, code);
        compiled = ctx.createContextFunction(code);
        compiledHasAggregates = ctx.hasAggregates();
        compiledValid = true;
    }

    public int getParseCount() {
        return parseCount;
    }

    public int getCompileCount() {
        return compileCount;
    }

    // ==================== 上下文和监听器 ====================

    private FormulaContext ensureContext() {
        if (context == null) {
            attach(new BasicFormulaContext());
            ownsContext = true;
        }
        return context;
    }

    private void attach(FormulaContext newContext) {
        context = newContext;
        ownsContext = false;
        context.addListener(contextListener);
    }

    private void detach() {
        if (context == null) {
            return;
        }
        context.removeListener(contextListener);
        if (ownsContext) {
            context.close();
        }
        context = null;
        ownsContext = false;
    }

    public void addChangeListener(FormulaChangeListener listener) {
        if (!changeListeners.contains(listener)) {
            changeListeners.add(listener);
        }
    }

    public void removeChangeListener(FormulaChangeListener listener) {
        changeListeners.remove(listener);
    }

    private void fireChanged(FormulaChangeEvent.Kind kind, String name) {
        FormulaChangeEvent event = new FormulaChangeEvent(this, kind, name);
        for (FormulaChangeListener listener : new ArrayList<>(changeListeners)) {
            listener.formulaChanged(event);
        }
    }

    /**
     * 注销上下文监听器
     *
     * 默认上下文是公式自己创建的, 一并关闭; 外部传入的上下文由调用方负责。
     */
    @Override
    public void close() {
        detach();
        invalidateContext();
        changeListeners.clear();
    }

    /**
     * 上下文变化 → 公式缓存失效 + 转发
     */
    private class ContextListener implements FormulaContextListener {

        @Override
        public void namespaceChanged(String name) {
            invalidateContext();
            fireChanged(FormulaChangeEvent.Kind.NAMESPACE, name);
            fireChanged(FormulaChangeEvent.Kind.DEPENDENT, name);
        }

        @Override
        public void dependentChanged(String name) {
            fireChanged(FormulaChangeEvent.Kind.DEPENDENT, name);
        }
    }
}
