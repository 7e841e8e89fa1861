package com.miniformula.context;

import com.miniformula.CommonConstant;
import com.miniformula.compiler.ContextFunction;
import com.miniformula.compiler.ScriptCompiler;
import com.miniformula.compiler.ScriptText;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * AbstractFormulaContext - 上下文的公共实现
 *
 * 负责和具体数据无关的部分:
 * - 监听器注册和通知
 * - 函数调用的嵌套栈, 聚合函数下标的分配
 * - 编译生命周期的记录(hasAggregates)
 * - 默认的变量/函数编译片段
 * - 公式脚本到可调用对象的转换, 带LRU缓存
 *
 * 子类只需要实现 evaluateVariable / evaluateFunction / isAggregate。
 *
 * 默认生成的脚本片段:
 * <pre>
 * x       → context.evaluateVariable("x",evalContext)
 * f(a, b) → context.evaluateFunction("f",[a,b])
 * </pre>
 */
public abstract class AbstractFormulaContext implements FormulaContext {

    /** 监听器 */
    private final List<FormulaContextListener> listeners = new ArrayList<>();

    /** 正在编译的函数调用栈(栈顶是最内层) */
    private final Deque<FunctionScope> functionScopes = new ArrayDeque<>();

    /** 本次编译已分配的聚合函数数量 */
    private int aggregateCount;

    /** 最近一次编译是否遇到聚合函数 */
    private boolean hasAggregates;

    /** 公式脚本 → 可调用对象, LRU */
    private final LinkedHashMap<String, ContextFunction> functionCache =
            new LinkedHashMap<>(16, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, ContextFunction> eldest) {
                    return size() > CommonConstant.CONTEXT_FUNCTION_CACHE_SIZE;
                }
            };

    private final ScriptCompiler scriptCompiler = new ScriptCompiler();

    // ==================== 编译 ====================

    @Override
    public String compileVariable(String name, Set<Integer> aggregateIndices) {
        return CommonConstant.CONTEXT_RECEIVER + ".evaluateVariable("
                + ScriptText.quote(name) + "," + CommonConstant.EVAL_CONTEXT_REFERENCE + ")";
    }

    @Override
    public String compileFunction(String name, List<String> arguments, Set<Integer> aggregateIndices) {
        return CommonConstant.CONTEXT_RECEIVER + ".evaluateFunction("
                + ScriptText.quote(name) + ",[" + String.join(",", arguments) + "])";
    }

    @Override
    public void beginFunctionContext(String name, boolean aggregate) {
        int index = aggregate ? aggregateCount++ : -1;
        functionScopes.push(new FunctionScope(name, index));
        if (aggregate) {
            aggregateRegistered(name, index);
        }
    }

    @Override
    public void endFunctionContext(String name) {
        FunctionScope scope = functionScopes.peek();
        if (scope == null || !scope.name.equals(name)) {
            throw new IllegalStateException("Unbalanced function context: " + name);
        }
        functionScopes.pop();
    }

    @Override
    public Set<Integer> getAggregateFunctionIndices() {
        Set<Integer> indices = new LinkedHashSet<>();
        // ArrayDeque.push放在队首, 倒序遍历得到从外到内的顺序
        Iterator<FunctionScope> it = functionScopes.descendingIterator();
        while (it.hasNext()) {
            FunctionScope scope = it.next();
            if (scope.aggregateIndex >= 0) {
                indices.add(scope.aggregateIndex);
            }
        }
        return Collections.unmodifiableSet(indices);
    }

    @Override
    public void willCompile() {
        functionScopes.clear();
        aggregateCount = 0;
        hasAggregates = false;
    }

    @Override
    public void didCompile() {
        hasAggregates = aggregateCount > 0;
    }

    @Override
    public void completeCompile() {
        functionScopes.clear();
    }

    @Override
    public boolean hasAggregates() {
        return hasAggregates;
    }

    /**
     * 编译时分配了一个聚合函数下标(子类钩子)
     *
     * @param name 聚合函数名
     * @param index 下标
     */
    protected void aggregateRegistered(String name, int index) {
        // 默认不做什么
    }

    @Override
    public ContextFunction createContextFunction(String code) {
        ContextFunction function = functionCache.get(code);
        if (function == null) {
            function = scriptCompiler.compile(code);
            functionCache.put(code, function);
        }
        return function;
    }

    // ==================== 变化通知 ====================

    @Override
    public void addListener(FormulaContextListener listener) {
        if (!listeners.contains(listener)) {
            listeners.add(listener);
        }
    }

    @Override
    public void removeListener(FormulaContextListener listener) {
        listeners.remove(listener);
    }

    public int getListenerCount() {
        return listeners.size();
    }

    /**
     * 通知命名空间变化
     */
    protected void fireNamespaceChanged(String name) {
        // 通知过程中监听器可能注销自己, 遍历副本
        for (FormulaContextListener listener : new ArrayList<>(listeners)) {
            listener.namespaceChanged(name);
        }
    }

    /**
     * 通知依赖值变化
     */
    protected void fireDependentChanged(String name) {
        for (FormulaContextListener listener : new ArrayList<>(listeners)) {
            listener.dependentChanged(name);
        }
    }

    @Override
    public void close() {
        listeners.clear();
        functionCache.clear();
    }

    /**
     * 一层函数调用
     */
    private static final class FunctionScope {
        final String name;
        /** 聚合函数下标, 普通函数为-1 */
        final int aggregateIndex;

        FunctionScope(String name, int aggregateIndex) {
            this.name = name;
            this.aggregateIndex = aggregateIndex;
        }
    }
}
