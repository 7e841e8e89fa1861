package com.miniformula.context;

import com.miniformula.error.FormulaReferenceException;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MapFormulaContext - 基于Map的上下文
 *
 * 变量和函数保存在Map中, 修改时发出通知:
 * - 新增/删除变量、注册/注销函数 → 命名空间变化
 * - 修改已有变量的值 → 依赖值变化
 *
 * 变量查找顺序: 求值上下文绑定 → 上下文变量。
 *
 * 使用示例:
 * <pre>
 * MapFormulaContext context = new MapFormulaContext();
 * context.setVariable("x", 3.0);
 * context.registerFunction("double", args -&gt; FormulaRuntime.toNumber(args.get(0)) * 2);
 *
 * Formula formula = new Formula("double(x) + 1", context);
 * formula.evaluate(EvalContext.empty()); // 7.0
 * </pre>
 */
public class MapFormulaContext extends AbstractFormulaContext {

    /** 变量 */
    private final Map<String, Object> variables = new LinkedHashMap<>();

    /** 函数 */
    private final Map<String, FormulaFunction> functions = new HashMap<>();

    // ==================== 变量 ====================

    /**
     * 设置变量值
     *
     * @param name 变量名
     * @param value 变量值(可以为null, 表示空值)
     */
    public void setVariable(String name, Object value) {
        boolean existed = variables.containsKey(name);
        Object old = variables.put(name, value);
        if (!existed) {
            variableChanged(name);
            fireNamespaceChanged(name);
        } else if (!Objects.equals(old, value)) {
            variableChanged(name);
            fireDependentChanged(name);
        }
    }

    /**
     * 删除变量
     *
     * @param name 变量名
     */
    public void removeVariable(String name) {
        if (variables.containsKey(name)) {
            variables.remove(name);
            variableChanged(name);
            fireNamespaceChanged(name);
        }
    }

    public boolean hasVariable(String name) {
        return variables.containsKey(name);
    }

    public Map<String, Object> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    // ==================== 函数 ====================

    /**
     * 注册函数, 同名函数被替换
     */
    public void registerFunction(String name, FormulaFunction function) {
        functions.put(name, Objects.requireNonNull(function, "function"));
        functionChanged(name);
        fireNamespaceChanged(name);
    }

    /**
     * 注销函数
     */
    public void unregisterFunction(String name) {
        if (functions.remove(name) != null) {
            functionChanged(name);
            fireNamespaceChanged(name);
        }
    }

    public boolean hasFunction(String name) {
        return functions.containsKey(name);
    }

    /**
     * 变量新增、修改或删除(子类钩子), 在通知监听器之前调用
     */
    protected void variableChanged(String name) {
    }

    /**
     * 函数注册或注销(子类钩子), 在通知监听器之前调用
     */
    protected void functionChanged(String name) {
    }

    // ==================== 求值 ====================

    @Override
    public Object evaluateVariable(String name, EvalContext evalContext) {
        EvalContext ec = EvalContext.orEmpty(evalContext);
        if (ec.has(name)) {
            return ec.get(name);
        }
        if (variables.containsKey(name)) {
            return variables.get(name);
        }
        throw new FormulaReferenceException(name, FormulaReferenceException.Kind.VARIABLE);
    }

    @Override
    public Object evaluateFunction(String name, List<Object> arguments) {
        FormulaFunction function = functions.get(name);
        if (function == null) {
            throw new FormulaReferenceException(name, FormulaReferenceException.Kind.FUNCTION);
        }
        return function.apply(arguments);
    }

    @Override
    public boolean isAggregate(String name) {
        return false;
    }
}
