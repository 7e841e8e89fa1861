package com.miniformula.context;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * EvalContext - 求值上下文
 *
 * 每次求值时传入的绑定值, 优先于上下文中的变量。
 * 表格上下文还用它携带当前行(case)的下标。
 *
 * 设计原则:
 * - 不可变对象, with* 方法返回新实例
 * - 绑定值允许为null(空值)
 */
public final class EvalContext {

    private static final EvalContext EMPTY = new EvalContext(Collections.emptyMap(), -1);

    /** 绑定值 */
    private final Map<String, Object> bindings;

    /** 当前行下标, -1表示没有 */
    private final int caseIndex;

    private EvalContext(Map<String, Object> bindings, int caseIndex) {
        this.bindings = bindings;
        this.caseIndex = caseIndex;
    }

    public static EvalContext empty() {
        return EMPTY;
    }

    public static EvalContext of(Map<String, ?> bindings) {
        return new EvalContext(Collections.unmodifiableMap(new HashMap<>(bindings)), -1);
    }

    public static EvalContext forCase(int caseIndex) {
        return EMPTY.withCaseIndex(caseIndex);
    }

    /**
     * null视为空上下文
     */
    public static EvalContext orEmpty(EvalContext evalContext) {
        return evalContext != null ? evalContext : EMPTY;
    }

    public EvalContext with(String name, Object value) {
        Map<String, Object> copy = new HashMap<>(bindings);
        copy.put(name, value);
        return new EvalContext(Collections.unmodifiableMap(copy), caseIndex);
    }

    public EvalContext withCaseIndex(int index) {
        return new EvalContext(bindings, index);
    }

    public boolean has(String name) {
        return bindings.containsKey(name);
    }

    public Object get(String name) {
        return bindings.get(name);
    }

    public Map<String, Object> getBindings() {
        return bindings;
    }

    public boolean hasCase() {
        return caseIndex >= 0;
    }

    public int getCaseIndex() {
        return caseIndex;
    }

    @Override
    public String toString() {
        return "EvalContext{bindings=" + bindings + ", caseIndex=" + caseIndex + "}";
    }
}
