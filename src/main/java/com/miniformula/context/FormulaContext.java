package com.miniformula.context;

import com.miniformula.compiler.ContextFunction;
import com.miniformula.error.FormulaException;
import com.miniformula.error.Messages;

import java.util.List;
import java.util.Set;

/**
 * FormulaContext - 公式的编译/求值上下文
 *
 * 公式引擎本身不知道变量和函数从哪里来, 全部委托给上下文:
 * - 直接求值: evaluateVariable / evaluateFunction 返回值
 * - 编译: compileVariable / compileFunction 返回公式脚本片段, 真正的解析推迟到调用时
 * - 聚合函数作用域: beginFunctionContext / endFunctionContext 维护嵌套, getAggregateFunctionIndices 取当前作用域
 * - 编译生命周期: willCompile → 遍历语法树 → didCompile → completeCompile
 * - 变化通知: 通过 {@link FormulaContextListener} 通知命名空间和依赖值的变化
 *
 * 设计原则:
 * - 显式接口代替属性观察, 监听器注册后必须在不用时注销
 * - 上下文拥有变量和函数的存储, 公式只持有引用
 */
public interface FormulaContext {

    // ==================== 直接求值 ====================

    /**
     * 求变量的值
     *
     * @param name 变量名
     * @param evalContext 求值上下文
     * @return 变量值
     * @throws com.miniformula.error.FormulaReferenceException 变量不存在
     */
    Object evaluateVariable(String name, EvalContext evalContext);

    /**
     * 调用函数
     *
     * @param name 函数名
     * @param arguments 已求值的参数
     * @return 函数结果
     * @throws com.miniformula.error.FormulaReferenceException 函数不存在
     */
    Object evaluateFunction(String name, List<Object> arguments);

    /**
     * 求聚合函数的值(编译产物在运行时调用)
     *
     * @param index 编译时分配的聚合函数下标
     * @param evalContext 求值上下文
     * @return 聚合结果
     */
    default Object evaluateAggregate(int index, EvalContext evalContext) {
        throw new FormulaException(Messages.get("formula.aggregate.invalidIndex", index));
    }

    // ==================== 编译 ====================

    /**
     * 编译变量引用
     *
     * @param name 变量名
     * @param aggregateIndices 外层聚合函数的下标(按从外到内的顺序)
     * @return 公式脚本片段
     */
    String compileVariable(String name, Set<Integer> aggregateIndices);

    /**
     * 编译函数调用
     *
     * @param name 函数名
     * @param arguments 已编译的参数片段
     * @param aggregateIndices 聚合函数的下标(包括本函数自己, 如果它是聚合函数)
     * @return 公式脚本片段
     */
    String compileFunction(String name, List<String> arguments, Set<Integer> aggregateIndices);

    /**
     * 是否为聚合函数
     */
    boolean isAggregate(String name);

    /**
     * 开始编译一个函数调用的参数
     *
     * @param name 函数名
     * @param aggregate 是否为聚合函数
     */
    void beginFunctionContext(String name, boolean aggregate);

    /**
     * 结束编译一个函数调用的参数
     *
     * @param name 函数名
     */
    void endFunctionContext(String name);

    /**
     * 当前外层聚合函数的下标, 有序
     */
    Set<Integer> getAggregateFunctionIndices();

    /**
     * 编译开始前调用, 重置每次编译的记录
     */
    void willCompile();

    /**
     * 语法树遍历结束后调用
     */
    void didCompile();

    /**
     * 编译完成后调用, 收尾每次编译的记录
     */
    void completeCompile();

    /**
     * 最近一次编译是否遇到了聚合函数
     */
    boolean hasAggregates();

    /**
     * 把公式脚本包装成可调用对象
     *
     * @param code 公式脚本
     * @return 可调用对象
     * @throws com.miniformula.error.FormulaSyntaxException 脚本格式错误
     */
    ContextFunction createContextFunction(String code);

    // ==================== 变化通知 ====================

    void addListener(FormulaContextListener listener);

    void removeListener(FormulaContextListener listener);

    /**
     * 释放上下文(可选实现)
     *
     * 默认实现不做什么。
     */
    default void close() {
        // 默认不做什么
    }
}
