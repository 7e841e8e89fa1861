package com.miniformula.context;

import java.util.List;

/**
 * AggregateFunction - 聚合函数
 *
 * 聚合函数跨所有行求值: 参数对每一行各求值一次,
 * 得到的参数列表按行传给 {@link #aggregate(List)}。
 *
 * 使用示例:
 * <pre>
 * AggregateFunction sum = rows -&gt; rows.stream()
 *         .mapToDouble(args -&gt; FormulaRuntime.toNumber(args.get(0)))
 *         .sum();
 * </pre>
 */
@FunctionalInterface
public interface AggregateFunction {

    /**
     * 聚合
     *
     * @param argumentsPerCase 每一行的参数值
     * @return 聚合结果
     */
    Object aggregate(List<List<Object>> argumentsPerCase);
}
