package com.miniformula.executor;

/**
 * 公式求值策略
 *
 * 三种策略对同一个公式给出相同的结果(或抛出同类的异常),
 * 区别在于求值方式和适用范围。
 */
public enum EvaluationStrategy {

    /**
     * 编译求值(默认)
     *
     * 语法树先生成公式脚本, 再编译成闭包, 结果按公式缓存。
     * 唯一支持聚合函数的策略。
     */
    COMPILED("compiled", "生成公式脚本并编译为闭包"),

    /**
     * 直接求值
     *
     * 递归遍历语法树, 不需要编译。
     */
    DIRECT("direct", "递归遍历语法树求值"),

    /**
     * 后缀求值
     *
     * 语法树转成后缀序列, 用一个栈求值。
     * 不短路: && || ?: 的所有运算数都会被求值, 但结果相同。
     */
    POSTFIX("postfix", "转换为后缀序列后用栈求值");

    private final String name;
    private final String description;

    EvaluationStrategy(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 按名字查找, 忽略大小写
     *
     * @return 策略, 找不到返回null
     */
    public static EvaluationStrategy fromName(String name) {
        for (EvaluationStrategy strategy : values()) {
            if (strategy.name.equalsIgnoreCase(name)) {
                return strategy;
            }
        }
        return null;
    }
}
