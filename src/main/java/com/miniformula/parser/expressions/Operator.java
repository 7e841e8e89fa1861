package com.miniformula.parser.expressions;

/**
 * Operator - 二元运算符
 *
 * 定义公式中支持的二元运算符及其分类。
 * 分类决定了运算落到运行时的哪个函数:
 * - ARITHMETIC: ^ * / % → FormulaRuntime.binaryOperator
 * - ADDITIVE: + - → FormulaRuntime.add / subtract
 * - RELATIONAL: &lt; &gt; &lt;= &gt;= → FormulaRuntime.lessThan / lessThanOrEqual
 * - EQUALITY / LOGICAL: 宿主语义, 不做类型转换
 */
public enum Operator {

    /** 乘方 */
    POWER("^", Category.ARITHMETIC),
    /** 乘法 */
    MULTIPLY("*", Category.ARITHMETIC),
    /** 除法 */
    DIVIDE("/", Category.ARITHMETIC),
    /** 取余 */
    MODULO("%", Category.ARITHMETIC),
    /** 加法 */
    ADD("+", Category.ADDITIVE),
    /** 减法 */
    SUBTRACT("-", Category.ADDITIVE),
    /** 小于 */
    LESS_THAN("<", Category.RELATIONAL),
    /** 大于 */
    GREATER_THAN(">", Category.RELATIONAL),
    /** 小于等于 */
    LESS_EQUAL("<=", Category.RELATIONAL),
    /** 大于等于 */
    GREATER_EQUAL(">=", Category.RELATIONAL),
    /** 等于 */
    EQUAL("==", Category.EQUALITY),
    /** 严格等于 */
    STRICT_EQUAL("===", Category.EQUALITY),
    /** 不等于 */
    NOT_EQUAL("!=", Category.EQUALITY),
    /** 严格不等于 */
    STRICT_NOT_EQUAL("!==", Category.EQUALITY),
    /** 逻辑与 */
    AND("&&", Category.LOGICAL),
    /** 逻辑或 */
    OR("||", Category.LOGICAL);

    /**
     * 运算符分类
     */
    public enum Category {
        ARITHMETIC, ADDITIVE, RELATIONAL, EQUALITY, LOGICAL
    }

    /** 运算符字符串表示 */
    private final String symbol;

    /** 分类 */
    private final Category category;

    Operator(String symbol, Category category) {
        this.symbol = symbol;
        this.category = category;
    }

    public String getSymbol() {
        return symbol;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * 根据符号获取运算符
     *
     * @param symbol 运算符符号
     * @return 运算符枚举,如果未知返回null
     */
    public static Operator fromSymbol(String symbol) {
        for (Operator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
