package com.miniformula.parser.expressions;

/**
 * PrefixOperator - 一元前缀运算符
 */
public enum PrefixOperator {

    /** 转为数值 */
    PLUS("+"),
    /** 取负 */
    MINUS("-"),
    /** 逻辑取反 */
    NOT("!");

    private final String symbol;

    PrefixOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 根据符号获取运算符
     *
     * @param symbol 运算符符号
     * @return 运算符枚举,如果未知返回null
     */
    public static PrefixOperator fromSymbol(String symbol) {
        for (PrefixOperator op : values()) {
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
