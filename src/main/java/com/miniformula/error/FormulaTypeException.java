package com.miniformula.error;

/**
 * FormulaTypeException - 运算数类型不合法
 *
 * 例如日期乘以数字、字符串减字符串。携带出错的运算符符号。
 */
public class FormulaTypeException extends FormulaException {

    private final String operator;

    public FormulaTypeException(String operator) {
        super(Messages.get("formula.typeError", operator));
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
