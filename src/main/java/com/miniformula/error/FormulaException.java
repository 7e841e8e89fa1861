package com.miniformula.error;

/**
 * FormulaException - 公式引擎异常基类
 *
 * 解析、编译、求值过程中的所有错误都是它的子类,
 * 调用方可以只捕获这一个类型。
 */
public class FormulaException extends RuntimeException {

    public FormulaException(String message) {
        super(message);
    }

    public FormulaException(String message, Throwable cause) {
        super(message, cause);
    }
}
