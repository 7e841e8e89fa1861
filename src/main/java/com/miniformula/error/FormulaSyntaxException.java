package com.miniformula.error;

/**
 * FormulaSyntaxException - 公式语法错误
 *
 * 三种来源:
 * - 源文本解析失败: 遇到意外的记号(found不为null), 或意外到达输入末尾(found为null)
 * - 求值/编译时遇到不认识的运算符
 * - 编译产物(公式脚本)格式错误
 *
 * 异常信息已经本地化, 解析器的原始诊断保存在originalMessage中。
 */
public class FormulaSyntaxException extends FormulaException {

    /** 出错的记号文本, 输入意外结束时为null */
    private final String found;

    /** 出错位置(行号从1开始), 未知时为-1 */
    private final int line;

    /** 出错位置(列号从0开始), 未知时为-1 */
    private final int column;

    /** 解析器给出的原始信息 */
    private final String originalMessage;

    public FormulaSyntaxException(String message, String found, int line, int column, String originalMessage) {
        super(message);
        this.found = found;
        this.line = line;
        this.column = column;
        this.originalMessage = originalMessage;
    }

    /**
     * 遇到意外记号
     */
    public static FormulaSyntaxException unexpectedToken(String found, int line, int column, String originalMessage) {
        return new FormulaSyntaxException(
                Messages.get("formula.syntaxError.middle", found), found, line, column, originalMessage);
    }

    /**
     * 输入意外结束
     */
    public static FormulaSyntaxException unexpectedEnd(int line, int column, String originalMessage) {
        return new FormulaSyntaxException(
                Messages.get("formula.syntaxError.end"), null, line, column, originalMessage);
    }

    /**
     * 不认识的运算符
     */
    public static FormulaSyntaxException invalidOperator(String operator) {
        String message = Messages.get("formula.syntaxError.invalidOperator", operator);
        return new FormulaSyntaxException(message, operator, -1, -1, message);
    }

    /**
     * 公式脚本格式错误
     */
    public static FormulaSyntaxException invalidScript(String detail) {
        String message = Messages.get("formula.syntaxError.script", detail);
        return new FormulaSyntaxException(message, null, -1, -1, detail);
    }

    public String getFound() {
        return found;
    }

    public boolean isEndOfInput() {
        return found == null;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getOriginalMessage() {
        return originalMessage;
    }
}
