package com.miniformula.error;

/**
 * FormulaReferenceException - 引用了上下文中不存在的变量或函数
 */
public class FormulaReferenceException extends FormulaException {

    /**
     * 引用类型
     */
    public enum Kind {
        /** 变量 */
        VARIABLE,
        /** 函数 */
        FUNCTION
    }

    private final String name;

    private final Kind kind;

    public FormulaReferenceException(String name, Kind kind) {
        super(Messages.get(kind == Kind.VARIABLE
                ? "formula.referenceError.variable"
                : "formula.referenceError.function", name));
        this.name = name;
        this.kind = kind;
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }
}
