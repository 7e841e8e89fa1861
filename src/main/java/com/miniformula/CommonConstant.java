package com.miniformula;

/**
 * 公共常量
 */
public final class CommonConstant {

    private CommonConstant() {
    }

    /** 公式脚本中运行时函数的接收者名, 如 runtime.add(a,b) */
    public static final String RUNTIME_RECEIVER = "runtime";

    /** 公式脚本中上下文的接收者名, 如 context.evaluateVariable("x",evalContext) */
    public static final String CONTEXT_RECEIVER = "context";

    /** 公式脚本中求值上下文的引用名 */
    public static final String EVAL_CONTEXT_REFERENCE = "evalContext";

    /** 上下文缓存的已编译脚本数量上限 */
    public static final int CONTEXT_FUNCTION_CACHE_SIZE = 64;

    /** 减法类型错误中使用的运算符符号(U+2212) */
    public static final String MINUS_SIGN = "−";
}
