package com.miniformula;

import com.miniformula.context.EvalContext;
import com.miniformula.context.MapFormulaContext;
import com.miniformula.error.FormulaException;
import com.miniformula.executor.EvaluationStrategy;
import com.miniformula.executor.FormulaRuntime;
import com.miniformula.formula.Formula;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Mini Formula - 命令行入口
 *
 * 用法:
 * <pre>
 * MiniFormula [-s compiled|direct|postfix] [-D name=value]... formula...
 * </pre>
 * 每个公式输出一行 "公式 = 结果"。-D 定义的变量对所有公式可见,
 * 值是数字、true/false, 否则按字符串处理。
 *
 * 退出码: 0 全部成功, 1 有公式求值失败, 2 参数错误。
 */
public class MiniFormula {

    static final int EXIT_OK = 0;
    static final int EXIT_FORMULA_ERROR = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        EvaluationStrategy strategy = EvaluationStrategy.COMPILED;
        MapFormulaContext context = new MapFormulaContext();
        List<String> formulas = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("-s".equals(arg) || "--strategy".equals(arg)) {
                if (i + 1 >= args.length) {
                    return usage(err, "missing strategy name");
                }
                strategy = EvaluationStrategy.fromName(args[++i]);
                if (strategy == null) {
                    return usage(err, "unknown strategy '" + args[i] + "'");
                }
            } else if ("-D".equals(arg)) {
                if (i + 1 >= args.length) {
                    return usage(err, "missing variable definition");
                }
                String definition = args[++i];
                int eq = definition.indexOf('=');
                if (eq <= 0) {
                    return usage(err, "variable definition must be name=value: " + definition);
                }
                context.setVariable(definition.substring(0, eq), parseValue(definition.substring(eq + 1)));
            } else {
                formulas.add(arg);
            }
        }

        if (formulas.isEmpty()) {
            return usage(err, "no formula given");
        }

        int exitCode = EXIT_OK;
        for (String source : formulas) {
            try (Formula formula = new Formula(source, context)) {
                Object result = formula.evaluate(EvalContext.empty(), strategy);
                out.println(source + " = " + FormulaRuntime.toDisplayString(result));
            } catch (FormulaException e) {
                err.println(source + ": " + e.getMessage());
                exitCode = EXIT_FORMULA_ERROR;
            }
        }
        return exitCode;
    }

    /**
     * 命令行上的值: 数字、布尔值, 其余为字符串
     */
    static Object parseValue(String text) {
        if ("true".equals(text) || "false".equals(text)) {
            return Boolean.valueOf(text);
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return text;
        }
    }

    private static int usage(PrintStream err, String problem) {
        err.println("Error: " + problem);
        err.println("Usage: MiniFormula [-s compiled|direct|postfix] [-D name=value]... formula...");
        err.println("Strategies:");
        for (EvaluationStrategy strategy : EvaluationStrategy.values()) {
            err.println("  " + strategy.getName() + "  " + strategy.getDescription());
        }
        return EXIT_USAGE;
    }
}
