package com.miniformula.compiler;

import com.miniformula.CommonConstant;
import com.miniformula.context.EvalContext;
import com.miniformula.context.FormulaContext;
import com.miniformula.error.FormulaSyntaxException;
import com.miniformula.executor.FormulaRuntime;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ConsoleErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ScriptCompiler - 公式脚本编译器
 *
 * 把 {@link CodeGenerator} 生成的公式脚本编译成 {@link ContextFunction}。
 * 脚本先由ANTLR解析, 再逐个节点转换成闭包, 调用时不再解析文本。
 *
 * 脚本中能出现的名字:
 * <pre>
 * runtime.add(a,b)  runtime.subtract(a,b)  runtime.lessThan(a,b)  runtime.lessThanOrEqual(a,b)
 * runtime.binaryOperator("*",a,b)
 * context.evaluateVariable("x",evalContext)
 * context.evaluateFunction("f",[a,b])
 * context.evaluateAggregate(0,evalContext)
 * context  evalContext
 * </pre>
 * 其他名字, 或参数个数不对, 都是脚本格式错误。
 *
 * 编译器无状态, 可以在多个上下文之间共享。
 */
public class ScriptCompiler {

    private static final Logger logger = LoggerFactory.getLogger(ScriptCompiler.class);

    /**
     * 编译公式脚本
     *
     * @param code 公式脚本
     * @return 可调用对象
     * @throws FormulaSyntaxException 脚本格式错误
     */
    public ContextFunction compile(String code) {
        if (code == null || code.trim().isEmpty()) {
            throw FormulaSyntaxException.invalidScript("empty script");
        }

        ScriptErrorCollector errorCollector = new ScriptErrorCollector();
        FormulaScriptLexer lexer = new FormulaScriptLexer(CharStreams.fromString(code));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorCollector);

        FormulaScriptParser parser = new FormulaScriptParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorCollector);

        FormulaScriptParser.ScriptContext tree = parser.script();
        if (errorCollector.hasErrors()) {
            throw FormulaSyntaxException.invalidScript(errorCollector.getErrorMessage());
        }

        ContextFunction function = new ClosureBuilder().visit(tree.expression());
        logger.debug("编译公式脚本: {}", code);
        return function;
    }

    /**
     * 脚本中的错误都是生成器的问题, 收集后统一报告
     */
    private static class ScriptErrorCollector extends ConsoleErrorListener {
        private final List<String> errors = new ArrayList<>();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer,
                                Object offendingSymbol,
                                int line,
                                int charPositionInLine,
                                String msg,
                                RecognitionException e) {
            errors.add(String.format("%d:%d %s", line, charPositionInLine, msg));
        }

        boolean hasErrors() {
            return !errors.isEmpty();
        }

        String getErrorMessage() {
            return String.join("; ", errors);
        }
    }

    /**
     * 脚本语法树 → 闭包树
     */
    private static class ClosureBuilder extends FormulaScriptBaseVisitor<ContextFunction> {

        @Override
        public ContextFunction visitParenthesisExpr(FormulaScriptParser.ParenthesisExprContext ctx) {
            return visit(ctx.expression());
        }

        @Override
        public ContextFunction visitPrefixExpr(FormulaScriptParser.PrefixExprContext ctx) {
            String operator = ctx.op.getText();
            ContextFunction operand = visit(ctx.operand);
            return (context, ec) -> FormulaRuntime.unaryOperator(operator, operand.apply(context, ec));
        }

        @Override
        public ContextFunction visitEqualityExpr(FormulaScriptParser.EqualityExprContext ctx) {
            ContextFunction left = visit(ctx.left);
            ContextFunction right = visit(ctx.right);
            boolean negate = ctx.op.getType() == FormulaScriptParser.NE
                    || ctx.op.getType() == FormulaScriptParser.STRICT_NE;
            return (context, ec) -> {
                boolean equal = FormulaRuntime.strictEquals(left.apply(context, ec), right.apply(context, ec));
                return negate != equal;
            };
        }

        @Override
        public ContextFunction visitAndExpr(FormulaScriptParser.AndExprContext ctx) {
            ContextFunction left = visit(ctx.left);
            ContextFunction right = visit(ctx.right);
            return (context, ec) -> {
                Object value = left.apply(context, ec);
                return FormulaRuntime.isTruthy(value) ? right.apply(context, ec) : value;
            };
        }

        @Override
        public ContextFunction visitOrExpr(FormulaScriptParser.OrExprContext ctx) {
            ContextFunction left = visit(ctx.left);
            ContextFunction right = visit(ctx.right);
            return (context, ec) -> {
                Object value = left.apply(context, ec);
                return FormulaRuntime.isTruthy(value) ? value : right.apply(context, ec);
            };
        }

        @Override
        public ContextFunction visitConditionalExpr(FormulaScriptParser.ConditionalExprContext ctx) {
            ContextFunction condition = visit(ctx.condition);
            ContextFunction whenTrue = visit(ctx.whenTrue);
            ContextFunction whenFalse = visit(ctx.whenFalse);
            return (context, ec) -> FormulaRuntime.isTruthy(condition.apply(context, ec))
                    ? whenTrue.apply(context, ec)
                    : whenFalse.apply(context, ec);
        }

        @Override
        public ContextFunction visitListExpr(FormulaScriptParser.ListExprContext ctx) {
            List<ContextFunction> elements = arguments(ctx.arguments());
            return (context, ec) -> {
                List<Object> values = new ArrayList<>(elements.size());
                for (ContextFunction element : elements) {
                    values.add(element.apply(context, ec));
                }
                return values;
            };
        }

        @Override
        public ContextFunction visitReferenceExpr(FormulaScriptParser.ReferenceExprContext ctx) {
            String name = ctx.IDENTIFIER().getText();
            if (CommonConstant.CONTEXT_RECEIVER.equals(name)) {
                return (context, ec) -> context;
            }
            if (CommonConstant.EVAL_CONTEXT_REFERENCE.equals(name)) {
                return (context, ec) -> ec;
            }
            throw FormulaSyntaxException.invalidScript("unknown reference '" + name + "'");
        }

        @Override
        public ContextFunction visitLiteralExpr(FormulaScriptParser.LiteralExprContext ctx) {
            Object value = literal(ctx.literal());
            return (context, ec) -> value;
        }

        @Override
        public ContextFunction visitCallExpr(FormulaScriptParser.CallExprContext ctx) {
            String receiver = ctx.receiver.getText();
            String method = ctx.method.getText();
            List<ContextFunction> args = arguments(ctx.arguments());

            if (CommonConstant.RUNTIME_RECEIVER.equals(receiver)) {
                return runtimeCall(method, args);
            }
            if (CommonConstant.CONTEXT_RECEIVER.equals(receiver)) {
                return contextCall(method, args);
            }
            throw FormulaSyntaxException.invalidScript("unknown receiver '" + receiver + "'");
        }

        private ContextFunction runtimeCall(String method, List<ContextFunction> args) {
            switch (method) {
                case "add": {
                    expectArguments(method, args, 2);
                    ContextFunction a = args.get(0);
                    ContextFunction b = args.get(1);
                    return (context, ec) -> FormulaRuntime.add(a.apply(context, ec), b.apply(context, ec));
                }
                case "subtract": {
                    expectArguments(method, args, 2);
                    ContextFunction a = args.get(0);
                    ContextFunction b = args.get(1);
                    return (context, ec) -> FormulaRuntime.subtract(a.apply(context, ec), b.apply(context, ec));
                }
                case "lessThan": {
                    expectArguments(method, args, 2);
                    ContextFunction a = args.get(0);
                    ContextFunction b = args.get(1);
                    return (context, ec) -> FormulaRuntime.lessThan(a.apply(context, ec), b.apply(context, ec));
                }
                case "lessThanOrEqual": {
                    expectArguments(method, args, 2);
                    ContextFunction a = args.get(0);
                    ContextFunction b = args.get(1);
                    return (context, ec) ->
                            FormulaRuntime.lessThanOrEqual(a.apply(context, ec), b.apply(context, ec));
                }
                case "binaryOperator": {
                    expectArguments(method, args, 3);
                    ContextFunction op = args.get(0);
                    ContextFunction a = args.get(1);
                    ContextFunction b = args.get(2);
                    return (context, ec) -> FormulaRuntime.binaryOperator(
                            String.valueOf(op.apply(context, ec)), a.apply(context, ec), b.apply(context, ec));
                }
                default:
                    throw FormulaSyntaxException.invalidScript("unknown method 'runtime." + method + "'");
            }
        }

        private ContextFunction contextCall(String method, List<ContextFunction> args) {
            switch (method) {
                case "evaluateVariable": {
                    expectArguments(method, args, 2);
                    ContextFunction name = args.get(0);
                    ContextFunction evalContext = args.get(1);
                    return (context, ec) -> context.evaluateVariable(
                            stringValue(name.apply(context, ec)), evalContextValue(evalContext.apply(context, ec)));
                }
                case "evaluateFunction": {
                    expectArguments(method, args, 2);
                    ContextFunction name = args.get(0);
                    ContextFunction arguments = args.get(1);
                    return (context, ec) -> context.evaluateFunction(
                            stringValue(name.apply(context, ec)), listValue(arguments.apply(context, ec)));
                }
                case "evaluateAggregate": {
                    expectArguments(method, args, 2);
                    ContextFunction index = args.get(0);
                    ContextFunction evalContext = args.get(1);
                    return (context, ec) -> context.evaluateAggregate(
                            indexValue(index.apply(context, ec)), evalContextValue(evalContext.apply(context, ec)));
                }
                default:
                    throw FormulaSyntaxException.invalidScript("unknown method 'context." + method + "'");
            }
        }

        private List<ContextFunction> arguments(FormulaScriptParser.ArgumentsContext ctx) {
            if (ctx == null) {
                return Collections.emptyList();
            }
            List<ContextFunction> args = new ArrayList<>();
            for (FormulaScriptParser.ExpressionContext expr : ctx.expression()) {
                args.add(visit(expr));
            }
            return args;
        }

        private static void expectArguments(String method, List<ContextFunction> args, int count) {
            if (args.size() != count) {
                throw FormulaSyntaxException.invalidScript(
                        method + " expects " + count + " argument(s), got " + args.size());
            }
        }

        private static Object literal(FormulaScriptParser.LiteralContext ctx) {
            switch (ctx.getStart().getType()) {
                case FormulaScriptParser.NUMBER:
                    return Double.parseDouble(ctx.getText());
                case FormulaScriptParser.STRING:
                    return ScriptText.unquote(ctx.getText());
                case FormulaScriptParser.TRUE:
                    return Boolean.TRUE;
                case FormulaScriptParser.FALSE:
                    return Boolean.FALSE;
                case FormulaScriptParser.NAN:
                    return Double.NaN;
                case FormulaScriptParser.INFINITY:
                    return Double.POSITIVE_INFINITY;
                default:
                    return null;
            }
        }
    }

    // ==================== 运行时参数检查 ====================

    private static String stringValue(Object value) {
        if (!(value instanceof String)) {
            throw FormulaSyntaxException.invalidScript("expected a name, got " + value);
        }
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> listValue(Object value) {
        if (!(value instanceof List)) {
            throw FormulaSyntaxException.invalidScript("expected an argument list, got " + value);
        }
        return (List<Object>) value;
    }

    private static EvalContext evalContextValue(Object value) {
        if (value != null && !(value instanceof EvalContext)) {
            throw FormulaSyntaxException.invalidScript("expected an evaluation context, got " + value);
        }
        return (EvalContext) value;
    }

    private static int indexValue(Object value) {
        if (!(value instanceof Number)) {
            throw FormulaSyntaxException.invalidScript("expected an aggregate index, got " + value);
        }
        return ((Number) value).intValue();
    }

    /**
     * 直接编译并求值, 主要用于调试
     */
    public Object evaluate(String code, FormulaContext context, EvalContext evalContext) {
        return compile(code).apply(context, evalContext);
    }
}
