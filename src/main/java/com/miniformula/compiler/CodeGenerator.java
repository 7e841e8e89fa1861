package com.miniformula.compiler;

import com.miniformula.CommonConstant;
import com.miniformula.context.FormulaContext;
import com.miniformula.error.FormulaSyntaxException;
import com.miniformula.parser.Expression;
import com.miniformula.parser.expressions.BinaryExpression;
import com.miniformula.parser.expressions.ConditionalExpression;
import com.miniformula.parser.expressions.FunctionCallExpression;
import com.miniformula.parser.expressions.LiteralExpression;
import com.miniformula.parser.expressions.Operator;
import com.miniformula.parser.expressions.PrefixOperator;
import com.miniformula.parser.expressions.UnaryExpression;
import com.miniformula.parser.expressions.VariableExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * CodeGenerator - 语法树 → 公式脚本
 *
 * 遍历语法树, 生成可以由 {@link ScriptCompiler} 编译的公式脚本。
 * 变量和函数调用的片段由上下文决定, 其余节点按固定规则翻译:
 * <pre>
 * a + b    → runtime.add(a,b)
 * a - b    → runtime.subtract(a,b)
 * a &lt; b    → runtime.lessThan(a,b)
 * a &gt; b    → runtime.lessThan(b,a)
 * a &lt;= b   → runtime.lessThanOrEqual(a,b)
 * a &gt;= b   → runtime.lessThanOrEqual(b,a)
 * a * b    → runtime.binaryOperator("*",a,b)     (/ % ^ 同理)
 * a == b   → (a==b)                              (=== != !== && || 同理)
 * c ? t : f → (c?t:f)
 * -a       → -(a)                                (+ ! 同理)
 * </pre>
 *
 * 编译生命周期: 无论成功还是抛出异常, 上下文的 willCompile / didCompile / completeCompile
 * 都恰好各调用一次。
 */
public class CodeGenerator {

    /**
     * 编译语法树
     *
     * @param expression 语法树根
     * @param context 上下文
     * @return 公式脚本
     * @throws FormulaSyntaxException 不认识的运算符
     */
    public String compile(Expression expression, FormulaContext context) {
        context.willCompile();
        try {
            return generate(expression, context);
        } finally {
            context.didCompile();
            context.completeCompile();
        }
    }

    private String generate(Expression expression, FormulaContext context) {
        switch (expression.getType()) {
            case BOOLEAN_LITERAL:
                return String.valueOf(((LiteralExpression) expression).getValue());
            case NUMERIC_LITERAL:
                return ScriptText.number((Double) ((LiteralExpression) expression).getValue());
            case STRING_LITERAL:
                return ScriptText.quote((String) ((LiteralExpression) expression).getValue());
            case VARIABLE:
                return context.compileVariable(
                        ((VariableExpression) expression).getName(), context.getAggregateFunctionIndices());
            case FUNCTION_CALL:
                return generateFunctionCall((FunctionCallExpression) expression, context);
            case UNARY:
                return generateUnary((UnaryExpression) expression, context);
            case BINARY:
                return generateBinary((BinaryExpression) expression, context);
            case CONDITIONAL:
                ConditionalExpression conditional = (ConditionalExpression) expression;
                return "(" + generate(conditional.getCondition(), context)
                        + "?" + generate(conditional.getWhenTrue(), context)
                        + ":" + generate(conditional.getWhenFalse(), context) + ")";
            default:
                throw new IllegalArgumentException("Unknown expression type: " + expression.getType());
        }
    }

    private String generateFunctionCall(FunctionCallExpression call, FormulaContext context) {
        String name = call.getName();
        context.beginFunctionContext(name, context.isAggregate(name));
        try {
            List<String> arguments = new ArrayList<>(call.getArguments().size());
            for (Expression argument : call.getArguments()) {
                arguments.add(generate(argument, context));
            }
            Set<Integer> indices = context.getAggregateFunctionIndices();
            return context.compileFunction(name, arguments, indices);
        } finally {
            context.endFunctionContext(name);
        }
    }

    private String generateUnary(UnaryExpression unary, FormulaContext context) {
        PrefixOperator op = PrefixOperator.fromSymbol(unary.getOperator());
        if (op == null) {
            throw FormulaSyntaxException.invalidOperator(unary.getOperator());
        }
        return op.getSymbol() + "(" + generate(unary.getOperand(), context) + ")";
    }

    private String generateBinary(BinaryExpression binary, FormulaContext context) {
        Operator op = Operator.fromSymbol(binary.getOperator());
        if (op == null) {
            throw FormulaSyntaxException.invalidOperator(binary.getOperator());
        }
        String left = generate(binary.getLeft(), context);
        String right = generate(binary.getRight(), context);

        switch (op) {
            case ADD:
                return runtimeCall("add", left, right);
            case SUBTRACT:
                return runtimeCall("subtract", left, right);
            case LESS_THAN:
                return runtimeCall("lessThan", left, right);
            case GREATER_THAN:
                return runtimeCall("lessThan", right, left);
            case LESS_EQUAL:
                return runtimeCall("lessThanOrEqual", left, right);
            case GREATER_EQUAL:
                return runtimeCall("lessThanOrEqual", right, left);
            case POWER:
            case MULTIPLY:
            case DIVIDE:
            case MODULO:
                return runtimeCall("binaryOperator", ScriptText.quote(op.getSymbol()), left, right);
            default:
                // 相等和逻辑运算在脚本中保留中缀写法
                return "(" + left + op.getSymbol() + right + ")";
        }
    }

    private static String runtimeCall(String method, String... arguments) {
        return CommonConstant.RUNTIME_RECEIVER + "." + method + "(" + String.join(",", arguments) + ")";
    }
}
