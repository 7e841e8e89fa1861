package com.miniformula.executor;

import com.miniformula.context.EvalContext;
import com.miniformula.context.FormulaContext;
import com.miniformula.error.FormulaSyntaxException;
import com.miniformula.parser.Expression;
import com.miniformula.parser.expressions.BinaryExpression;
import com.miniformula.parser.expressions.ConditionalExpression;
import com.miniformula.parser.expressions.FunctionCallExpression;
import com.miniformula.parser.expressions.LiteralExpression;
import com.miniformula.parser.expressions.Operator;
import com.miniformula.parser.expressions.UnaryExpression;
import com.miniformula.parser.expressions.VariableExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * ExpressionEvaluator - 语法树直接求值器
 *
 * 递归求值公式语法树, 不经过编译:
 * - 字面量: 直接返回值
 * - 变量: 交给上下文 evaluateVariable
 * - 函数调用: 从左到右求参数, 交给上下文 evaluateFunction
 * - 一元/二元运算: 交给 {@link FormulaRuntime}
 * - &amp;&amp; || 短路, 条件表达式只求选中的分支
 *
 * 设计原则:
 * - "Good taste": 按节点类型分发, 每种节点一个方法
 * - 零状态: 求值器本身无状态, 可以复用
 *
 * 使用示例:
 * <pre>
 * Expression expr = parser.parse("x * 2 + 1");
 * Object result = evaluator.evaluate(expr, context, EvalContext.of(Map.of("x", 3)));
 * // result = 7.0
 * </pre>
 */
public class ExpressionEvaluator implements ExpressionEvaluationStrategy {

    /**
     * 求值语法树
     *
     * @param expr 语法树根
     * @param context 上下文
     * @param evalContext 求值上下文
     * @return 结果
     * @throws FormulaSyntaxException 不认识的运算符
     */
    @Override
    public Object evaluate(Expression expr, FormulaContext context, EvalContext evalContext) {
        if (expr == null) {
            throw new IllegalArgumentException("Expression cannot be null");
        }
        EvalContext ec = EvalContext.orEmpty(evalContext);

        switch (expr.getType()) {
            case BOOLEAN_LITERAL:
            case NUMERIC_LITERAL:
            case STRING_LITERAL:
                return ((LiteralExpression) expr).getValue();

            case VARIABLE:
                return context.evaluateVariable(((VariableExpression) expr).getName(), ec);

            case FUNCTION_CALL:
                return evalFunctionCall((FunctionCallExpression) expr, context, ec);

            case UNARY:
                UnaryExpression unary = (UnaryExpression) expr;
                return FormulaRuntime.unaryOperator(unary.getOperator(), evaluate(unary.getOperand(), context, ec));

            case BINARY:
                return evalBinary((BinaryExpression) expr, context, ec);

            case CONDITIONAL:
                ConditionalExpression conditional = (ConditionalExpression) expr;
                Object condition = evaluate(conditional.getCondition(), context, ec);
                return FormulaRuntime.isTruthy(condition)
                        ? evaluate(conditional.getWhenTrue(), context, ec)
                        : evaluate(conditional.getWhenFalse(), context, ec);

            default:
                throw new IllegalArgumentException("Unknown expression type: " + expr.getType());
        }
    }

    private Object evalFunctionCall(FunctionCallExpression call, FormulaContext context, EvalContext ec) {
        List<Object> arguments = new ArrayList<>(call.getArguments().size());
        for (Expression argument : call.getArguments()) {
            arguments.add(evaluate(argument, context, ec));
        }
        return context.evaluateFunction(call.getName(), arguments);
    }

    private Object evalBinary(BinaryExpression binary, FormulaContext context, EvalContext ec) {
        Operator op = Operator.fromSymbol(binary.getOperator());
        if (op == null) {
            throw FormulaSyntaxException.invalidOperator(binary.getOperator());
        }

        Object left = evaluate(binary.getLeft(), context, ec);

        // 短路: 左边已经决定结果时不求右边
        if (op == Operator.AND && !FormulaRuntime.isTruthy(left)) {
            return left;
        }
        if (op == Operator.OR && FormulaRuntime.isTruthy(left)) {
            return left;
        }

        Object right = evaluate(binary.getRight(), context, ec);
        return FormulaRuntime.binary(op.getSymbol(), left, right);
    }
}
