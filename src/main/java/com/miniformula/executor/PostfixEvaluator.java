package com.miniformula.executor;

import com.miniformula.context.EvalContext;
import com.miniformula.context.FormulaContext;
import com.miniformula.parser.Expression;
import com.miniformula.parser.expressions.BinaryExpression;
import com.miniformula.parser.expressions.FunctionCallExpression;
import com.miniformula.parser.expressions.LiteralExpression;
import com.miniformula.parser.expressions.UnaryExpression;
import com.miniformula.parser.expressions.VariableExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * PostfixEvaluator - 后缀序列求值器
 *
 * 顺序扫描 {@link PostfixConverter} 生成的序列, 用一个栈保存中间结果。
 * 运算数都已在栈上, 所以 &amp;&amp; || ?: 不短路。
 *
 * 栈用ArrayList实现, 因为空值(null)也是合法的中间结果。
 */
public class PostfixEvaluator implements ExpressionEvaluationStrategy {

    @Override
    public Object evaluate(Expression expression, FormulaContext context, EvalContext evalContext) {
        return evaluate(PostfixConverter.toPostfix(expression), context, evalContext);
    }

    /**
     * 求值已经转换好的后缀序列
     */
    public Object evaluate(List<Expression> postfix, FormulaContext context, EvalContext evalContext) {
        EvalContext ec = EvalContext.orEmpty(evalContext);
        List<Object> stack = new ArrayList<>();

        for (Expression token : postfix) {
            switch (token.getType()) {
                case BOOLEAN_LITERAL:
                case NUMERIC_LITERAL:
                case STRING_LITERAL:
                    stack.add(((LiteralExpression) token).getValue());
                    break;

                case VARIABLE:
                    stack.add(context.evaluateVariable(((VariableExpression) token).getName(), ec));
                    break;

                case FUNCTION_CALL: {
                    FunctionCallExpression call = (FunctionCallExpression) token;
                    List<Object> arguments = popAll(stack, call.getArguments().size());
                    stack.add(context.evaluateFunction(call.getName(), arguments));
                    break;
                }

                case UNARY: {
                    Object operand = pop(stack);
                    stack.add(FormulaRuntime.unaryOperator(((UnaryExpression) token).getOperator(), operand));
                    break;
                }

                case BINARY: {
                    Object right = pop(stack);
                    Object left = pop(stack);
                    stack.add(FormulaRuntime.binary(((BinaryExpression) token).getOperator(), left, right));
                    break;
                }

                case CONDITIONAL: {
                    Object whenFalse = pop(stack);
                    Object whenTrue = pop(stack);
                    Object condition = pop(stack);
                    stack.add(FormulaRuntime.isTruthy(condition) ? whenTrue : whenFalse);
                    break;
                }

                default:
                    throw new IllegalArgumentException("Unknown expression type: " + token.getType());
            }
        }

        if (stack.size() != 1) {
            throw new IllegalStateException("Malformed postfix sequence, stack size: " + stack.size());
        }
        return stack.get(0);
    }

    private static Object pop(List<Object> stack) {
        if (stack.isEmpty()) {
            throw new IllegalStateException("Malformed postfix sequence, stack underflow");
        }
        return stack.remove(stack.size() - 1);
    }

    /**
     * 弹出栈顶的count个元素, 保持原来的顺序
     */
    private static List<Object> popAll(List<Object> stack, int count) {
        if (stack.size() < count) {
            throw new IllegalStateException("Malformed postfix sequence, stack underflow");
        }
        List<Object> top = stack.subList(stack.size() - count, stack.size());
        List<Object> values = new ArrayList<>(top);
        top.clear();
        return values;
    }
}
