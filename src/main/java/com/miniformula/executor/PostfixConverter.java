package com.miniformula.executor;

import com.miniformula.parser.Expression;
import com.miniformula.parser.expressions.BinaryExpression;
import com.miniformula.parser.expressions.ConditionalExpression;
import com.miniformula.parser.expressions.FunctionCallExpression;
import com.miniformula.parser.expressions.UnaryExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * PostfixConverter - 语法树 → 后缀序列
 *
 * 后序遍历语法树, 每个节点在它的所有子节点之后出现:
 * <pre>
 * a + b * c   →  a b c * +
 * f(x, 1)     →  x 1 f
 * c ? t : f   →  c t f ?:
 * </pre>
 * 序列中的元素就是原来的节点, 求值器用节点类型和子节点数决定出栈个数。
 * 序列长度等于节点总数。
 */
public final class PostfixConverter {

    private PostfixConverter() {
    }

    public static List<Expression> toPostfix(Expression root) {
        if (root == null) {
            throw new IllegalArgumentException("Expression cannot be null");
        }
        List<Expression> output = new ArrayList<>();
        append(root, output);
        return Collections.unmodifiableList(output);
    }

    private static void append(Expression expr, List<Expression> output) {
        switch (expr.getType()) {
            case FUNCTION_CALL:
                for (Expression argument : ((FunctionCallExpression) expr).getArguments()) {
                    append(argument, output);
                }
                break;
            case UNARY:
                append(((UnaryExpression) expr).getOperand(), output);
                break;
            case BINARY:
                BinaryExpression binary = (BinaryExpression) expr;
                append(binary.getLeft(), output);
                append(binary.getRight(), output);
                break;
            case CONDITIONAL:
                ConditionalExpression conditional = (ConditionalExpression) expr;
                append(conditional.getCondition(), output);
                append(conditional.getWhenTrue(), output);
                append(conditional.getWhenFalse(), output);
                break;
            default:
                // 叶子节点
                break;
        }
        output.add(expr);
    }
}
