package com.miniformula.parser;

import com.miniformula.error.FormulaSyntaxException;
import com.miniformula.parser.expressions.BinaryExpression;
import com.miniformula.parser.expressions.ConditionalExpression;
import com.miniformula.parser.expressions.FunctionCallExpression;
import com.miniformula.parser.expressions.LiteralExpression;
import com.miniformula.parser.expressions.Operator;
import com.miniformula.parser.expressions.PrefixOperator;
import com.miniformula.parser.expressions.UnaryExpression;
import com.miniformula.parser.expressions.VariableExpression;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * ASTBuilder - 将ANTLR语法树转换为Expression节点
 *
 * 使用访问者模式遍历ANTLR生成的语法树, 转换为 {@link Expression} 树。
 *
 * 运算符的各种写法统一成规范符号:
 * <pre>
 * =  ==        → ==
 * &lt;&gt; != ≠     → !=
 * ≤           → &lt;=
 * ≥           → &gt;=
 * ×           → *
 * ÷           → /
 * −           → -
 * and / or / not → &amp;&amp; / || / !
 * </pre>
 *
 * 括号不产生节点, 只影响树的形状。
 */
public class ASTBuilder extends FormulaBaseVisitor<Object> {

    @Override
    public Expression visitFormula(FormulaParser.FormulaContext ctx) {
        return (Expression) visit(ctx.expression());
    }

    // ==================== 运算 ====================

    @Override
    public Expression visitPowerExpr(FormulaParser.PowerExprContext ctx) {
        return binary(ctx.op, ctx.left, ctx.right);
    }

    @Override
    public Expression visitMultiplicativeExpr(FormulaParser.MultiplicativeExprContext ctx) {
        return binary(ctx.op, ctx.left, ctx.right);
    }

    @Override
    public Expression visitAdditiveExpr(FormulaParser.AdditiveExprContext ctx) {
        return binary(ctx.op, ctx.left, ctx.right);
    }

    @Override
    public Expression visitRelationalExpr(FormulaParser.RelationalExprContext ctx) {
        return binary(ctx.op, ctx.left, ctx.right);
    }

    @Override
    public Expression visitEqualityExpr(FormulaParser.EqualityExprContext ctx) {
        return binary(ctx.op, ctx.left, ctx.right);
    }

    @Override
    public Expression visitAndExpr(FormulaParser.AndExprContext ctx) {
        return binary(ctx.op, ctx.left, ctx.right);
    }

    @Override
    public Expression visitOrExpr(FormulaParser.OrExprContext ctx) {
        return binary(ctx.op, ctx.left, ctx.right);
    }

    @Override
    public Expression visitUnaryExpr(FormulaParser.UnaryExprContext ctx) {
        Expression operand = (Expression) visit(ctx.operand);
        PrefixOperator operator;
        switch (ctx.op.getType()) {
            case FormulaLexer.PLUS:
                operator = PrefixOperator.PLUS;
                break;
            case FormulaLexer.MINUS:
                operator = PrefixOperator.MINUS;
                break;
            case FormulaLexer.NOT:
                operator = PrefixOperator.NOT;
                break;
            default:
                throw FormulaSyntaxException.invalidOperator(ctx.op.getText());
        }
        return new UnaryExpression(operator.getSymbol(), operand);
    }

    @Override
    public Expression visitConditionalExpr(FormulaParser.ConditionalExprContext ctx) {
        Expression condition = (Expression) visit(ctx.condition);
        Expression whenTrue = (Expression) visit(ctx.whenTrue);
        Expression whenFalse = (Expression) visit(ctx.whenFalse);
        return new ConditionalExpression(condition, whenTrue, whenFalse);
    }

    @Override
    public Expression visitPrimaryExpr(FormulaParser.PrimaryExprContext ctx) {
        return (Expression) visit(ctx.primary());
    }

    // ==================== 基本项 ====================

    @Override
    public Expression visitParenthesisExpr(FormulaParser.ParenthesisExprContext ctx) {
        return (Expression) visit(ctx.expression());
    }

    @Override
    public Expression visitFunctionCallExpr(FormulaParser.FunctionCallExprContext ctx) {
        String name = visitIdentifier(ctx.name);
        List<Expression> arguments = new ArrayList<>();
        if (ctx.arguments() != null) {
            for (FormulaParser.ExpressionContext argCtx : ctx.arguments().expression()) {
                arguments.add((Expression) visit(argCtx));
            }
        }
        return new FunctionCallExpression(name, arguments);
    }

    @Override
    public Expression visitVariableExpr(FormulaParser.VariableExprContext ctx) {
        return new VariableExpression(visitIdentifier(ctx.identifier()));
    }

    @Override
    public Expression visitLiteralExpr(FormulaParser.LiteralExprContext ctx) {
        return (Expression) visit(ctx.literal());
    }

    // ==================== 字面量 ====================

    @Override
    public Object visitLiteral(FormulaParser.LiteralContext ctx) {
        if (ctx.NUMBER_LITERAL() != null) {
            return LiteralExpression.ofNumber(Double.parseDouble(ctx.getText()));
        } else if (ctx.STRING_LITERAL() != null) {
            return LiteralExpression.ofString(unescape(ctx.getText()));
        } else if (ctx.TRUE() != null) {
            return LiteralExpression.ofBoolean(true);
        } else if (ctx.FALSE() != null) {
            return LiteralExpression.ofBoolean(false);
        } else {
            throw FormulaSyntaxException.unexpectedToken(ctx.getText(),
                    ctx.getStart().getLine(), ctx.getStart().getCharPositionInLine(), "Unknown literal");
        }
    }

    // ==================== 标识符 ====================

    @Override
    public String visitIdentifier(FormulaParser.IdentifierContext ctx) {
        if (ctx.QUOTED_IDENTIFIER() != null) {
            String text = ctx.getText();
            return text.substring(1, text.length() - 1); // 去除反引号
        }
        return ctx.getText();
    }

    // ==================== 辅助方法 ====================

    private Expression binary(Token op, FormulaParser.ExpressionContext leftCtx,
                              FormulaParser.ExpressionContext rightCtx) {
        Expression left = (Expression) visit(leftCtx);
        Expression right = (Expression) visit(rightCtx);
        return new BinaryExpression(canonicalOperator(op), left, right);
    }

    private static Operator canonicalOperator(Token op) {
        switch (op.getType()) {
            case FormulaLexer.POW:
                return Operator.POWER;
            case FormulaLexer.STAR:
                return Operator.MULTIPLY;
            case FormulaLexer.SLASH:
                return Operator.DIVIDE;
            case FormulaLexer.PERCENT:
                return Operator.MODULO;
            case FormulaLexer.PLUS:
                return Operator.ADD;
            case FormulaLexer.MINUS:
                return Operator.SUBTRACT;
            case FormulaLexer.LT:
                return Operator.LESS_THAN;
            case FormulaLexer.GT:
                return Operator.GREATER_THAN;
            case FormulaLexer.LE:
                return Operator.LESS_EQUAL;
            case FormulaLexer.GE:
                return Operator.GREATER_EQUAL;
            case FormulaLexer.EQ:
                return Operator.EQUAL;
            case FormulaLexer.STRICT_EQ:
                return Operator.STRICT_EQUAL;
            case FormulaLexer.NE:
                return Operator.NOT_EQUAL;
            case FormulaLexer.STRICT_NE:
                return Operator.STRICT_NOT_EQUAL;
            case FormulaLexer.AND:
                return Operator.AND;
            case FormulaLexer.OR:
                return Operator.OR;
            default:
                throw FormulaSyntaxException.invalidOperator(op.getText());
        }
    }

    /**
     * 去除首尾引号, 处理反斜杠转义(\n \t \r, 其余字符原样)
     */
    static String unescape(String literal) {
        String body = literal.substring(1, literal.length() - 1);
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                sb.append(c);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n':
                    sb.append('\n');
                    break;
                case 't':
                    sb.append('\t');
                    break;
                case 'r':
                    sb.append('\r');
                    break;
                default:
                    sb.append(next);
            }
        }
        return sb.toString();
    }
}
