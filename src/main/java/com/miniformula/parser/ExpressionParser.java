package com.miniformula.parser;

import com.miniformula.error.FormulaException;
import com.miniformula.error.FormulaSyntaxException;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ConsoleErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/**
 * ExpressionParser - 公式解析器对外接口
 *
 * 把公式源文本解析成 {@link Expression} 语法树。
 *
 * 设计原则:
 * - 简单的接口: 一个方法 parse(String source)
 * - 只报告第一个错误: 出错记号的文本, 或者输入意外结束
 * - 纯函数: 相同的输入总是得到相同的树
 *
 * 使用示例:
 * <pre>
 * ExpressionParser parser = new ExpressionParser();
 * Expression expr = parser.parse("mean(x) + 2 * y");
 * </pre>
 */
public class ExpressionParser {

    /**
     * 解析公式
     *
     * @param source 公式源文本
     * @return 语法树根
     * @throws FormulaSyntaxException 语法错误
     * @throws IllegalArgumentException source为null
     */
    public Expression parse(String source) {
        if (source == null) {
            throw new IllegalArgumentException("Formula source cannot be null");
        }

        try {
            // 1. 词法分析
            FirstErrorCollector errorCollector = new FirstErrorCollector(source);
            FormulaLexer lexer = new FormulaLexer(CharStreams.fromString(source));
            lexer.removeErrorListeners();
            lexer.addErrorListener(errorCollector);

            // 2. 语法分析
            CommonTokenStream tokens = new CommonTokenStream(lexer);
            FormulaParser parser = new FormulaParser(tokens);
            parser.removeErrorListeners();
            parser.addErrorListener(errorCollector);

            FormulaParser.FormulaContext tree = parser.formula();

            // 检查是否有错误
            if (errorCollector.hasError()) {
                throw errorCollector.getError();
            }

            // 3. 转换为Expression树
            return (Expression) new ASTBuilder().visit(tree);

        } catch (FormulaSyntaxException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FormulaException("Failed to parse formula: " + e.getMessage(), e);
        }
    }

    /**
     * ANTLR错误收集器
     *
     * 只保留第一个错误, 之后的错误多半是连锁反应。
     */
    private static class FirstErrorCollector extends ConsoleErrorListener {
        private final String source;
        private FormulaSyntaxException error;

        FirstErrorCollector(String source) {
            this.source = source;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer,
                                Object offendingSymbol,
                                int line,
                                int charPositionInLine,
                                String msg,
                                RecognitionException e) {
            if (error != null) {
                return;
            }
            if (offendingSymbol instanceof Token) {
                Token token = (Token) offendingSymbol;
                if (token.getType() == Token.EOF) {
                    error = FormulaSyntaxException.unexpectedEnd(line, charPositionInLine, msg);
                } else {
                    error = FormulaSyntaxException.unexpectedToken(token.getText(), line, charPositionInLine, msg);
                }
            } else {
                // 词法错误没有记号, 取出错位置的字符
                error = FormulaSyntaxException.unexpectedToken(
                        charAt(line, charPositionInLine), line, charPositionInLine, msg);
            }
        }

        private String charAt(int line, int column) {
            String[] lines = source.split("\n", -1);
            if (line >= 1 && line <= lines.length && column >= 0 && column < lines[line - 1].length()) {
                return String.valueOf(lines[line - 1].charAt(column));
            }
            return source;
        }

        boolean hasError() {
            return error != null;
        }

        FormulaSyntaxException getError() {
            return error;
        }
    }
}
