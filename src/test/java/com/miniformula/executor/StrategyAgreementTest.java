package com.miniformula.executor;

import com.miniformula.context.EvalContext;
import com.miniformula.context.MapFormulaContext;
import com.miniformula.error.FormulaException;
import com.miniformula.parser.Expression;
import com.miniformula.parser.expressions.BinaryExpression;
import com.miniformula.parser.expressions.ConditionalExpression;
import com.miniformula.parser.expressions.FunctionCallExpression;
import com.miniformula.parser.expressions.LiteralExpression;
import com.miniformula.parser.expressions.Operator;
import com.miniformula.parser.expressions.PrefixOperator;
import com.miniformula.parser.expressions.UnaryExpression;
import com.miniformula.parser.expressions.VariableExpression;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StrategyAgreementTest - 三种求值策略结果一致
 *
 * 用固定种子随机生成小语法树, 比较直接求值、编译求值和后缀求值:
 * - 直接求值和编译求值: 都成功且结果相同, 或者都抛出同一类FormulaException
 * - 后缀求值不短路, 未选中的分支也会求值, 所以只要求: 成功时结果与直接求值相同
 */
@DisplayName("求值策略一致性测试")
class StrategyAgreementTest {

    private static final long SEED = 20240115L;
    private static final int TREES = 600;
    private static final int MAX_DEPTH = 4;

    private static final Object[] NUMBERS = {0.0, 1.0, 2.5, 10.0, 1e21};
    private static final String[] STRINGS = {"", "a", "3", " ", "2024-01-15", "say \"hi\" \\ ok"};
    private static final String[] VARIABLES = {"n", "s", "e", "d", "b", "w", "num"};
    private static final String[] FUNCTIONS = {"pick", "len"};

    private final ExpressionEvaluationStrategy direct = EvaluatorFactory.create(EvaluationStrategy.DIRECT);
    private final ExpressionEvaluationStrategy compiled = EvaluatorFactory.create(EvaluationStrategy.COMPILED);
    private final ExpressionEvaluationStrategy postfix = EvaluatorFactory.create(EvaluationStrategy.POSTFIX);

    private MapFormulaContext context;
    private Random random;

    @BeforeEach
    void setUp() {
        context = new MapFormulaContext();
        context.setVariable("n", 3);
        context.setVariable("s", "abc");
        context.setVariable("e", null);
        context.setVariable("d", new Date(86_400_000L));
        context.setVariable("b", true);
        context.setVariable("w", "  ");
        context.setVariable("num", "42");
        context.registerFunction("pick", args -> args.isEmpty() ? null : args.get(0));
        context.registerFunction("len", List::size);
        random = new Random(SEED);
    }

    @Test
    @DisplayName("测试随机语法树上三种策略一致")
    void testStrategiesAgree() {
        int bothSucceeded = 0;
        for (int i = 0; i < TREES; i++) {
            Expression tree = randomExpression(0);
            EvalContext ec = EvalContext.empty();

            Outcome directOutcome = run(direct, tree, ec);
            Outcome compiledOutcome = run(compiled, tree, ec);
            Outcome postfixOutcome = run(postfix, tree, ec);

            String message = "tree: " + tree;
            assertEquals(directOutcome.failed(), compiledOutcome.failed(), message);
            if (directOutcome.failed()) {
                assertEquals(directOutcome.error.getClass(), compiledOutcome.error.getClass(), message);
            } else {
                assertTrue(sameValue(directOutcome.value, compiledOutcome.value),
                        message + " direct=" + directOutcome.value + " compiled=" + compiledOutcome.value);
                bothSucceeded++;
            }
            if (!postfixOutcome.failed()) {
                assertFalse(directOutcome.failed(), message);
                assertTrue(sameValue(directOutcome.value, postfixOutcome.value),
                        message + " direct=" + directOutcome.value + " postfix=" + postfixOutcome.value);
            }
        }
        // 生成器产生的树大多数应该能求值, 否则测试没有意义
        assertTrue(bothSucceeded > TREES / 4, "only " + bothSucceeded + " trees evaluated");
    }

    @Test
    @DisplayName("测试求值上下文绑定在三种策略中一致")
    void testBindingsAgree() {
        Expression tree = new BinaryExpression(Operator.ADD,
                new VariableExpression("n"),
                new FunctionCallExpression("pick", List.of(new VariableExpression("extra"))));
        EvalContext ec = EvalContext.of(Map.of("extra", 4, "n", 1));

        assertEquals(5.0, direct.evaluate(tree, context, ec));
        assertEquals(5.0, compiled.evaluate(tree, context, ec));
        assertEquals(5.0, postfix.evaluate(tree, context, ec));
    }

    @Test
    @DisplayName("测试三种策略抛出同一类异常")
    void testFailureClassesAgree() {
        List<Expression> trees = List.of(
                new VariableExpression("missing"),
                new FunctionCallExpression("missing", List.of()),
                new BinaryExpression(Operator.MULTIPLY, new VariableExpression("d"), LiteralExpression.ofNumber(2.0)),
                new BinaryExpression(Operator.SUBTRACT, new VariableExpression("n"), new VariableExpression("d")),
                new BinaryExpression(Operator.GREATER_THAN,
                        new VariableExpression("missing"), new VariableExpression("n")));

        for (Expression tree : trees) {
            Outcome directOutcome = run(direct, tree, EvalContext.empty());
            Outcome compiledOutcome = run(compiled, tree, EvalContext.empty());
            Outcome postfixOutcome = run(postfix, tree, EvalContext.empty());

            String message = "tree: " + tree;
            assertTrue(directOutcome.failed(), message);
            assertEquals(directOutcome.error.getClass(), compiledOutcome.error.getClass(), message);
            assertEquals(directOutcome.error.getClass(), postfixOutcome.error.getClass(), message);
        }
    }

    // ==================== 随机语法树 ====================

    private Expression randomExpression(int depth) {
        int choice = depth >= MAX_DEPTH ? random.nextInt(3) : random.nextInt(7);
        switch (choice) {
            case 0:
                return randomLiteral();
            case 1:
                return new VariableExpression(pick(VARIABLES));
            case 2:
                return random.nextBoolean() ? randomLiteral() : new VariableExpression(pick(VARIABLES));
            case 3:
                return new UnaryExpression(
                        pick(PrefixOperator.values()).getSymbol(), randomExpression(depth + 1));
            case 4:
                return new ConditionalExpression(
                        randomExpression(depth + 1), randomExpression(depth + 1), randomExpression(depth + 1));
            case 5: {
                int count = random.nextInt(3);
                List<Expression> arguments = new ArrayList<>();
                for (int i = 0; i < count; i++) {
                    arguments.add(randomExpression(depth + 1));
                }
                return new FunctionCallExpression(pick(FUNCTIONS), arguments);
            }
            default:
                return new BinaryExpression(pick(Operator.values()),
                        randomExpression(depth + 1), randomExpression(depth + 1));
        }
    }

    private Expression randomLiteral() {
        switch (random.nextInt(3)) {
            case 0:
                return LiteralExpression.ofNumber((Double) pick(NUMBERS));
            case 1:
                return LiteralExpression.ofString(pick(STRINGS));
            default:
                return LiteralExpression.ofBoolean(random.nextBoolean());
        }
    }

    private <T> T pick(T[] values) {
        return values[random.nextInt(values.length)];
    }

    // ==================== 比较 ====================

    private Outcome run(ExpressionEvaluationStrategy strategy, Expression tree, EvalContext ec) {
        try {
            return new Outcome(strategy.evaluate(tree, context, ec), null);
        } catch (FormulaException e) {
            return new Outcome(null, e);
        }
    }

    private static boolean sameValue(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            double x = ((Number) a).doubleValue();
            double y = ((Number) b).doubleValue();
            return Double.compare(x, y) == 0 || x == y;
        }
        return Objects.equals(a, b);
    }

    private static final class Outcome {
        final Object value;
        final FormulaException error;

        Outcome(Object value, FormulaException error) {
            this.value = value;
            this.error = error;
        }

        boolean failed() {
            return error != null;
        }
    }
}
