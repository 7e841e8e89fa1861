package com.miniformula.context;

import com.miniformula.compiler.ContextFunction;
import com.miniformula.error.FormulaReferenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MapFormulaContextTest - 变量/函数上下文测试
 *
 * 测试:
 * - 变量和函数的查找, 求值上下文优先
 * - 命名空间变化和依赖值变化的通知
 * - 函数调用栈和聚合下标
 * - 公式脚本缓存
 */
@DisplayName("变量/函数上下文测试")
class MapFormulaContextTest {

    private MapFormulaContext context;
    private List<String> events;

    @BeforeEach
    void setUp() {
        context = new MapFormulaContext();
        events = new ArrayList<>();
        context.addListener(new FormulaContextListener() {
            @Override
            public void namespaceChanged(String name) {
                events.add("namespace:" + name);
            }

            @Override
            public void dependentChanged(String name) {
                events.add("dependent:" + name);
            }
        });
    }

    @Test
    @DisplayName("测试变量查找, 求值上下文优先")
    void testVariableLookup() {
        context.setVariable("x", 1);
        assertEquals(1, context.evaluateVariable("x", EvalContext.empty()));
        assertEquals(2, context.evaluateVariable("x", EvalContext.of(Map.of("x", 2))));
        assertEquals(1, context.evaluateVariable("x", null));

        FormulaReferenceException e = assertThrows(FormulaReferenceException.class,
                () -> context.evaluateVariable("y", EvalContext.empty()));
        assertEquals("y", e.getName());
        assertEquals(FormulaReferenceException.Kind.VARIABLE, e.getKind());
        assertEquals("'y' is unrecognized", e.getMessage());
    }

    @Test
    @DisplayName("测试空值变量")
    void testNullVariable() {
        context.setVariable("blank", null);
        assertTrue(context.hasVariable("blank"));
        assertNull(context.evaluateVariable("blank", EvalContext.empty()));
        assertNull(context.evaluateVariable("z", EvalContext.empty().with("z", null)));
    }

    @Test
    @DisplayName("测试函数调用")
    void testFunctions() {
        context.registerFunction("count", List::size);
        assertEquals(3, context.evaluateFunction("count", List.of(1, 2, 3)));
        assertTrue(context.hasFunction("count"));

        context.unregisterFunction("count");
        FormulaReferenceException e = assertThrows(FormulaReferenceException.class,
                () -> context.evaluateFunction("count", List.of()));
        assertEquals(FormulaReferenceException.Kind.FUNCTION, e.getKind());
    }

    @Test
    @DisplayName("测试变化通知")
    void testNotifications() {
        context.setVariable("x", 1);
        context.setVariable("x", 1);
        context.setVariable("x", 2);
        context.removeVariable("x");
        context.removeVariable("x");
        context.registerFunction("f", args -> null);

        assertEquals(List.of("namespace:x", "dependent:x", "namespace:x", "namespace:f"), events);
    }

    @Test
    @DisplayName("测试注销监听器和关闭")
    void testRemoveListenerAndClose() {
        FormulaContextListener extra = new FormulaContextListener() {
            @Override
            public void namespaceChanged(String name) {
                fail("removed listener must not be notified");
            }

            @Override
            public void dependentChanged(String name) {
                fail("removed listener must not be notified");
            }
        };
        context.addListener(extra);
        context.addListener(extra);
        assertEquals(2, context.getListenerCount());

        context.removeListener(extra);
        context.setVariable("x", 1);
        assertEquals(1, context.getListenerCount());

        context.close();
        assertEquals(0, context.getListenerCount());
    }

    @Test
    @DisplayName("测试聚合下标按从外到内排序")
    void testAggregateIndices() {
        context.willCompile();
        context.beginFunctionContext("outer", true);
        context.beginFunctionContext("plain", false);
        context.beginFunctionContext("inner", true);

        assertEquals(List.of(0, 1), new ArrayList<>(context.getAggregateFunctionIndices()));

        context.endFunctionContext("inner");
        assertEquals(Set.of(0), context.getAggregateFunctionIndices());
        context.endFunctionContext("plain");
        context.endFunctionContext("outer");
        context.didCompile();
        context.completeCompile();

        assertTrue(context.hasAggregates());
        assertTrue(context.getAggregateFunctionIndices().isEmpty());
    }

    @Test
    @DisplayName("测试函数调用栈不匹配")
    void testUnbalancedFunctionContext() {
        context.beginFunctionContext("f", false);
        assertThrows(IllegalStateException.class, () -> context.endFunctionContext("g"));
    }

    @Test
    @DisplayName("测试默认编译片段")
    void testCompileFragments() {
        assertEquals("context.evaluateVariable(\"x\",evalContext)", context.compileVariable("x", Set.of()));
        assertEquals("context.evaluateVariable(\"say \\\"hi\\\"\",evalContext)",
                context.compileVariable("say \"hi\"", Set.of()));
        assertEquals("context.evaluateFunction(\"f\",[1.0,\"a\"])",
                context.compileFunction("f", List.of("1.0", "\"a\""), Set.of()));
    }

    @Test
    @DisplayName("测试公式脚本缓存")
    void testContextFunctionCache() {
        context.setVariable("x", 4);
        ContextFunction first = context.createContextFunction("runtime.add(context.evaluateVariable(\"x\",evalContext),1)");
        ContextFunction second = context.createContextFunction("runtime.add(context.evaluateVariable(\"x\",evalContext),1)");

        assertSame(first, second);
        assertEquals(5.0, first.apply(context, EvalContext.empty()));
    }
}
