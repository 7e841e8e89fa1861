package com.miniformula.compiler;

import com.miniformula.context.EvalContext;
import com.miniformula.context.MapFormulaContext;
import com.miniformula.error.FormulaSyntaxException;
import com.miniformula.error.FormulaTypeException;
import com.miniformula.executor.FormulaRuntime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScriptCompilerTest - 公式脚本编译器测试
 */
@DisplayName("公式脚本编译器测试")
class ScriptCompilerTest {

    private ScriptCompiler compiler;
    private MapFormulaContext context;
    private List<Object> calls;

    @BeforeEach
    void setUp() {
        compiler = new ScriptCompiler();
        context = new MapFormulaContext();
        calls = new ArrayList<>();
        context.setVariable("x", 4);
        context.registerFunction("echo", args -> {
            calls.addAll(args);
            return args.isEmpty() ? null : args.get(0);
        });
    }

    private Object run(String code) {
        return compiler.evaluate(code, context, EvalContext.empty());
    }

    @Test
    @DisplayName("测试字面量")
    void testLiterals() {
        assertEquals(1.5, run("1.5"));
        assertEquals(1.0E21, run("1.0E21"));
        assertEquals("a\"b", run("\"a\\\"b\""));
        assertNull(run("null"));
        assertTrue(FormulaRuntime.isNaN(run("NaN")));
        assertEquals(Double.NEGATIVE_INFINITY, run("-Infinity"));
        assertEquals(List.of(1.0, "a"), run("[1,\"a\"]"));
    }

    @Test
    @DisplayName("测试运行时函数")
    void testRuntimeCalls() {
        assertEquals(5.0, run("runtime.add(context.evaluateVariable(\"x\",evalContext),1)"));
        assertEquals(3.0, run("runtime.subtract(4,1)"));
        assertEquals(true, run("runtime.lessThan(1,2)"));
        assertEquals(true, run("runtime.lessThanOrEqual(2,2)"));
        assertEquals(8.0, run("runtime.binaryOperator(\"*\",2,4)"));
        assertThrows(FormulaTypeException.class, () -> run("runtime.binaryOperator(\"*\",\"a\",4)"));
    }

    @Test
    @DisplayName("测试上下文函数和求值上下文")
    void testContextCalls() {
        ContextFunction function = compiler.compile("context.evaluateVariable(\"x\",evalContext)");
        assertEquals(4, function.apply(context, EvalContext.empty()));
        assertEquals(9, function.apply(context, EvalContext.of(Map.of("x", 9))));

        assertEquals("hi", run("context.evaluateFunction(\"echo\",[\"hi\",2])"));
        assertEquals(List.of("hi", 2.0), calls);
    }

    @Test
    @DisplayName("测试中缀运算和条件")
    void testInfix() {
        assertEquals(true, run("(1==1.0)"));
        assertEquals(false, run("(1===\"1\")"));
        assertEquals(true, run("(1!==\"1\")"));
        assertEquals("b", run("(0||\"b\")"));
        assertEquals(0.0, run("(0&&\"b\")"));
        assertEquals("t", run("(true?\"t\":\"f\")"));
        assertEquals(false, run("!(1)"));
    }

    @Test
    @DisplayName("测试短路: 未选中的分支不求值")
    void testShortCircuit() {
        run("(false?context.evaluateFunction(\"echo\",[1]):context.evaluateFunction(\"echo\",[2]))");
        run("(0&&context.evaluateFunction(\"echo\",[3]))");
        run("(1||context.evaluateFunction(\"echo\",[4]))");
        assertEquals(List.of(2.0), calls);
    }

    @Test
    @DisplayName("测试格式错误的脚本")
    void testMalformedScript() {
        assertThrows(FormulaSyntaxException.class, () -> compiler.compile("runtime.add(1,"));
        assertThrows(FormulaSyntaxException.class, () -> compiler.compile(""));
        assertThrows(FormulaSyntaxException.class, () -> compiler.compile("1 # 2"));
    }

    @Test
    @DisplayName("测试不认识的名字")
    void testUnknownNames() {
        assertThrows(FormulaSyntaxException.class, () -> compiler.compile("system.exit(1)"));
        assertThrows(FormulaSyntaxException.class, () -> compiler.compile("runtime.multiply(1,2)"));
        assertThrows(FormulaSyntaxException.class, () -> compiler.compile("context.evaluateSomething(1)"));
        assertThrows(FormulaSyntaxException.class, () -> compiler.compile("runtime.add(1)"));
        assertThrows(FormulaSyntaxException.class, () -> compiler.compile("window"));
    }

    @Test
    @DisplayName("测试参数类型在调用时检查")
    void testArgumentTypes() {
        ContextFunction function = compiler.compile("context.evaluateVariable(1,evalContext)");
        assertThrows(FormulaSyntaxException.class, () -> function.apply(context, EvalContext.empty()));

        ContextFunction notList = compiler.compile("context.evaluateFunction(\"echo\",1)");
        assertThrows(FormulaSyntaxException.class, () -> notList.apply(context, EvalContext.empty()));
    }
}
