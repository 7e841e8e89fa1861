package com.miniformula.executor;

import com.miniformula.error.FormulaSyntaxException;
import com.miniformula.error.FormulaTypeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Date;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FormulaRuntimeTest - 运算符类型转换规则测试
 *
 * 三种求值方式共用这里的运算符语义, 这组测试向量就是运算符的规格。
 */
@DisplayName("运算符类型转换规则测试")
class FormulaRuntimeTest {

    private static final Date DATE = new Date(1_000_000L);

    static Stream<Arguments> bothEmpty() {
        return Stream.of(
                Arguments.of(null, null),
                Arguments.of(null, ""),
                Arguments.of("", null),
                Arguments.of("", "")
        );
    }

    static Stream<Arguments> oneEmptyOneNumeric() {
        return Stream.of(
                Arguments.of(null, 5),
                Arguments.of("", 5.5),
                Arguments.of(5, null),
                Arguments.of(-1, ""),
                Arguments.of("", "7"),
                Arguments.of(true, "")
        );
    }

    static Stream<String> whiteSpaceStrings() {
        return Stream.of(" ", "   ", "\t", "\u00A0 ");
    }

    // ==================== 空值传播 ====================

    @ParameterizedTest
    @MethodSource("bothEmpty")
    @DisplayName("两边都为空: 所有运算结果为空串")
    void testBothEmpty(Object a, Object b) {
        assertEquals("", FormulaRuntime.add(a, b));
        assertEquals("", FormulaRuntime.subtract(a, b));
        assertEquals("", FormulaRuntime.lessThan(a, b));
        assertEquals("", FormulaRuntime.lessThanOrEqual(a, b));
        assertEquals("", FormulaRuntime.binaryOperator("*", a, b));
    }

    @ParameterizedTest
    @MethodSource("oneEmptyOneNumeric")
    @DisplayName("一边为空一边为数字: 空值压过数字")
    void testEmptyDominatesNumeric(Object a, Object b) {
        assertEquals("", FormulaRuntime.add(a, b));
        assertEquals("", FormulaRuntime.subtract(a, b));
        assertEquals("", FormulaRuntime.lessThan(a, b));
        assertEquals("", FormulaRuntime.lessThanOrEqual(a, b));
        assertEquals("", FormulaRuntime.binaryOperator("/", a, b));
        assertEquals("", FormulaRuntime.binaryOperator("^", a, b));
    }

    // ==================== 空白字符串 ====================

    @ParameterizedTest
    @MethodSource("whiteSpaceStrings")
    @DisplayName("空白字符串不是数字也不是空值: 加法拼接")
    void testWhiteSpaceAdd(String space) {
        assertEquals(space + "5", FormulaRuntime.add(space, 5));
        assertEquals("5" + space, FormulaRuntime.add(5, space));
        assertEquals(space + space, FormulaRuntime.add(space, space));
    }

    @ParameterizedTest
    @MethodSource("whiteSpaceStrings")
    @DisplayName("空白字符串不是数字也不是空值: 算术运算类型错误")
    void testWhiteSpaceArithmetic(String space) {
        assertThrows(FormulaTypeException.class, () -> FormulaRuntime.subtract(space, 5));
        assertThrows(FormulaTypeException.class, () -> FormulaRuntime.subtract(5, space));
        assertThrows(FormulaTypeException.class, () -> FormulaRuntime.binaryOperator("*", space, 2));
        assertThrows(FormulaTypeException.class, () -> FormulaRuntime.binaryOperator("%", 2, space));
        assertEquals(0.0, FormulaRuntime.toNumber(space));
    }

    @Test
    @DisplayName("空白字符串的比较按字符串比较")
    void testWhiteSpaceCompare() {
        assertEquals(true, FormulaRuntime.lessThan(" ", 5));
        assertEquals(false, FormulaRuntime.lessThan(5, " "));
        assertEquals(true, FormulaRuntime.lessThanOrEqual(" ", " "));
        assertEquals(false, FormulaRuntime.lessThan(" ", ""));
    }

    // ==================== 加法 ====================

    @Test
    @DisplayName("测试加法: 数字字符串按数字相加")
    void testAddNumericString() {
        assertEquals(3.0, FormulaRuntime.add(1, "2"));
        assertEquals(3.5, FormulaRuntime.add("1.5", "2"));
        assertEquals(2.0, FormulaRuntime.add(true, 1));
    }

    @Test
    @DisplayName("测试加法: 字符串拼接")
    void testAddConcatenation() {
        assertEquals("ab", FormulaRuntime.add("a", "b"));
        assertEquals("a1", FormulaRuntime.add("a", 1));
        assertEquals("x", FormulaRuntime.add("", "x"));
        assertEquals("x", FormulaRuntime.add("x", null));
    }

    @Test
    @DisplayName("测试加法: 日期加数字得到日期")
    void testAddDate() {
        assertEquals(new Date(1_000_500L), FormulaRuntime.add(DATE, 500));
        assertEquals(new Date(1_000_500L), FormulaRuntime.add(500, DATE));
    }

    @Test
    @DisplayName("测试加法: NaN和错误值传播")
    void testAddPropagation() {
        assertTrue(FormulaRuntime.isNaN(FormulaRuntime.add(Double.NaN, 1)));
        assertTrue(FormulaRuntime.isNaN(FormulaRuntime.add("a", Double.NaN)));

        RuntimeException error = new RuntimeException("boom");
        assertSame(error, FormulaRuntime.add(error, 1));
        assertSame(error, FormulaRuntime.add("", error));
    }

    // ==================== 减法 ====================

    @Test
    @DisplayName("测试减法: 日期减数字")
    void testSubtractNumberFromDate() {
        assertEquals(new Date(999_995L), FormulaRuntime.subtract(DATE, 5));
    }

    @Test
    @DisplayName("测试减法: 数字减日期是类型错误")
    void testSubtractDateFromNumber() {
        FormulaTypeException e = assertThrows(FormulaTypeException.class,
                () -> FormulaRuntime.subtract(5, DATE));
        assertEquals("−", e.getOperator());
    }

    @Test
    @DisplayName("测试减法: 日期减日期得到毫秒数")
    void testSubtractDates() {
        assertEquals(999_000.0, FormulaRuntime.subtract(DATE, new Date(1_000L)));
        assertEquals(86_400_000.0, FormulaRuntime.subtract("2024-01-16", "2024-01-15"));
    }

    @Test
    @DisplayName("测试减法: 非数字字符串是类型错误")
    void testSubtractStrings() {
        assertEquals(4.0, FormulaRuntime.subtract("6", 2));
        assertThrows(FormulaTypeException.class, () -> FormulaRuntime.subtract("a", "b"));
        assertThrows(FormulaTypeException.class, () -> FormulaRuntime.subtract("a", ""));
    }

    // ==================== 比较 ====================

    @Test
    @DisplayName("测试比较: NaN传播而不是false")
    void testLessThanNaN() {
        assertTrue(FormulaRuntime.isNaN(FormulaRuntime.lessThan(Double.NaN, 5)));
        assertTrue(FormulaRuntime.isNaN(FormulaRuntime.lessThanOrEqual(5, Double.NaN)));
    }

    @Test
    @DisplayName("测试比较: 数字和字符串")
    void testLessThan() {
        assertEquals(true, FormulaRuntime.lessThan(2, 10));
        assertEquals(true, FormulaRuntime.lessThan("2", "10"));
        assertEquals(true, FormulaRuntime.lessThan("apple", "banana"));
        assertEquals(false, FormulaRuntime.lessThan("b", "a"));
        assertEquals(true, FormulaRuntime.lessThanOrEqual(3, 3));
        assertEquals(false, FormulaRuntime.lessThan(3, 3));
        assertEquals(true, FormulaRuntime.lessThan("2024-01-15", DATE.getTime() + 1e15));
    }

    @Test
    @DisplayName("测试大于: 交换运算数")
    void testGreaterThanSwapsOperands() {
        assertEquals(true, FormulaRuntime.binary(">", 3, 2));
        assertEquals(false, FormulaRuntime.binary(">", 2, 3));
        assertEquals(true, FormulaRuntime.binary(">=", 2, 2));
        assertEquals("", FormulaRuntime.binary(">", "", 2));
    }

    // ==================== 乘除取余乘方 ====================

    @Test
    @DisplayName("测试乘除取余乘方")
    void testBinaryOperator() {
        assertEquals(6.0, FormulaRuntime.binaryOperator("*", 2, "3"));
        assertEquals(2.5, FormulaRuntime.binaryOperator("/", 5, 2));
        assertEquals(1.0, FormulaRuntime.binaryOperator("%", 7, 3));
        assertEquals(1024.0, FormulaRuntime.binaryOperator("^", 2, 10));
        assertEquals(Double.POSITIVE_INFINITY, FormulaRuntime.binaryOperator("/", 1, 0));
    }

    @Test
    @DisplayName("测试乘法: 日期是类型错误, 与另一边无关")
    void testBinaryOperatorRejectsDates() {
        FormulaTypeException e = assertThrows(FormulaTypeException.class,
                () -> FormulaRuntime.binaryOperator("*", DATE, 2));
        assertEquals("*", e.getOperator());
        assertThrows(FormulaTypeException.class, () -> FormulaRuntime.binaryOperator("*", 2, DATE));
        assertThrows(FormulaTypeException.class, () -> FormulaRuntime.binaryOperator("/", "2024-01-15", 2));
        assertThrows(FormulaTypeException.class, () -> FormulaRuntime.binaryOperator("%", DATE, ""));
    }

    @Test
    @DisplayName("测试乘法: 非数字字符串是类型错误")
    void testBinaryOperatorRejectsStrings() {
        assertThrows(FormulaTypeException.class, () -> FormulaRuntime.binaryOperator("*", "a", "b"));
        assertThrows(FormulaTypeException.class, () -> FormulaRuntime.binaryOperator("*", "a", 2));
    }

    @Test
    @DisplayName("测试乘法: NaN传播")
    void testBinaryOperatorNaN() {
        assertTrue(FormulaRuntime.isNaN(FormulaRuntime.binaryOperator("*", Double.NaN, 2)));
        assertTrue(FormulaRuntime.isNaN(FormulaRuntime.binaryOperator("^", "x", Double.NaN)));
    }

    @Test
    @DisplayName("测试不认识的运算符")
    void testInvalidOperator() {
        assertThrows(FormulaSyntaxException.class, () -> FormulaRuntime.binaryOperator("+", 1, 2));
        assertThrows(FormulaSyntaxException.class, () -> FormulaRuntime.binaryOperator("**", 1, 2));
        assertThrows(FormulaSyntaxException.class, () -> FormulaRuntime.binary("<>", 1, 2));
        assertThrows(FormulaSyntaxException.class, () -> FormulaRuntime.unaryOperator("~", 1));
    }

    // ==================== 一元运算和辅助函数 ====================

    @Test
    @DisplayName("测试一元运算")
    void testUnaryOperator() {
        assertEquals(-3.0, FormulaRuntime.unaryOperator("-", "3"));
        assertEquals(1.0, FormulaRuntime.unaryOperator("+", true));
        assertEquals(true, FormulaRuntime.unaryOperator("!", 0));
        assertEquals(false, FormulaRuntime.unaryOperator("!", "x"));
    }

    @Test
    @DisplayName("测试严格相等")
    void testStrictEquals() {
        assertTrue(FormulaRuntime.strictEquals(1, 1.0));
        assertTrue(FormulaRuntime.strictEquals("a", "a"));
        assertTrue(FormulaRuntime.strictEquals(null, null));
        assertFalse(FormulaRuntime.strictEquals(Double.NaN, Double.NaN));
        assertFalse(FormulaRuntime.strictEquals(1, "1"));
        assertFalse(FormulaRuntime.strictEquals(new Date(0), new Date(0)));
        assertEquals(true, FormulaRuntime.binary("!==", 1, "1"));
    }

    @Test
    @DisplayName("测试真值判定")
    void testIsTruthy() {
        assertFalse(FormulaRuntime.isTruthy(null));
        assertFalse(FormulaRuntime.isTruthy(""));
        assertFalse(FormulaRuntime.isTruthy(0));
        assertFalse(FormulaRuntime.isTruthy(Double.NaN));
        assertFalse(FormulaRuntime.isTruthy(false));
        assertTrue(FormulaRuntime.isTruthy("0"));
        assertTrue(FormulaRuntime.isTruthy(-1));
        assertTrue(FormulaRuntime.isTruthy(DATE));
    }

    @Test
    @DisplayName("测试逻辑运算返回运算数本身")
    void testLogicalOperators() {
        assertEquals(0, FormulaRuntime.binary("&&", 0, "x"));
        assertEquals("x", FormulaRuntime.binary("&&", 1, "x"));
        assertEquals("y", FormulaRuntime.binary("||", "", "y"));
        assertEquals("a", FormulaRuntime.binary("||", "a", "y"));
    }

    @Test
    @DisplayName("测试数值转换")
    void testToNumber() {
        assertEquals(31.0, FormulaRuntime.toNumber("0x1F"));
        assertEquals(12.0, FormulaRuntime.toNumber(" 12 "));
        assertEquals(0.0, FormulaRuntime.toNumber("   "));
        assertEquals(0.0, FormulaRuntime.toNumber(null));
        assertEquals(1.0, FormulaRuntime.toNumber(true));
        assertEquals(1000.0, FormulaRuntime.toNumber("1e3"));
        assertEquals(Double.POSITIVE_INFINITY, FormulaRuntime.toNumber("Infinity"));
        assertTrue(Double.isNaN(FormulaRuntime.toNumber("abc")));
    }

    @Test
    @DisplayName("测试超出long范围的前缀数字")
    void testLargePrefixedNumber() {
        double twoTo64 = Math.pow(2, 64);
        assertEquals(twoTo64, FormulaRuntime.toNumber("0x10000000000000000"));
        assertEquals(twoTo64, FormulaRuntime.add("0x10000000000000000", 1));
        assertEquals(twoTo64, FormulaRuntime.toNumber("0b1" + "0".repeat(64)));
        assertEquals(Math.pow(8, 30), FormulaRuntime.toNumber("0o1" + "0".repeat(30)));
    }

    @Test
    @DisplayName("测试显示字符串")
    void testToDisplayString() {
        assertEquals("3", FormulaRuntime.toDisplayString(3.0));
        assertEquals("2.5", FormulaRuntime.toDisplayString(2.5));
        assertEquals("", FormulaRuntime.toDisplayString(null));
        assertEquals("NaN", FormulaRuntime.toDisplayString(Double.NaN));
        assertEquals("true", FormulaRuntime.toDisplayString(true));
        assertEquals("1970-01-01T00:00:00Z", FormulaRuntime.toDisplayString(new Date(0)));
    }

    @Test
    @DisplayName("测试大数和小数的显示字符串")
    void testToDisplayStringExponent() {
        assertEquals("0", FormulaRuntime.toDisplayString(-0.0));
        assertEquals("100000000000000000000", FormulaRuntime.toDisplayString(1e20));
        assertEquals("1e+21", FormulaRuntime.toDisplayString(1e21));
        assertEquals("-1.5e+22", FormulaRuntime.toDisplayString(-1.5e22));
        assertEquals("0.000001", FormulaRuntime.toDisplayString(1e-6));
        assertEquals("1e-7", FormulaRuntime.toDisplayString(1e-7));
        assertEquals("1.5e-7", FormulaRuntime.toDisplayString(1.5e-7));
        assertEquals("1e+21x", FormulaRuntime.add(1e21, "x"));
    }
}
