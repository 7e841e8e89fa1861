package com.miniformula.executor;

import com.miniformula.CommonConstant;
import com.miniformula.error.FormulaSyntaxException;
import com.miniformula.error.FormulaTypeException;
import com.miniformula.parser.expressions.Operator;
import com.miniformula.parser.expressions.PrefixOperator;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Date;
import java.util.regex.Pattern;

/**
 * FormulaRuntime - 公式运算的类型转换规则
 *
 * 公式的运算符不使用宿主语言的原生语义, 而是按下面的规则处理数字、日期、布尔值、空值和字符串:
 * - 能解释为数字的值(数字、布尔值、数字字符串、日期)按数字运算
 * - 错误值和NaN直接传播, 不报错
 * - 空值(null或"")传播为"", 空值和数字运算结果也是""
 * - 真正不合法的组合(如日期乘以数字)抛出 {@link FormulaTypeException}
 *
 * 三种求值方式(直接求值、编译求值、后缀求值)都调用这里的函数,
 * 运算符的语义只在这里定义一次。
 *
 * 设计原则:
 * - 纯函数, 无状态, 全部是静态方法
 * - 分类(arithmeticStarter)和收尾(arithmeticFinisher / stringFinisher)共用
 */
public final class FormulaRuntime {

    /** 非空且只包含空白字符的字符串 */
    private static final Pattern WHITE_SPACE = Pattern.compile("[\\s\\uFEFF\\u00A0]+");

    private static final Pattern DECIMAL = Pattern.compile(
            "[+-]?(?:\\d+\\.?\\d*(?:[eE][+-]?\\d+)?|\\.\\d+(?:[eE][+-]?\\d+)?)");

    private static final Pattern HEX = Pattern.compile("0[xX][0-9a-fA-F]+");

    private static final Pattern BINARY = Pattern.compile("0[bB][01]+");

    private static final Pattern OCTAL = Pattern.compile("0[oO][0-7]+");

    private FormulaRuntime() {
    }

    // ==================== 值的判定 ====================

    /**
     * 是否为空值: null 或空字符串
     */
    public static boolean isEmpty(Object value) {
        return value == null || (value instanceof String && ((String) value).isEmpty());
    }

    /**
     * 是否为错误值(内层求值传上来的异常对象)
     */
    public static boolean isError(Object value) {
        return value instanceof Throwable;
    }

    /**
     * 值本身是否就是NaN
     */
    public static boolean isNaN(Object value) {
        return (value instanceof Double && ((Double) value).isNaN())
                || (value instanceof Float && ((Float) value).isNaN());
    }

    static boolean isWhiteSpaceString(Object value) {
        return value instanceof String && WHITE_SPACE.matcher((String) value).matches();
    }

    /**
     * 真值判定: null、false、0、NaN、"" 为假, 其余为真
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof String) {
            return !((String) value).isEmpty();
        }
        return true;
    }

    // ==================== 宿主语义的转换 ====================

    /**
     * 转为数值
     *
     * - null、空白字符串 → 0
     * - 布尔值 → 0/1
     * - 日期 → 时间戳(毫秒)
     * - 字符串: 十进制、0x/0b/0o前缀、Infinity, 其余为NaN
     *
     * @param value 任意值
     * @return 数值, 无法转换时为NaN
     */
    public static double toNumber(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? 1 : 0;
        }
        if (value instanceof Date) {
            return ((Date) value).getTime();
        }
        if (value instanceof String) {
            return parseNumber((String) value);
        }
        return Double.NaN;
    }

    private static double parseNumber(String text) {
        String s = text.replaceAll("^[\\s\\uFEFF\\u00A0]+|[\\s\\uFEFF\\u00A0]+$", "");
        if (s.isEmpty()) {
            return 0;
        }
        if (DECIMAL.matcher(s).matches()) {
            return Double.parseDouble(s);
        }
        // 前缀数字可能超出long范围
        if (HEX.matcher(s).matches()) {
            return new BigInteger(s.substring(2), 16).doubleValue();
        }
        if (BINARY.matcher(s).matches()) {
            return new BigInteger(s.substring(2), 2).doubleValue();
        }
        if (OCTAL.matcher(s).matches()) {
            return new BigInteger(s.substring(2), 8).doubleValue();
        }
        switch (s) {
            case "Infinity":
            case "+Infinity":
                return Double.POSITIVE_INFINITY;
            case "-Infinity":
                return Double.NEGATIVE_INFINITY;
            default:
                return Double.NaN;
        }
    }

    /**
     * 转为字符串, 用于拼接和字典序比较
     *
     * 整数不带小数部分(3 而不是 3.0), 日期用ISO-8601格式, 空值为""。
     * 绝对值在 [1e-7, 1e21) 之外的数字用指数形式: 1e+21, 1.5e-7。
     */
    public static String toDisplayString(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d)) {
                return "NaN";
            }
            if (Double.isInfinite(d)) {
                return d > 0 ? "Infinity" : "-Infinity";
            }
            return formatNumber(d);
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant().toString();
        }
        if (value instanceof Throwable) {
            return String.valueOf(((Throwable) value).getMessage());
        }
        return value.toString();
    }

    private static String formatNumber(double d) {
        if (d == 0) {
            return "0";
        }
        BigDecimal decimal = new BigDecimal(Double.toString(d)).stripTrailingZeros();
        double abs = Math.abs(d);
        if (abs >= 1e-7 && abs < 1e21) {
            return decimal.toPlainString();
        }

        String digits = decimal.unscaledValue().abs().toString();
        int exponent = digits.length() - 1 - decimal.scale();
        StringBuilder sb = new StringBuilder();
        if (d < 0) {
            sb.append('-');
        }
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exponent >= 0 ? '+' : '-').append(Math.abs(exponent));
        return sb.toString();
    }

    /**
     * 严格相等(== === != !== 使用), 不做类型转换
     *
     * 数字按数值比较(NaN不等于任何值), 字符串和布尔值按值比较, 其余按引用比较。
     */
    public static boolean strictEquals(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return ((Number) left).doubleValue() == ((Number) right).doubleValue();
        }
        if (left == right) {
            return true;
        }
        if (left == null || right == null) {
            return false;
        }
        if ((left instanceof String && right instanceof String)
                || (left instanceof Boolean && right instanceof Boolean)) {
            return left.equals(right);
        }
        return false;
    }

    // ==================== 一元运算 ====================

    /**
     * 一元运算: + 转数值, - 取负, ! 逻辑取反
     *
     * @throws FormulaSyntaxException 不认识的运算符
     */
    public static Object unaryOperator(String operator, Object value) {
        PrefixOperator op = PrefixOperator.fromSymbol(operator);
        if (op == null) {
            throw FormulaSyntaxException.invalidOperator(operator);
        }
        switch (op) {
            case PLUS:
                return toNumber(value);
            case MINUS:
                return -toNumber(value);
            case NOT:
                return !isTruthy(value);
            default:
                throw FormulaSyntaxException.invalidOperator(operator);
        }
    }

    // ==================== 二元运算 ====================

    /**
     * 二元运算的公共前置步骤: 对两个运算数分类
     *
     * - 空值: null 或 ""
     * - 只含空白的字符串既不是数字也不是日期
     * - 日期: 日期值, 或可识别为日期的字符串
     * - 数值: 能转为数字的值; 不能直接转换的日期字符串取其时间戳
     *
     * 任一运算数是错误值时直接传播该错误值; 任一运算数是NaN时传播NaN。
     */
    static OperandClassification arithmeticStarter(Object operand1, Object operand2) {
        if (isError(operand1)) {
            return OperandClassification.propagate(operand1);
        }
        if (isError(operand2)) {
            return OperandClassification.propagate(operand2);
        }
        if (isNaN(operand1) || isNaN(operand2)) {
            return OperandClassification.propagate(Double.NaN);
        }

        boolean spaceStr1 = isWhiteSpaceString(operand1);
        boolean spaceStr2 = isWhiteSpaceString(operand2);
        boolean empty1 = isEmpty(operand1);
        boolean empty2 = isEmpty(operand2);
        boolean date1 = DateValues.isDate(operand1) || (!spaceStr1 && DateValues.isDateString(operand1));
        boolean date2 = DateValues.isDate(operand2) || (!spaceStr2 && DateValues.isDateString(operand2));
        double num1 = !empty1 && !spaceStr1 ? numericValue(operand1) : Double.NaN;
        double num2 = !empty2 && !spaceStr2 ? numericValue(operand2) : Double.NaN;

        return new OperandClassification(empty1, empty2, date1, date2, num1, num2);
    }

    private static double numericValue(Object operand) {
        double num = toNumber(operand);
        return Double.isNaN(num) ? DateValues.toEpochMillis(operand) : num;
    }

    /**
     * 不能按数字处理时的公共收尾: 空值传播, 否则类型错误
     */
    static Object arithmeticFinisher(OperandClassification c, String operator) {
        // 空值传播
        if (c.empty1 && c.empty2) {
            return "";
        }
        // 空值压过数值
        if ((c.empty1 && c.isNumeric2()) || (c.isNumeric1() && c.empty2)) {
            return "";
        }
        throw new FormulaTypeException(operator);
    }

    /**
     * 不能按数字比较时的公共收尾: 空值传播, 否则按字符串字典序比较
     */
    static Object stringFinisher(OperandClassification c, Object operand1, Object operand2, String operator) {
        if (c.empty1 && c.empty2) {
            return "";
        }
        if ((c.empty1 && c.isNumeric2()) || (c.isNumeric1() && c.empty2)) {
            return "";
        }
        int cmp = toDisplayString(operand1).compareTo(toDisplayString(operand2));
        return "<".equals(operator) ? cmp < 0 : cmp <= 0;
    }

    /**
     * 加法
     *
     * 能解释为数字的值按数字相加; 恰好一边是日期时结果是日期;
     * 空值传播或按空串拼接; 其余情况按字符串拼接。
     */
    public static Object add(Object operand1, Object operand2) {
        OperandClassification c = arithmeticStarter(operand1, operand2);
        if (c.hasPropagated()) {
            return c.getPropagated();
        }

        if (c.isNumeric1() && c.isNumeric2()) {
            double sum = c.num1 + c.num2;
            return c.date1 != c.date2 ? DateValues.createDate(sum) : (Object) sum;
        }

        // 字符串可以拼接, 所以不用arithmeticFinisher
        if (c.empty1 && c.empty2) {
            return "";
        }
        if ((c.empty1 && c.isNumeric2()) || (c.isNumeric1() && c.empty2)) {
            return "";
        }
        if (c.empty1) {
            return toDisplayString(operand2);
        }
        if (c.empty2) {
            return toDisplayString(operand1);
        }
        return toDisplayString(operand1) + toDisplayString(operand2);
    }

    /**
     * 减法
     *
     * 日期减数字得到日期, 日期减日期得到数字, 数字减日期是类型错误。
     * 其余非数字组合: 空值传播, 否则类型错误。
     */
    public static Object subtract(Object operand1, Object operand2) {
        OperandClassification c = arithmeticStarter(operand1, operand2);
        if (c.hasPropagated()) {
            return c.getPropagated();
        }

        if (c.isNumeric1() && c.isNumeric2()) {
            if (c.date1 && !c.date2) {
                return DateValues.createDate(c.num1 - c.num2);
            }
            if (!c.date1 && c.date2) {
                throw new FormulaTypeException(CommonConstant.MINUS_SIGN);
            }
            return c.num1 - c.num2;
        }
        return arithmeticFinisher(c, CommonConstant.MINUS_SIGN);
    }

    /**
     * 小于
     *
     * 能解释为数字的值(包括日期)按数字比较, 否则按字符串比较, 空值和NaN传播。
     */
    public static Object lessThan(Object operand1, Object operand2) {
        OperandClassification c = arithmeticStarter(operand1, operand2);
        if (c.hasPropagated()) {
            return c.getPropagated();
        }
        if (c.isNumeric1() && c.isNumeric2()) {
            return c.num1 < c.num2;
        }
        return stringFinisher(c, operand1, operand2, "<");
    }

    /**
     * 小于等于, 规则同 {@link #lessThan(Object, Object)}
     */
    public static Object lessThanOrEqual(Object operand1, Object operand2) {
        OperandClassification c = arithmeticStarter(operand1, operand2);
        if (c.hasPropagated()) {
            return c.getPropagated();
        }
        if (c.isNumeric1() && c.isNumeric2()) {
            return c.num1 <= c.num2;
        }
        return stringFinisher(c, operand1, operand2, "<=");
    }

    /**
     * 乘、除、取余、乘方
     *
     * 日期不能参与这些运算, 先于数值转换检查。这里的数值转换不走arithmeticStarter,
     * 日期字符串不会退回到时间戳。
     *
     * @param operator "*", "/", "%" 或 "^"
     * @throws FormulaSyntaxException 运算符不是以上四个之一
     * @throws FormulaTypeException 运算数类型不合法
     */
    public static Object binaryOperator(String operator, Object operand1, Object operand2) {
        Operator op = Operator.fromSymbol(operator);
        if (op == null || op.getCategory() != Operator.Category.ARITHMETIC) {
            throw FormulaSyntaxException.invalidOperator(operator);
        }

        boolean empty1 = isEmpty(operand1);
        boolean empty2 = isEmpty(operand2);
        boolean spaceStr1 = isWhiteSpaceString(operand1);
        boolean spaceStr2 = isWhiteSpaceString(operand2);

        // 日期不能参与这些运算
        if (DateValues.isDate(operand1) || DateValues.isDateString(operand1)
                || DateValues.isDate(operand2) || DateValues.isDateString(operand2)) {
            throw new FormulaTypeException(operator);
        }

        double num1 = !empty1 && !spaceStr1 ? toNumber(operand1) : Double.NaN;
        double num2 = !empty2 && !spaceStr2 ? toNumber(operand2) : Double.NaN;
        boolean numeric1 = !Double.isNaN(num1);
        boolean numeric2 = !Double.isNaN(num2);

        if (numeric1 && numeric2) {
            switch (op) {
                case MULTIPLY:
                    return num1 * num2;
                case DIVIDE:
                    return num1 / num2;
                case MODULO:
                    return num1 % num2;
                case POWER:
                    return Math.pow(num1, num2);
                default:
                    throw FormulaSyntaxException.invalidOperator(operator);
            }
        }

        // 错误值传播
        if (isError(operand1)) {
            return operand1;
        }
        if (isError(operand2)) {
            return operand2;
        }
        // NaN传播
        if (isNaN(operand1) || isNaN(operand2)) {
            return Double.NaN;
        }
        // 空值传播
        if (empty1 && empty2) {
            return "";
        }
        // 空值压过数值
        if ((empty1 && numeric2) || (numeric1 && empty2)) {
            return "";
        }
        throw new FormulaTypeException(operator);
    }

    /**
     * 按运算符分发二元运算(求值时已拿到两个运算数), 逻辑运算不短路
     *
     * &gt; 和 &gt;= 交换运算数, 实现为 lessThan(b, a) / lessThanOrEqual(b, a)。
     *
     * @throws FormulaSyntaxException 不认识的运算符
     */
    public static Object binary(String operator, Object left, Object right) {
        Operator op = Operator.fromSymbol(operator);
        if (op == null) {
            throw FormulaSyntaxException.invalidOperator(operator);
        }
        switch (op) {
            case POWER:
            case MULTIPLY:
            case DIVIDE:
            case MODULO:
                return binaryOperator(operator, left, right);
            case ADD:
                return add(left, right);
            case SUBTRACT:
                return subtract(left, right);
            case LESS_THAN:
                return lessThan(left, right);
            case GREATER_THAN:
                return lessThan(right, left);
            case LESS_EQUAL:
                return lessThanOrEqual(left, right);
            case GREATER_EQUAL:
                return lessThanOrEqual(right, left);
            case EQUAL:
            case STRICT_EQUAL:
                return strictEquals(left, right);
            case NOT_EQUAL:
            case STRICT_NOT_EQUAL:
                return !strictEquals(left, right);
            case AND:
                return isTruthy(left) ? right : left;
            case OR:
                return isTruthy(left) ? left : right;
            default:
                throw FormulaSyntaxException.invalidOperator(operator);
        }
    }
}
