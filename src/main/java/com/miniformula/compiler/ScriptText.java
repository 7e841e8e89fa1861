package com.miniformula.compiler;

/**
 * 公式脚本文本的辅助方法
 */
public final class ScriptText {

    private ScriptText() {
    }

    /**
     * 把字符串写成公式脚本的字符串字面量
     *
     * 反斜杠和双引号需要转义, 其余字符原样保留。
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' || c == '"') {
                sb.append('\\');
            }
            sb.append(c);
        }
        sb.append('"');
        return sb.toString();
    }

    /**
     * quote的逆操作, 输入包括两侧的双引号
     */
    public static String unquote(String literal) {
        String body = literal.substring(1, literal.length() - 1);
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                c = body.charAt(++i);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * 数值字面量
     *
     * NaN和无穷大没有数字写法, 用脚本关键字表示。
     */
    public static String number(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value < 0 || (value == 0 && 1 / value < 0)) {
            return "-" + Double.toString(-value);
        }
        return Double.toString(value);
    }
}
