package com.miniformula.executor;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DateValues - 日期值的识别和构造
 *
 * 公式中的日期值用 {@link java.util.Date} 表示, 数值形式是时间戳(毫秒)。
 * 日期加减数字就是时间戳加减毫秒数。
 *
 * 识别的日期字符串:
 * - ISO-8601日期: 2024-01-15
 * - ISO-8601日期时间: 2024-01-15T08:30, 2024-01-15 08:30:15.250, 2024-01-15T08:30:00Z, ...+08:00
 * - 美式日期: 1/15/2024, 1/15/2024 8:30
 *
 * 没有时区的日期按UTC解释, 保证结果与运行环境无关。
 */
public final class DateValues {

    private static final Pattern ISO_DATE_TIME = Pattern.compile(
            "(\\d{4})-(\\d{1,2})-(\\d{1,2})"
                    + "(?:[T ](\\d{1,2}):(\\d{2})(?::(\\d{2})(?:\\.(\\d{1,9}))?)?"
                    + "(Z|[+-]\\d{2}:?\\d{2})?)?");

    private static final Pattern US_DATE_TIME = Pattern.compile(
            "(\\d{1,2})/(\\d{1,2})/(\\d{4})(?: (\\d{1,2}):(\\d{2})(?::(\\d{2}))?)?");

    private DateValues() {
    }

    /**
     * 是否已经是日期类型的值
     */
    public static boolean isDate(Object value) {
        return value instanceof Date;
    }

    /**
     * 是否是可以识别为日期的字符串
     */
    public static boolean isDateString(Object value) {
        return value instanceof String && parseDate((String) value) != null;
    }

    /**
     * 由时间戳构造日期
     *
     * @param millis 时间戳(毫秒)
     * @return 日期; 时间戳不是有限数时返回NaN
     */
    public static Object createDate(double millis) {
        if (Double.isNaN(millis) || Double.isInfinite(millis)) {
            return Double.NaN;
        }
        return new Date(Math.round(millis));
    }

    /**
     * 解析日期字符串
     *
     * @param text 字符串
     * @return 日期, 无法识别时返回null
     */
    public static Date parseDate(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }

        Matcher iso = ISO_DATE_TIME.matcher(trimmed);
        if (iso.matches()) {
            return toDate(iso.group(1), iso.group(2), iso.group(3),
                    iso.group(4), iso.group(5), iso.group(6), iso.group(7), iso.group(8));
        }

        Matcher us = US_DATE_TIME.matcher(trimmed);
        if (us.matches()) {
            return toDate(us.group(3), us.group(1), us.group(2),
                    us.group(4), us.group(5), us.group(6), null, null);
        }
        return null;
    }

    /**
     * 日期的数值形式
     *
     * @param value 日期或日期字符串
     * @return 时间戳(毫秒), 不是日期时返回NaN
     */
    public static double toEpochMillis(Object value) {
        if (value instanceof Date) {
            return ((Date) value).getTime();
        }
        if (value instanceof String) {
            Date date = parseDate((String) value);
            if (date != null) {
                return date.getTime();
            }
        }
        return Double.NaN;
    }

    private static Date toDate(String year, String month, String day,
                               String hour, String minute, String second,
                               String fraction, String offset) {
        try {
            LocalDate date = LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
            LocalTime time = LocalTime.MIDNIGHT;
            if (hour != null) {
                int nanos = 0;
                if (fraction != null) {
                    nanos = Integer.parseInt((fraction + "000000000").substring(0, 9));
                }
                time = LocalTime.of(Integer.parseInt(hour), Integer.parseInt(minute),
                        second != null ? Integer.parseInt(second) : 0, nanos);
            }
            ZoneOffset zone = offset == null ? ZoneOffset.UTC : ZoneOffset.of(normalizeOffset(offset));
            OffsetDateTime dateTime = OffsetDateTime.of(LocalDateTime.of(date, time), zone);
            return Date.from(dateTime.toInstant());
        } catch (DateTimeException e) {
            // 格式匹配但取值越界(如 2024-13-40), 不是日期
            return null;
        }
    }

    private static String normalizeOffset(String offset) {
        if ("Z".equals(offset) || offset.indexOf(':') >= 0) {
            return offset;
        }
        return offset.substring(0, 3) + ":" + offset.substring(3);
    }
}
