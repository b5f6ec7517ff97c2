package com.wangbin.scheduler.common.utils;

import java.util.Locale;

/**
 * 数字展示格式
 */
public class NumberFormatUtil {

    private NumberFormatUtil() {
    }

    /**
     * 整数不带小数位，其余保留一位小数，例如 {@code 8 -> "8"}，{@code 7.25 -> "7.3"}。
     */
    public static String compact(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
