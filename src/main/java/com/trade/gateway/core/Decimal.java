package com.trade.gateway.core;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 精确小数工具类
 * 价格、数量、金额一律不经过 double
 */
public final class Decimal {

    private Decimal() {}

    /**
     * 中间除法使用的精度（币数量 / 合约面值，名义价值 / 价格）
     */
    public static final int DIVISION_SCALE = 16;

    private static final int PRICE_SCALE = 8;

    public static BigDecimal of(String value) {
        return new BigDecimal(value);
    }

    public static BigDecimal scalePrice(BigDecimal value) {
        return value.setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 安全除法，除数为 0 时返回 0
     */
    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        if (divisor.compareTo(BigDecimal.ZERO) == 0) {
            return BigDecimal.ZERO;
        }
        return dividend.divide(divisor, DIVISION_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 按步长取整：value 中包含的步长个数（按指定舍入方式）乘以步长
     */
    public static BigDecimal snapToStep(BigDecimal value, BigDecimal step, RoundingMode mode) {
        if (step == null || step.compareTo(BigDecimal.ZERO) <= 0) {
            return value;
        }
        BigDecimal units = value.divide(step, 0, mode);
        return units.multiply(step);
    }

    /**
     * 发送格式：无科学计数法，无尾随 0
     */
    public static String plain(BigDecimal value) {
        if (value.compareTo(BigDecimal.ZERO) == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }

    public static BigDecimal parse(String raw, BigDecimal fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public static BigDecimal parsePositive(String raw, BigDecimal fallback) {
        BigDecimal value = parse(raw, fallback);
        if (value != null && value.compareTo(BigDecimal.ZERO) > 0) {
            return value;
        }
        return fallback;
    }

    public static BigDecimal firstPositive(BigDecimal... values) {
        for (BigDecimal v : values) {
            if (v != null && v.compareTo(BigDecimal.ZERO) > 0) {
                return v;
            }
        }
        return BigDecimal.ZERO;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.compareTo(BigDecimal.ZERO) > 0;
    }

    public static boolean isZero(BigDecimal value) {
        return value != null && value.compareTo(BigDecimal.ZERO) == 0;
    }
}
