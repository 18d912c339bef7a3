package com.rebalance.backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class MoneyUtils {

    public static final int SCALE = 4;
    public static final int QTY_SCALE = 6;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
    public static final BigDecimal QTY_TOLERANCE = new BigDecimal("0.000001");

    private MoneyUtils() {
    }

    public static BigDecimal bd(String value) {
        if (value == null || value.isBlank()) {
            return ZERO;
        }
        return scale(new BigDecimal(value));
    }

    public static BigDecimal bd(double value) {
        return scale(BigDecimal.valueOf(value));
    }

    public static BigDecimal scale(BigDecimal value) {
        if (value == null) {
            return ZERO;
        }
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal qty(BigDecimal value) {
        if (value == null) {
            return BigDecimal.ZERO.setScale(QTY_SCALE, RoundingMode.HALF_UP);
        }
        return value.setScale(QTY_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal multiply(BigDecimal left, BigDecimal right) {
        return scale(scale(left).multiply(right == null ? BigDecimal.ZERO : right));
    }

    /**
     * Rounds a quantity down to a whole number of lots.
     */
    public static BigDecimal floorToLot(BigDecimal quantity, BigDecimal lotSize) {
        if (quantity == null || quantity.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal lot = (lotSize == null || lotSize.signum() <= 0) ? BigDecimal.ONE : lotSize;
        BigDecimal lots = quantity.divide(lot, 0, RoundingMode.FLOOR);
        return lots.multiply(lot).stripTrailingZeros();
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static boolean sameQuantity(BigDecimal left, BigDecimal right) {
        BigDecimal a = left == null ? BigDecimal.ZERO : left;
        BigDecimal b = right == null ? BigDecimal.ZERO : right;
        return a.subtract(b).abs().compareTo(QTY_TOLERANCE) <= 0;
    }

    public static BigDecimal toBigDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
