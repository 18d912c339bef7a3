package com.rebalance.backend.model;

import java.math.BigDecimal;
import java.util.Locale;

public enum OrderSide {
    BUY,
    SELL;

    public int sign() {
        return this == BUY ? 1 : -1;
    }

    public BigDecimal signed(BigDecimal quantity) {
        return this == BUY ? quantity : quantity.negate();
    }

    public static OrderSide fromString(String side) {
        if (side == null) {
            return null;
        }
        return switch (side.trim().toUpperCase(Locale.ROOT)) {
            case "BUY", "B", "BOT", "LONG" -> BUY;
            case "SELL", "S", "SLD", "SHORT" -> SELL;
            default -> null;
        };
    }
}
