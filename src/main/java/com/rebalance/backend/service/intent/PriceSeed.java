package com.rebalance.backend.service.intent;

import com.rebalance.backend.model.OrderSide;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Prices known for one symbol. {@code reference} drives sizing; the quote sides drive limit prices.
 */
public record PriceSeed(BigDecimal reference, BigDecimal bid, BigDecimal ask, BigDecimal last, String source) {

    public static PriceSeed ofClose(BigDecimal close, String source) {
        return new PriceSeed(close, null, null, null, source);
    }

    public BigDecimal mid() {
        if (!positive(bid) || !positive(ask)) {
            return null;
        }
        return bid.add(ask).divide(BigDecimal.valueOf(2), 4, RoundingMode.HALF_UP);
    }

    /**
     * Buys price off the ask and sells off the bid, falling back through last and mid to the opposite side.
     */
    public BigDecimal priceFor(OrderSide side) {
        BigDecimal[] preference = side == OrderSide.BUY
                ? new BigDecimal[]{ask, last, mid(), bid}
                : new BigDecimal[]{bid, last, mid(), ask};
        for (BigDecimal candidate : preference) {
            if (positive(candidate)) {
                return candidate;
            }
        }
        return reference;
    }

    private static boolean positive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
