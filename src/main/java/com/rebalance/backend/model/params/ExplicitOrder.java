package com.rebalance.backend.model.params;

import java.math.BigDecimal;

/**
 * A manually composed order carried on the run until execution materializes it.
 */
public record ExplicitOrder(
        String symbol,
        String side,
        BigDecimal quantity,
        String orderType,
        BigDecimal limitPrice
) {
}
