package com.rebalance.backend.service.intent;

import com.rebalance.backend.model.OrderSide;
import com.rebalance.backend.model.OrderType;

import java.math.BigDecimal;

/**
 * One sized delta order before it is persisted. {@code quantity} is always positive; the side carries the sign.
 */
public record OrderIntent(
        String intentId,
        String symbol,
        OrderSide side,
        BigDecimal quantity,
        BigDecimal weight,
        OrderType orderType,
        BigDecimal limitPrice,
        BigDecimal primePrice,
        boolean outsideRth
) {

    public OrderIntent withIntentId(String id) {
        return new OrderIntent(id, symbol, side, quantity, weight, orderType, limitPrice, primePrice, outsideRth);
    }

    public BigDecimal signedQuantity() {
        return side.signed(quantity);
    }
}
