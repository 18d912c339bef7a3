package com.rebalance.backend.service.intent;

import com.rebalance.backend.model.OrderType;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.Map;

@Builder
public record IntentRequest(
        Long runId,
        Map<String, BigDecimal> targetWeights,
        Map<String, BigDecimal> holdings,
        Map<String, PriceSeed> prices,
        BigDecimal portfolioValue,
        BigDecimal cashBufferRatio,
        BigDecimal lotSize,
        BigDecimal minQty,
        OrderType orderType,
        boolean outsideRth
) {
}
