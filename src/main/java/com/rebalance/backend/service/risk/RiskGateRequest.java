package com.rebalance.backend.service.risk;

import com.rebalance.backend.service.intent.OrderIntent;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Planned orders plus the account view they are checked against. {@code bypass} skips the limit checks
 * (manual orders); {@code force} ignores an active trading halt.
 */
@Builder
public record RiskGateRequest(
        List<OrderIntent> orders,
        Map<String, BigDecimal> holdings,
        BigDecimal portfolioValue,
        BigDecimal cashAvailable,
        boolean bypass,
        boolean force
) {
}
