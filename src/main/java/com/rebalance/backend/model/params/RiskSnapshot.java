package com.rebalance.backend.model.params;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record RiskSnapshot(
        boolean allowed,
        boolean bypassed,
        List<String> reasons,
        BigDecimal totalNotional,
        BigDecimal portfolioValue,
        BigDecimal projectedCash,
        int symbolCount,
        Instant evaluatedAt
) {
}
