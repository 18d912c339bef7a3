package com.rebalance.backend.model.params;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Holdings captured right before submission; fills are only inferred relative to this.
 */
public record PositionsBaseline(Instant refreshedAt, Map<String, BigDecimal> quantities) {
}
