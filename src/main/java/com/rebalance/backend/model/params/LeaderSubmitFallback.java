package com.rebalance.backend.model.params;

import java.time.Instant;

/**
 * Why the leader channel was passed over at submission time.
 */
public record LeaderSubmitFallback(String reason, Instant at) {
}
