package com.rebalance.backend.model.params;

public record CompletionSummary(int total, int filled, int cancelled, int rejected, int skipped) {
}
