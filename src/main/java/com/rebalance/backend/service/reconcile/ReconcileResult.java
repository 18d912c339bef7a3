package com.rebalance.backend.service.reconcile;

import com.rebalance.backend.model.RunStatus;

import java.util.List;

/**
 * Outcome of one pass. {@code changed} is false when the pass wrote nothing.
 */
public record ReconcileResult(Long runId, boolean changed, RunStatus status, String message, List<String> actions) {
}
