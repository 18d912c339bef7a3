package com.rebalance.backend.service.reconcile;

import java.util.List;

/**
 * Outcome of one pass over the orders that belong to no run.
 */
public record FreeStandingSweep(int orders, boolean changed, List<String> actions) {
}
