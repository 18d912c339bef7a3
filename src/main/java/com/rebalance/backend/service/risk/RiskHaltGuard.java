package com.rebalance.backend.service.risk;

/**
 * Intraday trading halt consulted before any order leaves the service.
 */
public interface RiskHaltGuard {

    HaltStatus currentStatus();

    record HaltStatus(boolean halted, String reason) {

        public static HaltStatus clear() {
            return new HaltStatus(false, null);
        }
    }
}
