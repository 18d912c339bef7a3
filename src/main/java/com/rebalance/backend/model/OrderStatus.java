package com.rebalance.backend.model;

import java.util.Locale;

/**
 * Order lifecycle. Transitions only move forward; the low-confidence reopen path is the single exception
 * and lives in {@link TradeOrder#reopenTo(OrderStatus, String, java.time.Instant)}.
 */
public enum OrderStatus {
    NEW,        // persisted, not yet seen by the broker
    SUBMITTED,  // command accepted or order visible in open orders
    PARTIAL,
    FILLED,
    CANCELED,
    REJECTED,
    SKIPPED;    // never sent, usually because nothing needed to trade

    public boolean isTerminal() {
        return this == FILLED || this == CANCELED || this == REJECTED || this == SKIPPED;
    }

    public boolean canTransitionTo(OrderStatus target) {
        if (target == null) return false;
        if (this == target) return true; // idempotent self transition

        return switch (this) {
            case NEW -> target == SUBMITTED || target == CANCELED || target == REJECTED || target == SKIPPED;
            case SUBMITTED -> target == PARTIAL || target == FILLED || target == CANCELED || target == REJECTED;
            case PARTIAL -> target == FILLED || target == CANCELED;
            default -> false;
        };
    }

    public boolean canReopenTo(OrderStatus target) {
        return (this == CANCELED || this == SKIPPED)
                && (target == SUBMITTED || target == PARTIAL || target == FILLED);
    }

    /**
     * Maps broker and bridge spellings onto the lifecycle. Returns null for statuses that carry no
     * lifecycle meaning (for example "PendingSubmit").
     */
    public static OrderStatus fromString(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        String normalized = status.trim().toUpperCase(Locale.ROOT).replace(" ", "_");
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return switch (normalized) {
                case "PARTIALLYFILLED", "PARTIALLY_FILLED", "PART_FILLED" -> PARTIAL;
                case "CANCELLED", "CANCELLED_BY_USER", "CANCEL" -> CANCELED;
                case "INVALID", "ERROR", "FAILED" -> REJECTED;
                case "ACCEPTED", "PRESUBMITTED", "OPEN", "WORKING" -> SUBMITTED;
                case "COMPLETE", "COMPLETED" -> FILLED;
                default -> null;
            };
        }
    }
}
