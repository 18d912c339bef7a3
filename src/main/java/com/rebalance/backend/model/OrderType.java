package com.rebalance.backend.model;

import java.util.Locale;

public enum OrderType {
    MKT,
    LMT,
    ADAPTIVE_LMT,
    PEG_MID;

    public boolean isLimitLike() {
        return this == LMT || this == PEG_MID;
    }

    // Adaptive orders are priced by the broker but still need a priming price for consistency checks
    public boolean requiresPrimePrice() {
        return this == ADAPTIVE_LMT || this == MKT;
    }

    /**
     * Normalizes aliases; returns null when the value names no supported type.
     */
    public static OrderType parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return switch (normalized) {
            case "MKT", "MARKET" -> MKT;
            case "LMT", "LIMIT" -> LMT;
            case "ADAPTIVE_LMT", "ADAPTIVE", "ADAPTIVE_LIMIT" -> ADAPTIVE_LMT;
            case "PEG_MID", "MIDPRICE", "PEG_MIDPOINT", "MIDPOINT" -> PEG_MID;
            default -> null;
        };
    }
}
