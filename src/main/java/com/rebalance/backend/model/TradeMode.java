package com.rebalance.backend.model;

public enum TradeMode {
    PAPER,
    LIVE
}
