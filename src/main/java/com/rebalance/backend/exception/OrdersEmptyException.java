package com.rebalance.backend.exception;

/**
 * Every symbol already sits at its target quantity; callers treat this as a no-op run.
 */
public class OrdersEmptyException extends TradingException {

    public static final String REASON = "orders_empty";

    public OrdersEmptyException() {
        super(REASON);
    }
}
