package com.rebalance.backend.exception;

/**
 * A bridge file could not be written after retries.
 */
public class BridgeIoException extends TradingException {
    public BridgeIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
