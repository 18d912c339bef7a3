package com.rebalance.backend.exception;

public class PortfolioValueRequiredException extends TradingException {

    public static final String REASON = "portfolio_value_required";

    public PortfolioValueRequiredException() {
        super(REASON);
    }
}
