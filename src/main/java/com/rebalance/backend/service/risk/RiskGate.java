package com.rebalance.backend.service.risk;

import com.rebalance.backend.config.RiskProperties;
import com.rebalance.backend.model.OrderSide;
import com.rebalance.backend.model.params.RiskSnapshot;
import com.rebalance.backend.service.intent.OrderIntent;
import com.rebalance.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pre-submission checks over a whole batch. Every violated limit is reported, not only the first.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RiskGate {

    private final RiskProperties riskProperties;
    private final RiskHaltGuard riskHaltGuard;
    private final Clock clock;

    public RiskGateDecision evaluate(RiskGateRequest request) {
        List<String> reasons = new ArrayList<>();
        List<OrderIntent> orders = request.orders() == null ? List.of() : request.orders();
        Map<String, BigDecimal> holdings = request.holdings() == null ? Map.of() : request.holdings();
        BigDecimal portfolioValue = request.portfolioValue();

        BigDecimal totalNotional = BigDecimal.ZERO;
        BigDecimal cashDelta = BigDecimal.ZERO;
        Map<String, BigDecimal> postTradeQty = new LinkedHashMap<>();
        Map<String, BigDecimal> symbolPrice = new LinkedHashMap<>();
        for (OrderIntent order : orders) {
            BigDecimal price = priceOf(order);
            BigDecimal notional = order.quantity().multiply(price);
            totalNotional = totalNotional.add(notional);
            cashDelta = order.side() == OrderSide.BUY ? cashDelta.subtract(notional) : cashDelta.add(notional);
            postTradeQty.merge(order.symbol(), order.signedQuantity(), BigDecimal::add);
            symbolPrice.putIfAbsent(order.symbol(), price);
            // An unpriced order has no notional, so no limit below could catch it
            if (!request.bypass() && price.signum() <= 0) {
                reasons.add("missing_price:" + order.symbol());
            }
            if (!request.bypass() && riskProperties.getMaxOrderNotional() != null
                    && notional.compareTo(riskProperties.getMaxOrderNotional()) > 0) {
                reasons.add("max_order_notional:" + order.symbol());
            }
        }
        BigDecimal projectedCash = request.cashAvailable() == null ? null : request.cashAvailable().add(cashDelta);

        if (!request.bypass()) {
            boolean hasValue = MoneyUtils.isPositive(portfolioValue);
            if (riskProperties.hasNotionalLimits() && !hasValue) {
                reasons.add("portfolio_value_required");
            }
            if (hasValue && riskProperties.getMaxPositionRatio() != null) {
                BigDecimal cap = portfolioValue.multiply(riskProperties.getMaxPositionRatio());
                for (Map.Entry<String, BigDecimal> entry : postTradeQty.entrySet()) {
                    BigDecimal held = holdings.getOrDefault(entry.getKey(), BigDecimal.ZERO);
                    BigDecimal exposure = held.add(entry.getValue()).abs().multiply(symbolPrice.get(entry.getKey()));
                    if (exposure.compareTo(cap) > 0) {
                        reasons.add("max_position_ratio:" + entry.getKey());
                    }
                }
            }
            if (riskProperties.getMaxTotalNotional() != null
                    && totalNotional.compareTo(riskProperties.getMaxTotalNotional()) > 0) {
                reasons.add("max_total_notional");
            }
            if (riskProperties.getMaxSymbols() != null && postTradeQty.size() > riskProperties.getMaxSymbols()) {
                reasons.add("max_symbols");
            }
            if (riskProperties.getMinCashBufferRatio() != null && hasValue) {
                if (projectedCash == null) {
                    reasons.add("min_cash_buffer_ratio:missing_cash_available");
                } else {
                    BigDecimal ratio = projectedCash.divide(portfolioValue, 6, RoundingMode.HALF_UP);
                    if (ratio.compareTo(riskProperties.getMinCashBufferRatio()) < 0) {
                        reasons.add("min_cash_buffer_ratio");
                    }
                }
            }
        }

        RiskHaltGuard.HaltStatus halt = riskHaltGuard.currentStatus();
        if (halt.halted() && !request.force()) {
            reasons.add("risk_halt:" + (halt.reason() == null ? "halted" : halt.reason()));
        }

        boolean allowed = reasons.isEmpty();
        RiskSnapshot snapshot = new RiskSnapshot(allowed, request.bypass(), List.copyOf(reasons),
                MoneyUtils.scale(totalNotional),
                portfolioValue,
                projectedCash == null ? null : MoneyUtils.scale(projectedCash),
                postTradeQty.size(),
                Instant.now(clock));
        if (!allowed) {
            log.warn("Risk gate rejected batch orders={} reasons={}", orders.size(), reasons);
        }
        return new RiskGateDecision(allowed, snapshot.reasons(), snapshot);
    }

    private static BigDecimal priceOf(OrderIntent order) {
        if (MoneyUtils.isPositive(order.limitPrice())) {
            return order.limitPrice();
        }
        return MoneyUtils.isPositive(order.primePrice()) ? order.primePrice() : BigDecimal.ZERO;
    }
}
