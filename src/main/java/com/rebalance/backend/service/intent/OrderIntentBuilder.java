package com.rebalance.backend.service.intent;

import com.rebalance.backend.exception.OrdersEmptyException;
import com.rebalance.backend.exception.PortfolioValueRequiredException;
import com.rebalance.backend.model.OrderSide;
import com.rebalance.backend.model.OrderType;
import com.rebalance.backend.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Turns target weights and current holdings into signed delta orders.
 *
 * <p>target_qty = floor_to_lot(weight * portfolio_value * (1 - cash_buffer) / price), delta = target_qty - held.
 * Held symbols without a target are divested. Sells come before buys so their proceeds fund the buys.
 */
@Component
@Slf4j
public class OrderIntentBuilder {

    private static final Comparator<OrderIntent> SELLS_FIRST = Comparator
            .comparing((OrderIntent intent) -> intent.side() == OrderSide.SELL ? 0 : 1)
            .thenComparing(OrderIntent::symbol);

    public List<OrderIntent> build(IntentRequest request) {
        if (!MoneyUtils.isPositive(request.portfolioValue())) {
            throw new PortfolioValueRequiredException();
        }
        BigDecimal cashBuffer = request.cashBufferRatio() == null ? BigDecimal.ZERO : request.cashBufferRatio();
        BigDecimal effectiveValue = request.portfolioValue().multiply(BigDecimal.ONE.subtract(cashBuffer));
        BigDecimal minQty = request.minQty() == null ? BigDecimal.ZERO : request.minQty();
        OrderType orderType = request.orderType() == null ? OrderType.MKT : request.orderType();
        Map<String, BigDecimal> targets = request.targetWeights() == null ? Map.of() : request.targetWeights();
        Map<String, BigDecimal> holdings = request.holdings() == null ? Map.of() : request.holdings();

        TreeSet<String> symbols = new TreeSet<>(targets.keySet());
        symbols.addAll(holdings.keySet());

        List<OrderIntent> unsorted = new ArrayList<>();
        for (String symbol : symbols) {
            PriceSeed seed = request.prices() == null ? null : request.prices().get(symbol);
            if (seed == null || !MoneyUtils.isPositive(seed.reference())) {
                log.warn("Skipping symbol without price runId={} symbol={}", request.runId(), symbol);
                continue;
            }
            BigDecimal held = holdings.getOrDefault(symbol, BigDecimal.ZERO);
            BigDecimal weight = targets.get(symbol);
            BigDecimal targetQty;
            if (weight == null) {
                targetQty = BigDecimal.ZERO;
            } else {
                BigDecimal positiveWeight = weight.signum() < 0 ? BigDecimal.ZERO : weight;
                BigDecimal rawQty = positiveWeight.multiply(effectiveValue)
                        .divide(seed.reference(), 8, RoundingMode.HALF_UP);
                targetQty = MoneyUtils.floorToLot(rawQty, request.lotSize());
            }
            BigDecimal delta = targetQty.subtract(held);
            if (delta.signum() == 0 || delta.abs().compareTo(minQty) < 0) {
                continue;
            }
            OrderSide side = delta.signum() > 0 ? OrderSide.BUY : OrderSide.SELL;
            unsorted.add(new OrderIntent(null, symbol, side, delta.abs().stripTrailingZeros(),
                    weight == null ? BigDecimal.ZERO : weight, orderType,
                    limitPrice(orderType, side, seed), seed.reference(), request.outsideRth()));
        }
        if (unsorted.isEmpty()) {
            throw new OrdersEmptyException();
        }
        unsorted.sort(SELLS_FIRST);

        List<OrderIntent> intents = new ArrayList<>(unsorted.size());
        for (int i = 0; i < unsorted.size(); i++) {
            intents.add(unsorted.get(i).withIntentId(intentId(request.runId(), i)));
        }
        return intents;
    }

    public static String intentId(Long runId, int sequence) {
        return "oi_" + runId + "_" + sequence;
    }

    private BigDecimal limitPrice(OrderType orderType, OrderSide side, PriceSeed seed) {
        if (!orderType.isLimitLike()) {
            return null;
        }
        BigDecimal price = orderType == OrderType.PEG_MID ? seed.mid() : seed.priceFor(side);
        return MoneyUtils.scale(MoneyUtils.isPositive(price) ? price : seed.reference());
    }
}
