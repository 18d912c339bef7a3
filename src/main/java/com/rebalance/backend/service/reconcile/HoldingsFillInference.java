package com.rebalance.backend.service.reconcile;

import com.rebalance.backend.model.TradeOrder;
import com.rebalance.backend.model.params.PositionsBaseline;
import com.rebalance.backend.service.TradeOrderService;
import com.rebalance.backend.service.TradeOrderService.FillEvidence;
import com.rebalance.backend.service.bridge.BridgeReader;
import com.rebalance.backend.service.bridge.BridgeSnapshots.PositionsSnapshot;
import com.rebalance.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Infers fills from how far holdings moved since submission when no execution event arrived.
 *
 * <p>For each symbol and side the moved quantity is handed out to the run's orders in id order, each capped
 * at its requested quantity. A fill is only written for the part that exceeds what the order already has,
 * keyed by the cumulative quantity so the same holdings view never produces a second fill.
 */
@Component
@Slf4j
@RequiredArgsConstructor
class HoldingsFillInference {

    static final String EVENT_SOURCE = "holdings";

    private final BridgeReader bridgeReader;
    private final TradeOrderService tradeOrderService;

    void apply(ReconcilePass pass) {
        PositionsBaseline baseline = pass.run().getParams().getPositionsBaseline();
        if (baseline == null || baseline.quantities() == null || baseline.quantities().isEmpty()) {
            return;
        }
        PositionsSnapshot positions = bridgeReader.readPositions();
        if (positions.stale()) {
            return;
        }
        Map<String, List<TradeOrder>> groups = new LinkedHashMap<>();
        for (TradeOrder order : pass.orders()) {
            if (!baseline.quantities().containsKey(order.getSymbol())) {
                continue;
            }
            groups.computeIfAbsent(order.getSymbol() + "|" + order.getSide(), key -> new ArrayList<>()).add(order);
        }
        for (List<TradeOrder> group : groups.values()) {
            group.sort(Comparator.comparing(TradeOrder::getId));
            TradeOrder first = group.get(0);
            BigDecimal before = baseline.quantities().get(first.getSymbol());
            BigDecimal after = positions.quantity(first.getSymbol());
            BigDecimal moved = after.subtract(before).multiply(BigDecimal.valueOf(first.getSide().sign()));
            if (moved.signum() <= 0) {
                continue;
            }
            allocate(pass, group, moved, positions.avgCost(first.getSymbol()));
        }
    }

    private void allocate(ReconcilePass pass, List<TradeOrder> group, BigDecimal moved, BigDecimal avgCost) {
        BigDecimal remaining = moved;
        for (TradeOrder order : group) {
            if (remaining.signum() <= 0) {
                return;
            }
            BigDecimal cumulative = remaining.min(order.getQuantity());
            remaining = remaining.subtract(cumulative);
            if (!pass.acceptsEvidence(order) || pass.visibleOpenOrderTags().contains(order.tag())) {
                continue;
            }
            BigDecimal filled = order.getFilledQuantity() == null ? BigDecimal.ZERO : order.getFilledQuantity();
            if (cumulative.subtract(filled).compareTo(MoneyUtils.QTY_TOLERANCE) <= 0) {
                continue;
            }
            String execId = "pos:" + order.getId() + ":" + MoneyUtils.qty(cumulative).stripTrailingZeros().toPlainString();
            FillEvidence evidence = new FillEvidence(execId, cumulative.subtract(filled), priceFor(order, avgCost),
                    null, pass.config().now(), true);
            if (tradeOrderService.recordFill(order, evidence, EVENT_SOURCE)) {
                order.getParams().recordEvent(EVENT_SOURCE, order.tag(), order.getStatus().name().toLowerCase(Locale.ROOT),
                        null, pass.config().now());
                pass.progress("holdings", "fill:" + order.getClientOrderId());
            }
        }
    }

    private static BigDecimal priceFor(TradeOrder order, BigDecimal avgCost) {
        if (MoneyUtils.isPositive(avgCost)) {
            return avgCost;
        }
        if (MoneyUtils.isPositive(order.getLimitPrice())) {
            return order.getLimitPrice();
        }
        return order.getParams().getPrimePrice();
    }
}
