package com.rebalance.backend.service.reconcile;

import com.rebalance.backend.model.OrderStatus;
import com.rebalance.backend.model.TradeOrder;
import com.rebalance.backend.model.params.RuntimeFallback;
import com.rebalance.backend.repository.TradeOrderRepository;
import com.rebalance.backend.service.OrderStateMachine;
import com.rebalance.backend.service.bridge.BridgeReader;
import com.rebalance.backend.service.bridge.BridgeSnapshots.OpenOrdersSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Set;

/**
 * Compares orders with the broker's open-order list. Presence confirms submission; absence only counts
 * after a grace period and produces a low-confidence status that stronger evidence may later override.
 */
@Component
@Slf4j
@RequiredArgsConstructor
class OpenOrdersSync {

    static final String EVENT_SOURCE = "lean_open_orders";
    static final String PRESENT = "present_in_open_orders";
    static final String MISSING = "missing_from_open_orders";

    private final BridgeReader bridgeReader;
    private final OrderStateMachine orderStateMachine;
    private final TradeOrderRepository tradeOrderRepository;

    void apply(ReconcilePass pass) {
        OpenOrdersSnapshot snapshot = bridgeReader.readOpenOrders(pass.outputDir());
        if (!isUsable(pass, snapshot)) {
            return;
        }
        Set<String> tags = snapshot.tags();
        pass.setVisibleOpenOrderTags(tags);
        boolean fallbackSettling = withinFallbackGrace(pass);
        Instant snapshotAt = snapshot.refreshedAt();
        for (TradeOrder order : pass.orders()) {
            if (!pass.acceptsEvidence(order)) {
                continue;
            }
            if (tags.contains(order.tag())) {
                markPresent(pass, order);
            } else if (!fallbackSettling && !order.isTerminal() && order.getCreatedAt().isBefore(snapshotAt)) {
                markMissing(pass, order, snapshot);
            }
        }
    }

    // A freshly launched fallback process has not published its orders yet
    private boolean withinFallbackGrace(ReconcilePass pass) {
        if (pass.freeStanding()) {
            return false;
        }
        RuntimeFallback fallback = pass.run().getParams().getRuntimeFallback();
        if (fallback == null || !fallback.isTriggered() || fallback.getTriggeredAt() == null) {
            return false;
        }
        return Duration.between(fallback.getTriggeredAt(), pass.config().now()).compareTo(pass.config().fallbackGrace()) < 0;
    }

    /**
     * Empty lists only mean something when the run's own process wrote them; lists that share no tag with
     * this run describe some other session. Free-standing orders are only ever sent through the leader, so
     * its list counts as a whole while the leader is healthy.
     */
    private boolean isUsable(ReconcilePass pass, OpenOrdersSnapshot snapshot) {
        if (!snapshot.isFresh()) {
            return false;
        }
        if (pass.freeStanding()) {
            return pass.executorActive();
        }
        if (snapshot.items().isEmpty()) {
            return snapshot.runScoped();
        }
        Set<String> tags = snapshot.tags();
        if (tags.isEmpty()) {
            return false;
        }
        return !Collections.disjoint(tags, pass.ordersByTag().keySet());
    }

    private void markPresent(ReconcilePass pass, TradeOrder order) {
        Instant now = pass.config().now();
        if (order.isLowConfidence()) {
            orderStateMachine.reopen(order, OrderStatus.SUBMITTED, EVENT_SOURCE, now);
            order.getParams().recordEvent(EVENT_SOURCE, order.tag(), "open", PRESENT, now);
            order.getParams().setOpenOrdersMissingSince(null);
            tradeOrderRepository.save(order);
            pass.progress("open_orders", "reopen:" + order.getClientOrderId());
            return;
        }
        boolean wasMissing = order.getParams().getOpenOrdersMissingSince() != null;
        if (order.getStatus() == OrderStatus.NEW) {
            order.getParams().recordEvent(EVENT_SOURCE, order.tag(), "open", PRESENT, now);
            order.getParams().setOpenOrdersMissingSince(null);
            orderStateMachine.transition(order, OrderStatus.SUBMITTED, PRESENT, now);
            pass.progress("open_orders", PRESENT + ":" + order.getClientOrderId());
        } else if (wasMissing) {
            order.getParams().setOpenOrdersMissingSince(null);
            order.setUpdatedAt(now);
            tradeOrderRepository.save(order);
            pass.markChanged("open_orders:reappeared:" + order.getClientOrderId());
        }
    }

    private void markMissing(ReconcilePass pass, TradeOrder order, OpenOrdersSnapshot snapshot) {
        ReconcilePassConfig config = pass.config();
        Instant now = config.now();
        if (order.getStatus() == OrderStatus.NEW) {
            if (order.getParams().hasPendingCommand()) {
                return;
            }
            if (Duration.between(order.getCreatedAt(), now).compareTo(config.newOrderMinAge()) < 0) {
                return;
            }
        }
        Instant missingSince = order.getParams().getOpenOrdersMissingSince();
        if (missingSince == null) {
            order.getParams().setOpenOrdersMissingSince(now);
            order.setUpdatedAt(now);
            tradeOrderRepository.save(order);
            pass.markChanged("open_orders:missing:" + order.getClientOrderId());
            return;
        }
        Duration grace = graceFor(pass, order, snapshot);
        if (Duration.between(missingSince, now).compareTo(grace) < 0) {
            return;
        }
        order.getParams().recordEvent(EVENT_SOURCE, order.tag(), "missing", MISSING, now);
        switch (order.getStatus()) {
            case SUBMITTED, PARTIAL -> orderStateMachine.transition(order, OrderStatus.CANCELED, MISSING, now);
            case NEW -> {
                if (order.getRunId() == null) {
                    orderStateMachine.transition(order, OrderStatus.SKIPPED, MISSING, now);
                } else {
                    orderStateMachine.transition(order, OrderStatus.SUBMITTED, MISSING, now);
                    orderStateMachine.transition(order, OrderStatus.CANCELED, MISSING, now);
                }
            }
            default -> {
                return;
            }
        }
        log.info("Order missing from open orders, marked low-confidence clientOrderId={} status={}",
                order.getClientOrderId(), order.getStatus());
        pass.progress("open_orders", MISSING + ":" + order.getClientOrderId());
    }

    private Duration graceFor(ReconcilePass pass, TradeOrder order, OpenOrdersSnapshot snapshot) {
        ReconcilePassConfig config = pass.config();
        if (order.getStatus() == OrderStatus.NEW) {
            return pass.executorActive() ? config.unconfirmedFinalize() : config.unconfirmedFinalizeInactive();
        }
        if (!pass.executorActive()) {
            return config.openOrdersInactiveGrace();
        }
        return snapshot.runScoped() ? config.openOrdersRunGrace() : config.openOrdersGrace();
    }
}
