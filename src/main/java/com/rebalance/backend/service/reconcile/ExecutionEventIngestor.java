package com.rebalance.backend.service.reconcile;

import com.rebalance.backend.model.OrderStatus;
import com.rebalance.backend.model.TradeOrder;
import com.rebalance.backend.service.OrderStateMachine;
import com.rebalance.backend.service.TradeOrderService;
import com.rebalance.backend.service.TradeOrderService.FillEvidence;
import com.rebalance.backend.service.bridge.BridgeReader;
import com.rebalance.backend.service.bridge.BridgeSnapshots.ExecutionEvent;
import com.rebalance.backend.repository.TradeOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Applies the broker's execution event log. Only lines past the stored offsets are read, and fills
 * are keyed by event id so a replayed log adds nothing.
 */
@Component
@Slf4j
@RequiredArgsConstructor
class ExecutionEventIngestor {

    static final String EVENT_SOURCE = "lean_execution_events";

    private final BridgeReader bridgeReader;
    private final TradeOrderService tradeOrderService;
    private final OrderStateMachine orderStateMachine;
    private final TradeOrderRepository tradeOrderRepository;

    void apply(ReconcilePass pass) {
        List<Path> files = new ArrayList<>();
        files.add(bridgeReader.root().resolve(BridgeReader.EXECUTION_EVENTS_FILE));
        if (pass.outputDir() != null) {
            files.add(pass.outputDir().resolve(BridgeReader.EXECUTION_EVENTS_FILE));
        }
        List<ExecutionEvent> events = bridgeReader.readExecutionEvents(files, pass.eventLogOffsets());
        if (events.isEmpty()) {
            return;
        }
        Map<String, TradeOrder> byTag = pass.ordersByTag();
        for (ExecutionEvent event : events) {
            TradeOrder order = byTag.get(event.tag());
            if (order == null || !pass.acceptsEvidence(order)) {
                continue;
            }
            applyEvent(pass, order, event);
        }
    }

    private void applyEvent(ReconcilePass pass, TradeOrder order, ExecutionEvent event) {
        String status = event.status() == null ? "" : event.status().toLowerCase(Locale.ROOT);
        if (event.filled() != null && event.filled().signum() > 0) {
            FillEvidence evidence = new FillEvidence("evt:" + event.eventId(), event.filled(), event.fillPrice(),
                    event.commission(), event.time(), false);
            if (tradeOrderService.recordFill(order, evidence, EVENT_SOURCE)) {
                rememberBrokerId(order, event);
                order.getParams().recordEvent(EVENT_SOURCE, event.tag(), status, null, event.time());
                tradeOrderRepository.save(order);
                pass.progress("execution_event", "fill:" + order.getClientOrderId());
            }
            return;
        }
        OrderStatus target = switch (status) {
            case "submitted", "new", "accepted", "presubmitted" -> OrderStatus.SUBMITTED;
            case "canceled", "cancelled" -> OrderStatus.CANCELED;
            case "invalid", "rejected", "error" -> OrderStatus.REJECTED;
            default -> null;
        };
        if (target == null || order.getStatus() == target) {
            return;
        }
        if (order.isLowConfidence()) {
            if (target == OrderStatus.SUBMITTED && isNewer(event, order)) {
                orderStateMachine.reopen(order, target, EVENT_SOURCE, pass.config().now());
                order.getParams().recordEvent(EVENT_SOURCE, event.tag(), status, null, event.time());
                rememberBrokerId(order, event);
                tradeOrderRepository.save(order);
                pass.progress("execution_event", "reopen:" + order.getClientOrderId());
            }
            return;
        }
        if (!orderStateMachine.canTransition(order, target)) {
            log.debug("Execution event ignored clientOrderId={} status={} current={}", order.getClientOrderId(),
                    status, order.getStatus());
            return;
        }
        rememberBrokerId(order, event);
        order.getParams().recordEvent(EVENT_SOURCE, event.tag(), status, null, event.time());
        if (target == OrderStatus.REJECTED) {
            order.setRejectedReason("broker_" + status);
        }
        orderStateMachine.transition(order, target, EVENT_SOURCE, pass.config().now());
        pass.progress("execution_event", status + ":" + order.getClientOrderId());
    }

    // Only events after the low-confidence mark count; older lines in the log were already considered
    private static boolean isNewer(ExecutionEvent event, TradeOrder order) {
        Instant markedAt = order.getParams().getEventTime();
        return event.time() != null && (markedAt == null || event.time().isAfter(markedAt));
    }

    private void rememberBrokerId(TradeOrder order, ExecutionEvent event) {
        if (order.getBrokerOrderId() == null && event.brokerOrderId() != null) {
            order.setBrokerOrderId(event.brokerOrderId());
        }
    }
}
