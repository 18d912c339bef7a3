package com.rebalance.backend.service;

import com.rebalance.backend.model.OrderStatus;
import com.rebalance.backend.model.TradeOrder;
import com.rebalance.backend.repository.TradeOrderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class OrderStateMachine {

    private final TradeOrderRepository tradeOrderRepository;
    private final AuditEventService auditEventService;

    /**
     * Forward transition. A NEW order that receives fill evidence passes through SUBMITTED first.
     * @return false when the order already has the target status
     */
    @Transactional
    public boolean transition(TradeOrder order, OrderStatus target, String reason, Instant now) {
        if (order == null || target == null) {
            return false;
        }
        OrderStatus current = order.getStatus();
        if (current == target) {
            return false;
        }
        if (current == OrderStatus.NEW && (target == OrderStatus.PARTIAL || target == OrderStatus.FILLED)) {
            order.transitionTo(OrderStatus.SUBMITTED, now);
        }
        order.transitionTo(target, now);
        tradeOrderRepository.save(order);
        audit(order, current, target, reason);
        return true;
    }

    /**
     * Overrides a low-confidence CANCELED/SKIPPED status. The caller decides whether the evidence is recent enough.
     */
    @Transactional
    public boolean reopen(TradeOrder order, OrderStatus target, String evidence, Instant now) {
        OrderStatus current = order.getStatus();
        order.reopenTo(target, evidence, now);
        tradeOrderRepository.save(order);
        audit(order, current, target, "reopen:" + evidence);
        return true;
    }

    /**
     * Rejects an order after a runtime fault. Non-terminal orders follow the graph (a PARTIAL order is
     * cancelled since it already traded); low-confidence terminal orders are overridden.
     * @return false when the order carries a high-confidence terminal status
     */
    @Transactional
    public boolean forceReject(TradeOrder order, String reason, Instant now) {
        OrderStatus current = order.getStatus();
        if (order.isLowConfidence()) {
            order.rejectLowConfidence(reason, now);
        } else if (current.isTerminal()) {
            return false;
        } else if (current == OrderStatus.PARTIAL) {
            order.transitionTo(OrderStatus.CANCELED, now);
            order.setRejectedReason(reason);
        } else {
            order.transitionTo(OrderStatus.REJECTED, now);
            order.setRejectedReason(reason);
        }
        tradeOrderRepository.save(order);
        audit(order, current, order.getStatus(), reason);
        return true;
    }

    public boolean canTransition(TradeOrder order, OrderStatus target) {
        OrderStatus current = order.getStatus();
        if (current == OrderStatus.NEW && (target == OrderStatus.PARTIAL || target == OrderStatus.FILLED)) {
            return true;
        }
        return current.canTransitionTo(target);
    }

    private void audit(TradeOrder order, OrderStatus from, OrderStatus to, String reason) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("orderId", order.getId());
        metadata.put("clientOrderId", order.getClientOrderId());
        metadata.put("from", from.name());
        metadata.put("to", to.name());
        metadata.put("reason", reason);
        auditEventService.recordEvent(order.getRunId(), "order_status_changed", "TRANSITION",
                "Order state transition", metadata);
    }
}
