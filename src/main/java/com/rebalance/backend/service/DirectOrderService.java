package com.rebalance.backend.service;

import com.rebalance.backend.exception.BadRequestException;
import com.rebalance.backend.exception.ConflictException;
import com.rebalance.backend.exception.NotFoundException;
import com.rebalance.backend.model.OrderStatus;
import com.rebalance.backend.model.OrderType;
import com.rebalance.backend.model.TradeOrder;
import com.rebalance.backend.model.params.OrderParams;
import com.rebalance.backend.model.params.SubmitCommandState;
import com.rebalance.backend.repository.TradeOrderRepository;
import com.rebalance.backend.service.TradeOrderService.CreateOrderCommand;
import com.rebalance.backend.service.bridge.BridgeCommandWriter;
import com.rebalance.backend.service.bridge.BridgeCommandWriter.CommandRef;
import com.rebalance.backend.service.bridge.BridgeCommandWriter.SubmitOrderCommand;
import com.rebalance.backend.service.bridge.BridgeReader;
import com.rebalance.backend.service.intent.OrderIntent;
import com.rebalance.backend.service.reconcile.FreeStandingSweep;
import com.rebalance.backend.service.reconcile.ReconciliationEngine;
import com.rebalance.backend.service.risk.RiskGate;
import com.rebalance.backend.service.risk.RiskGateDecision;
import com.rebalance.backend.service.risk.RiskGateRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Orders that belong to no run: sent one at a time through the leader's command channel and reconciled
 * together against the leader's snapshots.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DirectOrderService {

    public static final String SOURCE_DIRECT = "direct";
    static final String USER_CANCEL = "user_cancel";

    private final TradeOrderRepository tradeOrderRepository;
    private final TradeOrderService tradeOrderService;
    private final OrderStateMachine orderStateMachine;
    private final BridgeReader bridgeReader;
    private final BridgeCommandWriter bridgeCommandWriter;
    private final RiskGate riskGate;
    private final ReconciliationEngine reconciliationEngine;
    private final AuditEventService auditEventService;
    private final TradeMetrics tradeMetrics;
    private final Clock clock;

    /**
     * Creates the order (idempotent on client order id) and submits it in one transaction.
     */
    @Transactional
    public TradeOrder createAndSubmit(CreateOrderCommand command) {
        if (command.runId() != null) {
            throw new BadRequestException("run_id must be empty for a direct order");
        }
        TradeOrder order = tradeOrderService.createOrder(command).order();
        if (order.getStatus() != OrderStatus.NEW || order.getParams().hasPendingCommand()) {
            return order;
        }
        return submit(order.getId());
    }

    /**
     * Writes a leader submit command for a NEW free-standing order. Risk limits are not applied to manual
     * orders; an active trading halt still refuses them.
     * @throws ConflictException when the order is not submittable, the leader is unhealthy or trading is halted
     */
    @Transactional
    public TradeOrder submit(Long orderId) {
        TradeOrder order = lock(orderId);
        if (order.getRunId() != null) {
            throw new ConflictException("Order " + orderId + " belongs to run " + order.getRunId());
        }
        if (order.getStatus() != OrderStatus.NEW || order.getParams().hasPendingCommand()) {
            throw new ConflictException("Order " + orderId + " cannot be submitted from " + order.getStatus());
        }
        if (!bridgeReader.readStatus().isHealthy()) {
            throw new ConflictException("bridge_unreachable");
        }
        RiskGateDecision decision = riskGate.evaluate(RiskGateRequest.builder()
                .orders(List.of(toIntent(order)))
                .bypass(true)
                .build());
        if (!decision.allowed()) {
            throw new ConflictException("risk_blocked:" + String.join(",", decision.reasons()));
        }

        Instant now = Instant.now(clock);
        OrderParams params = order.getParams();
        // Anything already in the log predates this command
        params.setEventLogOffsets(bridgeReader.eventLogEnds(
                List.of(bridgeReader.root().resolve(BridgeReader.EXECUTION_EVENTS_FILE))));
        CommandRef ref = bridgeCommandWriter.writeSubmitCommand(new SubmitOrderCommand(
                order.getId(),
                order.getSymbol(),
                order.getSide().signed(order.getQuantity()),
                order.tag(),
                order.getOrderType(),
                order.getLimitPrice(),
                Boolean.TRUE.equals(params.getOutsideRth()),
                OrderType.parse(order.getOrderType()) == OrderType.ADAPTIVE_LMT ? "Normal" : null));
        params.setSubmitCommand(SubmitCommandState.builder()
                .pending(true)
                .commandId(ref.commandId())
                .requestedAt(ref.requestedAt())
                .source(SOURCE_DIRECT)
                .status("pending")
                .build());
        order.setUpdatedAt(now);
        tradeOrderRepository.save(order);
        tradeMetrics.recordCommandsWritten(1);
        log.info("Direct order submitted clientOrderId={} commandId={}", order.getClientOrderId(), ref.commandId());
        auditEventService.recordEvent(null, "order", "DIRECT_SUBMIT", "Direct order submitted",
                Map.of("orderId", order.getId(), "commandId", ref.commandId()));
        return order;
    }

    /**
     * Cancels an order. Orders the broker may already hold get a cancel command first; terminal orders are
     * returned unchanged.
     */
    @Transactional
    public TradeOrder cancel(Long orderId) {
        TradeOrder order = lock(orderId);
        if (order.isTerminal()) {
            return order;
        }
        Instant now = Instant.now(clock);
        OrderParams params = order.getParams();
        if (order.getStatus() != OrderStatus.NEW || params.hasPendingCommand()) {
            CommandRef ref = bridgeCommandWriter.writeCancelCommand(order.getId(), order.tag(),
                    order.getBrokerOrderId(), USER_CANCEL);
            params.getProvenance().put("cancel_command_id", ref.commandId());
            if (params.hasPendingCommand()) {
                params.getSubmitCommand().setPending(false);
                params.getSubmitCommand().setStatus("canceled");
            }
        }
        params.recordEvent(USER_CANCEL, order.tag(), "canceled", null, now);
        orderStateMachine.transition(order, OrderStatus.CANCELED, USER_CANCEL, now);
        log.info("Order cancelled by operator clientOrderId={} runId={}", order.getClientOrderId(), order.getRunId());
        return order;
    }

    /**
     * Returns the order, reconciling free-standing orders first while evidence can still move it.
     */
    public TradeOrder getOrder(Long orderId) {
        TradeOrder order = tradeOrderService.getOrder(orderId);
        if (order.getRunId() == null && !order.isTerminal()) {
            reconciliationEngine.reconcileFreeStanding();
            return tradeOrderService.getOrder(orderId);
        }
        return order;
    }

    public FreeStandingSweep refresh() {
        return reconciliationEngine.reconcileFreeStanding();
    }

    @Transactional(readOnly = true)
    public List<TradeOrder> listOrders(String status) {
        if (status == null || status.isBlank()) {
            return tradeOrderRepository.findTop100ByOrderByIdDesc();
        }
        OrderStatus parsed = OrderStatus.fromString(status);
        if (parsed == null) {
            throw new BadRequestException("Unsupported status: " + status);
        }
        return tradeOrderRepository.findTop100ByStatusOrderByIdDesc(parsed);
    }

    private TradeOrder lock(Long orderId) {
        return tradeOrderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new NotFoundException("Order not found: " + orderId));
    }

    private static OrderIntent toIntent(TradeOrder order) {
        return new OrderIntent(null, order.getSymbol(), order.getSide(), order.getQuantity(), null,
                OrderType.parse(order.getOrderType()), order.getLimitPrice(), order.getParams().getPrimePrice(),
                Boolean.TRUE.equals(order.getParams().getOutsideRth()));
    }
}
