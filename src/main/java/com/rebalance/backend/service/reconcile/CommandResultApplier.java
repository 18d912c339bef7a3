package com.rebalance.backend.service.reconcile;

import com.rebalance.backend.model.OrderStatus;
import com.rebalance.backend.model.TradeOrder;
import com.rebalance.backend.model.params.SubmitCommandState;
import com.rebalance.backend.repository.TradeOrderRepository;
import com.rebalance.backend.service.OrderStateMachine;
import com.rebalance.backend.service.bridge.BridgeReader;
import com.rebalance.backend.service.bridge.BridgeSnapshots.CommandResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * Reads the leader's result file for every order with a pending submit command.
 */
@Component
@Slf4j
@RequiredArgsConstructor
class CommandResultApplier {

    static final String EVENT_SOURCE = "lean_command_results";
    private static final Set<String> ACCEPTED = Set.of("submitted", "ok", "filled", "accepted");
    private static final Set<String> REJECTED = Set.of("rejected", "error", "failed", "invalid", "parse_error",
            "not_connected");

    private final BridgeReader bridgeReader;
    private final OrderStateMachine orderStateMachine;
    private final TradeOrderRepository tradeOrderRepository;

    void apply(ReconcilePass pass) {
        for (TradeOrder order : pass.orders()) {
            SubmitCommandState command = order.getParams().getSubmitCommand();
            if (command == null || !command.isPending() || command.isSuperseded()) {
                continue;
            }
            Optional<CommandResult> result = bridgeReader.readCommandResult(command.getCommandId());
            if (result.isEmpty()) {
                continue;
            }
            applyResult(pass, order, command, result.get());
        }
    }

    private void applyResult(ReconcilePass pass, TradeOrder order, SubmitCommandState command, CommandResult result) {
        command.setPending(false);
        command.setStatus(result.status());
        command.setProcessedAt(result.processedAt() != null ? result.processedAt() : pass.config().now());
        if (result.brokerOrderId() != null && order.getBrokerOrderId() == null) {
            order.setBrokerOrderId(result.brokerOrderId());
        }
        order.getParams().recordEvent(EVENT_SOURCE, order.tag(), result.status(), null, command.getProcessedAt());

        if (ACCEPTED.contains(result.status()) && order.getStatus() == OrderStatus.NEW) {
            orderStateMachine.transition(order, OrderStatus.SUBMITTED, EVENT_SOURCE, pass.config().now());
        } else if (REJECTED.contains(result.status()) && orderStateMachine.canTransition(order, OrderStatus.REJECTED)) {
            order.setRejectedReason(result.error() != null ? result.error() : "command_" + result.status());
            orderStateMachine.transition(order, OrderStatus.REJECTED, EVENT_SOURCE, pass.config().now());
        } else {
            log.debug("Command result recorded without status change clientOrderId={} result={}",
                    order.getClientOrderId(), result.status());
            tradeOrderRepository.save(order);
        }
        log.info("Command result applied clientOrderId={} commandId={} status={}", order.getClientOrderId(),
                command.getCommandId(), result.status());
        pass.progress("command_result", result.status() + ":" + order.getClientOrderId());
    }
}
