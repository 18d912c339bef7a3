package com.rebalance.backend.service.reconcile;

import com.rebalance.backend.config.BridgeProperties;
import com.rebalance.backend.model.OrderStatus;
import com.rebalance.backend.model.TradeOrder;
import com.rebalance.backend.model.params.SubmitCommandState;
import com.rebalance.backend.service.OrderStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Rejects free-standing orders whose submit command expired without a result. The leader drops expired
 * commands, and no fallback process exists for orders outside a run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
class ExpiredCommandSweep {

    static final String EVENT_SOURCE = "command_expired";
    static final String REASON = "submit_command_expired";

    private final BridgeProperties bridgeProperties;
    private final OrderStateMachine orderStateMachine;

    void apply(ReconcilePass pass) {
        Instant now = pass.config().now();
        Duration expiry = Duration.ofSeconds(bridgeProperties.getCommandExpirySeconds());
        for (TradeOrder order : pass.orders()) {
            SubmitCommandState command = order.getParams().getSubmitCommand();
            if (order.getStatus() != OrderStatus.NEW || command == null || !command.isPending()
                    || command.getRequestedAt() == null) {
                continue;
            }
            if (Duration.between(command.getRequestedAt(), now).compareTo(expiry) <= 0) {
                continue;
            }
            command.setPending(false);
            command.setStatus("expired");
            order.setRejectedReason(REASON);
            order.getParams().recordEvent(EVENT_SOURCE, order.tag(), "expired", null, now);
            orderStateMachine.transition(order, OrderStatus.REJECTED, REASON, now);
            log.warn("Submit command expired without result clientOrderId={} commandId={}", order.getClientOrderId(),
                    command.getCommandId());
            pass.progress("command_result", REASON + ":" + order.getClientOrderId());
        }
    }
}
