package com.rebalance.backend.service.reconcile;

import com.rebalance.backend.model.OrderSide;
import com.rebalance.backend.model.OrderStatus;
import com.rebalance.backend.model.RunStatus;
import com.rebalance.backend.model.TradeOrder;
import com.rebalance.backend.model.TradeRun;
import com.rebalance.backend.model.params.PositionsBaseline;
import com.rebalance.backend.repository.TradeOrderRepository;
import com.rebalance.backend.service.AuditEventService;
import com.rebalance.backend.service.OrderStateMachine;
import com.rebalance.backend.service.bridge.BridgeReader;
import com.rebalance.backend.service.bridge.BridgeSnapshots.PositionsSnapshot;
import com.rebalance.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Scans the execution process log for faults that explain why orders never reached the broker.
 */
@Component
@Slf4j
@RequiredArgsConstructor
class RuntimeErrorDetector {

    static final String LOG_FILE = "log.txt";
    static final String WARMUP_MARKER = "not allowed in initialize or during warm up";
    static final String WARMUP_REASON = "OrderRequest.Submit blocked during warmup/initialize";
    static final String WARMUP_MESSAGE = "execution_error:submit_during_warmup";
    static final String NO_ORDERS_MESSAGE = "no_orders_submitted";
    private static final List<String> NO_ORDERS_MARKERS = List.of("lean_bridge_no_orders", "no orders submitted");

    enum RuntimeFault { SUBMIT_DURING_WARMUP, NO_ORDERS_SUBMITTED }

    private final BridgeReader bridgeReader;
    private final OrderStateMachine orderStateMachine;
    private final TradeOrderRepository tradeOrderRepository;
    private final AuditEventService auditEventService;

    /**
     * @return true when a fault was found and the run was failed
     */
    boolean apply(ReconcilePass pass) {
        Optional<RuntimeFault> fault = scan(pass.outputDir());
        if (fault.isEmpty()) {
            return false;
        }
        if (fault.get() == RuntimeFault.SUBMIT_DURING_WARMUP) {
            applyWarmupBlock(pass);
        } else {
            applyNoOrdersSubmitted(pass);
        }
        return true;
    }

    Optional<RuntimeFault> scan(Path outputDir) {
        if (outputDir == null) {
            return Optional.empty();
        }
        Path logFile = outputDir.resolve(LOG_FILE);
        if (!Files.isRegularFile(logFile)) {
            return Optional.empty();
        }
        String content;
        try {
            content = Files.readString(logFile, StandardCharsets.UTF_8).toLowerCase(Locale.ROOT);
        } catch (IOException e) {
            log.warn("Cannot read execution log file={} error={}", logFile, e.getMessage());
            return Optional.empty();
        }
        if (content.contains(WARMUP_MARKER)) {
            return Optional.of(RuntimeFault.SUBMIT_DURING_WARMUP);
        }
        for (String marker : NO_ORDERS_MARKERS) {
            if (content.contains(marker)) {
                return Optional.of(RuntimeFault.NO_ORDERS_SUBMITTED);
            }
        }
        return Optional.empty();
    }

    private void applyWarmupBlock(ReconcilePass pass) {
        Instant now = pass.config().now();
        for (TradeOrder order : pass.orders()) {
            if (orderStateMachine.forceReject(order, WARMUP_REASON, now)) {
                pass.progress("runtime_error", "rejected:" + order.getClientOrderId());
            }
        }
        TradeRun run = pass.run();
        run.getParams().setRuntimeError("submit_during_warmup");
        run.transitionTo(RunStatus.FAILED, WARMUP_MESSAGE, now);
        pass.markChanged("run:" + WARMUP_MESSAGE);
        log.error("Execution process submitted during warm-up runId={}", run.getId());
        auditEventService.recordEvent(run.getId(), "runtime_error", "SUBMIT_DURING_WARMUP", WARMUP_REASON, null);
    }

    /**
     * Orders whose target position is already held count as filled; the rest are cancelled with low
     * confidence in case the broker did act after all.
     */
    private void applyNoOrdersSubmitted(ReconcilePass pass) {
        Instant now = pass.config().now();
        PositionsSnapshot positions = bridgeReader.readPositions();
        PositionsBaseline baseline = pass.run().getParams().getPositionsBaseline();
        TreeSet<String> alreadyHeld = new TreeSet<>();
        List<TradeOrder> touched = new ArrayList<>();
        for (TradeOrder order : pass.orders()) {
            if (order.isTerminal()) {
                continue;
            }
            if (!positions.stale() && isAlreadyHeld(order, positions, baseline)) {
                order.setFilledQuantity(order.getQuantity());
                order.getParams().setAlreadyHeld(true);
                order.getParams().recordEvent("lean_log", order.tag(), "already_held", "already_held", now);
                orderStateMachine.transition(order, OrderStatus.FILLED, "already_held", now);
                alreadyHeld.add(order.getSymbol());
            } else {
                order.getParams().recordEvent("lean_log", order.tag(), "not_submitted", NO_ORDERS_MESSAGE, now);
                if (order.getStatus() == OrderStatus.PARTIAL || order.getStatus() == OrderStatus.SUBMITTED) {
                    orderStateMachine.transition(order, OrderStatus.CANCELED, NO_ORDERS_MESSAGE, now);
                } else {
                    orderStateMachine.transition(order, OrderStatus.SUBMITTED, NO_ORDERS_MESSAGE, now);
                    orderStateMachine.transition(order, OrderStatus.CANCELED, NO_ORDERS_MESSAGE, now);
                }
            }
            tradeOrderRepository.save(order);
            touched.add(order);
            pass.progress("runtime_error", NO_ORDERS_MESSAGE + ":" + order.getClientOrderId());
        }
        TradeRun run = pass.run();
        run.getParams().setAlreadyHeldSymbols(new ArrayList<>(alreadyHeld));
        run.getParams().setRuntimeError(NO_ORDERS_MESSAGE);
        run.transitionTo(RunStatus.FAILED, NO_ORDERS_MESSAGE, now);
        pass.markChanged("run:" + NO_ORDERS_MESSAGE);
        log.warn("Execution process submitted no orders runId={} alreadyHeld={} orders={}", run.getId(), alreadyHeld,
                touched.size());
        auditEventService.recordEvent(run.getId(), "runtime_error", "NO_ORDERS_SUBMITTED",
                "Execution process reported no orders", Map.of("alreadyHeldSymbols", alreadyHeld));
    }

    private static boolean isAlreadyHeld(TradeOrder order, PositionsSnapshot positions, PositionsBaseline baseline) {
        BigDecimal held = positions.quantity(order.getSymbol());
        BigDecimal before = BigDecimal.ZERO;
        if (order.getParams().getBaselineQuantity() != null) {
            before = order.getParams().getBaselineQuantity();
        } else if (baseline != null && baseline.quantities() != null) {
            before = baseline.quantities().getOrDefault(order.getSymbol(), BigDecimal.ZERO);
        }
        BigDecimal target = before.add(order.getSide().signed(order.getQuantity()));
        if (MoneyUtils.sameQuantity(held, target)) {
            return true;
        }
        return order.getSide() == OrderSide.BUY ? held.compareTo(target) > 0 : held.compareTo(target) < 0;
    }
}
