package com.rebalance.backend.service.execution;

import com.rebalance.backend.exception.TradingException;
import com.rebalance.backend.model.OrderSide;
import com.rebalance.backend.model.OrderType;
import com.rebalance.backend.model.TradeOrder;
import com.rebalance.backend.model.TradeRun;
import com.rebalance.backend.model.params.LeaderSubmitFallback;
import com.rebalance.backend.model.params.OrderParams;
import com.rebalance.backend.model.params.PositionsBaseline;
import com.rebalance.backend.model.params.RunParams;
import com.rebalance.backend.model.params.RuntimeFallback;
import com.rebalance.backend.model.params.SubmissionMetadata;
import com.rebalance.backend.model.params.SubmissionSource;
import com.rebalance.backend.model.params.SubmitCommandState;
import com.rebalance.backend.repository.TradeOrderRepository;
import com.rebalance.backend.service.AuditEventService;
import com.rebalance.backend.service.JobLockService;
import com.rebalance.backend.service.TradeMetrics;
import com.rebalance.backend.service.bridge.BridgeCommandWriter;
import com.rebalance.backend.service.bridge.BridgeCommandWriter.CommandRef;
import com.rebalance.backend.service.bridge.BridgeCommandWriter.SubmitOrderCommand;
import com.rebalance.backend.service.bridge.BridgeReader;
import com.rebalance.backend.service.bridge.BridgeSnapshots.PositionsSnapshot;
import com.rebalance.backend.service.bridge.CommandChannelHealthChecker;
import com.rebalance.backend.service.bridge.CommandChannelHealthChecker.ChannelHealth;
import com.rebalance.backend.service.intent.OrderIntent;
import com.rebalance.backend.service.intent.OrderIntentFileService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sends a run's orders out through the leader command queue when that channel is healthy, otherwise through
 * a short-lived execution process. Also owns the switch to the fallback process when leader commands stall.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SubmissionDispatcher {

    public static final String MESSAGE_LEADER = "submitted_leader";
    public static final String MESSAGE_SHORT_LIVED = "submitted_short_lived";
    public static final String MESSAGE_FALLBACK = "submitted_fallback";
    public static final String REASON_PENDING_TIMEOUT = "submit_command_pending_timeout";
    static final String SUPERSEDED_BY = "short_lived_fallback";
    static final String SOURCE_LEADER = "leader_command";

    private final CommandChannelHealthChecker channelHealthChecker;
    private final BridgeCommandWriter bridgeCommandWriter;
    private final BridgeReader bridgeReader;
    private final OrderIntentFileService orderIntentFileService;
    private final ProcessLifecycleManager processLifecycleManager;
    private final FallbackRateLimiter fallbackRateLimiter;
    private final JobLockService jobLockService;
    private final TradeOrderRepository tradeOrderRepository;
    private final AuditEventService auditEventService;
    private final TradeMetrics tradeMetrics;
    private final Clock clock;

    public record DispatchResult(SubmissionSource source, String message, int commandCount) {
    }

    /**
     * Submits every order of the run. The caller persists the run afterwards.
     * @throws TradingException when neither channel could take the orders
     */
    public DispatchResult submit(TradeRun run, List<TradeOrder> orders) {
        Instant now = Instant.now(clock);
        captureBaseline(run, orders, now);
        ChannelHealth health = channelHealthChecker.check();
        if (health.healthy()) {
            int written = submitViaLeader(run, orders, now);
            run.getParams().setSubmission(SubmissionMetadata.builder()
                    .source(SubmissionSource.LEADER_COMMAND)
                    .submittedAt(now)
                    .commandCount(written)
                    .build());
            tradeMetrics.recordCommandsWritten(written);
            auditEventService.recordEvent(run.getId(), "submission", "LEADER_COMMAND",
                    "Orders submitted through leader command queue", Map.of("commands", written));
            return new DispatchResult(SubmissionSource.LEADER_COMMAND, MESSAGE_LEADER, written);
        }

        log.info("Leader channel unavailable runId={} reason={}", run.getId(), health.reason());
        if (!"leader_disabled".equals(health.reason())) {
            run.getParams().setLeaderSubmitFallback(
                    new LeaderSubmitFallback("command_channel_unhealthy:" + health.reason(), now));
        }
        RunParams params = run.getParams();
        Path intentPath = params.getOrderIntentPath() != null
                ? Path.of(params.getOrderIntentPath())
                : orderIntentFileService.intentPath(run.getId());
        Path paramsPath = params.getExecutionParamsPath() != null
                ? Path.of(params.getExecutionParamsPath())
                : orderIntentFileService.executionParamsPath(run.getId());
        ProcessLifecycleManager.LaunchedProcess launched = launchFor(run.getId(), intentPath, paramsPath);
        params.setSubmission(SubmissionMetadata.builder()
                .source(SubmissionSource.SHORT_LIVED)
                .pid(launched.pid())
                .outputDir(launched.outputDir().toString())
                .configPath(launched.configPath().toString())
                .submittedAt(now)
                .launchedAt(launched.launchedAt())
                .build());
        auditEventService.recordEvent(run.getId(), "submission", "SHORT_LIVED",
                "Orders submitted through short-lived execution process",
                Map.of("pid", launched.pid(), "reason", health.reason()));
        return new DispatchResult(SubmissionSource.SHORT_LIVED, MESSAGE_SHORT_LIVED, 0);
    }

    /**
     * Moves orders whose leader command never got a result onto a fallback process. Rate limited per run and
     * serialized with other submissions through the execution job lock.
     * @return true when the fallback process was launched
     */
    public boolean triggerRuntimeFallback(TradeRun run, List<TradeOrder> timedOut, Instant now) {
        if (timedOut.isEmpty()) {
            return false;
        }
        if (!fallbackRateLimiter.tryAcquire(run.getId())) {
            log.debug("Fallback launch rate limited runId={}", run.getId());
            return false;
        }
        Optional<JobLockService.Lease> lease = jobLockService.tryAcquire(JobLockService.TRADE_EXECUTION, "runtime_fallback");
        if (lease.isEmpty()) {
            return false;
        }
        try (JobLockService.Lease ignored = lease.get()) {
            List<OrderIntent> intents = new ArrayList<>(timedOut.size());
            for (TradeOrder order : timedOut) {
                intents.add(toIntent(order));
            }
            Path intentPath = orderIntentFileService.writeIntents(run.getId(),
                    orderIntentFileService.fallbackIntentPath(run.getId()), intents);
            Path paramsPath = run.getParams().getExecutionParamsPath() != null
                    ? Path.of(run.getParams().getExecutionParamsPath())
                    : orderIntentFileService.executionParamsPath(run.getId());
            ProcessLifecycleManager.LaunchedProcess launched = launchFor(run.getId(), intentPath, paramsPath);

            List<String> cleared = new ArrayList<>();
            for (TradeOrder order : timedOut) {
                SubmitCommandState command = order.getParams().getSubmitCommand();
                if (command != null && !command.isSuperseded()) {
                    command.setPending(false);
                    command.setStatus(SubmitCommandState.STATUS_SUPERSEDED);
                    command.setSupersededBy(SUPERSEDED_BY);
                    order.setUpdatedAt(now);
                    tradeOrderRepository.save(order);
                }
                cleared.add(order.getClientOrderId());
            }
            RunParams params = run.getParams();
            params.setSubmission(SubmissionMetadata.builder()
                    .source(SubmissionSource.SHORT_LIVED_FALLBACK)
                    .pid(launched.pid())
                    .outputDir(launched.outputDir().toString())
                    .configPath(launched.configPath().toString())
                    .submittedAt(now)
                    .launchedAt(launched.launchedAt())
                    .build());
            params.setRuntimeFallback(RuntimeFallback.builder()
                    .triggered(true)
                    .triggeredAt(now)
                    .reason(REASON_PENDING_TIMEOUT)
                    .clearedPendingOrders(cleared)
                    .build());
            tradeMetrics.recordFallbackLaunched();
            auditEventService.recordEvent(run.getId(), "submission", "RUNTIME_FALLBACK",
                    "Pending leader commands moved to fallback process",
                    Map.of("orders", cleared, "pid", launched.pid()));
            log.warn("Runtime fallback launched runId={} orders={} pid={}", run.getId(), cleared, launched.pid());
            return true;
        } catch (TradingException | UncheckedIOException e) {
            log.warn("Runtime fallback launch failed runId={} error={}", run.getId(), e.getMessage());
            auditEventService.recordEvent(run.getId(), "submission", "RUNTIME_FALLBACK_FAILED",
                    "Fallback process could not be launched", Map.of("error", String.valueOf(e.getMessage())));
            return false;
        }
    }

    private int submitViaLeader(TradeRun run, List<TradeOrder> orders, Instant now) {
        int written = 0;
        for (TradeOrder order : orders) {
            if (order.isTerminal() || order.getParams().hasPendingCommand()) {
                continue;
            }
            OrderParams params = order.getParams();
            OrderType type = OrderType.parse(order.getOrderType());
            CommandRef ref = bridgeCommandWriter.writeSubmitCommand(new SubmitOrderCommand(
                    order.getId(),
                    order.getSymbol(),
                    order.getSide().signed(order.getQuantity()),
                    order.tag(),
                    order.getOrderType(),
                    order.getLimitPrice(),
                    Boolean.TRUE.equals(params.getOutsideRth()),
                    type == OrderType.ADAPTIVE_LMT ? "Normal" : null));
            params.setSubmitCommand(SubmitCommandState.builder()
                    .pending(true)
                    .commandId(ref.commandId())
                    .requestedAt(ref.requestedAt())
                    .source(SOURCE_LEADER)
                    .status("pending")
                    .build());
            order.setUpdatedAt(now);
            tradeOrderRepository.save(order);
            written++;
        }
        log.info("Leader submit commands written runId={} count={}", run.getId(), written);
        return written;
    }

    private ProcessLifecycleManager.LaunchedProcess launchFor(Long runId, Path intentPath, Path paramsPath) {
        Path outputDir = orderIntentFileService.runOutputDir(runId);
        Path configPath = orderIntentFileService.writeRunConfig(runId, intentPath, paramsPath, outputDir);
        return processLifecycleManager.launch(runId, configPath, outputDir);
    }

    /**
     * Records holdings right before submission so later holdings deltas can be read as fills.
     */
    private void captureBaseline(TradeRun run, List<TradeOrder> orders, Instant now) {
        PositionsSnapshot positions = bridgeReader.readPositions();
        if (positions.stale()) {
            log.info("Positions snapshot stale, no fill baseline captured runId={}", run.getId());
            return;
        }
        Map<String, BigDecimal> quantities = new LinkedHashMap<>();
        for (TradeOrder order : orders) {
            BigDecimal held = positions.quantity(order.getSymbol());
            quantities.put(order.getSymbol(), held);
            order.getParams().setBaselineQuantity(held);
        }
        run.getParams().setPositionsBaseline(new PositionsBaseline(
                positions.refreshedAt() != null ? positions.refreshedAt() : now, quantities));
    }

    private static OrderIntent toIntent(TradeOrder order) {
        OrderParams params = order.getParams();
        OrderType type = Optional.ofNullable(OrderType.parse(order.getOrderType())).orElse(OrderType.MKT);
        OrderSide side = order.getSide();
        return new OrderIntent(
                params.getIntentId() != null ? params.getIntentId() : order.getClientOrderId(),
                order.getSymbol(),
                side,
                order.remainingQuantity(),
                params.getWeight() == null ? BigDecimal.ZERO : params.getWeight(),
                type,
                order.getLimitPrice(),
                params.getPrimePrice(),
                Boolean.TRUE.equals(params.getOutsideRth()));
    }
}
