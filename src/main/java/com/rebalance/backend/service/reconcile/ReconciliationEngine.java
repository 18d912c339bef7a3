package com.rebalance.backend.service.reconcile;

import com.rebalance.backend.config.ExecutionProperties;
import com.rebalance.backend.config.ReconcileProperties;
import com.rebalance.backend.exception.NotFoundException;
import com.rebalance.backend.model.OrderStatus;
import com.rebalance.backend.model.RunStatus;
import com.rebalance.backend.model.TradeOrder;
import com.rebalance.backend.model.TradeRun;
import com.rebalance.backend.model.params.SubmissionMetadata;
import com.rebalance.backend.model.params.SubmissionSource;
import com.rebalance.backend.repository.TradeOrderRepository;
import com.rebalance.backend.repository.TradeRunRepository;
import com.rebalance.backend.service.bridge.BridgeReader;
import com.rebalance.backend.service.execution.FallbackRateLimiter;
import com.rebalance.backend.service.execution.ProcessLifecycleManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Brings a run's persisted state in line with what the broker bridge reports.
 *
 * <p>A pass holds the run row lock for its whole duration, so passes on the same run never interleave.
 * Every step only writes when its evidence changes something; a pass over unchanged inputs reports
 * {@code changed=false}. Terminal runs are never moved; their only work is stopping a leftover process.
 * Orders that belong to no run are reconciled together by {@link #reconcileFreeStanding()}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReconciliationEngine {

    private static final Set<String> FINAL_TERMINATION_OUTCOMES = Set.of(
            ProcessLifecycleManager.OUTCOME_TERMINATED,
            ProcessLifecycleManager.OUTCOME_NOT_RUNNING,
            ProcessLifecycleManager.OUTCOME_LEADER_PROTECTED);
    private static final Set<OrderStatus> OPEN_ORDER_STATUSES = EnumSet.of(OrderStatus.NEW, OrderStatus.SUBMITTED,
            OrderStatus.PARTIAL);
    private static final Set<OrderStatus> REOPENABLE_ORDER_STATUSES = EnumSet.of(OrderStatus.CANCELED,
            OrderStatus.SKIPPED);

    private final TradeRunRepository tradeRunRepository;
    private final TradeOrderRepository tradeOrderRepository;
    private final ReconcileProperties reconcileProperties;
    private final ExecutionProperties executionProperties;
    private final BridgeReader bridgeReader;
    private final ProcessLifecycleManager processLifecycleManager;
    private final ExecutionEventIngestor executionEventIngestor;
    private final CommandResultApplier commandResultApplier;
    private final OpenOrdersSync openOrdersSync;
    private final HoldingsFillInference holdingsFillInference;
    private final RuntimeErrorDetector runtimeErrorDetector;
    private final PendingSubmitMonitor pendingSubmitMonitor;
    private final RunCompletionEvaluator runCompletionEvaluator;
    private final StallDetector stallDetector;
    private final ExpiredCommandSweep expiredCommandSweep;
    private final FallbackRateLimiter fallbackRateLimiter;
    private final Clock clock;

    @Transactional
    public ReconcileResult reconcile(Long runId) {
        return reconcile(runId, ReconcilePassConfig.from(reconcileProperties, executionProperties, Instant.now(clock)));
    }

    @Transactional
    public ReconcileResult reconcile(Long runId, ReconcilePassConfig config) {
        TradeRun run = tradeRunRepository.findByIdForUpdate(runId)
                .orElseThrow(() -> new NotFoundException("Run not found: " + runId));
        String previousRunId = MDC.get("runId");
        MDC.put("runId", String.valueOf(runId));
        try {
            ReconcilePass pass = runPass(run, config);
            if (run.isTerminal()) {
                fallbackRateLimiter.release(runId);
            }
            if (pass.changed()) {
                tradeRunRepository.save(run);
                log.info("Reconcile pass changed run runId={} status={} actions={}", runId, run.getStatus(),
                        pass.actions());
            } else {
                log.debug("Reconcile pass no-op runId={} status={}", runId, run.getStatus());
            }
            return new ReconcileResult(runId, pass.changed(), run.getStatus(), run.getMessage(),
                    List.copyOf(pass.actions()));
        } finally {
            if (previousRunId == null) {
                MDC.remove("runId");
            } else {
                MDC.put("runId", previousRunId);
            }
        }
    }

    @Transactional
    public FreeStandingSweep reconcileFreeStanding() {
        return reconcileFreeStanding(ReconcilePassConfig.from(reconcileProperties, executionProperties, Instant.now(clock)));
    }

    /**
     * Applies broker evidence to orders that belong to no run. Those orders were sent through the leader,
     * so only its event log, command results and open-order list are consulted. The orders share one read
     * position per event log, starting from the furthest back any of them has reached.
     */
    @Transactional
    public FreeStandingSweep reconcileFreeStanding(ReconcilePassConfig config) {
        List<TradeOrder> orders = tradeOrderRepository.findFreeStandingForUpdate(OPEN_ORDER_STATUSES,
                REOPENABLE_ORDER_STATUSES, config.now().minus(config.lowConfidenceReopenGrace()));
        if (orders.isEmpty()) {
            return new FreeStandingSweep(0, false, List.of());
        }
        Map<String, Long> offsets = sharedOffsets(orders);
        ReconcilePass pass = ReconcilePass.freeStanding(orders, config, bridgeReader.readStatus().isHealthy(), offsets);
        executionEventIngestor.apply(pass);
        commandResultApplier.apply(pass);
        expiredCommandSweep.apply(pass);
        openOrdersSync.apply(pass);
        for (TradeOrder order : orders) {
            Map<String, Long> own = order.getParams().getEventLogOffsets();
            if (own != null && !offsets.equals(own)) {
                order.getParams().setEventLogOffsets(new LinkedHashMap<>(offsets));
            }
        }
        if (pass.changed()) {
            log.info("Free-standing orders reconciled count={} actions={}", orders.size(), pass.actions());
        }
        return new FreeStandingSweep(orders.size(), pass.changed(), List.copyOf(pass.actions()));
    }

    // Orders never submitted have no read position and nothing in the log to miss
    private static Map<String, Long> sharedOffsets(List<TradeOrder> orders) {
        Map<String, Long> shared = null;
        for (TradeOrder order : orders) {
            Map<String, Long> own = order.getParams().getEventLogOffsets();
            if (own == null) {
                continue;
            }
            if (shared == null) {
                shared = new LinkedHashMap<>(own);
                continue;
            }
            shared.keySet().retainAll(own.keySet());
            for (Map.Entry<String, Long> entry : own.entrySet()) {
                shared.computeIfPresent(entry.getKey(), (key, current) -> Math.min(current, entry.getValue()));
            }
        }
        return shared == null ? new LinkedHashMap<>() : shared;
    }

    private ReconcilePass runPass(TradeRun run, ReconcilePassConfig config) {
        int attempt = run.getParams().currentAttempt();
        List<TradeOrder> orders = tradeOrderRepository.findByRunIdOrderByIdAsc(run.getId()).stream()
                .filter(order -> order.getParams().attemptOrDefault() == attempt)
                .collect(Collectors.toList());
        SubmissionMetadata submission = run.getParams().getSubmission();
        Path outputDir = outputDir(submission);
        if (run.isTerminal() || !RunStatus.RECONCILABLE.contains(run.getStatus())) {
            ReconcilePass pass = new ReconcilePass(run, orders, config, outputDir, false);
            if (run.isTerminal()) {
                stopLeftoverProcess(pass);
            }
            return pass;
        }

        ReconcilePass pass = new ReconcilePass(run, orders, config, outputDir, isExecutorActive(submission));
        executionEventIngestor.apply(pass);
        commandResultApplier.apply(pass);
        openOrdersSync.apply(pass);
        holdingsFillInference.apply(pass);
        if (runtimeErrorDetector.apply(pass)) {
            run.getParams().setCompletionSummary(runCompletionEvaluator.summarize(orders));
            stopLeftoverProcess(pass);
            return pass;
        }
        pendingSubmitMonitor.apply(pass);

        Optional<RunCompletionEvaluator.Completion> completion = runCompletionEvaluator.evaluate(orders);
        if (completion.isPresent()) {
            RunCompletionEvaluator.Completion done = completion.get();
            run.getParams().setCompletionSummary(done.summary());
            run.transitionTo(done.status(), done.message(), config.now());
            pass.markChanged("run:" + done.status());
            stopLeftoverProcess(pass);
        } else {
            stallDetector.apply(pass);
        }
        return pass;
    }

    private void stopLeftoverProcess(ReconcilePass pass) {
        SubmissionMetadata submission = pass.run().getParams().getSubmission();
        if (submission == null || submission.getSource() == null || !submission.getSource().isShortLived()
                || submission.getPid() == null) {
            return;
        }
        String previous = submission.getTerminationOutcome();
        if (previous != null && FINAL_TERMINATION_OUTCOMES.contains(previous)) {
            return;
        }
        String outcome = processLifecycleManager.terminateIfRunning(pass.run().getId(), submission.getPid(),
                bridgeReader.readStatus().pid());
        if (ProcessLifecycleManager.OUTCOME_KILL_REQUESTED.equals(previous)) {
            if (ProcessLifecycleManager.OUTCOME_KILL_REQUESTED.equals(outcome)) {
                return;
            }
            if (ProcessLifecycleManager.OUTCOME_NOT_RUNNING.equals(outcome)) {
                outcome = ProcessLifecycleManager.OUTCOME_TERMINATED;
            }
        }
        submission.setTerminationOutcome(outcome);
        submission.setTerminationAt(pass.config().now());
        pass.markChanged("process:" + outcome);
    }

    private boolean isExecutorActive(SubmissionMetadata submission) {
        if (submission == null || submission.getSource() == null) {
            return false;
        }
        if (submission.getSource() == SubmissionSource.LEADER_COMMAND) {
            return bridgeReader.readStatus().isHealthy();
        }
        return processLifecycleManager.isAlive(submission.getPid());
    }

    private static Path outputDir(SubmissionMetadata submission) {
        if (submission == null || submission.getOutputDir() == null) {
            return null;
        }
        return Path.of(submission.getOutputDir());
    }
}
