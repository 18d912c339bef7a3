package com.rebalance.backend.service.reconcile;

import com.rebalance.backend.model.RunStatus;
import com.rebalance.backend.model.TradeOrder;
import com.rebalance.backend.model.TradeRun;
import com.rebalance.backend.model.params.RuntimeFallback;
import com.rebalance.backend.model.params.SubmitCommandState;
import com.rebalance.backend.service.TradeMetrics;
import com.rebalance.backend.service.execution.SubmissionDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Watches leader submit commands that never got a result and hands their orders to the fallback process.
 */
@Component
@Slf4j
@RequiredArgsConstructor
class PendingSubmitMonitor {

    private final SubmissionDispatcher submissionDispatcher;
    private final TradeMetrics tradeMetrics;

    void apply(ReconcilePass pass) {
        TradeRun run = pass.run();
        Instant now = pass.config().now();
        List<TradeOrder> timedOut = timedOut(pass);
        if (timedOut.isEmpty()) {
            autoResume(pass);
            return;
        }
        if (submissionDispatcher.triggerRuntimeFallback(run, timedOut, now)) {
            run.transitionTo(RunStatus.RUNNING, SubmissionDispatcher.MESSAGE_FALLBACK, now);
            pass.progress("runtime_fallback", "launched:" + timedOut.size());
            return;
        }
        if (run.getStatus() == RunStatus.RUNNING) {
            run.markStalled(SubmissionDispatcher.REASON_PENDING_TIMEOUT, now);
            tradeMetrics.recordRunStalled();
            log.warn("Run stalled on pending submit commands runId={} orders={}", run.getId(), timedOut.size());
            pass.markChanged("run:stalled:" + SubmissionDispatcher.REASON_PENDING_TIMEOUT);
        }
    }

    List<TradeOrder> timedOut(ReconcilePass pass) {
        Duration timeout = pass.config().submitPendingTimeout();
        List<TradeOrder> result = new ArrayList<>();
        for (TradeOrder order : pass.orders()) {
            SubmitCommandState command = order.getParams().getSubmitCommand();
            if (order.isTerminal() || command == null || !command.isPending() || command.isSuperseded()) {
                continue;
            }
            Instant requestedAt = command.getRequestedAt();
            if (requestedAt != null && Duration.between(requestedAt, pass.config().now()).compareTo(timeout) >= 0) {
                result.add(order);
            }
        }
        return result;
    }

    private void autoResume(ReconcilePass pass) {
        TradeRun run = pass.run();
        RuntimeFallback fallback = run.getParams().getRuntimeFallback();
        if (run.getStatus() != RunStatus.STALLED
                || !SubmissionDispatcher.REASON_PENDING_TIMEOUT.equals(run.getStalledReason())
                || fallback == null || !fallback.isTriggered()) {
            return;
        }
        Instant now = pass.config().now();
        run.transitionTo(RunStatus.RUNNING, SubmissionDispatcher.MESSAGE_FALLBACK, now);
        fallback.setAutoResumedAt(now);
        log.info("Stalled run resumed after fallback runId={}", run.getId());
        pass.progress("runtime_fallback", "auto_resumed");
    }
}
