package com.rebalance.backend.service.reconcile;

import com.rebalance.backend.model.RunStatus;
import com.rebalance.backend.model.TradeRun;
import com.rebalance.backend.repository.TradeRunRepository;
import com.rebalance.backend.service.ScheduledTaskGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Periodically reconciles every running or stalled run, and the orders that belong to no run, so that status
 * moves without anyone polling the API.
 * Each run is reconciled in its own transaction; a failure on one run does not stop the sweep.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "reconcile", name = "refresher-enabled", havingValue = "true", matchIfMissing = true)
public class ActiveRunRefresher {

    private final TradeRunRepository tradeRunRepository;
    private final ReconciliationEngine reconciliationEngine;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(fixedDelayString = "${reconcile.refresh-interval-seconds:30}",
            initialDelayString = "${reconcile.refresh-interval-seconds:30}",
            timeUnit = TimeUnit.SECONDS)
    public void refreshActiveRuns() {
        scheduledTaskGuard.run("free_standing_refresh", null, reconciliationEngine::reconcileFreeStanding);
        List<TradeRun> runs = tradeRunRepository.findByStatusInOrderByIdAsc(RunStatus.RECONCILABLE);
        if (runs.isEmpty()) {
            return;
        }
        log.debug("Refreshing active runs count={}", runs.size());
        for (TradeRun run : runs) {
            scheduledTaskGuard.run("active_run_refresh", run.getId(), () -> {
                ReconcileResult result = reconciliationEngine.reconcile(run.getId());
                if (result.changed()) {
                    log.info("Active run refreshed runId={} status={} actions={}", run.getId(), result.status(),
                            result.actions().size());
                }
            });
        }
    }
}
