package com.rebalance.backend.service.reconcile;

import com.rebalance.backend.model.RunStatus;
import com.rebalance.backend.model.TradeRun;
import com.rebalance.backend.service.TradeMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Flags runs that stopped making progress during market hours and fails stalled runs past their deadline.
 */
@Component
@Slf4j
@RequiredArgsConstructor
class StallDetector {

    static final String NO_PROGRESS = "no_progress";
    static final String DEADLINE_EXCEEDED = "stalled_deadline_exceeded";

    private final TradeMetrics tradeMetrics;

    void apply(ReconcilePass pass) {
        TradeRun run = pass.run();
        ReconcilePassConfig config = pass.config();
        Instant now = config.now();
        if (run.getStatus() == RunStatus.RUNNING) {
            if (!MarketClock.isOpen(now, config.marketZone())) {
                return;
            }
            Instant anchor = progressAnchor(run);
            if (anchor != null && Duration.between(anchor, now).compareTo(config.stallWindow()) >= 0) {
                run.markStalled(NO_PROGRESS, now);
                tradeMetrics.recordRunStalled();
                log.warn("Run stalled runId={} lastProgressAt={}", run.getId(), anchor);
                pass.markChanged("run:stalled:" + NO_PROGRESS);
            }
        } else if (run.getStatus() == RunStatus.STALLED) {
            Instant stalledAt = run.getStalledAt() != null ? run.getStalledAt() : progressAnchor(run);
            if (stalledAt != null && Duration.between(stalledAt, now).compareTo(deadline(run, config)) >= 0) {
                run.transitionTo(RunStatus.FAILED, DEADLINE_EXCEEDED, now);
                log.warn("Stalled run failed past deadline runId={} stalledAt={}", run.getId(), stalledAt);
                pass.markChanged("run:" + DEADLINE_EXCEEDED);
            }
        }
    }

    private static Instant progressAnchor(TradeRun run) {
        if (run.getLastProgressAt() != null) {
            return run.getLastProgressAt();
        }
        if (run.getStartedAt() != null) {
            return run.getStartedAt();
        }
        return run.getUpdatedAt() != null ? run.getUpdatedAt() : run.getCreatedAt();
    }

    private static Duration deadline(TradeRun run, ReconcilePassConfig config) {
        Long minutes = run.getParams().getStallDeadlineMinutes();
        return minutes != null && minutes > 0 ? Duration.ofMinutes(minutes) : config.defaultStallDeadline();
    }
}
