package com.rebalance.backend.service.reconcile;

import com.rebalance.backend.config.ExecutionProperties;
import com.rebalance.backend.config.ReconcileProperties;
import lombok.Builder;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Thresholds and the clock reading used for one reconciliation pass.
 */
@Builder
public record ReconcilePassConfig(
        Instant now,
        Duration openOrdersGrace,
        Duration openOrdersRunGrace,
        Duration openOrdersInactiveGrace,
        Duration unconfirmedFinalize,
        Duration unconfirmedFinalizeInactive,
        Duration newOrderMinAge,
        Duration fallbackGrace,
        Duration submitPendingTimeout,
        Duration lowConfidenceReopenGrace,
        Duration stallWindow,
        Duration defaultStallDeadline,
        ZoneId marketZone
) {

    public static ReconcilePassConfig from(ReconcileProperties reconcile, ExecutionProperties execution, Instant now) {
        return ReconcilePassConfig.builder()
                .now(now)
                .openOrdersGrace(Duration.ofSeconds(reconcile.getOpenOrdersGraceSeconds()))
                .openOrdersRunGrace(Duration.ofSeconds(reconcile.getOpenOrdersRunGraceSeconds()))
                .openOrdersInactiveGrace(Duration.ofSeconds(reconcile.getOpenOrdersInactiveGraceSeconds()))
                .unconfirmedFinalize(Duration.ofSeconds(reconcile.getUnconfirmedFinalizeSeconds()))
                .unconfirmedFinalizeInactive(Duration.ofSeconds(reconcile.getUnconfirmedFinalizeInactiveSeconds()))
                .newOrderMinAge(Duration.ofSeconds(reconcile.getNewOrderMinAgeSeconds()))
                .fallbackGrace(Duration.ofSeconds(reconcile.getFallbackGraceSeconds()))
                .submitPendingTimeout(Duration.ofSeconds(execution.getSubmitPendingTimeoutSeconds()))
                .lowConfidenceReopenGrace(Duration.ofSeconds(reconcile.getLowConfidenceReopenGraceSeconds()))
                .stallWindow(Duration.ofMinutes(reconcile.getStallWindowMinutes()))
                .defaultStallDeadline(Duration.ofMinutes(execution.getStallDeadlineMinutes()))
                .marketZone(ZoneId.of(reconcile.getMarketTimezone()))
                .build();
    }
}
