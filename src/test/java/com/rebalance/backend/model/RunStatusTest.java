package com.rebalance.backend.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunStatusTest {

    @Test
    void runningMayStallAndResume() {
        assertThat(RunStatus.RUNNING.canTransitionTo(RunStatus.STALLED)).isTrue();
        assertThat(RunStatus.STALLED.canTransitionTo(RunStatus.RUNNING)).isTrue();
    }

    @Test
    void blockedOnlyCancels() {
        assertThat(RunStatus.BLOCKED.canTransitionTo(RunStatus.CANCELED)).isTrue();
        assertThat(RunStatus.BLOCKED.canTransitionTo(RunStatus.RUNNING)).isFalse();
    }

    @Test
    void terminalRunRejectsTransition() {
        TradeRun run = TradeRun.builder().id(7L).status(RunStatus.DONE).build();

        assertThatThrownBy(() -> run.transitionTo(RunStatus.RUNNING, "again", Instant.now()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("DONE -> RUNNING");
    }

    @Test
    void leavingStalledClearsStallMarkers() {
        Instant now = Instant.parse("2026-03-02T15:00:00Z");
        TradeRun run = TradeRun.builder().id(1L).status(RunStatus.RUNNING).build();
        run.markStalled("no_progress", now);
        assertThat(run.getStalledReason()).isEqualTo("no_progress");

        run.transitionTo(RunStatus.RUNNING, "manual_resume", now.plusSeconds(60));

        assertThat(run.getStalledAt()).isNull();
        assertThat(run.getStalledReason()).isNull();
        assertThat(run.getStartedAt()).isEqualTo(now.plusSeconds(60));
    }
}
