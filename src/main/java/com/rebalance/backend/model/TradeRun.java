package com.rebalance.backend.model;

import com.rebalance.backend.model.params.RunParams;
import com.rebalance.backend.model.params.RunParamsConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

@Entity
@Table(name = "trade_runs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Slf4j
public class TradeRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_id", nullable = false)
    private Long projectId;

    @Column(name = "decision_snapshot_id")
    private Long decisionSnapshotId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TradeMode mode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private RunStatus status = RunStatus.QUEUED;

    @Column(length = 512)
    private String message;

    @Convert(converter = RunParamsConverter.class)
    @Column(name = "params")
    @Builder.Default
    private RunParams params = new RunParams();

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "last_progress_at")
    private Instant lastProgressAt;

    @Column(name = "progress_stage", length = 64)
    private String progressStage;

    @Column(name = "progress_reason", length = 255)
    private String progressReason;

    @Column(name = "stalled_at")
    private Instant stalledAt;

    @Column(name = "stalled_reason", length = 255)
    private String stalledReason;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    /**
     * Moves the run forward.
     * @throws IllegalStateException if the transition is not part of the run graph
     */
    public void transitionTo(RunStatus target, String newMessage, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                    String.format("Invalid run transition: %s -> %s for run %s", status, target, id));
        }
        RunStatus previous = this.status;
        this.status = target;
        if (newMessage != null) {
            this.message = newMessage;
        }
        if (target == RunStatus.RUNNING && startedAt == null) {
            this.startedAt = now;
        }
        if (target.isTerminal() && endedAt == null) {
            this.endedAt = now;
        }
        if (target != RunStatus.STALLED) {
            this.stalledAt = null;
            this.stalledReason = null;
        }
        this.updatedAt = now;
        if (previous != target) {
            log.info("Run state transition runId={} from={} to={} message={}", id, previous, target, this.message);
        }
    }

    public void markStalled(String reason, Instant now) {
        transitionTo(RunStatus.STALLED, "stalled", now);
        this.stalledAt = now;
        this.stalledReason = reason;
    }

    public void markProgress(String stage, String reason, Instant now) {
        this.lastProgressAt = now;
        this.progressStage = stage;
        this.progressReason = reason;
        this.updatedAt = now;
    }

    /**
     * Operator re-execution of a blocked or failed run. Bypasses the forward-only graph on purpose.
     */
    public void requeue(Instant now) {
        log.info("Run requeued runId={} from={}", id, status);
        this.status = RunStatus.QUEUED;
        this.endedAt = null;
        this.stalledAt = null;
        this.stalledReason = null;
        this.updatedAt = now;
    }
}
