package com.rebalance.backend.dto;

import com.rebalance.backend.model.TradeRun;
import com.rebalance.backend.model.params.RunParams;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunResponse {
    private Long id;
    private Long projectId;
    private Long decisionSnapshotId;
    private String mode;
    private String status;
    private String message;
    private RunParams params;
    private Instant createdAt;
    private Instant startedAt;
    private Instant endedAt;
    private Instant updatedAt;
    private Instant lastProgressAt;
    private String progressStage;
    private String progressReason;
    private Instant stalledAt;
    private String stalledReason;

    public static RunResponse from(TradeRun run) {
        return RunResponse.builder()
                .id(run.getId())
                .projectId(run.getProjectId())
                .decisionSnapshotId(run.getDecisionSnapshotId())
                .mode(run.getMode().name())
                .status(run.getStatus().name())
                .message(run.getMessage())
                .params(run.getParams())
                .createdAt(run.getCreatedAt())
                .startedAt(run.getStartedAt())
                .endedAt(run.getEndedAt())
                .updatedAt(run.getUpdatedAt())
                .lastProgressAt(run.getLastProgressAt())
                .progressStage(run.getProgressStage())
                .progressReason(run.getProgressReason())
                .stalledAt(run.getStalledAt())
                .stalledReason(run.getStalledReason())
                .build();
    }
}
