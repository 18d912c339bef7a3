package com.rebalance.backend.dto;

import com.rebalance.backend.service.reconcile.ReconcileResult;

import java.util.List;

public record RefreshResponse(Long runId, boolean changed, String status, String message, List<String> actions) {

    public static RefreshResponse from(ReconcileResult result) {
        return new RefreshResponse(result.runId(), result.changed(), result.status().name(), result.message(),
                result.actions());
    }
}
