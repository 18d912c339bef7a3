package com.rebalance.backend.dto;

import com.rebalance.backend.model.SystemGuardState;

import java.time.Instant;

public record GuardStateResponse(boolean halted, String haltReason, Instant haltedAt, Instant updatedAt) {

    public static GuardStateResponse from(SystemGuardState state) {
        return new GuardStateResponse(state.isHalted(), state.getHaltReason(), state.getHaltedAt(), state.getUpdatedAt());
    }
}
