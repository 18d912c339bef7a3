package com.rebalance.backend.model;

import java.util.EnumSet;
import java.util.Set;

public enum RunStatus {
    QUEUED,
    RUNNING,
    BLOCKED,
    STALLED,
    DONE,
    PARTIAL,
    FAILED,
    CANCELED;

    public static final Set<RunStatus> ACTIVE = EnumSet.of(QUEUED, RUNNING, STALLED);
    public static final Set<RunStatus> RECONCILABLE = EnumSet.of(RUNNING, STALLED);

    public boolean isTerminal() {
        return this == DONE || this == PARTIAL || this == FAILED || this == CANCELED;
    }

    public boolean canTransitionTo(RunStatus target) {
        if (target == null) return false;
        if (this == target) return true;

        return switch (this) {
            case QUEUED -> target == RUNNING || target == BLOCKED || target == DONE || target == FAILED
                    || target == CANCELED;
            case RUNNING -> target == STALLED || target == DONE || target == PARTIAL || target == FAILED
                    || target == CANCELED;
            case STALLED -> target == RUNNING || target == DONE || target == PARTIAL || target == FAILED
                    || target == CANCELED;
            case BLOCKED -> target == CANCELED;
            default -> false;
        };
    }
}
