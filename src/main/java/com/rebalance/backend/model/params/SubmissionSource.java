package com.rebalance.backend.model.params;

public enum SubmissionSource {
    LEADER_COMMAND,
    SHORT_LIVED,
    SHORT_LIVED_FALLBACK;

    public boolean isShortLived() {
        return this != LEADER_COMMAND;
    }
}
