package com.chambua.pricing.model;

import java.util.EnumSet;
import java.util.Set;

public enum UploadStatus {
    PENDING,
    IN_PROGRESS,
    DONE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }

    public Set<UploadStatus> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(IN_PROGRESS, CANCELLED, FAILED);
            case IN_PROGRESS:
                return EnumSet.of(DONE, FAILED, CANCELLED);
            default:
                return EnumSet.noneOf(UploadStatus.class);
        }
    }

    public boolean canTransitionTo(UploadStatus next) {
        return next != null && allowedNext().contains(next);
    }
}
