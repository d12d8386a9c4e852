package com.nexusbounty.model;

public enum DisputeStatus {
    OPEN,
    UNDER_REVIEW,
    RESOLVED,
    REJECTED;

    public boolean isActive() {
        return this == OPEN || this == UNDER_REVIEW;
    }
}
