package com.nexusbounty.model;

public enum BountyStatus {
    OPEN,
    COMPLETED,
    UNDER_REVIEW,
    EXPIRED,
    CANCELLED
}
