package com.nexusbounty.model;

public enum SettlementKind {
    RESOLUTION,
    EXPIRY,
    DISPUTE_CORRECTION
}
