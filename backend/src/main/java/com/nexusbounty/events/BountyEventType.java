package com.nexusbounty.events;

public enum BountyEventType {
    BOUNTY_COMPLETED,
    BOUNTY_EXPIRED,
    DISPUTE_RESOLVED
}
