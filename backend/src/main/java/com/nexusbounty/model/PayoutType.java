package com.nexusbounty.model;

public enum PayoutType {
    BOUNTY_REWARD,
    STAKE_RETURN,
    STAKE_SLASH,
    FEE,
    REFUND
}
