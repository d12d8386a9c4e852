package com.nexusbounty.model;

public enum DisputeResolution {
    ACCEPTED,
    REJECTED
}
