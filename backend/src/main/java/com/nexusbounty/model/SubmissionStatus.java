package com.nexusbounty.model;

public enum SubmissionStatus {
    PENDING,
    CORRECT,
    INCORRECT,
    EXCLUDED
}
