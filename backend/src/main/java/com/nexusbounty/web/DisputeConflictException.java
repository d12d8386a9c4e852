package com.nexusbounty.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class DisputeConflictException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public DisputeConflictException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public static DisputeConflictException bountyNotCompleted(String detail) {
        return new DisputeConflictException(HttpStatus.CONFLICT, "bounty_not_completed", detail);
    }

    public static DisputeConflictException notEligible(String detail) {
        return new DisputeConflictException(HttpStatus.CONFLICT, "dispute_not_eligible", detail);
    }

    public static DisputeConflictException alreadyDisputed(String detail) {
        return new DisputeConflictException(HttpStatus.CONFLICT, "already_disputed", detail);
    }

    public static DisputeConflictException invalidTransition(String detail) {
        return new DisputeConflictException(HttpStatus.CONFLICT, "invalid_dispute_transition", detail);
    }

    public static DisputeConflictException insufficientStake(String detail) {
        return new DisputeConflictException(HttpStatus.BAD_REQUEST, "insufficient_stake", detail);
    }

    public static DisputeConflictException invalidSubmission(String detail) {
        return new DisputeConflictException(HttpStatus.NOT_FOUND, "invalid_submission", detail);
    }

    public static DisputeConflictException disputeNotFound(String detail) {
        return new DisputeConflictException(HttpStatus.NOT_FOUND, "dispute_not_found", detail);
    }
}
