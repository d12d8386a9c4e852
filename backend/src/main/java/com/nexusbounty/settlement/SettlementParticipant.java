package com.nexusbounty.settlement;

import com.nexusbounty.model.SubmissionStatus;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One submission as seen by the planner.
 *
 * @param weight the vote weight used in the resolving pass; ignored for non-correct submissions
 */
public record SettlementParticipant(
        UUID submissionId,
        String recipient,
        BigDecimal stakeAmount,
        SubmissionStatus status,
        BigDecimal weight,
        OffsetDateTime submittedAt
) {
}
