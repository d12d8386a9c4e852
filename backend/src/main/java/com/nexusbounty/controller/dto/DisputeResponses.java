package com.nexusbounty.controller.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.nexusbounty.model.BountyStatus;
import com.nexusbounty.model.Dispute;
import com.nexusbounty.model.DisputeStatus;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

public final class DisputeResponses {

    private DisputeResponses() {
    }

    public record DisputeDetail(
            UUID disputeId,
            UUID bountyId,
            UUID submissionId,
            String disputerId,
            String disputerWallet,
            String reason,
            JsonNode evidence,
            BigDecimal stakeAmount,
            boolean adminOverride,
            DisputeStatus status,
            String resolution,
            String resolverId,
            OffsetDateTime createdAt,
            OffsetDateTime resolvedAt
    ) {
        public static DisputeDetail from(Dispute dispute) {
            return new DisputeDetail(
                    dispute.getDisputeId(),
                    dispute.getBountyId(),
                    dispute.getSubmissionId(),
                    dispute.getDisputerId(),
                    dispute.getDisputerWallet(),
                    dispute.getReason(),
                    dispute.getEvidenceJson(),
                    dispute.getStakeAmount(),
                    Boolean.TRUE.equals(dispute.getAdminOverride()),
                    dispute.getStatus(),
                    dispute.getResolution(),
                    dispute.getResolverId(),
                    dispute.getCreatedAt(),
                    dispute.getResolvedAt()
            );
        }
    }

    /**
     * @param bountyStatus status of the bounty once the decision has been applied
     */
    public record DisputeDecision(DisputeDetail dispute, BountyStatus bountyStatus) {
    }
}
