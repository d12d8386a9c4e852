package com.nexusbounty.controller.dto;

import com.nexusbounty.model.Payout;
import com.nexusbounty.model.PayoutStatus;
import com.nexusbounty.model.PayoutType;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

public final class PayoutResponses {

    private PayoutResponses() {
    }

    public record PayoutSummary(
            UUID payoutId,
            UUID submissionId,
            UUID disputeId,
            String recipient,
            BigDecimal amount,
            PayoutType payoutType,
            PayoutStatus status,
            Integer settlementVersion,
            String transactionHash,
            int attempts,
            String lastError,
            OffsetDateTime processedAt
    ) {
        public static PayoutSummary from(Payout payout) {
            return new PayoutSummary(
                    payout.getPayoutId(),
                    payout.getSubmissionId(),
                    payout.getDisputeId(),
                    payout.getRecipient(),
                    payout.getAmount(),
                    payout.getPayoutType(),
                    payout.getStatus(),
                    payout.getSettlementVersion(),
                    payout.getTransactionHash(),
                    payout.getAttempts() == null ? 0 : payout.getAttempts(),
                    payout.getLastError(),
                    payout.getProcessedAt()
            );
        }
    }
}
