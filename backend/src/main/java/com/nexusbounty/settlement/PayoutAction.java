package com.nexusbounty.settlement;

import com.nexusbounty.model.PayoutType;

import java.math.BigDecimal;
import java.util.UUID;

public record PayoutAction(
        PayoutType type,
        String recipient,
        BigDecimal amount,
        UUID submissionId,
        UUID disputeId,
        String idempotencyKey
) {
}
