package com.nexusbounty.payment;

import com.nexusbounty.model.PayoutType;

import java.math.BigDecimal;
import java.util.UUID;

public record PayoutInstruction(
        UUID payoutId,
        String idempotencyKey,
        String recipient,
        BigDecimal amount,
        PayoutType payoutType
) {
}
