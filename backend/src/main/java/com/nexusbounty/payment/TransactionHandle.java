package com.nexusbounty.payment;

import java.time.OffsetDateTime;

public record TransactionHandle(String transactionHash, OffsetDateTime submittedAt) {
}
