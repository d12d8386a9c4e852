package com.nexusbounty.payment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Hash;

import java.time.OffsetDateTime;

/**
 * Payment gateway that signs nothing. The transaction hash is derived from the idempotency key,
 * so repeated execution of a payout reports the same hash.
 */
@Component
@ConditionalOnProperty(
        prefix = "nexus.settlement.payment",
        name = "mode",
        havingValue = "mock",
        matchIfMissing = true
)
public class MockPaymentGateway implements PaymentGateway {

    private static final Logger log = LoggerFactory.getLogger(MockPaymentGateway.class);

    @Override
    public TransactionHandle execute(PayoutInstruction instruction) throws PaymentExecutionException {
        if (instruction.amount() == null || instruction.amount().signum() <= 0) {
            throw new PaymentExecutionException("Payout amount must be positive", false);
        }
        String transactionHash = Hash.sha3String(instruction.idempotencyKey());
        log.debug("Mock payment executed: {} {} to {} ({})",
                instruction.payoutType(), instruction.amount(), instruction.recipient(), transactionHash);
        return new TransactionHandle(transactionHash, OffsetDateTime.now());
    }
}
