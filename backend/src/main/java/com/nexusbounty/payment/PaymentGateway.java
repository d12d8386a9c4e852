package com.nexusbounty.payment;

/**
 * Executes one payout against the payment rail. Implementations must treat the instruction's
 * idempotency key as the deduplication key: executing the same key twice must not pay twice.
 */
public interface PaymentGateway {

    TransactionHandle execute(PayoutInstruction instruction) throws PaymentExecutionException;
}
