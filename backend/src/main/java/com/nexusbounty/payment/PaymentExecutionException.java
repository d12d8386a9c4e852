package com.nexusbounty.payment;

public class PaymentExecutionException extends Exception {

    private final boolean retryable;

    public PaymentExecutionException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public PaymentExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.retryable = true;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
