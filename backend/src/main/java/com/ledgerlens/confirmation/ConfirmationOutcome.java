package com.ledgerlens.confirmation;

/**
 * Result of processing a user's reply. {@code transactionId} is set only for CONFIRMED.
 */
public record ConfirmationOutcome(Status status, String message, String processingLogId, String transactionId) {

    public enum Status {
        NOTHING_PENDING,
        CONFIRMED,
        REJECTED
    }

    public boolean confirmed() {
        return status == Status.CONFIRMED;
    }
}
