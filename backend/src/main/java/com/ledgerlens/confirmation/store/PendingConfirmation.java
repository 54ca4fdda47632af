package com.ledgerlens.confirmation.store;

import com.ledgerlens.domain.MergedResult;

import java.time.Instant;

/**
 * A merged classification waiting for the user's yes/no. One per user; a newer document replaces it.
 */
public record PendingConfirmation(
        String userId,
        String processingLogId,
        String documentId,
        MergedResult merged,
        Instant createdAt,
        Instant expiresAt
) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
