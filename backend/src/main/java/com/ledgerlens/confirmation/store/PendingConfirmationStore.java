package com.ledgerlens.confirmation.store;

import java.util.Optional;

/**
 * Per-user slot holding the confirmation the user is expected to answer next.
 */
public interface PendingConfirmationStore {

    /** Stores the slot, replacing any previous one for the same user. */
    void put(PendingConfirmation pending);

    /**
     * Removes and returns the user's slot. Empty when there is none or it has expired (an expired slot is removed
     * as well).
     */
    Optional<PendingConfirmation> getAndDelete(String userId);

    boolean hasPending(String userId);

    /** @return number of expired slots removed */
    int sweepExpired();

    PendingConfirmationStats stats();
}
