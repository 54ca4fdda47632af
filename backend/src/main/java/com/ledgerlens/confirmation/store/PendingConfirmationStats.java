package com.ledgerlens.confirmation.store;

/** Snapshot of the pending store: all held slots and how many of them are already expired. */
public record PendingConfirmationStats(long total, long expired) {
}
