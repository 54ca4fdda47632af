package com.ledgerlens.queue.job;

import java.util.Locale;

public enum CompletionStatus {
    COMPLETED,
    FAILED,
    MANUAL_REVIEW;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
