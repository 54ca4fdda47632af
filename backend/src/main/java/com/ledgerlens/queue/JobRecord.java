package com.ledgerlens.queue;

import java.time.Instant;

/** Retained summary of a finished job. {@code error} is null for completed jobs. */
public record JobRecord(String jobId, int attempts, Instant finishedAt, String error) {
}
