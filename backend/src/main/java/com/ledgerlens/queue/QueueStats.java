package com.ledgerlens.queue;

public record QueueStats(String queue, int waiting, int active, int delayed, int completed, int failed) {
}
