package com.ledgerlens.api.controller;

import com.ledgerlens.confirmation.store.PendingConfirmationStats;
import com.ledgerlens.confirmation.store.PendingConfirmationStore;
import com.ledgerlens.queue.QueueService;
import com.ledgerlens.queue.QueueStats;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Operational counters: per-queue job stats and pending confirmation slots.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class QueueController {

    private final QueueService queueService;
    private final PendingConfirmationStore pendingConfirmationStore;

    @GetMapping("/queues/stats")
    public List<QueueStats> queueStats() {
        return queueService.getQueueStats();
    }

    @GetMapping("/confirmations/stats")
    public PendingConfirmationStats confirmationStats() {
        return pendingConfirmationStore.stats();
    }
}
