package com.ledgerlens.confirmation.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.ledgerlens.confirmation.ConfirmationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Process-local store backed by a size-bounded Caffeine cache. Expiry is judged against each slot's own
 * {@code expiresAt} so a slot is never answerable past its deadline, even between sweeps.
 */
@Component
@Slf4j
public class InMemoryPendingConfirmationStore implements PendingConfirmationStore {

    private final Cache<String, PendingConfirmation> slots;
    private final Clock clock;

    public InMemoryPendingConfirmationStore(ConfirmationProperties confirmationProperties, Clock clock) {
        this.slots = Caffeine.newBuilder()
                .maximumSize(confirmationProperties.getMaxPending())
                .build();
        this.clock = clock;
    }

    @Override
    public void put(PendingConfirmation pending) {
        PendingConfirmation previous = slots.asMap().put(pending.userId(), pending);
        if (previous != null) {
            log.info("Pending confirmation for user {} replaced (log {} -> {})",
                    pending.userId(), previous.processingLogId(), pending.processingLogId());
        }
    }

    @Override
    public Optional<PendingConfirmation> getAndDelete(String userId) {
        PendingConfirmation pending = slots.asMap().remove(userId);
        if (pending == null) {
            return Optional.empty();
        }
        if (pending.isExpired(Instant.now(clock))) {
            log.debug("Pending confirmation for user {} expired at {}", userId, pending.expiresAt());
            return Optional.empty();
        }
        return Optional.of(pending);
    }

    @Override
    public boolean hasPending(String userId) {
        PendingConfirmation pending = slots.getIfPresent(userId);
        return pending != null && !pending.isExpired(Instant.now(clock));
    }

    @Scheduled(fixedDelayString = "${ledgerlens.confirmation.sweep-interval-ms:1800000}")
    public void scheduledSweep() {
        sweepExpired();
    }

    @Override
    public int sweepExpired() {
        Instant now = Instant.now(clock);
        int before = slots.asMap().size();
        slots.asMap().values().removeIf(p -> p.isExpired(now));
        int removed = before - slots.asMap().size();
        if (removed > 0) {
            log.info("Swept {} expired pending confirmation(s)", removed);
        }
        return Math.max(0, removed);
    }

    @Override
    public PendingConfirmationStats stats() {
        Instant now = Instant.now(clock);
        long expired = slots.asMap().values().stream().filter(p -> p.isExpired(now)).count();
        return new PendingConfirmationStats(slots.asMap().size(), expired);
    }
}
