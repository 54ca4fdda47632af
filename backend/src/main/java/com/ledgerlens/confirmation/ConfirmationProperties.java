package com.ledgerlens.confirmation;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Pending-confirmation lifetime and store sizing.
 */
@ConfigurationProperties(prefix = "ledgerlens.confirmation")
@NoArgsConstructor
@Getter
@Setter
public class ConfirmationProperties {

    /** Hours a pending confirmation stays answerable. Default 24. */
    private long expiryHours = 24;

    /** How often (ms) expired slots are swept. Default 30 min. */
    private long sweepIntervalMs = 1_800_000;

    /** Upper bound on pending slots held in memory (one per user). */
    private long maxPending = 100_000;
}
