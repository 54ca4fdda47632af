package com.ledgerlens.ingestion;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Upload-event consumer config.
 */
@ConfigurationProperties(prefix = "ledgerlens.ingestion")
@NoArgsConstructor
@Getter
@Setter
public class IngestionProperties {

    /** Start the poll loop on application ready. Off by default so tests and local runs stay quiet. */
    private boolean enabled = false;

    /** Messages fetched per poll. */
    private int batchSize = 10;

    /** Pause (ms) between polls. */
    private long pollDelayMs = 2_000;

    /** Pause (ms) after a failed poll before retrying the same cursor. */
    private long errorDelayMs = 10_000;
}
