package com.ledgerlens.pipeline.vision;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Vision stage config.
 */
@ConfigurationProperties(prefix = "ledgerlens.vision")
@NoArgsConstructor
@Getter
@Setter
public class VisionProperties {

    /** Total structured attempts before the raw-JSON fallback. Default 3. */
    private int maxSchemaRetries = 3;

    /** Confidence reported when the vision stage produced nothing usable. */
    private double failureConfidence = 0.1;
}
