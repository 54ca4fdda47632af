package com.ledgerlens.ingestion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Object-storage event envelope as published on the stream.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UploadEvent(
        String eventType,
        String eventTime,
        @JsonProperty("eventID") String eventId,
        String source,
        Data data
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(String resourceName, String resourceId, String compartmentId,
                       AdditionalDetails additionalDetails) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AdditionalDetails(String bucketName, String namespace, String eTag) {
    }
}
