package com.ledgerlens.adapter.stream;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Streaming endpoint carrying object-storage "object created" events. Reads use a consumer-group cursor that
 * commits on read.
 */
@ConfigurationProperties(prefix = "ledgerlens.stream")
@NoArgsConstructor
@Getter
@Setter
public class EventStreamProperties {

    /** Base URL up to and including the API version, e.g. {@code https://cell-1.streaming.us-phoenix-1.oci.oraclecloud.com/20180418}. */
    private String endpoint = "http://localhost:8091/20180418";

    private String streamId;

    private String groupName = "document-processors";

    private String instanceName = "ledgerlens-1";

    /** Optional Authorization header value, for deployments behind a signing proxy. */
    private String authorization;

    private long requestTimeoutMs = 15_000;
}
