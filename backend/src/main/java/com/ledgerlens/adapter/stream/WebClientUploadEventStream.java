package com.ledgerlens.adapter.stream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.ledgerlens.ingestion.StreamBatch;
import com.ledgerlens.ingestion.StreamMessage;
import com.ledgerlens.ingestion.UploadEventStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Streaming REST client: group cursors and message reads. Keys and values arrive base64-encoded.
 */
@Slf4j
public class WebClientUploadEventStream implements UploadEventStream {

    static final String NEXT_CURSOR_HEADER = "opc-next-cursor";

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CursorResponse(String value) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record WireMessage(String key, String value, Long offset, String partition) {
    }

    private final WebClient webClient;
    private final EventStreamProperties properties;

    public WebClientUploadEventStream(WebClient.Builder builder, EventStreamProperties properties) {
        WebClient.Builder b = builder.baseUrl(properties.getEndpoint());
        if (properties.getAuthorization() != null && !properties.getAuthorization().isBlank()) {
            b = b.defaultHeader(HttpHeaders.AUTHORIZATION, properties.getAuthorization());
        }
        this.webClient = b.build();
        this.properties = properties;
    }

    @Override
    public String createCursor() {
        Map<String, Object> body = Map.of(
                "groupName", properties.getGroupName(),
                "instanceName", properties.getInstanceName(),
                "type", "TRIM_HORIZON",
                "commitOnGet", true);
        CursorResponse response;
        try {
            response = webClient.post()
                    .uri("/streams/{streamId}/groupCursors", properties.getStreamId())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(CursorResponse.class)
                    .onErrorMap(WebClientResponseException.class,
                            e -> new EventStreamException("Cursor request failed with HTTP " + e.getStatusCode().value(), e))
                    .block(Duration.ofMillis(properties.getRequestTimeoutMs()));
        } catch (EventStreamException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EventStreamException("Cursor request failed: " + e.getMessage(), e);
        }
        if (response == null || response.value() == null) {
            throw new EventStreamException("Cursor response without value");
        }
        log.info("Group cursor created for {} / {}", properties.getGroupName(), properties.getInstanceName());
        return response.value();
    }

    @Override
    public StreamBatch getMessages(String cursor, int limit) {
        ResponseEntity<List<WireMessage>> response;
        try {
            response = webClient.get()
                    .uri(uri -> uri.path("/streams/{streamId}/messages")
                            .queryParam("cursor", cursor)
                            .queryParam("limit", limit)
                            .build(properties.getStreamId()))
                    .retrieve()
                    .toEntityList(WireMessage.class)
                    .onErrorMap(WebClientResponseException.class,
                            e -> new EventStreamException("Message read failed with HTTP " + e.getStatusCode().value(), e))
                    .block(Duration.ofMillis(properties.getRequestTimeoutMs()));
        } catch (EventStreamException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EventStreamException("Message read failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new EventStreamException("Message read returned nothing");
        }
        return new StreamBatch(decode(response.getBody()), response.getHeaders().getFirst(NEXT_CURSOR_HEADER));
    }

    static List<StreamMessage> decode(List<WireMessage> wire) {
        List<StreamMessage> out = new ArrayList<>();
        if (wire == null) {
            return out;
        }
        for (WireMessage m : wire) {
            try {
                out.add(new StreamMessage(decodeBase64(m.key()), decodeBase64(m.value()),
                        m.offset() == null ? -1 : m.offset()));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping stream message at offset {}: value is not base64", m.offset());
            }
        }
        return out;
    }

    private static String decodeBase64(String value) {
        if (value == null) {
            return null;
        }
        return new String(Base64.getDecoder().decode(value), StandardCharsets.UTF_8);
    }
}
