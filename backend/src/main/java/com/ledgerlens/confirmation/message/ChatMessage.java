package com.ledgerlens.confirmation.message;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assistant-authored message pushed to a user outside a request/response exchange.
 */
public record ChatMessage(
        String id,
        String userId,
        ChatMessageType type,
        String role,
        String content,
        Instant timestamp,
        Map<String, Object> metadata
) {

    public static final String ASSISTANT_ROLE = "assistant";

    public ChatMessage {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
