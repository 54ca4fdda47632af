package com.ledgerlens.ingestion;

import java.util.List;

/** Messages read from one cursor position, plus the cursor to continue from. */
public record StreamBatch(List<StreamMessage> messages, String nextCursor) {

    public StreamBatch {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
