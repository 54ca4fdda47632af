package com.ledgerlens.ingestion;

/**
 * Cursor-based stream of object-storage notifications.
 */
public interface UploadEventStream {

    /** Cursor positioned at the oldest message not yet committed by this consumer group. */
    String createCursor();

    StreamBatch getMessages(String cursor, int limit);
}
