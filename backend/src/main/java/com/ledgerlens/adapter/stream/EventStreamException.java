package com.ledgerlens.adapter.stream;

/**
 * Cursor creation or message read failed.
 */
public class EventStreamException extends RuntimeException {

    public EventStreamException(String message) {
        super(message);
    }

    public EventStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
