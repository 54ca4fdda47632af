package com.ledgerlens.ingestion;

/** One stream record; {@code value} is the decoded JSON text of the event. */
public record StreamMessage(String key, String value, long offset) {
}
