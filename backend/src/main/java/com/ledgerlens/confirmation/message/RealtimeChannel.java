package com.ledgerlens.confirmation.message;

/**
 * Live delivery callback for one user (an open SSE stream, for example). Throwing marks the channel broken.
 */
@FunctionalInterface
public interface RealtimeChannel {

    void deliver(ChatMessage message) throws Exception;
}
