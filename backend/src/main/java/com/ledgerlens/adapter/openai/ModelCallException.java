package com.ledgerlens.adapter.openai;

/**
 * The chat completions call failed or answered without usable content.
 */
public class ModelCallException extends RuntimeException {

    public ModelCallException(String message) {
        super(message);
    }

    public ModelCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
