package com.ledgerlens.confirmation.message;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Kind of asynchronous chat message; serialized in lower snake case. */
public enum ChatMessageType {
    SYSTEM,
    CONFIRMATION_REQUEST,
    FILE_UPLOAD_SUCCESS,
    TRANSACTION_CONFIRMED,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
