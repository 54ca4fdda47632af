package com.ledgerlens.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * A chat reply from the user. {@code processingLogId} optionally pins the answer to one document.
 */
public record UserReplyRequest(
        @NotBlank(message = "EMPTY_MESSAGE")
        @Size(max = 2000, message = "MESSAGE_TOO_LONG")
        String message,

        String processingLogId
) {
}
