package com.ledgerlens.api.dto;

/**
 * {@code confirmation=false} means the text was not a yes/no answer and was ignored here.
 */
public record UserReplyResponse(boolean confirmation, Boolean confirmed, String jobId) {

    public static UserReplyResponse notAConfirmation() {
        return new UserReplyResponse(false, null, null);
    }
}
