package com.ledgerlens.confirmation;

import com.ledgerlens.pipeline.PipelineException;

/**
 * Confirmation could not be recorded or persisted. Propagates to the queue so the job is retried.
 */
public class ConfirmationException extends PipelineException {

    public static final String ERROR_CODE = "CONFIRMATION_FAILED";

    public ConfirmationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
