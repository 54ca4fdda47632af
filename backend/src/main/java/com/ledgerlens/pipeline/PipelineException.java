package com.ledgerlens.pipeline;

import lombok.Getter;

/**
 * Fatal-to-this-run pipeline failure. The orchestrator records it on the processing log and marks the run FAILED.
 */
@Getter
public class PipelineException extends RuntimeException {

    /** Error code stored with the failure: VERIFICATION_FAILED, CONFIRMATION_FAILED, ... */
    private final String errorCode;

    public PipelineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
