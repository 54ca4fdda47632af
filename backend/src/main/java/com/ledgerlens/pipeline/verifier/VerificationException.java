package com.ledgerlens.pipeline.verifier;

import com.ledgerlens.pipeline.PipelineException;

/**
 * Verifier call failed. There is no fallback: no transaction may come from an unverified guess.
 */
public class VerificationException extends PipelineException {

    public static final String ERROR_CODE = "VERIFICATION_FAILED";

    public VerificationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
