package com.ledgerlens.domain;

/**
 * Data a pipeline stage leaves on the processing log. One variant per stage keeps the log schema closed.
 */
public sealed interface StagePayload permits OcrPayload, VisionPayload, VerifierPayload {

    ProcessingStage stage();
}
