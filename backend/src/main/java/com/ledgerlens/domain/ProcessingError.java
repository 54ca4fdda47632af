package com.ledgerlens.domain;

import java.time.Instant;

/** One entry of the processing log's ordered error list. */
public record ProcessingError(ProcessingStage stage, String error, Instant timestamp) {
}
