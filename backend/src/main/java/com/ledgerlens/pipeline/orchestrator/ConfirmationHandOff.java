package com.ledgerlens.pipeline.orchestrator;

import com.ledgerlens.domain.MergedResult;
import com.ledgerlens.domain.ProcessingLog;

/**
 * Receives a merged result that needs the user's approval before anything is persisted.
 */
public interface ConfirmationHandOff {

    /**
     * Records the pending confirmation and schedules the request message. Throws when the pending state could
     * not be recorded; the run is then failed.
     */
    void requestConfirmation(ProcessingLog processingLog, String userId, MergedResult merged);
}
