package com.ledgerlens.worker;

import com.ledgerlens.pipeline.extraction.ExtractionStatus;

/**
 * What to do with an extractor job after one status check.
 */
public record AnalysisPollDecision(Action action, int attemptsRemaining, long delayMs) {

    public enum Action {
        DONE,
        FAILED,
        RESCHEDULE,
        GIVE_UP
    }

    /**
     * A still-running job costs one attempt; it is rescheduled while attempts remain, otherwise abandoned.
     */
    public static AnalysisPollDecision decide(int attemptsRemaining, long retryDelayMs, ExtractionStatus status) {
        return switch (status) {
            case COMPLETED -> new AnalysisPollDecision(Action.DONE, attemptsRemaining, 0);
            case FAILED -> new AnalysisPollDecision(Action.FAILED, attemptsRemaining, 0);
            case PROCESSING -> attemptsRemaining - 1 > 0
                    ? new AnalysisPollDecision(Action.RESCHEDULE, attemptsRemaining - 1, retryDelayMs)
                    : new AnalysisPollDecision(Action.GIVE_UP, 0, 0);
        };
    }
}
