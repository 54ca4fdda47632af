package com.ledgerlens.worker;

import com.ledgerlens.queue.job.CompletedJob;

/**
 * Reacts to a finished upload or analysis. Every bean implementing this is called for each completed job.
 */
public interface CompletionListener {

    void onCompleted(CompletedJob job);
}
