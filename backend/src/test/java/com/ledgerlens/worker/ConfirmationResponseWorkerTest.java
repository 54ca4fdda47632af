package com.ledgerlens.worker;

import com.ledgerlens.confirmation.ConfirmationException;
import com.ledgerlens.confirmation.ConfirmationOutcome;
import com.ledgerlens.confirmation.ConfirmationService;
import com.ledgerlens.confirmation.message.ChatMessageService;
import com.ledgerlens.queue.JobQueue;
import com.ledgerlens.queue.job.ConfirmationResponseJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConfirmationResponseWorkerTest {

    @Mock
    JobQueue<ConfirmationResponseJob> confirmationResponseQueue;
    @Mock
    ConfirmationService confirmationService;
    @Mock
    ChatMessageService chatMessageService;

    private ConfirmationResponseWorker worker;
    private final ConfirmationResponseJob job =
            ConfirmationResponseJob.create("user-1", true, "si", null, Instant.parse("2025-06-01T12:00:00Z"));

    @BeforeEach
    void setUp() {
        worker = new ConfirmationResponseWorker(confirmationResponseQueue, confirmationService, chatMessageService);
    }

    @Test
    @DisplayName("the outcome of the reply is sent back to the user")
    void sendsOutcome() {
        when(confirmationService.processConfirmationResponse("user-1", true, "si", null)).thenReturn(
                new ConfirmationOutcome(ConfirmationOutcome.Status.CONFIRMED, "guardada", "log-1", "tx-1"));

        worker.handle(job);

        verify(chatMessageService).sendTransactionConfirmationResult("user-1", true, "guardada");
    }

    @Test
    @DisplayName("a persistence failure propagates so the queue retries the reply")
    void failurePropagates() {
        when(confirmationService.processConfirmationResponse("user-1", true, "si", null))
                .thenThrow(new ConfirmationException("Could not record confirmation", new IllegalStateException()));

        assertThatThrownBy(() -> worker.handle(job)).isInstanceOf(ConfirmationException.class);
        verify(chatMessageService, never()).sendTransactionConfirmationResult(anyString(), anyBoolean(), anyString());
    }

    @Test
    @DisplayName("after the last attempt the user is told the transaction was not saved")
    void exhausted() {
        worker.onExhausted(job, new IllegalStateException("db down"));

        verify(chatMessageService).sendTransactionConfirmationResult("user-1", false,
                ConfirmationResponseWorker.STORE_FAILED);
    }
}
