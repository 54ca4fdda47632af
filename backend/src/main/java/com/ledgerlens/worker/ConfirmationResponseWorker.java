package com.ledgerlens.worker;

import com.ledgerlens.confirmation.ConfirmationOutcome;
import com.ledgerlens.confirmation.ConfirmationService;
import com.ledgerlens.confirmation.message.ChatMessageService;
import com.ledgerlens.queue.JobHandler;
import com.ledgerlens.queue.JobQueue;
import com.ledgerlens.queue.job.ConfirmationResponseJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Drains transaction-confirmation-response: applies the user's answer and tells them what happened.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConfirmationResponseWorker implements JobHandler<ConfirmationResponseJob> {

    static final String STORE_FAILED = "❌ Error al guardar la transacción. Intenta subir el documento nuevamente.";

    private final JobQueue<ConfirmationResponseJob> confirmationResponseQueue;
    private final ConfirmationService confirmationService;
    private final ChatMessageService chatMessageService;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        confirmationResponseQueue.start(this);
    }

    @Override
    public void handle(ConfirmationResponseJob job) {
        ConfirmationOutcome outcome = confirmationService.processConfirmationResponse(
                job.userId(), job.confirmed(), job.message(), job.processingLogId());
        chatMessageService.sendTransactionConfirmationResult(job.userId(), outcome.confirmed(), outcome.message());
        log.info("Reply from user {} processed: {}", job.userId(), outcome.status());
    }

    @Override
    public void onExhausted(ConfirmationResponseJob job, Exception lastError) {
        chatMessageService.sendTransactionConfirmationResult(job.userId(), false, STORE_FAILED);
    }
}
