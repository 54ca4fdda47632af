package com.ledgerlens.worker;

import com.ledgerlens.confirmation.ConfirmationMessageFormatter;
import com.ledgerlens.confirmation.message.ChatMessageService;
import com.ledgerlens.domain.ClassificationResult;
import com.ledgerlens.queue.JobHandler;
import com.ledgerlens.queue.JobQueue;
import com.ledgerlens.queue.job.ConfirmationRequestJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Drains document-confirmation: renders the summary of a merged result and delivers it to the user, live when
 * they are connected, otherwise to their mailbox.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConfirmationRequestWorker implements JobHandler<ConfirmationRequestJob> {

    private final JobQueue<ConfirmationRequestJob> confirmationQueue;
    private final ConfirmationMessageFormatter confirmationMessageFormatter;
    private final ChatMessageService chatMessageService;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        confirmationQueue.start(this);
    }

    @Override
    public void handle(ConfirmationRequestJob job) {
        String content = confirmationMessageFormatter.confirmationRequest(job.transaction(), job.confidence());
        chatMessageService.sendConfirmationRequest(job.userId(), content, job.processingLogId(),
                transactionData(job.transaction(), job.confidence()));
        log.info("Confirmation request for log {} sent to user {}", job.processingLogId(), job.userId());
    }

    private static Map<String, Object> transactionData(ClassificationResult result, double confidence) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("transactionType", result.transactionType() == null ? null : result.transactionType().name());
        data.put("category", result.category());
        data.put("subcategory", result.subcategory());
        data.put("amount", result.amount());
        data.put("currency", result.currency());
        data.put("transactionDate", result.transactionDate() == null ? null : result.transactionDate().toString());
        data.put("description", result.description());
        data.put("merchant", result.merchant());
        data.put("confidence", confidence);
        return data;
    }
}
