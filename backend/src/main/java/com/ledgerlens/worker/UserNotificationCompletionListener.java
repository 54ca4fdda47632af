package com.ledgerlens.worker;

import com.ledgerlens.confirmation.message.ChatMessageService;
import com.ledgerlens.queue.job.CompletedJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Tells the user when their document could not be processed. Successful runs already produced a confirmation
 * request, so they are only logged.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class UserNotificationCompletionListener implements CompletionListener {

    private final ChatMessageService chatMessageService;

    @Override
    public void onCompleted(CompletedJob job) {
        switch (job.status()) {
            case FAILED -> {
                if (job.userId() != null) {
                    chatMessageService.sendErrorMessage(job.userId(),
                            "No pude procesar tu documento " + nameOf(job) + ": " + job.error());
                }
            }
            case MANUAL_REVIEW -> log.info("Log {} requires manual review (user {}, {} ms)",
                    job.processingLogId(), job.userId(), job.processingTimeMs());
            case COMPLETED -> log.info("Log {} finished for user {} (confidence {}, {} ms)",
                    job.processingLogId(), job.userId(), job.confidence(), job.processingTimeMs());
        }
    }

    private static String nameOf(CompletedJob job) {
        return job.objectName() == null ? "" : "`" + job.objectName() + "`";
    }
}
