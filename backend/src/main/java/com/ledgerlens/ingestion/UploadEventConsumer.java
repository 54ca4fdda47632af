package com.ledgerlens.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerlens.config.AsyncConfig;
import com.ledgerlens.domain.DocumentType;
import com.ledgerlens.domain.UploadSource;
import com.ledgerlens.queue.QueueService;
import com.ledgerlens.queue.job.UploadJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single poll loop over the upload-event stream: keeps document uploads, derives hints from the object name and
 * enqueues one upload job per document. A failed poll is retried from the same cursor after a pause.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class UploadEventConsumer {

    private final AtomicBoolean running = new AtomicBoolean(false);

    private final UploadEventStream uploadEventStream;
    private final QueueService queueService;
    private final IngestionProperties ingestionProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    @Qualifier(AsyncConfig.INGESTION_EXECUTOR)
    private final Executor ingestionExecutor;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!ingestionProperties.isEnabled()) {
            log.info("Upload event consumer disabled");
            return;
        }
        start();
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        ingestionExecutor.execute(this::pollLoop);
        log.info("Upload event consumer started (batch {}, poll every {} ms)",
                ingestionProperties.getBatchSize(), ingestionProperties.getPollDelayMs());
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Upload event consumer stopping");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void pollLoop() {
        String cursor = null;
        while (running.get()) {
            long pause;
            try {
                if (cursor == null) {
                    cursor = uploadEventStream.createCursor();
                }
                cursor = pollOnce(cursor);
                pause = ingestionProperties.getPollDelayMs();
            } catch (RuntimeException e) {
                log.warn("Upload event poll failed, retrying in {} ms: {}",
                        ingestionProperties.getErrorDelayMs(), e.getMessage());
                pause = ingestionProperties.getErrorDelayMs();
            }
            try {
                Thread.sleep(pause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Upload event consumer interrupted");
                break;
            }
        }
        running.set(false);
    }

    /**
     * Reads one batch and enqueues its document uploads.
     *
     * @return the cursor to continue from
     */
    String pollOnce(String cursor) {
        StreamBatch batch = uploadEventStream.getMessages(cursor, ingestionProperties.getBatchSize());
        if (!batch.messages().isEmpty()) {
            log.debug("Processing {} stream message(s)", batch.messages().size());
        }
        for (StreamMessage message : batch.messages()) {
            handle(message);
        }
        return batch.nextCursor() != null ? batch.nextCursor() : cursor;
    }

    /** @return true when the message produced an upload job */
    boolean handle(StreamMessage message) {
        if (message.value() == null || message.value().isBlank()) {
            log.debug("Skipping stream message {} with no value", message.offset());
            return false;
        }
        UploadEvent event;
        try {
            event = objectMapper.readValue(message.value(), UploadEvent.class);
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable stream message {}: {}", message.offset(), e.getOriginalMessage());
            return false;
        }
        if (event.data() == null || !ObjectNameHints.isDocumentUpload(event.eventType(), event.data().resourceName())) {
            return false;
        }

        UploadEvent.Data data = event.data();
        UploadEvent.AdditionalDetails details = data.additionalDetails();
        String objectName = data.resourceName();
        UploadSource source = ObjectNameHints.source(objectName);
        DocumentType documentType = ObjectNameHints.documentType(objectName);
        queueService.addUploadJob(UploadJob.create(
                data.resourceId() != null ? data.resourceId() : objectName,
                details != null ? details.namespace() : null,
                details != null ? details.bucketName() : null,
                objectName,
                ObjectNameHints.userId(objectName),
                source,
                documentType,
                ObjectNameHints.region(event.source()),
                eventTime(event.eventTime()),
                Instant.now(clock)));
        return true;
    }

    private Instant eventTime(String value) {
        if (value == null) {
            return Instant.now(clock);
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return Instant.now(clock);
        }
    }
}
