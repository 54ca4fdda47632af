package com.ledgerlens.worker;

import com.ledgerlens.domain.ProcessingLog;
import com.ledgerlens.domain.ProcessingLogRepository;
import com.ledgerlens.domain.ProcessingStage;
import com.ledgerlens.domain.ProcessingStatus;
import com.ledgerlens.pipeline.extraction.DocumentExtractor;
import com.ledgerlens.pipeline.extraction.ExtractionResult;
import com.ledgerlens.queue.JobHandler;
import com.ledgerlens.queue.JobQueue;
import com.ledgerlens.queue.QueueService;
import com.ledgerlens.queue.job.AnalysisStatusPollJob;
import com.ledgerlens.queue.job.CompletedJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.function.Consumer;

/**
 * Drains document-analysis: checks an asynchronous extractor job and either records its result, reschedules
 * itself, or gives up after the last attempt.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AnalysisPollWorker implements JobHandler<AnalysisStatusPollJob> {

    static final String TIMEOUT_ERROR = "Analysis timeout - maximum retries exceeded";

    private final JobQueue<AnalysisStatusPollJob> analysisQueue;
    private final DocumentExtractor documentExtractor;
    private final ProcessingLogRepository processingLogRepository;
    private final QueueService queueService;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        analysisQueue.start(this);
    }

    @Override
    public void handle(AnalysisStatusPollJob job) {
        ExtractionResult result = documentExtractor.getResult(job.extractorJobId());
        AnalysisPollDecision decision = AnalysisPollDecision.decide(job.attemptsRemaining(), job.retryDelayMs(),
                result.status());
        Instant now = Instant.now(clock);
        switch (decision.action()) {
            case DONE -> {
                updateLog(job, processingLog -> {
                    processingLog.setOcrPayload(result.toPayload());
                    processingLog.setStatus(ProcessingStatus.COMPLETED);
                    processingLog.setCurrentStage(ProcessingStage.OCR_EXTRACTION);
                    processingLog.setCompletedAt(now);
                });
                queueService.addCompletedJob(CompletedJob.completed(job.extractorJobId(), job.processingLogId(),
                        job.userId(), job.objectName(), 1.0, elapsed(job, now), now));
                log.info("Extractor job {} completed", job.extractorJobId());
            }
            case FAILED -> {
                String error = result.error() != null ? result.error() : "Analysis failed";
                updateLog(job, processingLog -> {
                    processingLog.setStatus(ProcessingStatus.FAILED);
                    processingLog.setFailedAt(now);
                    processingLog.addError(ProcessingStage.OCR_EXTRACTION, error, now);
                });
                queueService.addCompletedJob(CompletedJob.failed(job.extractorJobId(), job.processingLogId(),
                        job.userId(), job.objectName(), error, elapsed(job, now), now));
                log.warn("Extractor job {} failed: {}", job.extractorJobId(), error);
            }
            case RESCHEDULE -> {
                queueService.addAnalysisJob(job.next(decision.attemptsRemaining(), now), decision.delayMs());
                log.debug("Extractor job {} still processing; {} check(s) left",
                        job.extractorJobId(), decision.attemptsRemaining());
            }
            case GIVE_UP -> {
                updateLog(job, processingLog -> {
                    processingLog.setStatus(ProcessingStatus.TIMEOUT);
                    processingLog.setFailedAt(now);
                    processingLog.addError(ProcessingStage.OCR_EXTRACTION, TIMEOUT_ERROR, now);
                });
                queueService.addCompletedJob(CompletedJob.failed(job.extractorJobId(), job.processingLogId(),
                        job.userId(), job.objectName(), TIMEOUT_ERROR, elapsed(job, now), now));
                log.warn("Extractor job {} timed out", job.extractorJobId());
            }
        }
    }

    private void updateLog(AnalysisStatusPollJob job, Consumer<ProcessingLog> change) {
        if (job.processingLogId() == null) {
            return;
        }
        processingLogRepository.findById(job.processingLogId()).ifPresent(processingLog -> {
            change.accept(processingLog);
            processingLog.setUpdatedAt(Instant.now(clock));
            processingLogRepository.save(processingLog);
        });
    }

    private static long elapsed(AnalysisStatusPollJob job, Instant now) {
        return job.submittedAt() == null ? 0 : Math.max(0, now.toEpochMilli() - job.submittedAt().toEpochMilli());
    }
}
