package com.ledgerlens.worker;

import com.ledgerlens.domain.ProcessingLog;
import com.ledgerlens.domain.ProcessingLogRepository;
import com.ledgerlens.domain.ProcessingStage;
import com.ledgerlens.domain.ProcessingStatus;
import com.ledgerlens.domain.UploadSource;
import com.ledgerlens.pipeline.extraction.DocumentExtractor;
import com.ledgerlens.pipeline.extraction.ExtractionFeature;
import com.ledgerlens.pipeline.extraction.ExtractionResult;
import com.ledgerlens.pipeline.extraction.ExtractionStatus;
import com.ledgerlens.pipeline.extraction.StorageReference;
import com.ledgerlens.queue.QueueService;
import com.ledgerlens.queue.job.AnalysisStatusPollJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Extraction-only analysis requested through the API. An extractor that answers asynchronously is followed up
 * by polling jobs on document-analysis.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnalysisSubmissionService {

    private static final Set<ExtractionFeature> FEATURES = EnumSet.of(
            ExtractionFeature.TEXT_DETECTION,
            ExtractionFeature.KEY_VALUE_DETECTION,
            ExtractionFeature.TABLE_EXTRACTION,
            ExtractionFeature.DOCUMENT_CLASSIFICATION,
            ExtractionFeature.LANGUAGE_CLASSIFICATION);

    private final DocumentExtractor documentExtractor;
    private final ProcessingLogRepository processingLogRepository;
    private final QueueService queueService;
    private final Clock clock;

    /** @return id of the processing log that tracks the analysis */
    public String submit(StorageReference storage, String userId) {
        Instant now = Instant.now(clock);
        ProcessingLog processingLog = new ProcessingLog();
        processingLog.setDocumentId(storage.objectId());
        processingLog.setUserId(userId);
        processingLog.setNamespace(storage.namespace());
        processingLog.setBucketName(storage.bucketName());
        processingLog.setObjectName(storage.objectName());
        processingLog.setSource(UploadSource.API);
        processingLog.setStatus(ProcessingStatus.PROCESSING_OCR);
        processingLog.setCurrentStage(ProcessingStage.OCR_EXTRACTION);
        processingLog.setQueuedAt(now);
        processingLog.setStartedAt(now);
        processingLog.setCreatedAt(now);
        processingLog.setUpdatedAt(now);
        processingLog = processingLogRepository.save(processingLog);

        ExtractionResult result = documentExtractor.analyze(storage, FEATURES);
        if (result.status() == ExtractionStatus.PROCESSING && result.jobId() != null) {
            processingLog.setExtractorJobId(result.jobId());
            processingLogRepository.save(processingLog);
            queueService.addAnalysisJob(AnalysisStatusPollJob.create(result.jobId(), processingLog.getId(), userId,
                    storage.objectName(), now));
            log.info("Analysis of {} submitted as extractor job {} (log {})",
                    storage.objectName(), result.jobId(), processingLog.getId());
            return processingLog.getId();
        }

        if (result.status() == ExtractionStatus.COMPLETED) {
            processingLog.setOcrPayload(result.toPayload());
            processingLog.setStatus(ProcessingStatus.COMPLETED);
            processingLog.setCompletedAt(now);
        } else {
            processingLog.setStatus(ProcessingStatus.FAILED);
            processingLog.setFailedAt(now);
            processingLog.addError(ProcessingStage.OCR_EXTRACTION,
                    result.error() != null ? result.error() : "Analysis failed", now);
        }
        processingLog.setUpdatedAt(now);
        processingLogRepository.save(processingLog);
        return processingLog.getId();
    }
}
