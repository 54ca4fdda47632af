package com.ledgerlens.pipeline.orchestrator;

import com.ledgerlens.config.AsyncConfig;
import com.ledgerlens.domain.ClassificationResult;
import com.ledgerlens.domain.DocumentType;
import com.ledgerlens.domain.MergedResult;
import com.ledgerlens.domain.OcrPayload;
import com.ledgerlens.domain.ProcessingLog;
import com.ledgerlens.domain.ProcessingLogRepository;
import com.ledgerlens.domain.ProcessingStage;
import com.ledgerlens.domain.ProcessingStatus;
import com.ledgerlens.domain.VerifierPayload;
import com.ledgerlens.domain.VisionPayload;
import com.ledgerlens.pipeline.classifier.DocumentContext;
import com.ledgerlens.pipeline.classifier.ExtractedDocument;
import com.ledgerlens.pipeline.classifier.RuleBasedClassifier;
import com.ledgerlens.pipeline.extraction.DocumentExtractor;
import com.ledgerlens.pipeline.extraction.DocumentImageRenderer;
import com.ledgerlens.pipeline.extraction.ExtractionException;
import com.ledgerlens.pipeline.extraction.ExtractionFeature;
import com.ledgerlens.pipeline.extraction.ExtractionResult;
import com.ledgerlens.pipeline.extraction.ExtractionStatus;
import com.ledgerlens.pipeline.extraction.RenderedPage;
import com.ledgerlens.pipeline.extraction.StorageReference;
import com.ledgerlens.pipeline.merge.AnalysisMerger;
import com.ledgerlens.pipeline.verifier.ClassificationComparison;
import com.ledgerlens.pipeline.verifier.ClassificationVerifier;
import com.ledgerlens.pipeline.verifier.VerificationRequest;
import com.ledgerlens.pipeline.vision.VisionAnalyzer;
import com.ledgerlens.pipeline.vision.VisionRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one document through OCR, vision, rule-based classification, verification and merge, then hands the
 * merged result to the confirmation workflow. Status and stage are saved before each stage's work starts.
 * OCR, rendering and vision failures degrade the run; a verifier or persistence failure ends it as FAILED.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentProcessingOrchestrator {

    static final Set<ExtractionFeature> OCR_FEATURES = EnumSet.of(
            ExtractionFeature.TEXT_DETECTION,
            ExtractionFeature.KEY_VALUE_DETECTION,
            ExtractionFeature.TABLE_EXTRACTION,
            ExtractionFeature.DOCUMENT_CLASSIFICATION);

    private final ProcessingLogRepository processingLogRepository;
    private final DocumentExtractor documentExtractor;
    private final DocumentImageRenderer documentImageRenderer;
    private final VisionAnalyzer visionAnalyzer;
    private final RuleBasedClassifier ruleBasedClassifier;
    private final ClassificationVerifier classificationVerifier;
    private final AnalysisMerger analysisMerger;
    private final ConfirmationHandOff confirmationHandOff;
    private final PipelineProperties pipelineProperties;
    private final Clock clock;
    @Qualifier(AsyncConfig.PIPELINE_EXECUTOR)
    private final AsyncTaskExecutor pipelineExecutor;

    public DocumentProcessingResult process(DocumentProcessingRequest request) {
        long startedMs = clock.millis();
        Instant now = Instant.now(clock);
        ProcessingLog processingLog = newLog(request, now);
        try {
            processingLog = processingLogRepository.save(processingLog);
        } catch (RuntimeException e) {
            log.error("Could not create processing log for document {}: {}", request.documentId(), e.getMessage(), e);
            return DocumentProcessingResult.failed(null, clock.millis() - startedMs, e.getMessage());
        }
        log.info("Processing document {} for user {} (log {})",
                request.documentId(), request.userId(), processingLog.getId());

        try {
            OcrPayload ocr = runOcr(processingLog, request.storage());
            VisionPayload vision = runVision(processingLog, request);

            DocumentType documentType = ocr.detectedDocumentType() != null
                    ? ocr.detectedDocumentType()
                    : request.documentType();
            DocumentContext context = new DocumentContext(documentType, request.storage().objectName(),
                    ocr.language() != null ? ocr.language() : "es");
            ExtractedDocument extracted = ExtractedDocument.from(ocr);
            ClassificationResult ruleBased = runClassification(processingLog, extracted, context);

            enterStage(processingLog, ProcessingStatus.PROCESSING_LLM_VERIFICATION, ProcessingStage.LLM_VERIFICATION);
            long verifyStart = clock.millis();
            ClassificationResult verified = classificationVerifier.verify(
                    new VerificationRequest(ruleBased, extracted, context));
            ClassificationComparison comparison = classificationVerifier.compare(verified, ruleBased);
            processingLog.setLlmProcessingTime(clock.millis() - verifyStart);

            MergedResult merged = analysisMerger.merge(ruleBased, verified, vision);
            processingLog.setLlmConfidence(verified.confidence());
            processingLog.setOverallConfidence(merged.finalConfidence());
            processingLog.setVerifierPayload(new VerifierPayload(verified, comparison.discrepancies(),
                    comparison.recommendedSource(), comparison.combinedConfidence(),
                    classificationVerifier.insights(verified)));
            processingLog.setMergedResult(merged);

            // the log must be answerable before the user can see the request
            long elapsed = clock.millis() - startedMs;
            processingLog.setTotalProcessingTime(elapsed);
            enterStage(processingLog, ProcessingStatus.PENDING_CONFIRMATION, ProcessingStage.USER_CONFIRMATION);
            confirmationHandOff.requestConfirmation(processingLog, request.userId(), merged);
            log.info("Document {} awaiting confirmation (log {}, confidence {}, {} ms)",
                    request.documentId(), processingLog.getId(), merged.finalConfidence(), elapsed);
            return DocumentProcessingResult.pendingConfirmation(processingLog.getId(), merged.finalConfidence(),
                    elapsed);
        } catch (RuntimeException e) {
            return markFailed(processingLog, e, clock.millis() - startedMs);
        }
    }

    private OcrPayload runOcr(ProcessingLog processingLog, StorageReference storage) {
        enterStage(processingLog, ProcessingStatus.PROCESSING_OCR, ProcessingStage.OCR_EXTRACTION);
        long start = clock.millis();
        long timeoutMs = pipelineProperties.getOcrTimeoutMs();
        OcrPayload payload;
        try {
            payload = extractWithin(processingLog, storage, timeoutMs).toPayload();
            processingLog.setOcrConfidence(ocrConfidence(payload));
        } catch (ExtractionException e) {
            log.warn("{} (log {}); continuing without text", e.getMessage(), processingLog.getId());
            processingLog.addError(ProcessingStage.OCR_EXTRACTION, e.getMessage(), Instant.now(clock));
            processingLog.setOcrConfidence(0.0);
            payload = OcrPayload.empty();
        }
        processingLog.setOcrPayload(payload);
        if (payload.detectedDocumentType() != null) {
            processingLog.setDocumentType(payload.detectedDocumentType());
        }
        if (payload.language() != null) {
            processingLog.setDetectedLanguage(payload.language());
        }
        processingLog.setOcrProcessingTime(clock.millis() - start);
        return payload;
    }

    /**
     * Runs the extraction on the pipeline executor and waits at most {@code timeoutMs}. A timed-out task is
     * interrupted so its thread goes back to the pool.
     */
    private ExtractionResult extractWithin(ProcessingLog processingLog, StorageReference storage, long timeoutMs) {
        Future<ExtractionResult> task;
        try {
            task = pipelineExecutor.submit(() -> extract(processingLog, storage, clock.millis() + timeoutMs));
        } catch (TaskRejectedException e) {
            throw new ExtractionException("OCR failed: no pipeline thread available", e);
        }
        try {
            return task.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            throw new ExtractionException("OCR timed out after " + timeoutMs + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ExtractionException("OCR failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExtractionException("OCR interrupted", e);
        }
    }

    /** Runs on the pipeline executor. Polls an async extractor job until it settles or the deadline passes. */
    private ExtractionResult extract(ProcessingLog processingLog, StorageReference storage, long deadlineMs) {
        ExtractionResult result = documentExtractor.analyze(storage, OCR_FEATURES);
        if (result.status() == ExtractionStatus.PROCESSING && result.jobId() != null) {
            processingLog.setExtractorJobId(result.jobId());
            while (result.status() == ExtractionStatus.PROCESSING) {
                if (clock.millis() >= deadlineMs) {
                    throw new ExtractionException("Extractor job " + result.jobId() + " still processing");
                }
                try {
                    Thread.sleep(pipelineProperties.getOcrPollIntervalMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new ExtractionException("Interrupted while polling extractor job " + result.jobId(), e);
                }
                result = documentExtractor.getResult(result.jobId());
            }
        }
        if (result.status() != ExtractionStatus.COMPLETED) {
            throw new ExtractionException(result.error() != null ? result.error() : "Extractor returned " + result.status());
        }
        return result;
    }

    /** 0 without text; otherwise 0.5, +0.2 for long text, +0.1 each for amounts, dates and key-values; max 1. */
    static double ocrConfidence(OcrPayload payload) {
        if (payload.text().isBlank()) {
            return 0.0;
        }
        double confidence = 0.5;
        if (payload.text().length() > 100) {
            confidence += 0.2;
        }
        if (!payload.amounts().isEmpty()) {
            confidence += 0.1;
        }
        if (!payload.dates().isEmpty()) {
            confidence += 0.1;
        }
        if (!payload.keyValues().isEmpty()) {
            confidence += 0.1;
        }
        return Math.min(1.0, confidence);
    }

    private VisionPayload runVision(ProcessingLog processingLog, DocumentProcessingRequest request) {
        enterStage(processingLog, ProcessingStatus.PROCESSING_VISION, ProcessingStage.VISION_ANALYSIS);
        long start = clock.millis();
        try {
            List<RenderedPage> pages = documentImageRenderer.render(request.storage());
            if (pages == null || pages.isEmpty()) {
                visionUnavailable(processingLog, "No pages rendered for vision analysis");
                return null;
            }
            RenderedPage first = pages.get(0);
            VisionPayload payload = visionAnalyzer.analyze(
                    new VisionRequest(first.data(), first.mimeType(), request.documentType()));
            processingLog.setVisionPayload(payload);
            if (!payload.success()) {
                visionUnavailable(processingLog, "Vision analysis failed: " + payload.error());
                return null;
            }
            processingLog.setVisionConfidence(payload.result().confidence());
            return payload;
        } catch (RuntimeException e) {
            visionUnavailable(processingLog, "Document rendering failed: " + e.getMessage());
            return null;
        } finally {
            processingLog.setVisionProcessingTime(clock.millis() - start);
        }
    }

    private void visionUnavailable(ProcessingLog processingLog, String message) {
        log.warn("{} (log {}); continuing without vision", message, processingLog.getId());
        processingLog.addError(ProcessingStage.VISION_ANALYSIS, message, Instant.now(clock));
    }

    private ClassificationResult runClassification(ProcessingLog processingLog, ExtractedDocument extracted,
                                                   DocumentContext context) {
        enterStage(processingLog, ProcessingStatus.PROCESSING_CLASSIFICATION, ProcessingStage.TEXT_ANALYSIS);
        long start = clock.millis();
        ClassificationResult result = ruleBasedClassifier.classify(extracted, context);
        processingLog.setClassificationResult(result);
        processingLog.setClassificationConfidence(result.confidence());
        processingLog.setClassificationProcessingTime(clock.millis() - start);
        return result;
    }

    private DocumentProcessingResult markFailed(ProcessingLog processingLog, RuntimeException e, long elapsedMs) {
        log.error("Processing failed for log {} at stage {}: {}",
                processingLog.getId(), processingLog.getCurrentStage(), e.getMessage(), e);
        Instant now = Instant.now(clock);
        processingLog.addError(processingLog.getCurrentStage(), e.getMessage(), now);
        processingLog.setStatus(ProcessingStatus.FAILED);
        processingLog.setCurrentStage(ProcessingStage.FINAL_VALIDATION);
        processingLog.setFailedAt(now);
        processingLog.setTotalProcessingTime(elapsedMs);
        try {
            save(processingLog);
        } catch (RuntimeException saveError) {
            log.error("Could not record failure on log {}: {}", processingLog.getId(), saveError.getMessage(),
                    saveError);
        }
        return DocumentProcessingResult.failed(processingLog.getId(), elapsedMs, e.getMessage());
    }

    private void enterStage(ProcessingLog processingLog, ProcessingStatus status, ProcessingStage stage) {
        processingLog.setStatus(status);
        processingLog.setCurrentStage(stage);
        save(processingLog);
        log.debug("Log {} -> {} / {}", processingLog.getId(), status, stage);
    }

    private ProcessingLog save(ProcessingLog processingLog) {
        processingLog.setUpdatedAt(Instant.now(clock));
        return processingLogRepository.save(processingLog);
    }

    private ProcessingLog newLog(DocumentProcessingRequest request, Instant now) {
        ProcessingLog processingLog = new ProcessingLog();
        processingLog.setDocumentId(request.documentId());
        processingLog.setUserId(request.userId());
        StorageReference storage = request.storage();
        processingLog.setNamespace(storage.namespace());
        processingLog.setBucketName(storage.bucketName());
        processingLog.setObjectName(storage.objectName());
        processingLog.setSource(request.source());
        processingLog.setDocumentType(request.documentType());
        processingLog.setStatus(ProcessingStatus.QUEUED);
        processingLog.setCurrentStage(ProcessingStage.DOCUMENT_UPLOAD);
        processingLog.setQueuedAt(now);
        processingLog.setStartedAt(now);
        processingLog.setCreatedAt(now);
        processingLog.setUpdatedAt(now);
        return processingLog;
    }
}
