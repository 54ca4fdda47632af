package com.ledgerlens.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One row per document submission. The orchestrator writes status + stage before each stage starts, so a stuck
 * log shows exactly where a run stopped.
 */
@Document(collection = "processing_logs")
@CompoundIndexes({
    @CompoundIndex(name = "user_status", def = "{'userId': 1, 'status': 1}"),
    @CompoundIndex(name = "status_stage", def = "{'status': 1, 'currentStage': 1}"),
    @CompoundIndex(name = "created_status", def = "{'createdAt': 1, 'status': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ProcessingLog {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String documentId;
    private String userId;
    @Indexed(sparse = true)
    private String transactionId;

    private String bucketName;
    private String objectName;
    private String namespace;
    private UploadSource source;

    private ProcessingStatus status;
    private ProcessingStage currentStage;
    private DocumentType documentType;
    private String detectedLanguage = "es";

    private Double ocrConfidence;
    private Double visionConfidence;
    private Double classificationConfidence;
    private Double llmConfidence;
    private Double overallConfidence;

    private Long ocrProcessingTime;
    private Long visionProcessingTime;
    private Long classificationProcessingTime;
    private Long llmProcessingTime;
    private Long totalProcessingTime;

    /** Set when the extractor answered with an async job id. */
    private String extractorJobId;

    private OcrPayload ocrPayload;
    private VisionPayload visionPayload;
    private ClassificationResult classificationResult;
    private VerifierPayload verifierPayload;
    private MergedResult mergedResult;

    private List<ProcessingError> errors = new ArrayList<>();
    /** Free-text outcome of the confirmation step (e.g. rejection by the user). */
    private String confirmationNote;

    private Instant queuedAt;
    private Instant startedAt;
    private Instant completedAt;
    private Instant failedAt;
    private Instant createdAt;
    private Instant updatedAt;

    public void addError(ProcessingStage stage, String message, Instant at) {
        if (errors == null) {
            errors = new ArrayList<>();
        }
        errors.add(new ProcessingError(stage, message, at));
    }
}
