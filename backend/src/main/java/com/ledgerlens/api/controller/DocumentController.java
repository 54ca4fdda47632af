package com.ledgerlens.api.controller;

import com.ledgerlens.api.dto.AnalysisAcceptedResponse;
import com.ledgerlens.api.dto.AnalysisRequest;
import com.ledgerlens.api.dto.DocumentAcceptedResponse;
import com.ledgerlens.api.dto.DocumentUploadRequest;
import com.ledgerlens.confirmation.message.ChatMessageService;
import com.ledgerlens.domain.DocumentType;
import com.ledgerlens.domain.UploadSource;
import com.ledgerlens.pipeline.extraction.StorageReference;
import com.ledgerlens.queue.QueueService;
import com.ledgerlens.queue.job.UploadJob;
import com.ledgerlens.worker.AnalysisSubmissionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * POST /documents (full pipeline) and POST /analyses (extraction only, polled in the background).
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class DocumentController {

    static final String DEFAULT_REGION = "us-phoenix-1";

    private final QueueService queueService;
    private final AnalysisSubmissionService analysisSubmissionService;
    private final ChatMessageService chatMessageService;
    private final Clock clock;

    @PostMapping("/documents")
    public ResponseEntity<DocumentAcceptedResponse> submitDocument(@Valid @RequestBody DocumentUploadRequest request) {
        Instant now = Instant.now(clock);
        String objectId = request.objectId() != null && !request.objectId().isBlank()
                ? request.objectId()
                : UUID.randomUUID().toString();
        UploadJob job = UploadJob.create(objectId, request.namespace(), request.bucketName(), request.objectName(),
                request.userId(), UploadSource.fromLabel(request.source()),
                DocumentType.fromHint(request.documentType()), DEFAULT_REGION, now, now);
        String jobId = queueService.addUploadJob(job);
        chatMessageService.sendFileUploadConfirmation(request.userId(), fileName(request.objectName()));
        return ResponseEntity.accepted().body(new DocumentAcceptedResponse(jobId, "queued"));
    }

    @PostMapping("/analyses")
    public ResponseEntity<AnalysisAcceptedResponse> submitAnalysis(@Valid @RequestBody AnalysisRequest request) {
        String logId = analysisSubmissionService.submit(
                new StorageReference(request.namespace(), request.bucketName(), request.objectName(), null),
                request.userId());
        return ResponseEntity.accepted().body(new AnalysisAcceptedResponse(logId));
    }

    private static String fileName(String objectName) {
        int slash = objectName.lastIndexOf('/');
        return slash >= 0 ? objectName.substring(slash + 1) : objectName;
    }
}
