package com.ledgerlens.queue.job;

import com.ledgerlens.domain.DocumentType;
import com.ledgerlens.domain.UploadSource;

import java.time.Instant;

/**
 * A newly stored document to run through the pipeline.
 */
public record UploadJob(
        String jobId,
        String objectId,
        String namespace,
        String bucketName,
        String objectName,
        String userId,
        UploadSource source,
        DocumentType documentType,
        String region,
        Instant eventTime
) implements Job {

    public static UploadJob create(String objectId, String namespace, String bucketName, String objectName,
                                   String userId, UploadSource source, DocumentType documentType, String region,
                                   Instant eventTime, Instant now) {
        return new UploadJob("upload-" + objectId + "-" + now.toEpochMilli(), objectId, namespace, bucketName,
                objectName, userId, source, documentType, region, eventTime);
    }

    @Override
    public int priority() {
        return source == null ? UploadSource.API.priority() : source.priority();
    }
}
