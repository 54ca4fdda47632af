package com.ledgerlens.pipeline.extraction;

/**
 * Location of an uploaded document in object storage.
 */
public record StorageReference(String namespace, String bucketName, String objectName, String objectId) {
}
