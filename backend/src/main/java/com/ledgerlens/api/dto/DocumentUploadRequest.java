package com.ledgerlens.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * POST /api/v1/documents request body: a document already stored in object storage.
 * Source defaults to api; document type is an optional hint (RECEIPT, INVOICE, ...).
 */
public record DocumentUploadRequest(
        @NotBlank(message = "INVALID_USER")
        String userId,

        String namespace,

        @NotBlank(message = "INVALID_LOCATION")
        String bucketName,

        @NotBlank(message = "INVALID_LOCATION")
        @Pattern(regexp = "(?i).+\\.(pdf|jpg|jpeg|png|gif|bmp|tiff)$", message = "UNSUPPORTED_FILE_TYPE")
        String objectName,

        String objectId,

        String source,

        String documentType
) {
}
