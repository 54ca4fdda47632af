package com.ledgerlens.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/analyses request body: run asynchronous extraction only, without classification.
 */
public record AnalysisRequest(
        @NotBlank(message = "INVALID_USER")
        String userId,

        String namespace,

        @NotBlank(message = "INVALID_LOCATION")
        String bucketName,

        @NotBlank(message = "INVALID_LOCATION")
        String objectName
) {
}
