package com.ledgerlens.api.dto;

public record AnalysisAcceptedResponse(String processingLogId) {
}
