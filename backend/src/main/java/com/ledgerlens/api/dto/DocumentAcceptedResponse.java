package com.ledgerlens.api.dto;

public record DocumentAcceptedResponse(String jobId, String status) {
}
