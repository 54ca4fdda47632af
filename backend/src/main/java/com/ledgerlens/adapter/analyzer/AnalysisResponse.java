package com.ledgerlens.adapter.analyzer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Wire shape of {@code POST /analyses} and {@code GET /analyses/{jobId}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record AnalysisResponse(
        String status,
        String jobId,
        String text,
        List<BigDecimal> amounts,
        List<String> dates,
        Map<String, String> keyValues,
        Integer tableCount,
        String merchant,
        String documentType,
        String language,
        String error
) {
}
