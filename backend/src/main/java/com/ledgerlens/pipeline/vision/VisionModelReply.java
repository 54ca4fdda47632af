package com.ledgerlens.pipeline.vision;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Structured answer requested from the vision model. Field names match the JSON schema sent with the request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VisionModelReply(
        String extractedText,
        List<BigDecimal> amounts,
        List<String> dates,
        MerchantInfo merchantInfo,
        TransactionInfo transactionInfo,
        ChileanContext chileanContext,
        Double confidence
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MerchantInfo(String merchantName, String rut, Double confidence) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TransactionInfo(
            String transactionType,
            String category,
            String subcategory,
            BigDecimal amount,
            String currency,
            String description,
            Double confidence
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChileanContext(
            String documentType,
            @JsonProperty("hasRUT") Boolean hasRut,
            @JsonProperty("hasIVA") Boolean hasIva
    ) {
    }
}
