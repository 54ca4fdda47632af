package com.ledgerlens.pipeline.vision;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerlens.common.LenientDates;
import com.ledgerlens.domain.AnalysisSource;
import com.ledgerlens.domain.ChileanDocumentType;
import com.ledgerlens.domain.ClassificationResult;
import com.ledgerlens.domain.TransactionType;
import com.ledgerlens.domain.VisionPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Wraps the multimodal call: structured attempts with schema-validation retry, then a raw-JSON prompt parsed
 * field by field. Never throws; total failure yields {@code success=false} with a low-confidence default.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VisionAnalyzer {

    static final String UNKNOWN_MERCHANT = "Comercio desconocido";
    static final String DEFAULT_CATEGORY = "otros_gastos";
    static final String DEFAULT_DESCRIPTION = "Gasto general";
    static final double DEFAULT_CONFIDENCE = 0.1;

    private final VisionModelClient visionModelClient;
    private final ObjectMapper objectMapper;
    private final VisionProperties visionProperties;
    private final Clock clock;

    public VisionPayload analyze(VisionRequest request) {
        RuntimeException schemaError = null;
        int attempts = Math.max(1, visionProperties.getMaxSchemaRetries());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                VisionModelReply reply = visionModelClient.analyzeStructured(request);
                return toPayload(reply, false);
            } catch (VisionSchemaException e) {
                schemaError = e;
                log.debug("Vision schema validation failed (attempt {}/{}): {}", attempt, attempts, e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Vision analysis failed: {}", e.getMessage());
                return failure(e.getMessage());
            }
        }

        log.info("Vision structured output failed {} time(s); trying raw JSON fallback", attempts);
        try {
            String raw = visionModelClient.analyzeRaw(request);
            VisionModelReply parsed = parseRaw(raw);
            return toPayload(parsed, true);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Vision raw JSON fallback failed ({}); reporting original schema error", e.getMessage());
            return failure(schemaError.getMessage());
        }
    }

    /**
     * Strips markdown fences and reads the reply, defaulting every absent field.
     */
    VisionModelReply parseRaw(String raw) throws JsonProcessingException {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Empty vision reply");
        }
        JsonNode root = objectMapper.readTree(stripFences(raw));
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Vision reply is not a JSON object");
        }
        JsonNode merchant = root.path("merchantInfo");
        JsonNode tx = root.path("transactionInfo");
        JsonNode chile = root.path("chileanContext");

        List<BigDecimal> amounts = new ArrayList<>();
        root.path("amounts").forEach(n -> {
            if (n.isNumber()) {
                amounts.add(n.decimalValue());
            }
        });
        List<String> dates = new ArrayList<>();
        root.path("dates").forEach(n -> dates.add(n.asText()));

        return new VisionModelReply(
                root.path("extractedText").asText(""),
                amounts,
                dates,
                new VisionModelReply.MerchantInfo(
                        merchant.path("merchantName").asText(UNKNOWN_MERCHANT),
                        merchant.hasNonNull("rut") ? merchant.get("rut").asText() : null,
                        merchant.path("confidence").asDouble(DEFAULT_CONFIDENCE)),
                new VisionModelReply.TransactionInfo(
                        tx.path("transactionType").asText("EXPENSE"),
                        tx.path("category").asText(DEFAULT_CATEGORY),
                        tx.hasNonNull("subcategory") ? tx.get("subcategory").asText() : null,
                        tx.path("amount").isNumber() ? tx.get("amount").decimalValue() : BigDecimal.ZERO,
                        tx.path("currency").asText("CLP"),
                        tx.path("description").asText(DEFAULT_DESCRIPTION),
                        tx.path("confidence").asDouble(DEFAULT_CONFIDENCE)),
                new VisionModelReply.ChileanContext(
                        chile.path("documentType").asText(ChileanDocumentType.UNKNOWN.name()),
                        chile.path("hasRUT").asBoolean(false),
                        chile.path("hasIVA").asBoolean(false)),
                root.path("confidence").asDouble(DEFAULT_CONFIDENCE));
    }

    static String stripFences(String raw) {
        String s = raw.trim();
        if (s.startsWith("```")) {
            int firstNewline = s.indexOf('\n');
            s = firstNewline >= 0 ? s.substring(firstNewline + 1) : s.substring(3);
        }
        if (s.endsWith("```")) {
            s = s.substring(0, s.length() - 3);
        }
        return s.trim();
    }

    private VisionPayload toPayload(VisionModelReply reply, boolean fallbackUsed) {
        VisionModelReply.TransactionInfo tx = reply.transactionInfo();
        VisionModelReply.MerchantInfo merchant = reply.merchantInfo();
        VisionModelReply.ChileanContext chile = reply.chileanContext();

        double confidence = reply.confidence() != null
                ? reply.confidence()
                : tx != null && tx.confidence() != null ? tx.confidence() : DEFAULT_CONFIDENCE;
        LocalDate date = reply.dates() == null
                ? null
                : LenientDates.latestNotAfter(reply.dates(), LocalDate.now(clock)).orElse(null);
        String merchantName = merchant != null && merchant.merchantName() != null
                ? merchant.merchantName()
                : UNKNOWN_MERCHANT;

        Map<String, Object> entities = new LinkedHashMap<>();
        entities.put("detectedAmounts", reply.amounts() == null ? List.of() : reply.amounts());
        entities.put("detectedDates", reply.dates() == null ? List.of() : reply.dates());
        if (merchant != null && merchant.rut() != null) {
            entities.put("rut", merchant.rut());
        }

        ClassificationResult result = new ClassificationResult(
                parseType(tx == null ? null : tx.transactionType()),
                tx != null && tx.category() != null ? tx.category() : DEFAULT_CATEGORY,
                tx == null ? null : tx.subcategory(),
                tx == null ? BigDecimal.ZERO : tx.amount(),
                tx == null ? "CLP" : tx.currency(),
                date,
                tx != null && tx.description() != null ? tx.description() : DEFAULT_DESCRIPTION,
                merchantName,
                confidence,
                fallbackUsed ? "Vision analysis (raw JSON fallback)" : "Vision analysis",
                entities,
                AnalysisSource.VISION);
        return new VisionPayload(true, result,
                parseChileanType(chile == null ? null : chile.documentType()),
                chile != null && Boolean.TRUE.equals(chile.hasRut()),
                chile != null && Boolean.TRUE.equals(chile.hasIva()),
                fallbackUsed,
                null);
    }

    private VisionPayload failure(String error) {
        ClassificationResult result = new ClassificationResult(TransactionType.EXPENSE, DEFAULT_CATEGORY, null,
                BigDecimal.ZERO, "CLP", null, DEFAULT_DESCRIPTION, "Error de procesamiento",
                visionProperties.getFailureConfidence(), "Vision analysis failed", Map.of(), AnalysisSource.VISION);
        return new VisionPayload(false, result, ChileanDocumentType.UNKNOWN, false, false, false, error);
    }

    private static TransactionType parseType(String value) {
        return "INCOME".equalsIgnoreCase(value) ? TransactionType.INCOME : TransactionType.EXPENSE;
    }

    private static ChileanDocumentType parseChileanType(String value) {
        if (value == null) {
            return ChileanDocumentType.UNKNOWN;
        }
        try {
            return ChileanDocumentType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ChileanDocumentType.UNKNOWN;
        }
    }
}
