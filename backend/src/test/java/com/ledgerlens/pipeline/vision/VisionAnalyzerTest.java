package com.ledgerlens.pipeline.vision;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerlens.domain.ChileanDocumentType;
import com.ledgerlens.domain.TransactionType;
import com.ledgerlens.domain.VisionPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VisionAnalyzerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    VisionModelClient visionModelClient;

    private VisionAnalyzer analyzer;
    private final VisionRequest request = new VisionRequest(new byte[]{1, 2, 3}, "image/png", null);

    @BeforeEach
    void setUp() {
        analyzer = new VisionAnalyzer(visionModelClient, new ObjectMapper(), new VisionProperties(), CLOCK);
    }

    @Test
    @DisplayName("structured reply maps to a successful payload with the latest non-future date")
    void structuredReply() {
        when(visionModelClient.analyzeStructured(request)).thenReturn(reply());

        VisionPayload payload = analyzer.analyze(request);

        assertThat(payload.success()).isTrue();
        assertThat(payload.fallbackUsed()).isFalse();
        assertThat(payload.result().transactionType()).isEqualTo(TransactionType.EXPENSE);
        assertThat(payload.result().category()).isEqualTo("alimentacion");
        assertThat(payload.result().amount()).isEqualByComparingTo("15990");
        assertThat(payload.result().merchant()).isEqualTo("JUMBO");
        assertThat(payload.result().confidence()).isEqualTo(0.9);
        assertThat(payload.result().transactionDate()).isEqualTo(LocalDate.of(2025, 5, 20));
        assertThat(payload.chileanDocumentType()).isEqualTo(ChileanDocumentType.BOLETA);
        assertThat(payload.hasRut()).isTrue();
        assertThat(payload.result().extractedEntities()).containsEntry("rut", "76.123.456-7");
    }

    @Test
    @DisplayName("repeated schema failures fall back to the raw JSON prompt")
    void schemaFailuresUseRawFallback() {
        when(visionModelClient.analyzeStructured(request)).thenThrow(new VisionSchemaException("missing amount"));
        when(visionModelClient.analyzeRaw(request)).thenReturn("""
                ```json
                {"transactionInfo": {"transactionType": "INCOME", "category": "sueldo", "amount": 850000},
                 "confidence": 0.6}
                ```""");

        VisionPayload payload = analyzer.analyze(request);

        verify(visionModelClient, times(3)).analyzeStructured(request);
        assertThat(payload.success()).isTrue();
        assertThat(payload.fallbackUsed()).isTrue();
        assertThat(payload.result().transactionType()).isEqualTo(TransactionType.INCOME);
        assertThat(payload.result().amount()).isEqualByComparingTo("850000");
        assertThat(payload.result().merchant()).isEqualTo(VisionAnalyzer.UNKNOWN_MERCHANT);
        assertThat(payload.result().description()).isEqualTo(VisionAnalyzer.DEFAULT_DESCRIPTION);
    }

    @Test
    @DisplayName("failed fallback reports the original schema error with default confidence")
    void fallbackFailureReportsSchemaError() {
        when(visionModelClient.analyzeStructured(request)).thenThrow(new VisionSchemaException("missing amount"));
        when(visionModelClient.analyzeRaw(request)).thenReturn("not json at all");

        VisionPayload payload = analyzer.analyze(request);

        assertThat(payload.success()).isFalse();
        assertThat(payload.error()).isEqualTo("missing amount");
        assertThat(payload.result().confidence()).isEqualTo(0.1);
        assertThat(payload.result().category()).isEqualTo(VisionAnalyzer.DEFAULT_CATEGORY);
    }

    @Test
    @DisplayName("transport failure is not retried and never reaches the fallback")
    void transportFailureIsImmediate() {
        when(visionModelClient.analyzeStructured(any())).thenThrow(new IllegalStateException("HTTP 503"));

        VisionPayload payload = analyzer.analyze(request);

        assertThat(payload.success()).isFalse();
        assertThat(payload.error()).isEqualTo("HTTP 503");
        verify(visionModelClient, times(1)).analyzeStructured(any());
        verify(visionModelClient, never()).analyzeRaw(any());
    }

    @Test
    void stripFences_removesMarkdownWrapper() {
        assertThat(VisionAnalyzer.stripFences("```json\n{\"a\":1}\n```")).isEqualTo("{\"a\":1}");
        assertThat(VisionAnalyzer.stripFences("  {\"a\":1} ")).isEqualTo("{\"a\":1}");
    }

    private static VisionModelReply reply() {
        return new VisionModelReply(
                "JUMBO\nTOTAL $15.990",
                List.of(new BigDecimal("15990")),
                List.of("20/05/2025", "01/01/2030"),
                new VisionModelReply.MerchantInfo("JUMBO", "76.123.456-7", 0.95),
                new VisionModelReply.TransactionInfo("EXPENSE", "alimentacion", "supermercado",
                        new BigDecimal("15990"), "CLP", "Compra supermercado", 0.9),
                new VisionModelReply.ChileanContext("BOLETA", true, true),
                0.9);
    }
}
