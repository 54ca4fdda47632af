package com.ledgerlens.pipeline.verifier;

import com.ledgerlens.domain.AnalysisSource;
import com.ledgerlens.domain.ClassificationResult;
import com.ledgerlens.domain.TransactionType;
import com.ledgerlens.pipeline.classifier.DocumentContext;
import com.ledgerlens.pipeline.classifier.ExtractedDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClassificationVerifierTest {

    @Mock
    VerifierModelClient verifierModelClient;

    @InjectMocks
    ClassificationVerifier verifier;

    private final VerificationRequest request = new VerificationRequest(
            result(TransactionType.EXPENSE, "alimentacion", "15990", 0.7),
            new ExtractedDocument("COMPRA JUMBO $15.990", List.of(new BigDecimal("15990")), List.of(), null, Map.of()),
            new DocumentContext(null, "boleta.jpg", "es"));

    @Test
    @DisplayName("verifier answer is tagged as the LLM source")
    void verifyTagsSource() {
        when(verifierModelClient.verify(request))
                .thenReturn(result(TransactionType.EXPENSE, "alimentacion", "15990", 0.85));

        ClassificationResult answer = verifier.verify(request);

        assertThat(answer.source()).isEqualTo(AnalysisSource.LLM);
        assertThat(answer.confidence()).isEqualTo(0.85);
    }

    @Test
    @DisplayName("any verifier failure surfaces as VerificationException")
    void verifyFailureIsWrapped() {
        when(verifierModelClient.verify(any())).thenThrow(new IllegalStateException("quota exceeded"));

        assertThatThrownBy(() -> verifier.verify(request))
                .isInstanceOf(VerificationException.class)
                .hasMessageContaining("quota exceeded");
    }

    @Test
    void verifyNullAnswerIsAFailure() {
        when(verifierModelClient.verify(any())).thenReturn(null);

        assertThatThrownBy(() -> verifier.verify(request)).isInstanceOf(VerificationException.class);
    }

    @Test
    @DisplayName("agreement averages confidences; verifier recommended")
    void compareAgreement() {
        ClassificationComparison comparison = verifier.compare(
                result(TransactionType.EXPENSE, "alimentacion", "15990", 0.9),
                result(TransactionType.EXPENSE, "alimentacion", "15950", 0.7));

        assertThat(comparison.hasDiscrepancies()).isFalse();
        assertThat(comparison.recommendedSource()).isEqualTo(AnalysisSource.LLM);
        assertThat(comparison.combinedConfidence()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    @DisplayName("unsure verifier that agrees keeps the rule-based answer")
    void compareUnsureAgreementKeepsRuleBased() {
        ClassificationResult ruleBased = result(TransactionType.EXPENSE, "alimentacion", "15990", 0.7);
        ClassificationComparison comparison = verifier.compare(
                result(TransactionType.EXPENSE, "alimentacion", "15990", 0.4), ruleBased);

        assertThat(comparison.recommendedSource()).isEqualTo(AnalysisSource.OCR);
        assertThat(comparison.recommended()).isSameAs(ruleBased);
    }

    @Test
    @DisplayName("disagreement lists each differing field and discounts the better confidence")
    void compareDisagreement() {
        ClassificationComparison comparison = verifier.compare(
                result(TransactionType.INCOME, "negocio", "20000", 0.8),
                result(TransactionType.EXPENSE, "alimentacion", "15990", 0.7));

        assertThat(comparison.discrepancies()).containsExactly(
                "Tipo de transacción: OCR=EXPENSE, LLM=INCOME",
                "Categoría: OCR=alimentacion, LLM=negocio",
                "Monto: OCR=15990, LLM=20000");
        assertThat(comparison.recommendedSource()).isEqualTo(AnalysisSource.LLM);
        assertThat(comparison.combinedConfidence()).isCloseTo(0.64, within(1e-9));
    }

    @Test
    void insightsFlagSmallAmountsAndLowConfidence() {
        List<String> insights = verifier.insights(result(TransactionType.EXPENSE, "transporte", "800", 0.4));

        assertThat(insights).containsExactly(
                "🔸 Monto menor: $800 CLP",
                "🚗 Gasto en movilización y transporte",
                "⚠️ Clasificación con baja confianza - revisar manualmente");
    }

    private static ClassificationResult result(TransactionType type, String category, String amount,
                                               double confidence) {
        return new ClassificationResult(type, category, null, new BigDecimal(amount), "CLP", null, "desc", null,
                confidence, "test", Map.of(), AnalysisSource.OCR);
    }
}
