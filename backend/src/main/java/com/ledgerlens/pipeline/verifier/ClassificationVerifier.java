package com.ledgerlens.pipeline.verifier;

import com.ledgerlens.common.MoneyFormat;
import com.ledgerlens.domain.AnalysisSource;
import com.ledgerlens.domain.ClassificationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Calls the verifying model and compares its answer to the rule-based one.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ClassificationVerifier {

    private static final BigDecimal AMOUNT_TOLERANCE_RATIO = new BigDecimal("0.05");
    private static final BigDecimal AMOUNT_TOLERANCE_FLOOR = BigDecimal.valueOf(100);
    private static final BigDecimal SIGNIFICANT_AMOUNT = BigDecimal.valueOf(50_000);
    private static final BigDecimal SMALL_AMOUNT = BigDecimal.valueOf(1_000);

    private static final Map<String, String> CATEGORY_INSIGHTS = Map.of(
            "servicios_basicos", "🏠 Gasto en servicios esenciales del hogar",
            "transporte", "🚗 Gasto en movilización y transporte",
            "alimentacion", "🍽️ Gasto en comida y alimentación",
            "salud", "🏥 Inversión en salud y bienestar",
            "educacion", "📚 Inversión en educación y desarrollo",
            "sueldo", "💼 Ingreso laboral regular",
            "trabajo_independiente", "👨‍💼 Ingreso por servicios profesionales");

    private final VerifierModelClient verifierModelClient;

    /**
     * @throws VerificationException on any verifier failure; callers must not guess past it
     */
    public ClassificationResult verify(VerificationRequest request) {
        try {
            ClassificationResult result = verifierModelClient.verify(request);
            if (result == null) {
                throw new IllegalStateException("Verifier returned no result");
            }
            log.debug("Verifier answered {} / {} confidence={}",
                    result.transactionType(), result.category(), result.confidence());
            return result.withSource(AnalysisSource.LLM);
        } catch (VerificationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new VerificationException("LLM verification failed: " + e.getMessage(), e);
        }
    }

    /**
     * Verifier wins unless it is unsure (confidence below 0.5) and agrees with the rule-based answer.
     */
    public ClassificationComparison compare(ClassificationResult verifier, ClassificationResult ruleBased) {
        List<String> discrepancies = new ArrayList<>();
        if (verifier.transactionType() != ruleBased.transactionType()) {
            discrepancies.add("Tipo de transacción: OCR=" + ruleBased.transactionType()
                    + ", LLM=" + verifier.transactionType());
        }
        if (!Objects.equals(verifier.category(), ruleBased.category())) {
            discrepancies.add("Categoría: OCR=" + ruleBased.category() + ", LLM=" + verifier.category());
        }
        BigDecimal diff = verifier.amount().subtract(ruleBased.amount()).abs();
        BigDecimal tolerance = ruleBased.amount().multiply(AMOUNT_TOLERANCE_RATIO).max(AMOUNT_TOLERANCE_FLOOR);
        if (diff.compareTo(tolerance) > 0) {
            discrepancies.add("Monto: OCR=" + ruleBased.amount().toPlainString()
                    + ", LLM=" + verifier.amount().toPlainString());
        }

        boolean keepRuleBased = verifier.confidence() < 0.5 && discrepancies.isEmpty();
        double combined = discrepancies.isEmpty()
                ? Math.min(1.0, (verifier.confidence() + ruleBased.confidence()) / 2)
                : Math.max(verifier.confidence(), ruleBased.confidence()) * 0.8;
        return new ClassificationComparison(
                List.copyOf(discrepancies),
                keepRuleBased ? ruleBased : verifier,
                keepRuleBased ? AnalysisSource.OCR : AnalysisSource.LLM,
                ClassificationResult.clamp(combined));
    }

    /** Short Spanish remarks shown alongside a verified classification. */
    public List<String> insights(ClassificationResult result) {
        List<String> insights = new ArrayList<>();
        if (result.amount().compareTo(SIGNIFICANT_AMOUNT) > 0) {
            insights.add("💰 Transacción significativa de $" + MoneyFormat.clp(result.amount()) + " CLP");
        }
        if (result.amount().compareTo(SMALL_AMOUNT) < 0) {
            insights.add("🔸 Monto menor: $" + MoneyFormat.clp(result.amount()) + " CLP");
        }
        String categoryInsight = CATEGORY_INSIGHTS.get(result.category());
        if (categoryInsight != null) {
            insights.add(categoryInsight);
        }
        if (result.confidence() < 0.5) {
            insights.add("⚠️ Clasificación con baja confianza - revisar manualmente");
        } else if (result.confidence() > 0.8) {
            insights.add("✅ Clasificación con alta confianza");
        }
        return insights;
    }
}
