package com.ledgerlens.pipeline.merge;

import com.ledgerlens.domain.AnalysisSource;
import com.ledgerlens.domain.ClassificationResult;
import com.ledgerlens.domain.MergedResult;
import com.ledgerlens.domain.TransactionType;
import com.ledgerlens.domain.VisionPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Combines rule-based, verifier and vision opinions into one result, a final confidence and a discrepancy list.
 * A confident vision answer (above 0.7) is preferred; otherwise the most confident source wins.
 */
@Component
@Slf4j
public class AnalysisMerger {

    static final double VISION_PRIORITY_THRESHOLD = 0.7;
    private static final double AGREEMENT_BONUS = 0.1;
    private static final double VISION_LLM_AMOUNT_BONUS = 0.1;
    private static final double VISION_LLM_CATEGORY_BONUS = 0.05;
    private static final BigDecimal AMOUNT_AGREEMENT_RATIO = new BigDecimal("0.1");
    private static final BigDecimal AMOUNT_DISCREPANCY_RATIO = new BigDecimal("0.2");

    /**
     * @param ruleBased always present
     * @param verifier  null when the verifier was not reached
     * @param vision    null when rendering failed; ignored unless {@code success}
     */
    public MergedResult merge(ClassificationResult ruleBased, ClassificationResult verifier, VisionPayload vision) {
        Objects.requireNonNull(ruleBased, "ruleBased");
        ClassificationResult visionResult = vision != null && vision.success() ? vision.result() : null;

        List<ClassificationResult> sources = new ArrayList<>();
        sources.add(ruleBased.withSource(AnalysisSource.OCR));
        if (verifier != null) {
            sources.add(verifier.withSource(AnalysisSource.LLM));
        }
        if (visionResult != null) {
            sources.add(visionResult.withSource(AnalysisSource.VISION));
        }
        ClassificationResult llm = verifier == null ? null : sources.get(1);
        ClassificationResult vis = visionResult == null ? null : sources.get(sources.size() - 1);

        boolean visionPrioritized = vis != null && vis.confidence() > VISION_PRIORITY_THRESHOLD;
        ClassificationResult primary = visionPrioritized ? vis : sources.stream()
                .max(Comparator.comparingDouble(ClassificationResult::confidence))
                .orElse(sources.get(0));

        int agreements = 0;
        if (sources.size() > 1) {
            if (distinct(sources, ClassificationResult::category).size() == 1) {
                agreements++;
            }
            if (distinct(sources, ClassificationResult::transactionType).size() == 1) {
                agreements++;
            }
        }
        double confidence = primary.confidence() + agreements * AGREEMENT_BONUS;
        if (vis != null && llm != null) {
            if (bothAmountsRead(vis, llm)
                    && amountRatio(vis.amount(), llm.amount()).compareTo(AMOUNT_AGREEMENT_RATIO) < 0) {
                confidence += VISION_LLM_AMOUNT_BONUS;
            }
            if (Objects.equals(vis.category(), llm.category())) {
                confidence += VISION_LLM_CATEGORY_BONUS;
            }
        }

        List<String> discrepancies = discrepancies(sources, vis, llm);
        ClassificationResult finalResult = finalise(primary, ruleBased, confidence);
        List<String> sourcesUsed = sources.stream().map(s -> s.source().displayName()).toList();
        String reasoning = reasoning(primary, visionPrioritized, agreements, discrepancies.size());

        log.debug("Merged {} source(s): primary={} confidence={} discrepancies={}",
                sources.size(), primary.source(), finalResult.confidence(), discrepancies.size());
        return new MergedResult(finalResult, finalResult.confidence(), sourcesUsed, discrepancies, reasoning);
    }

    private static List<String> discrepancies(List<ClassificationResult> sources, ClassificationResult vis,
                                              ClassificationResult llm) {
        List<String> out = new ArrayList<>();
        if (vis != null && llm != null && bothAmountsRead(vis, llm)
                && amountRatio(vis.amount(), llm.amount()).compareTo(AMOUNT_DISCREPANCY_RATIO) > 0) {
            out.add("Amount discrepancy: Vision " + vis.amount().toPlainString()
                    + " vs LLM " + llm.amount().toPlainString());
        }
        Set<String> categories = distinct(sources, ClassificationResult::category);
        if (categories.size() > 1) {
            out.add("Category discrepancy: " + String.join(" vs ", categories));
        }
        Set<String> types = distinct(sources, ClassificationResult::transactionType);
        if (types.size() > 1) {
            out.add("Transaction type discrepancy: " + String.join(" vs ", types));
        }
        return out;
    }

    /** A zero amount means the source could not read one, so it neither agrees nor disagrees. */
    private static boolean bothAmountsRead(ClassificationResult vis, ClassificationResult llm) {
        return vis.amount() != null && vis.amount().signum() != 0
                && llm.amount() != null && llm.amount().signum() != 0;
    }

    /** |a-b| / max(a,b); zero when both are zero. */
    static BigDecimal amountRatio(BigDecimal a, BigDecimal b) {
        BigDecimal max = a.max(b);
        if (max.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return a.subtract(b).abs().divide(max, MathContext.DECIMAL64);
    }

    private static ClassificationResult finalise(ClassificationResult primary, ClassificationResult ruleBased,
                                                 double confidence) {
        return new ClassificationResult(
                primary.transactionType() != null ? primary.transactionType() : TransactionType.EXPENSE,
                primary.category() != null ? primary.category() : "otros_gastos",
                primary.subcategory(),
                primary.amount(),
                primary.currency(),
                primary.transactionDate() != null ? primary.transactionDate() : ruleBased.transactionDate(),
                primary.description() != null ? primary.description() : "Transacción procesada",
                primary.merchant(),
                confidence,
                primary.reasoning(),
                primary.extractedEntities(),
                primary.source());
    }

    private static String reasoning(ClassificationResult primary, boolean visionPrioritized, int agreements,
                                    int discrepancyCount) {
        List<String> parts = new ArrayList<>();
        parts.add(String.format(Locale.ROOT, "Selected %s as primary source (confidence: %.1f%%)",
                primary.source().displayName(), primary.confidence() * 100));
        if (visionPrioritized) {
            parts.add("Vision API prioritized for enhanced Chilean document recognition");
        }
        if (agreements > 0) {
            parts.add(agreements + " agreement(s) between sources");
        }
        if (discrepancyCount > 0) {
            parts.add(discrepancyCount + " discrepancy(ies) detected");
        }
        return String.join(". ", parts);
    }

    private static Set<String> distinct(List<ClassificationResult> sources,
                                        Function<ClassificationResult, Object> field) {
        return sources.stream()
                .map(field)
                .map(String::valueOf)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
