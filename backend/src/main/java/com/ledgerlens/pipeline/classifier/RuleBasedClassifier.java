package com.ledgerlens.pipeline.classifier;

import com.ledgerlens.common.LenientDates;
import com.ledgerlens.domain.AnalysisSource;
import com.ledgerlens.domain.ClassificationResult;
import com.ledgerlens.domain.DocumentType;
import com.ledgerlens.domain.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic keyword/pattern scoring over extracted text. Never throws: empty input yields a default
 * low-confidence EXPENSE in the generic category.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RuleBasedClassifier {

    private static final List<String> INCOME_KEYWORDS = List.of(
            "sueldo", "salario", "remuneracion", "liquidacion", "haberes",
            "honorarios", "freelance", "independiente", "servicios", "consultoria",
            "ventas", "factura emitida", "ingreso", "cobro",
            "dividendos", "intereses", "inversion", "renta", "deposito plazo",
            "bono", "subsidio", "devolucion", "reembolso", "premio");

    private static final List<String> EXPENSE_KEYWORDS = List.of(
            "compra", "pago", "factura", "boleta", "recibo", "gasto",
            "supermercado", "restaurante", "comida", "bencina", "combustible",
            "luz", "agua", "gas", "internet", "telefono", "cable",
            "medico", "farmacia", "clinica", "hospital", "medicina",
            "colegio", "universidad", "educacion", "matricula");

    /** Invoice issued by the user (they are billing someone). */
    private static final List<String> ISSUED_INVOICE_KEYWORDS = List.of(
            "factura emitida", "factura de venta", "cobro", "pago recibido");

    private static final List<Pattern> BUSINESS_DOCUMENT_PATTERNS = List.of(
            Pattern.compile("rut[\\s:]?\\d{2}\\.\\d{3}\\.\\d{3}-?[\\dk]", Pattern.CASE_INSENSITIVE),
            Pattern.compile("factura\\s+electronica", Pattern.CASE_INSENSITIVE),
            Pattern.compile("boleta\\s+electronica", Pattern.CASE_INSENSITIVE));

    private static final Pattern NUMERIC_LINE = Pattern.compile("^\\d+[\\d\\s,.-]*$");
    private static final Pattern NAME_BEFORE_RUT = Pattern.compile(
            "([A-ZÀ-ÿ][A-ZÀ-ÿ\\s]+)\\s+RUT[\\s:]?\\d{2}\\.\\d{3}\\.\\d{3}-?[\\dk]",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final List<String> MERCHANT_KEYS =
            List.of("merchant", "comercio", "empresa", "proveedor", "store", "tienda");
    private static final BigDecimal MIN_SIGNIFICANT_AMOUNT = BigDecimal.valueOf(100);

    private final CategoryCatalogue categoryCatalogue;
    private final Clock clock;

    public ClassificationResult classify(ExtractedDocument document, DocumentContext context) {
        ExtractedDocument doc = document != null ? document : ExtractedDocument.from(null);
        DocumentContext ctx = context != null ? context : new DocumentContext(null, null, "es");
        String text = doc.text();

        TransactionType type = determineTransactionType(text, ctx.documentType());
        CategoryMatch match = categorize(text, type, ctx.documentType());
        BigDecimal amount = primaryAmount(doc.amounts());
        LocalDate today = LocalDate.now(clock);
        LocalDate date = transactionDate(doc.dates(), today);
        String description = describe(text, match.category());
        String merchant = doc.merchant() != null && !doc.merchant().isBlank()
                ? doc.merchant().trim()
                : extractMerchant(text, doc.keyValues()).orElse(null);
        double confidence = confidence(text, match, ctx.documentType(), amount, date, today, merchant != null);

        Map<String, Object> entities = new LinkedHashMap<>();
        entities.put("detectedAmounts", doc.amounts());
        entities.put("detectedDates", doc.dates());
        entities.put("textLength", text.length());
        entities.put("documentType", ctx.documentType() == null ? null : ctx.documentType().name());
        entities.put("keywordMatches", match.matchedKeywords());
        entities.put("patternMatches", match.matchedPatterns());

        ClassificationResult result = new ClassificationResult(type, match.category(), match.subcategory(), amount,
                "CLP", date, description, merchant, confidence, match.reasoning(), entities, AnalysisSource.OCR);
        log.debug("Rule-based classification: {} / {} amount={} confidence={}",
                type, match.category(), amount, confidence);
        return result;
    }

    TransactionType determineTransactionType(String text, DocumentType documentType) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (documentType == DocumentType.PAYSLIP) {
            return TransactionType.INCOME;
        }
        if (documentType == DocumentType.INVOICE && ISSUED_INVOICE_KEYWORDS.stream().anyMatch(lower::contains)) {
            return TransactionType.INCOME;
        }
        long incomeScore = INCOME_KEYWORDS.stream().filter(lower::contains).count();
        long expenseScore = EXPENSE_KEYWORDS.stream().filter(lower::contains).count();
        boolean businessDocument = BUSINESS_DOCUMENT_PATTERNS.stream().anyMatch(p -> p.matcher(text).find());
        if (businessDocument && incomeScore == expenseScore) {
            return TransactionType.EXPENSE;
        }
        return incomeScore > expenseScore ? TransactionType.INCOME : TransactionType.EXPENSE;
    }

    CategoryMatch categorize(String text, TransactionType type, DocumentType documentType) {
        String lower = text.toLowerCase(Locale.ROOT);
        CategoryMatch best = CategoryMatch.fallback(categoryCatalogue.defaultCategory(type));
        for (CategoryDefinition category : categoryCatalogue.categoriesFor(type)) {
            int score = 0;
            List<String> keywords = new ArrayList<>();
            List<String> patterns = new ArrayList<>();
            for (String keyword : category.keywords()) {
                if (lower.contains(keyword)) {
                    score += 2;
                    keywords.add(keyword);
                }
            }
            for (Pattern pattern : category.patterns()) {
                if (pattern.matcher(text).find()) {
                    score += 3;
                    patterns.add(pattern.pattern());
                }
            }
            String subcategory = null;
            if (score > 0) {
                int bestSubScore = 0;
                for (CategoryDefinition.Subcategory sub : category.subcategories()) {
                    int subScore = (int) sub.keywords().stream().filter(lower::contains).count();
                    if (subScore > bestSubScore) {
                        bestSubScore = subScore;
                        subcategory = sub.name();
                    }
                }
                score += bestSubScore;
            }
            if (categoryCatalogue.hasDocumentTypeBonus(documentType, category.name())) {
                score += 1;
            }
            if (score > best.score()) {
                best = new CategoryMatch(category.name(), subcategory, score, List.copyOf(keywords),
                        List.copyOf(patterns),
                        "Coincidencia con " + keywords.size() + " palabras clave y " + patterns.size() + " patrones");
            }
        }
        return best;
    }

    BigDecimal primaryAmount(List<BigDecimal> amounts) {
        List<BigDecimal> present = amounts.stream().filter(Objects::nonNull).toList();
        if (present.isEmpty()) {
            return BigDecimal.ZERO;
        }
        if (present.size() == 1) {
            return present.get(0);
        }
        return present.stream()
                .filter(a -> a.compareTo(MIN_SIGNIFICANT_AMOUNT) >= 0)
                .max(Comparator.naturalOrder())
                .orElseGet(() -> present.stream().max(Comparator.naturalOrder()).orElse(BigDecimal.ZERO));
    }

    /** Most recent parseable, non-future date; today when nothing qualifies. */
    LocalDate transactionDate(List<String> dates, LocalDate today) {
        return LenientDates.latestNotAfter(dates, today).orElse(today);
    }

    String describe(String text, String category) {
        List<String> lines = Arrays.stream(text.split("\\R"))
                .map(l -> l.replaceAll("\\s+", " ").trim())
                .filter(l -> !l.isEmpty())
                .limit(5)
                .toList();
        for (String line : lines) {
            String lower = line.toLowerCase(Locale.ROOT);
            if (line.length() > 10 && line.length() < 100
                    && !NUMERIC_LINE.matcher(line).matches()
                    && !lower.contains("total")) {
                return line;
            }
        }
        return categoryCatalogue.fallbackDescription(category);
    }

    Optional<String> extractMerchant(String text, Map<String, String> keyValues) {
        for (Map.Entry<String, String> kv : keyValues.entrySet()) {
            if (kv.getKey() == null || kv.getValue() == null || kv.getValue().isBlank()) {
                continue;
            }
            String key = kv.getKey().toLowerCase(Locale.ROOT);
            if (MERCHANT_KEYS.stream().anyMatch(key::contains)) {
                return Optional.of(kv.getValue().trim());
            }
        }
        Matcher rut = NAME_BEFORE_RUT.matcher(text);
        if (rut.find()) {
            return Optional.of(rut.group(1).trim());
        }
        return Arrays.stream(text.split("\\R"))
                .limit(3)
                .map(String::trim)
                .filter(l -> l.length() > 5 && l.length() < 50)
                .filter(l -> !NUMERIC_LINE.matcher(l).matches())
                .findFirst();
    }

    private static double confidence(String text, CategoryMatch match, DocumentType documentType, BigDecimal amount,
                                     LocalDate date, LocalDate today, boolean merchantFound) {
        double confidence = 0.3;
        if (text.length() > 50) {
            confidence += 0.1;
        }
        if (amount.signum() > 0) {
            confidence += 0.2;
        }
        if (!date.equals(today)) {
            confidence += 0.1;
        }
        confidence += Math.min(match.matchedKeywords().size() * 0.05, 0.15);
        confidence += Math.min(match.matchedPatterns().size() * 0.1, 0.2);
        if (DocumentType.isKnown(documentType)) {
            confidence += 0.1;
        }
        if (merchantFound) {
            confidence += 0.05;
        }
        return ClassificationResult.clamp(confidence);
    }

    record CategoryMatch(String category, String subcategory, int score, List<String> matchedKeywords,
                         List<String> matchedPatterns, String reasoning) {

        static CategoryMatch fallback(String category) {
            return new CategoryMatch(category, null, 0, List.of(), List.of(), "Clasificación por defecto");
        }
    }
}
