package com.ledgerlens.adapter.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerlens.common.LenientDates;
import com.ledgerlens.domain.AnalysisSource;
import com.ledgerlens.domain.ClassificationResult;
import com.ledgerlens.domain.TransactionType;
import com.ledgerlens.pipeline.classifier.DocumentContext;
import com.ledgerlens.pipeline.classifier.ExtractedDocument;
import com.ledgerlens.pipeline.verifier.VerificationRequest;
import com.ledgerlens.pipeline.verifier.VerifierModelClient;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Asks the text model to re-classify the extracted document, showing it the rule-based answer for verification.
 */
@Slf4j
public class OpenAiVerifierModelClient implements VerifierModelClient {

    static final String SCHEMA_NAME = "chilean_transaction_classification";

    private final OpenAiChatClient chatClient;
    private final ObjectMapper objectMapper;
    private final ModelClientProperties properties;

    public OpenAiVerifierModelClient(OpenAiChatClient chatClient, ObjectMapper objectMapper,
                                     ModelClientProperties properties) {
        this.chatClient = chatClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record VerifierReply(
            String transactionType,
            String category,
            String subcategory,
            BigDecimal amount,
            String currency,
            String merchant,
            String description,
            String transactionDate,
            Double confidence,
            String reasoning,
            Entities extractedEntities
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Entities(List<BigDecimal> amounts, List<String> dates, List<String> businesses, List<String> categories) {
    }

    @Override
    public ClassificationResult verify(VerificationRequest request) {
        String content = chatClient.complete(properties.getVerifierModel(),
                List.of(Map.of("role", "user", "content", prompt(request))),
                OpenAiChatClient.jsonSchema(SCHEMA_NAME, replySchema()));
        try {
            return toResult(objectMapper.readValue(content, VerifierReply.class));
        } catch (JsonProcessingException e) {
            throw new ModelCallException("Verifier reply is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    static ClassificationResult toResult(VerifierReply reply) {
        if (reply.transactionType() == null || reply.category() == null || reply.amount() == null
                || reply.confidence() == null) {
            throw new ModelCallException("Verifier reply lacks type, category, amount or confidence");
        }
        Map<String, Object> entities = new LinkedHashMap<>();
        if (reply.extractedEntities() != null) {
            Entities e = reply.extractedEntities();
            entities.put("amounts", e.amounts() == null ? List.of() : e.amounts());
            entities.put("dates", e.dates() == null ? List.of() : e.dates());
            entities.put("businesses", e.businesses() == null ? List.of() : e.businesses());
            entities.put("categories", e.categories() == null ? List.of() : e.categories());
        }
        return new ClassificationResult(
                "INCOME".equalsIgnoreCase(reply.transactionType()) ? TransactionType.INCOME : TransactionType.EXPENSE,
                reply.category(),
                reply.subcategory() == null || reply.subcategory().isBlank() ? null : reply.subcategory(),
                reply.amount(),
                reply.currency(),
                LenientDates.parse(reply.transactionDate()).orElse(null),
                reply.description(),
                reply.merchant() == null || reply.merchant().isBlank() ? null : reply.merchant(),
                reply.confidence(),
                reply.reasoning(),
                entities,
                AnalysisSource.LLM);
    }

    static String prompt(VerificationRequest request) {
        ExtractedDocument doc = request.extracted();
        DocumentContext ctx = request.context();
        ClassificationResult previous = request.ruleBased();

        StringBuilder sb = new StringBuilder();
        sb.append("Eres un experto en clasificación de documentos financieros chilenos. Analiza el documento y")
                .append(" extrae la transacción financiera.\n\n")
                .append("CONTEXTO CHILENO:\n")
                .append("- Documentos en español bajo normativa chilena\n")
                .append("- Fechas en formato DD/MM/YYYY\n")
                .append("- Montos en pesos chilenos (CLP)\n")
                .append("- Busca RUT, boletas electrónicas y facturas\n")
                .append("- Considera empresas chilenas conocidas (Jumbo, Líder, Copec, Enel, etc.)\n\n")
                .append("DOCUMENTO:\n")
                .append("Tipo de documento: ").append(ctx == null || ctx.documentType() == null
                        ? "Desconocido" : ctx.documentType().name()).append('\n')
                .append("Nombre del archivo: ").append(ctx == null || ctx.fileName() == null
                        ? "Sin nombre" : ctx.fileName()).append('\n')
                .append("Idioma: ").append(ctx == null || ctx.language() == null ? "es" : ctx.language())
                .append("\n\n")
                .append("TEXTO EXTRAÍDO:\n")
                .append(doc.text().isBlank() ? "No hay texto disponible" : doc.text()).append("\n\n")
                .append("DATOS DETECTADOS:\n")
                .append("- Montos encontrados: ").append(doc.amounts().stream()
                        .map(BigDecimal::toPlainString).collect(Collectors.joining(", ", "[", "]"))).append('\n')
                .append("- Fechas encontradas: ").append(doc.dates()).append('\n')
                .append("- Comercio detectado: ").append(doc.merchant() == null ? "No detectado" : doc.merchant())
                .append("\n\n");
        if (previous != null) {
            sb.append("CLASIFICACIÓN PREVIA (para verificación):\n")
                    .append("- Tipo: ").append(previous.transactionType()).append('\n')
                    .append("- Categoría: ").append(previous.category()).append('\n')
                    .append("- Subcategoría: ").append(previous.subcategory() == null ? "N/A" : previous.subcategory())
                    .append('\n')
                    .append("- Monto: ").append(previous.amount().toPlainString()).append(' ')
                    .append(previous.currency()).append('\n')
                    .append("- Descripción: ").append(previous.description()).append('\n')
                    .append("- Confianza: ").append(previous.confidence()).append('\n')
                    .append("- Razón: ").append(previous.reasoning()).append("\n\n");
        }
        sb.append("CATEGORÍAS DE GASTO (EXPENSE): transporte, servicios_basicos, alimentacion, compras, salud,")
                .append(" educacion, entretenimiento, otros_gastos\n")
                .append("CATEGORÍAS DE INGRESO (INCOME): sueldo, trabajo_independiente, negocio, inversiones,")
                .append(" otros_ingresos\n\n")
                .append("INSTRUCCIONES:\n")
                .append("1. Identifica el monto principal (no subtotales)\n")
                .append("2. Determina si es ingreso o gasto según el contexto\n")
                .append("3. Clasifica en la categoría más apropiada\n")
                .append("4. Extrae la fecha más probable en formato YYYY-MM-DD\n")
                .append("5. Identifica el comercio o empresa\n")
                .append("6. Asigna una confianza entre 0 y 1 y explica brevemente tu razonamiento\n");
        return sb.toString();
    }

    static Map<String, Object> replySchema() {
        Map<String, Object> nullableString = Map.of("type", List.of("string", "null"));
        Map<String, Object> entities = new LinkedHashMap<>();
        entities.put("amounts", Map.of("type", "array", "items", Map.of("type", "number")));
        entities.put("dates", Map.of("type", "array", "items", Map.of("type", "string")));
        entities.put("businesses", Map.of("type", "array", "items", Map.of("type", "string")));
        entities.put("categories", Map.of("type", "array", "items", Map.of("type", "string")));

        Map<String, Object> props = new LinkedHashMap<>();
        props.put("transactionType", Map.of("type", "string", "enum", List.of("INCOME", "EXPENSE")));
        props.put("category", Map.of("type", "string"));
        props.put("subcategory", nullableString);
        props.put("amount", Map.of("type", "number"));
        props.put("currency", Map.of("type", "string"));
        props.put("merchant", nullableString);
        props.put("description", Map.of("type", "string"));
        props.put("transactionDate", Map.of("type", "string"));
        props.put("confidence", Map.of("type", "number"));
        props.put("reasoning", Map.of("type", "string"));
        props.put("extractedEntities", object(entities));
        return object(props);
    }

    private static Map<String, Object> object(Map<String, Object> properties) {
        return Map.of("type", "object", "properties", properties,
                "required", List.copyOf(properties.keySet()), "additionalProperties", false);
    }
}
