package com.ledgerlens.adapter.openai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerlens.pipeline.vision.VisionModelClient;
import com.ledgerlens.pipeline.vision.VisionModelReply;
import com.ledgerlens.pipeline.vision.VisionRequest;
import com.ledgerlens.pipeline.vision.VisionSchemaException;
import lombok.extern.slf4j.Slf4j;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sends one page image to the multimodal model with a prompt tuned for Chilean receipts, invoices and statements.
 */
@Slf4j
public class OpenAiVisionModelClient implements VisionModelClient {

    static final String SCHEMA_NAME = "chilean_document_analysis";

    private static final String SYSTEM_PROMPT =
            "Eres un experto en análisis de documentos financieros chilenos. Respondes solo con JSON válido.";

    private final OpenAiChatClient chatClient;
    private final ObjectMapper objectMapper;
    private final ModelClientProperties properties;

    public OpenAiVisionModelClient(OpenAiChatClient chatClient, ObjectMapper objectMapper,
                                   ModelClientProperties properties) {
        this.chatClient = chatClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public VisionModelReply analyzeStructured(VisionRequest request) {
        String content = chatClient.complete(properties.getVisionModel(), messages(request),
                OpenAiChatClient.jsonSchema(SCHEMA_NAME, replySchema()));
        VisionModelReply reply;
        try {
            reply = objectMapper.readValue(content, VisionModelReply.class);
        } catch (JsonProcessingException e) {
            throw new VisionSchemaException("Vision reply is not valid JSON: " + e.getOriginalMessage(), e);
        }
        validate(reply);
        return reply;
    }

    @Override
    public String analyzeRaw(VisionRequest request) {
        return chatClient.complete(properties.getVisionModel(), messages(request), OpenAiChatClient.jsonObject());
    }

    static void validate(VisionModelReply reply) {
        if (reply == null) {
            throw new VisionSchemaException("Vision reply is empty");
        }
        if (reply.transactionInfo() == null) {
            throw new VisionSchemaException("Vision reply has no transactionInfo");
        }
        if (reply.transactionInfo().amount() == null || reply.transactionInfo().transactionType() == null
                || reply.transactionInfo().category() == null) {
            throw new VisionSchemaException("Vision transactionInfo lacks amount, type or category");
        }
        if (reply.merchantInfo() == null || reply.chileanContext() == null) {
            throw new VisionSchemaException("Vision reply lacks merchantInfo or chileanContext");
        }
        if (reply.confidence() == null || reply.confidence() < 0 || reply.confidence() > 1) {
            throw new VisionSchemaException("Vision confidence missing or outside [0,1]");
        }
    }

    private List<Map<String, Object>> messages(VisionRequest request) {
        String mimeType = request.mimeType() == null ? "image/png" : request.mimeType();
        String dataUrl = "data:" + mimeType + ";base64," + Base64.getEncoder().encodeToString(request.image());
        List<Map<String, Object>> userContent = List.of(
                Map.of("type", "text", "text", prompt(request)),
                Map.of("type", "image_url", "image_url", Map.of("url", dataUrl, "detail", "high")));
        return List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", userContent));
    }

    static String prompt(VisionRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("Analiza este documento financiero chileno y extrae la información de la transacción.\n\n");
        if (request.documentTypeHint() != null) {
            sb.append("Tipo de documento sugerido: ").append(request.documentTypeHint().name()).append("\n\n");
        }
        sb.append("CONTEXTO CHILENO:\n")
                .append("- Montos en pesos chilenos (CLP); el punto separa miles (15.990 = quince mil novecientos noventa)\n")
                .append("- Fechas en formato dd/mm/aaaa\n")
                .append("- Boletas y facturas suelen incluir RUT del emisor e IVA (19%)\n")
                .append("- Comercios frecuentes: Jumbo, Lider, Santa Isabel, Tottus, Unimarc, Copec, Shell, Falabella,")
                .append(" Ripley, Paris, Cruz Verde, Salcobrand, Enel, Aguas Andinas, Movistar, Entel\n\n")
                .append("CATEGORÍAS DE GASTO: transporte, servicios_basicos, alimentacion, compras, salud, educacion,")
                .append(" entretenimiento, otros_gastos\n")
                .append("CATEGORÍAS DE INGRESO: sueldo, trabajo_independiente, negocio, inversiones, otros_ingresos\n\n")
                .append("Responde SOLO con un objeto JSON con esta estructura:\n")
                .append("{\"extractedText\": string, \"amounts\": [number], \"dates\": [\"dd/mm/aaaa\"],")
                .append(" \"merchantInfo\": {\"merchantName\": string, \"rut\": string|null, \"confidence\": number},")
                .append(" \"transactionInfo\": {\"transactionType\": \"INCOME\"|\"EXPENSE\", \"category\": string,")
                .append(" \"subcategory\": string|null, \"amount\": number, \"currency\": \"CLP\",")
                .append(" \"description\": string, \"confidence\": number},")
                .append(" \"chileanContext\": {\"documentType\": \"BOLETA\"|\"FACTURA\"|\"RECIBO\"|\"TRANSFERENCIA\"|")
                .append("\"COMPROBANTE\"|\"UNKNOWN\", \"hasRUT\": boolean, \"hasIVA\": boolean},")
                .append(" \"confidence\": number}\n")
                .append("El monto de la transacción es el TOTAL pagado. Confianzas entre 0 y 1.");
        return sb.toString();
    }

    /** JSON schema mirroring {@link VisionModelReply}; strict mode needs every property listed as required. */
    static Map<String, Object> replySchema() {
        Map<String, Object> merchant = object(Map.of(
                "merchantName", type("string"),
                "rut", Map.of("type", List.of("string", "null")),
                "confidence", type("number")));
        Map<String, Object> transaction = object(Map.of(
                "transactionType", Map.of("type", "string", "enum", List.of("INCOME", "EXPENSE")),
                "category", type("string"),
                "subcategory", Map.of("type", List.of("string", "null")),
                "amount", type("number"),
                "currency", type("string"),
                "description", type("string"),
                "confidence", type("number")));
        Map<String, Object> chilean = object(Map.of(
                "documentType", Map.of("type", "string", "enum",
                        List.of("BOLETA", "FACTURA", "COMPROBANTE", "RECIBO", "TRANSFERENCIA", "UNKNOWN")),
                "hasRUT", type("boolean"),
                "hasIVA", type("boolean")));
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("extractedText", type("string"));
        root.put("amounts", Map.of("type", "array", "items", type("number")));
        root.put("dates", Map.of("type", "array", "items", type("string")));
        root.put("merchantInfo", merchant);
        root.put("transactionInfo", transaction);
        root.put("chileanContext", chilean);
        root.put("confidence", type("number"));
        return object(root);
    }

    private static Map<String, Object> object(Map<String, Object> properties) {
        return Map.of(
                "type", "object",
                "properties", properties,
                "required", List.copyOf(properties.keySet()),
                "additionalProperties", false);
    }

    private static Map<String, Object> type(String name) {
        return Map.of("type", name);
    }
}
