package com.ledgerlens.ingestion;

import com.ledgerlens.domain.DocumentType;
import com.ledgerlens.domain.UploadSource;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort hints read from object names and event sources, e.g. {@code whatsapp/user123_boleta.jpg}.
 */
public final class ObjectNameHints {

    public static final String UNKNOWN_USER = "unknown";
    public static final String DEFAULT_REGION = "us-phoenix-1";

    static final List<String> UPLOAD_EVENT_TYPES = List.of("ObjectCreated", "com.oraclecloud.objectstorage.createobject");
    static final List<String> DOCUMENT_EXTENSIONS = List.of(".pdf", ".jpg", ".jpeg", ".png", ".tiff", ".bmp");

    private static final Pattern USER = Pattern.compile("(?:^|/|_)user(\\d+)(?:_|/|\\.)", Pattern.CASE_INSENSITIVE);
    private static final Pattern REGION = Pattern.compile("\\.([a-z0-9-]+)\\.oraclecloud\\.com");

    private ObjectNameHints() {
    }

    /** Upload event type (substring, case-insensitive) on a supported document file. */
    public static boolean isDocumentUpload(String eventType, String objectName) {
        if (eventType == null || objectName == null) {
            return false;
        }
        String type = eventType.toLowerCase(Locale.ROOT);
        String name = objectName.toLowerCase(Locale.ROOT);
        return UPLOAD_EVENT_TYPES.stream().anyMatch(t -> type.contains(t.toLowerCase(Locale.ROOT)))
                && DOCUMENT_EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    public static String userId(String objectName) {
        if (objectName == null) {
            return UNKNOWN_USER;
        }
        Matcher m = USER.matcher(objectName);
        return m.find() ? "user" + m.group(1) : UNKNOWN_USER;
    }

    public static UploadSource source(String objectName) {
        String name = objectName == null ? "" : objectName.toLowerCase(Locale.ROOT);
        if (name.contains("whatsapp")) {
            return UploadSource.WHATSAPP;
        }
        if (name.contains("web")) {
            return UploadSource.WEB;
        }
        return UploadSource.API;
    }

    public static DocumentType documentType(String objectName) {
        String name = objectName == null ? "" : objectName.toLowerCase(Locale.ROOT);
        if (containsAny(name, "receipt", "recibo", "boleta")) {
            return DocumentType.RECEIPT;
        }
        if (containsAny(name, "invoice", "factura")) {
            return DocumentType.INVOICE;
        }
        if (containsAny(name, "bank", "statement", "estado_cuenta")) {
            return DocumentType.BANK_STATEMENT;
        }
        if (containsAny(name, "check", "cheque")) {
            return DocumentType.CHECK;
        }
        if (containsAny(name, "payslip", "nomina")) {
            return DocumentType.PAYSLIP;
        }
        if (containsAny(name, "tax", "impuesto")) {
            return DocumentType.TAX_FORM;
        }
        return DocumentType.OTHERS;
    }

    public static String region(String eventSource) {
        if (eventSource == null) {
            return DEFAULT_REGION;
        }
        Matcher m = REGION.matcher(eventSource);
        return m.find() ? m.group(1) : DEFAULT_REGION;
    }

    private static boolean containsAny(String value, String... needles) {
        for (String needle : needles) {
            if (value.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
