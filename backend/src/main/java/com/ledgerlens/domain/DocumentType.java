package com.ledgerlens.domain;

import java.util.Locale;

/**
 * Document kind reported by the extractor or guessed from the uploaded file name.
 */
public enum DocumentType {
    INVOICE,
    RECEIPT,
    BANK_STATEMENT,
    CHECK,
    PAYSLIP,
    TAX_FORM,
    OTHERS;

    /** Lenient parse; unknown or blank values map to {@code null}. */
    public static DocumentType fromHint(String hint) {
        if (hint == null || hint.isBlank()) {
            return null;
        }
        try {
            return DocumentType.valueOf(hint.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /** True for any concrete type; OTHERS and null count as unknown. */
    public static boolean isKnown(DocumentType type) {
        return type != null && type != OTHERS;
    }
}
