package com.ledgerlens.queue;

public final class QueueNames {

    public static final String DOCUMENT_UPLOAD = "document-upload";
    public static final String DOCUMENT_ANALYSIS = "document-analysis";
    public static final String DOCUMENT_COMPLETED = "document-completed";
    public static final String DOCUMENT_CONFIRMATION = "document-confirmation";
    public static final String CONFIRMATION_RESPONSE = "transaction-confirmation-response";

    private QueueNames() {
    }
}
