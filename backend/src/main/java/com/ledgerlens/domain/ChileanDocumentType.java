package com.ledgerlens.domain;

/**
 * Chilean tax-document kind as read by the vision model (boleta, factura, ...). Diagnostic only.
 */
public enum ChileanDocumentType {
    BOLETA,
    FACTURA,
    COMPROBANTE,
    RECIBO,
    TRANSFERENCIA,
    UNKNOWN
}
