package com.ledgerlens.domain;

public enum FinancialTransactionStatus {
    PENDING_CLASSIFICATION,
    CLASSIFIED,
    VERIFIED,
    MANUAL_REVIEW,
    REJECTED
}
