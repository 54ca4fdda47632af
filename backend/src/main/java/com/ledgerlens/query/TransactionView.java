package com.ledgerlens.query;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Read model of a stored financial transaction.
 */
public record TransactionView(
        String id,
        String processingLogId,
        String transactionType,
        String category,
        String subcategory,
        BigDecimal amount,
        String currency,
        LocalDate transactionDate,
        String description,
        String merchant,
        BigDecimal confidenceScore,
        String status,
        Instant createdAt
) {
}
