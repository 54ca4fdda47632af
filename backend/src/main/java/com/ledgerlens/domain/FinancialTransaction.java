package com.ledgerlens.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * Transaction created only after the user confirms the pipeline's summary. Immutable after creation except
 * for status transitions.
 */
@Document(collection = "financial_transactions")
@CompoundIndexes({
    @CompoundIndex(name = "user_date", def = "{'userId': 1, 'transactionDate': -1}"),
    @CompoundIndex(name = "user_type_category", def = "{'userId': 1, 'transactionType': 1, 'category': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class FinancialTransaction {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String userId;
    private String documentId;
    /** At most one transaction per processing log; guards confirmation replays. */
    @Indexed(unique = true, sparse = true)
    private String processingLogId;

    private TransactionType transactionType;
    private String category;
    private String subcategory;
    private BigDecimal amount;
    private String currency = "CLP";
    private LocalDate transactionDate;
    private String description;
    private String merchant;
    private BigDecimal confidenceScore;
    private FinancialTransactionStatus status;
    private ProcessingMethod processingMethod;
    private Map<String, Object> metadata = new HashMap<>();

    private Instant createdAt;
    private Instant updatedAt;
    private Instant classifiedAt;
    private Instant verifiedAt;
}
