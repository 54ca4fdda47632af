package com.ledgerlens.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.LocalDate;
import java.util.List;

/**
 * Persistence for financial_transactions.
 */
public interface FinancialTransactionRepository extends MongoRepository<FinancialTransaction, String> {

    boolean existsByProcessingLogId(String processingLogId);

    List<FinancialTransaction> findByUserIdOrderByTransactionDateDesc(String userId, Pageable pageable);

    List<FinancialTransaction> findByUserIdAndCategoryOrderByTransactionDateDesc(String userId, String category);

    List<FinancialTransaction> findByUserIdAndTransactionDateBetween(String userId, LocalDate from, LocalDate to);

    List<FinancialTransaction> findByStatusOrderByCreatedAtAsc(FinancialTransactionStatus status);
}
