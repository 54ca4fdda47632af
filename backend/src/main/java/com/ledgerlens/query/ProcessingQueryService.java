package com.ledgerlens.query;

import com.ledgerlens.domain.FinancialTransaction;
import com.ledgerlens.domain.FinancialTransactionRepository;
import com.ledgerlens.domain.ProcessingLog;
import com.ledgerlens.domain.ProcessingLogRepository;
import com.ledgerlens.domain.ProcessingStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read-only lookups of processing logs and stored transactions.
 */
@Service
@RequiredArgsConstructor
public class ProcessingQueryService {

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 100;

    private final ProcessingLogRepository processingLogRepository;
    private final FinancialTransactionRepository financialTransactionRepository;

    public Optional<ProcessingLogView> findLog(String processingLogId) {
        if (processingLogId == null || processingLogId.isBlank()) {
            return Optional.empty();
        }
        return processingLogRepository.findById(processingLogId.trim()).map(ProcessingQueryService::toLogView);
    }

    /** Newest transaction dates first; limit is clamped to [1, 100], default 20. */
    public List<TransactionView> recentTransactions(String userId, Integer limit) {
        int pageSize = Math.max(1, Math.min(limit == null ? DEFAULT_LIMIT : limit, MAX_LIMIT));
        return financialTransactionRepository
                .findByUserIdOrderByTransactionDateDesc(userId, PageRequest.of(0, pageSize))
                .stream()
                .map(ProcessingQueryService::toTransactionView)
                .toList();
    }

    /** Logs still waiting for the user's yes or no, newest first. */
    public List<ProcessingLogView> awaitingConfirmation(String userId) {
        return processingLogRepository
                .findByUserIdAndStatusOrderByCreatedAtDesc(userId, ProcessingStatus.PENDING_CONFIRMATION)
                .stream()
                .map(ProcessingQueryService::toLogView)
                .toList();
    }

    static ProcessingLogView toLogView(ProcessingLog l) {
        List<ProcessingLogView.StageError> errors = l.getErrors() == null ? List.of() : l.getErrors().stream()
                .map(e -> new ProcessingLogView.StageError(
                        e.stage() != null ? e.stage().name() : null, e.error(), e.timestamp()))
                .toList();
        return new ProcessingLogView(
                l.getId(),
                l.getDocumentId(),
                l.getUserId(),
                l.getObjectName(),
                l.getSource() != null ? l.getSource().label() : null,
                l.getStatus() != null ? l.getStatus().name() : null,
                l.getCurrentStage() != null ? l.getCurrentStage().name() : null,
                l.getDocumentType() != null ? l.getDocumentType().name() : null,
                l.getTransactionId(),
                l.getOcrConfidence(),
                l.getVisionConfidence(),
                l.getClassificationConfidence(),
                l.getLlmConfidence(),
                l.getOverallConfidence(),
                l.getTotalProcessingTime(),
                errors,
                l.getConfirmationNote(),
                l.getCreatedAt(),
                l.getUpdatedAt(),
                l.getCompletedAt(),
                l.getFailedAt());
    }

    static TransactionView toTransactionView(FinancialTransaction t) {
        return new TransactionView(
                t.getId(),
                t.getProcessingLogId(),
                t.getTransactionType() != null ? t.getTransactionType().name() : null,
                t.getCategory(),
                t.getSubcategory(),
                t.getAmount(),
                t.getCurrency(),
                t.getTransactionDate(),
                t.getDescription(),
                t.getMerchant(),
                t.getConfidenceScore(),
                t.getStatus() != null ? t.getStatus().name() : null,
                t.getCreatedAt());
    }
}
