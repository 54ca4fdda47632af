package com.ledgerlens.confirmation;

import com.ledgerlens.confirmation.store.PendingConfirmation;
import com.ledgerlens.confirmation.store.PendingConfirmationStore;
import com.ledgerlens.domain.ClassificationResult;
import com.ledgerlens.domain.FinancialTransaction;
import com.ledgerlens.domain.FinancialTransactionRepository;
import com.ledgerlens.domain.FinancialTransactionStatus;
import com.ledgerlens.domain.MergedResult;
import com.ledgerlens.domain.ProcessingLog;
import com.ledgerlens.domain.ProcessingLogRepository;
import com.ledgerlens.domain.ProcessingMethod;
import com.ledgerlens.domain.ProcessingStage;
import com.ledgerlens.domain.ProcessingStatus;
import com.ledgerlens.pipeline.orchestrator.ConfirmationHandOff;
import com.ledgerlens.queue.QueueService;
import com.ledgerlens.queue.job.ConfirmationRequestJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Two-phase confirmation: a merged result is parked per user until the user answers yes or no. Only a "yes"
 * creates a {@link FinancialTransaction}. Replies with nothing pending are an outcome, not an error.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConfirmationService implements ConfirmationHandOff {

    private static final Set<String> AFFIRMATIVE = Set.of(
            "si", "sí", "yes", "confirmar", "confirmo", "ok", "vale", "correcto", "exacto");
    private static final Set<String> NEGATIVE = Set.of(
            "no", "nope", "cancelar", "cancelo", "incorrecto", "mal", "error");

    private final PendingConfirmationStore pendingConfirmationStore;
    private final ProcessingLogRepository processingLogRepository;
    private final FinancialTransactionRepository financialTransactionRepository;
    private final QueueService queueService;
    private final ConfirmationMessageFormatter confirmationMessageFormatter;
    private final ConfirmationProperties confirmationProperties;
    private final Clock clock;

    @Override
    public void requestConfirmation(ProcessingLog processingLog, String userId, MergedResult merged) {
        Instant now = Instant.now(clock);
        PendingConfirmation pending = new PendingConfirmation(userId, processingLog.getId(),
                processingLog.getDocumentId(), merged, now,
                now.plus(Duration.ofHours(confirmationProperties.getExpiryHours())));
        pendingConfirmationStore.put(pending);
        try {
            queueService.addConfirmationRequestJob(ConfirmationRequestJob.create(userId, processingLog.getId(),
                    merged.finalResult(), merged.finalConfidence(), now));
        } catch (RuntimeException e) {
            // the user was never asked, so nothing may answer this slot
            pendingConfirmationStore.getAndDelete(userId);
            throw e;
        }
        log.info("Confirmation requested from user {} for log {} (expires {})",
                userId, processingLog.getId(), pending.expiresAt());
    }

    public boolean hasPendingConfirmation(String userId) {
        return pendingConfirmationStore.hasPending(userId);
    }

    /** True when the text is an unambiguous yes or no. */
    public boolean isConfirmationMessage(String text) {
        return parseConfirmation(text).isPresent();
    }

    /**
     * Whole-word match against the affirmative and negative sets; empty when neither or both sides match.
     */
    public Optional<Boolean> parseConfirmation(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String[] words = text.toLowerCase(Locale.ROOT).trim().split("[^\\p{L}\\p{N}]+");
        boolean yes = Arrays.stream(words).anyMatch(AFFIRMATIVE::contains);
        boolean no = Arrays.stream(words).anyMatch(NEGATIVE::contains);
        if (yes == no) {
            return Optional.empty();
        }
        return Optional.of(yes);
    }

    /**
     * Applies the user's answer to their pending confirmation.
     *
     * @param processingLogId targets a specific log; null means whatever is pending for the user
     * @throws ConfirmationException when the transaction or log cannot be written; the pending slot is restored
     */
    public ConfirmationOutcome processConfirmationResponse(String userId, boolean confirmed, String rawMessage,
                                                           String processingLogId) {
        Optional<PendingConfirmation> pending = processingLogId == null
                ? pendingConfirmationStore.getAndDelete(userId)
                : pendingForLog(userId, processingLogId);
        if (pending.isEmpty()) {
            log.info("Reply from user {} with nothing pending", userId);
            return new ConfirmationOutcome(ConfirmationOutcome.Status.NOTHING_PENDING,
                    confirmationMessageFormatter.nothingPending(), processingLogId, null);
        }
        PendingConfirmation slot = pending.get();
        try {
            return confirmed ? confirm(slot) : reject(slot, rawMessage);
        } catch (RuntimeException e) {
            pendingConfirmationStore.put(slot);
            throw new ConfirmationException("Could not record confirmation for log " + slot.processingLogId()
                    + ": " + e.getMessage(), e);
        }
    }

    /** Clears the user's slot and re-derives the pending state from the log, which must still await an answer. */
    private Optional<PendingConfirmation> pendingForLog(String userId, String processingLogId) {
        Optional<PendingConfirmation> fromStore = pendingConfirmationStore.getAndDelete(userId);
        if (fromStore.isPresent() && !processingLogId.equals(fromStore.get().processingLogId())) {
            // a newer document owns the slot; keep it answerable
            pendingConfirmationStore.put(fromStore.get());
        }
        Optional<ProcessingLog> found = processingLogRepository.findById(processingLogId);
        if (found.isEmpty() || found.get().getStatus() != ProcessingStatus.PENDING_CONFIRMATION
                || found.get().getMergedResult() == null || !userId.equals(found.get().getUserId())) {
            return Optional.empty();
        }
        ProcessingLog processingLog = found.get();
        Instant now = Instant.now(clock);
        Instant createdAt = processingLog.getUpdatedAt() != null ? processingLog.getUpdatedAt() : now;
        PendingConfirmation rebuilt = new PendingConfirmation(userId, processingLogId, processingLog.getDocumentId(),
                processingLog.getMergedResult(), createdAt,
                createdAt.plus(Duration.ofHours(confirmationProperties.getExpiryHours())));
        if (rebuilt.isExpired(now)) {
            log.info("Reply from user {} targets log {} whose confirmation expired at {}",
                    userId, processingLogId, rebuilt.expiresAt());
            return Optional.empty();
        }
        return Optional.of(rebuilt);
    }

    private static boolean awaitingAnswer(ProcessingLog processingLog) {
        return processingLog != null && processingLog.getStatus() == ProcessingStatus.PENDING_CONFIRMATION;
    }

    private ConfirmationOutcome notAwaiting(PendingConfirmation slot, ProcessingLog processingLog) {
        log.info("Log {} is {}; reply from user {} ignored", slot.processingLogId(),
                processingLog == null ? "missing" : processingLog.getStatus(), slot.userId());
        return new ConfirmationOutcome(ConfirmationOutcome.Status.NOTHING_PENDING,
                confirmationMessageFormatter.nothingPending(), slot.processingLogId(),
                processingLog != null ? processingLog.getTransactionId() : null);
    }

    private ConfirmationOutcome confirm(PendingConfirmation slot) {
        Instant now = Instant.now(clock);
        ProcessingLog processingLog = processingLogRepository.findById(slot.processingLogId()).orElse(null);
        if (!awaitingAnswer(processingLog)) {
            return notAwaiting(slot, processingLog);
        }
        if (financialTransactionRepository.existsByProcessingLogId(slot.processingLogId())) {
            log.info("Transaction for log {} already stored; ignoring repeated confirmation", slot.processingLogId());
            return new ConfirmationOutcome(ConfirmationOutcome.Status.NOTHING_PENDING,
                    confirmationMessageFormatter.nothingPending(), slot.processingLogId(),
                    processingLog.getTransactionId());
        }

        FinancialTransaction tx = financialTransactionRepository.save(toTransaction(slot, processingLog, now));
        processingLog.setTransactionId(tx.getId());
        processingLog.setStatus(ProcessingStatus.COMPLETED);
        processingLog.setCurrentStage(ProcessingStage.CONFIRMATION_PROCESSING);
        processingLog.setCompletedAt(now);
        processingLog.setUpdatedAt(now);
        processingLogRepository.save(processingLog);
        log.info("User {} confirmed log {}; transaction {} stored", slot.userId(), slot.processingLogId(), tx.getId());
        return new ConfirmationOutcome(ConfirmationOutcome.Status.CONFIRMED, confirmationMessageFormatter.saved(tx),
                slot.processingLogId(), tx.getId());
    }

    private ConfirmationOutcome reject(PendingConfirmation slot, String rawMessage) {
        Instant now = Instant.now(clock);
        ProcessingLog processingLog = processingLogRepository.findById(slot.processingLogId()).orElse(null);
        if (!awaitingAnswer(processingLog)) {
            return notAwaiting(slot, processingLog);
        }
        processingLog.setStatus(ProcessingStatus.COMPLETED);
        processingLog.setCurrentStage(ProcessingStage.CONFIRMATION_PROCESSING);
        processingLog.setConfirmationNote("Rejected by user" + (rawMessage == null ? "" : ": " + rawMessage));
        processingLog.setCompletedAt(now);
        processingLog.setUpdatedAt(now);
        processingLogRepository.save(processingLog);
        log.info("User {} rejected log {}", slot.userId(), slot.processingLogId());
        return new ConfirmationOutcome(ConfirmationOutcome.Status.REJECTED, confirmationMessageFormatter.rejected(),
                slot.processingLogId(), null);
    }

    private FinancialTransaction toTransaction(PendingConfirmation slot, ProcessingLog processingLog, Instant now) {
        ClassificationResult result = slot.merged().finalResult();
        FinancialTransaction tx = new FinancialTransaction();
        tx.setUserId(slot.userId());
        tx.setDocumentId(slot.documentId());
        tx.setProcessingLogId(slot.processingLogId());
        tx.setTransactionType(result.transactionType());
        tx.setCategory(result.category());
        tx.setSubcategory(result.subcategory());
        tx.setAmount(result.amount());
        tx.setCurrency(result.currency());
        tx.setTransactionDate(result.transactionDate());
        tx.setDescription(result.description());
        tx.setMerchant(result.merchant());
        tx.setConfidenceScore(BigDecimal.valueOf(slot.merged().finalConfidence()));
        tx.setStatus(FinancialTransactionStatus.VERIFIED);
        tx.setProcessingMethod(ProcessingMethod.USER_CONFIRMED);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("userConfirmed", true);
        metadata.put("confirmedAt", now.toString());
        metadata.put("sourcesUsed", slot.merged().sourcesUsed());
        metadata.put("discrepancies", slot.merged().discrepancies());
        metadata.put("reasoning", slot.merged().reasoning());
        if (processingLog != null) {
            putIfPresent(metadata, "ocrConfidence", processingLog.getOcrConfidence());
            putIfPresent(metadata, "classificationConfidence", processingLog.getClassificationConfidence());
            putIfPresent(metadata, "llmConfidence", processingLog.getLlmConfidence());
            putIfPresent(metadata, "visionConfidence", processingLog.getVisionConfidence());
        }
        tx.setMetadata(metadata);

        tx.setCreatedAt(now);
        tx.setUpdatedAt(now);
        tx.setClassifiedAt(now);
        tx.setVerifiedAt(now);
        return tx;
    }

    private static void putIfPresent(Map<String, Object> metadata, String key, Object value) {
        if (value != null) {
            metadata.put(key, value);
        }
    }
}
