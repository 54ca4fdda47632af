package com.ledgerlens.config;

import com.ledgerlens.domain.AnalysisSource;
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
import com.ledgerlens.domain.TransactionType;
import com.ledgerlens.domain.UploadSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexInfo;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DataMongoTest(properties = "spring.data.mongodb.auto-index-creation=true")
@Testcontainers
@Import(MongoConfig.class)
class ProcessingStoreMongoIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    MongoTemplate mongoTemplate;

    @Autowired
    ProcessingLogRepository processingLogRepository;

    @Autowired
    FinancialTransactionRepository financialTransactionRepository;

    @BeforeEach
    void clean() {
        processingLogRepository.deleteAll();
        financialTransactionRepository.deleteAll();
    }

    @Test
    @DisplayName("processing log round-trips its embedded merged result")
    void persistAndReadProcessingLogWithMergedResult() {
        ClassificationResult result = new ClassificationResult(TransactionType.EXPENSE, "alimentacion", "supermercado",
                new BigDecimal("15990"), "CLP", LocalDate.of(2025, 3, 14), "Compra supermercado", "JUMBO",
                0.85, "Vision analysis", Map.of("rut", "76.123.456-7"), AnalysisSource.VISION);
        ProcessingLog log = new ProcessingLog();
        log.setDocumentId("doc-1");
        log.setUserId("user42");
        log.setSource(UploadSource.WHATSAPP);
        log.setStatus(ProcessingStatus.PENDING_CONFIRMATION);
        log.setCurrentStage(ProcessingStage.USER_CONFIRMATION);
        log.setMergedResult(new MergedResult(result, 0.95, List.of("Vision", "OCR"),
                List.of("Category discrepancy: alimentacion vs compras"), "Selected Vision as primary source"));
        log.setCreatedAt(Instant.parse("2025-03-14T12:00:00Z"));
        log.setUpdatedAt(Instant.parse("2025-03-14T12:00:05Z"));

        ProcessingLog saved = processingLogRepository.save(log);
        assertThat(saved.getId()).isNotNull();

        ProcessingLog read = processingLogRepository.findById(saved.getId()).orElseThrow();
        assertThat(read.getMergedResult().finalConfidence()).isEqualTo(0.95);
        assertThat(read.getMergedResult().finalResult().amount()).isEqualByComparingTo("15990");
        assertThat(read.getMergedResult().finalResult().transactionDate()).isEqualTo(LocalDate.of(2025, 3, 14));
        assertThat(read.getMergedResult().discrepancies()).containsExactly("Category discrepancy: alimentacion vs compras");
        assertThat(processingLogRepository.findByUserIdAndStatusOrderByCreatedAtDesc("user42",
                ProcessingStatus.PENDING_CONFIRMATION)).hasSize(1);
    }

    @Test
    @DisplayName("financial transaction amount is stored as Decimal128 and the log id guard finds it")
    void persistFinancialTransaction() {
        financialTransactionRepository.save(transaction("log-1", LocalDate.of(2025, 1, 10), "12500.50"));
        financialTransactionRepository.save(transaction("log-2", LocalDate.of(2025, 2, 10), "990"));

        assertThat(financialTransactionRepository.existsByProcessingLogId("log-1")).isTrue();
        assertThat(financialTransactionRepository.existsByProcessingLogId("log-3")).isFalse();

        List<FinancialTransaction> recent = financialTransactionRepository
                .findByUserIdOrderByTransactionDateDesc("user42", PageRequest.of(0, 1));
        assertThat(recent).hasSize(1);
        assertThat(recent.get(0).getProcessingLogId()).isEqualTo("log-2");

        org.bson.Document raw = mongoTemplate.getCollection("financial_transactions")
                .find(new org.bson.Document("processingLogId", "log-1")).first();
        assertThat(raw).isNotNull();
        assertThat(raw.get("amount")).isInstanceOf(org.bson.types.Decimal128.class);
    }

    @Test
    @DisplayName("indexes on processing_logs and financial_transactions are created")
    void indexesCreated() {
        financialTransactionRepository.save(transaction("log-9", LocalDate.of(2025, 1, 1), "1"));
        processingLogRepository.save(new ProcessingLog());

        List<String> txIndexes = mongoTemplate.indexOps(FinancialTransaction.class).getIndexInfo().stream()
                .map(IndexInfo::getName).toList();
        List<String> logIndexes = mongoTemplate.indexOps(ProcessingLog.class).getIndexInfo().stream()
                .map(IndexInfo::getName).toList();
        assertThat(txIndexes).contains("user_date");
        assertThat(logIndexes).contains("user_status", "status_stage");
    }

    private static FinancialTransaction transaction(String logId, LocalDate date, String amount) {
        FinancialTransaction tx = new FinancialTransaction();
        tx.setUserId("user42");
        tx.setProcessingLogId(logId);
        tx.setTransactionType(TransactionType.EXPENSE);
        tx.setCategory("alimentacion");
        tx.setAmount(new BigDecimal(amount));
        tx.setTransactionDate(date);
        tx.setStatus(FinancialTransactionStatus.VERIFIED);
        tx.setProcessingMethod(ProcessingMethod.USER_CONFIRMED);
        tx.setCreatedAt(Instant.now());
        return tx;
    }
}
