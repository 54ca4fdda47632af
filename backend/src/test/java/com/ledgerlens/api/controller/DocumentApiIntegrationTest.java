package com.ledgerlens.api.controller;

import com.ledgerlens.confirmation.ConfirmationService;
import com.ledgerlens.domain.ClassificationResult;
import com.ledgerlens.domain.FinancialTransaction;
import com.ledgerlens.domain.FinancialTransactionRepository;
import com.ledgerlens.domain.FinancialTransactionStatus;
import com.ledgerlens.domain.MergedResult;
import com.ledgerlens.domain.ProcessingLog;
import com.ledgerlens.domain.ProcessingLogRepository;
import com.ledgerlens.domain.ProcessingStage;
import com.ledgerlens.domain.ProcessingStatus;
import com.ledgerlens.domain.TransactionType;
import com.ledgerlens.queue.QueueService;
import com.ledgerlens.queue.job.ConfirmationResponseJob;
import com.ledgerlens.queue.job.UploadJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest
@AutoConfigureWebTestClient
@Testcontainers
class DocumentApiIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    WebTestClient webTestClient;
    @Autowired
    ProcessingLogRepository processingLogRepository;
    @Autowired
    FinancialTransactionRepository financialTransactionRepository;
    @Autowired
    ConfirmationService confirmationService;

    @MockBean
    QueueService queueService;

    @BeforeEach
    void cleanUp() {
        processingLogRepository.deleteAll();
        financialTransactionRepository.deleteAll();
    }

    @Test
    @DisplayName("a stored document is queued for processing and the user is told it arrived")
    void submitDocument() {
        when(queueService.addUploadJob(any())).thenReturn("upload-obj-1-1");

        webTestClient.post()
                .uri("/api/v1/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of(
                        "userId", "user-10",
                        "bucketName", "uploads",
                        "objectName", "whatsapp/user-10/boleta.jpg",
                        "objectId", "obj-1",
                        "source", "whatsapp"))
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.jobId").isEqualTo("upload-obj-1-1")
                .jsonPath("$.status").isEqualTo("queued");

        ArgumentCaptor<UploadJob> job = ArgumentCaptor.forClass(UploadJob.class);
        verify(queueService).addUploadJob(job.capture());
        assertThat(job.getValue().objectId()).isEqualTo("obj-1");
        assertThat(job.getValue().userId()).isEqualTo("user-10");

        webTestClient.get()
                .uri("/api/v1/users/user-10/messages")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].type").isEqualTo("file_upload_success")
                .jsonPath("$[0].metadata.fileName").isEqualTo("boleta.jpg");
    }

    @Test
    @DisplayName("unsupported file types and missing users are rejected with an error code")
    void rejectsInvalidDocuments() {
        webTestClient.post()
                .uri("/api/v1/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("userId", "user-10", "bucketName", "uploads", "objectName", "notes.txt"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("UNSUPPORTED_FILE_TYPE")
                .jsonPath("$.timestamp").exists();

        webTestClient.post()
                .uri("/api/v1/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("bucketName", "uploads", "objectName", "boleta.pdf"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_USER");

        verify(queueService, never()).addUploadJob(any());
    }

    @Test
    @DisplayName("a reply with nothing pending is not treated as a confirmation")
    void replyWithNothingPending() {
        webTestClient.post()
                .uri("/api/v1/users/user-11/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("message", "si"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.confirmation").isEqualTo(false)
                .jsonPath("$.confirmed").doesNotExist();

        verify(queueService, never()).addConfirmationResponseJob(any());
    }

    @Test
    @DisplayName("a yes to a pending confirmation is queued for the confirmation worker")
    void replyConfirmsPending() {
        ProcessingLog processingLog = new ProcessingLog();
        processingLog.setId("log-12");
        processingLog.setUserId("user-12");
        confirmationService.requestConfirmation(processingLog, "user-12", merged());
        when(queueService.addConfirmationResponseJob(any())).thenReturn("confirmation-response-user-12-1");

        webTestClient.post()
                .uri("/api/v1/users/user-12/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("message", "Sí, confirmo"))
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.confirmation").isEqualTo(true)
                .jsonPath("$.confirmed").isEqualTo(true)
                .jsonPath("$.jobId").isEqualTo("confirmation-response-user-12-1");

        ArgumentCaptor<ConfirmationResponseJob> job = ArgumentCaptor.forClass(ConfirmationResponseJob.class);
        verify(queueService).addConfirmationResponseJob(job.capture());
        assertThat(job.getValue().confirmed()).isTrue();
        assertThat(job.getValue().processingLogId()).isNull();
    }

    @Test
    @DisplayName("processing logs are readable by id; unknown ids are 404")
    void processingLog() {
        ProcessingLog processingLog = new ProcessingLog();
        processingLog.setUserId("user-13");
        processingLog.setStatus(ProcessingStatus.PENDING_CONFIRMATION);
        processingLog.setCurrentStage(ProcessingStage.USER_CONFIRMATION);
        processingLog.setOverallConfidence(0.85);
        processingLog.setCreatedAt(Instant.parse("2025-06-01T12:00:00Z"));
        String id = processingLogRepository.save(processingLog).getId();

        webTestClient.get()
                .uri("/api/v1/processing-logs/{id}", id)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("PENDING_CONFIRMATION")
                .jsonPath("$.currentStage").isEqualTo("USER_CONFIRMATION")
                .jsonPath("$.overallConfidence").isEqualTo(0.85);

        webTestClient.get()
                .uri("/api/v1/users/user-13/pending-confirmations")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].id").isEqualTo(id);

        webTestClient.get()
                .uri("/api/v1/processing-logs/does-not-exist")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("stored transactions are listed newest first")
    void transactions() {
        financialTransactionRepository.saveAll(List.of(
                tx("log-a", LocalDate.of(2025, 5, 1), "10000"),
                tx("log-b", LocalDate.of(2025, 5, 20), "15990")));

        webTestClient.get()
                .uri("/api/v1/users/user-14/transactions?limit=1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].processingLogId").isEqualTo("log-b")
                .jsonPath("$[0].transactionDate").isEqualTo("2025-05-20");
    }

    private static FinancialTransaction tx(String logId, LocalDate date, String amount) {
        FinancialTransaction tx = new FinancialTransaction();
        tx.setUserId("user-14");
        tx.setProcessingLogId(logId);
        tx.setTransactionType(TransactionType.EXPENSE);
        tx.setCategory("alimentacion");
        tx.setAmount(new BigDecimal(amount));
        tx.setTransactionDate(date);
        tx.setStatus(FinancialTransactionStatus.VERIFIED);
        tx.setCreatedAt(Instant.parse("2025-06-01T12:00:00Z"));
        return tx;
    }

    private static MergedResult merged() {
        ClassificationResult result = new ClassificationResult(TransactionType.EXPENSE, "alimentacion", null,
                new BigDecimal("15990"), "CLP", LocalDate.of(2025, 5, 20), "Compra", "JUMBO", 0.85, null, null, null);
        return new MergedResult(result, 0.85, List.of("OCR Classification"), List.of(), "ok");
    }
}
