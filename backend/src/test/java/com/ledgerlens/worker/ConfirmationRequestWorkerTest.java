package com.ledgerlens.worker;

import com.ledgerlens.confirmation.ConfirmationMessageFormatter;
import com.ledgerlens.confirmation.message.ChatMessageService;
import com.ledgerlens.domain.ClassificationResult;
import com.ledgerlens.domain.TransactionType;
import com.ledgerlens.queue.JobQueue;
import com.ledgerlens.queue.job.ConfirmationRequestJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ConfirmationRequestWorkerTest {

    @Mock
    JobQueue<ConfirmationRequestJob> confirmationQueue;
    @Mock
    ChatMessageService chatMessageService;

    private ConfirmationRequestWorker worker;

    @BeforeEach
    void setUp() {
        worker = new ConfirmationRequestWorker(confirmationQueue, new ConfirmationMessageFormatter(),
                chatMessageService);
    }

    @Test
    @DisplayName("the rendered summary and transaction data are delivered for the processing log")
    @SuppressWarnings("unchecked")
    void deliversSummary() {
        ClassificationResult result = new ClassificationResult(TransactionType.EXPENSE, "alimentacion",
                "supermercado", new BigDecimal("15990"), "CLP", LocalDate.of(2025, 5, 20), "Compra",
                "JUMBO", 0.9, null, null, null);
        ConfirmationRequestJob job = ConfirmationRequestJob.create("user-1", "log-1", result, 0.87,
                Instant.parse("2025-06-01T12:00:00Z"));

        worker.handle(job);

        ArgumentCaptor<String> content = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Map<String, Object>> data = ArgumentCaptor.forClass(Map.class);
        verify(chatMessageService).sendConfirmationRequest(eq("user-1"), content.capture(), eq("log-1"),
                data.capture());
        assertThat(content.getValue()).contains("CLP 15.990").contains("87%");
        assertThat(data.getValue())
                .containsEntry("transactionType", "EXPENSE")
                .containsEntry("transactionDate", "2025-05-20")
                .containsEntry("confidence", 0.87);
    }

    @Test
    @DisplayName("results without a type or date still produce a summary")
    void missingFields() {
        ClassificationResult result = new ClassificationResult(null, "otros", null, null, null, null, null,
                null, 0.3, null, null, null);

        worker.handle(ConfirmationRequestJob.create("user-2", "log-2", result, 0.3,
                Instant.parse("2025-06-01T12:00:00Z")));

        verify(chatMessageService).sendConfirmationRequest(eq("user-2"), anyString(), eq("log-2"),
                argThat(data -> data.containsKey("transactionType")
                        && data.get("transactionType") == null));
    }
}
