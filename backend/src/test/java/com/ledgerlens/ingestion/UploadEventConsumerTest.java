package com.ledgerlens.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerlens.domain.DocumentType;
import com.ledgerlens.domain.UploadSource;
import com.ledgerlens.queue.QueueService;
import com.ledgerlens.queue.job.UploadJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UploadEventConsumerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);

    private static final String UPLOAD_EVENT = """
            {
              "eventType": "com.oraclecloud.objectstorage.createobject",
              "eventTime": "2025-06-01T11:59:30Z",
              "eventID": "evt-1",
              "source": "https://objectstorage.sa-santiago-1.oraclecloud.com",
              "data": {
                "resourceName": "whatsapp/user42_boleta.jpg",
                "resourceId": "obj-42",
                "additionalDetails": {"bucketName": "uploads", "namespace": "ns", "eTag": "x"}
              },
              "extra": true
            }
            """;

    @Mock
    UploadEventStream uploadEventStream;
    @Mock
    QueueService queueService;

    private UploadEventConsumer consumer;

    @BeforeEach
    void setUp() {
        IngestionProperties properties = new IngestionProperties();
        properties.setBatchSize(5);
        consumer = new UploadEventConsumer(uploadEventStream, queueService, properties, new ObjectMapper(), CLOCK,
                Runnable::run);
    }

    @Test
    @DisplayName("a document upload event becomes one upload job with hints from the object name")
    void uploadEventEnqueuesJob() {
        assertThat(consumer.handle(new StreamMessage("k", UPLOAD_EVENT, 1))).isTrue();

        ArgumentCaptor<UploadJob> job = ArgumentCaptor.forClass(UploadJob.class);
        verify(queueService).addUploadJob(job.capture());
        UploadJob uploadJob = job.getValue();
        assertThat(uploadJob.objectId()).isEqualTo("obj-42");
        assertThat(uploadJob.bucketName()).isEqualTo("uploads");
        assertThat(uploadJob.namespace()).isEqualTo("ns");
        assertThat(uploadJob.userId()).isEqualTo("user42");
        assertThat(uploadJob.source()).isEqualTo(UploadSource.WHATSAPP);
        assertThat(uploadJob.documentType()).isEqualTo(DocumentType.RECEIPT);
        assertThat(uploadJob.region()).isEqualTo("sa-santiago-1");
        assertThat(uploadJob.eventTime()).isEqualTo(Instant.parse("2025-06-01T11:59:30Z"));
        assertThat(uploadJob.priority()).isEqualTo(UploadSource.WHATSAPP.priority());
    }

    @Test
    @DisplayName("unreadable, empty and non-document messages are skipped")
    void skipsOtherMessages() {
        assertThat(consumer.handle(new StreamMessage("k", "{not json", 1))).isFalse();
        assertThat(consumer.handle(new StreamMessage("k", "", 2))).isFalse();
        assertThat(consumer.handle(new StreamMessage("k",
                UPLOAD_EVENT.replace("boleta.jpg", "notes.txt"), 3))).isFalse();
        assertThat(consumer.handle(new StreamMessage("k", "{\"eventType\":\"ObjectCreated\"}", 4))).isFalse();

        verify(queueService, never()).addUploadJob(any());
    }

    @Test
    @DisplayName("a poll handles every message and continues from the returned cursor")
    void pollOnceAdvancesCursor() {
        when(uploadEventStream.getMessages("c1", 5)).thenReturn(new StreamBatch(List.of(
                new StreamMessage("a", UPLOAD_EVENT, 10),
                new StreamMessage("b", "garbage", 11),
                new StreamMessage("c", UPLOAD_EVENT.replace("obj-42", "obj-43"), 12)), "c2"));

        assertThat(consumer.pollOnce("c1")).isEqualTo("c2");
        verify(queueService, times(2)).addUploadJob(any());
    }

    @Test
    @DisplayName("an empty poll without a next cursor keeps the current one")
    void emptyPollKeepsCursor() {
        when(uploadEventStream.getMessages("c1", 5)).thenReturn(new StreamBatch(List.of(), null));

        assertThat(consumer.pollOnce("c1")).isEqualTo("c1");
    }
}
