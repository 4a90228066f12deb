package com.comments.capture.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.NotLeaderOrFollowerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import com.comments.capture.config.CaptureProperties;
import com.comments.common.kafka.KafkaTopics;
import com.comments.common.kafka.SubmissionHeaders;
import com.comments.common.model.Envelope;
import com.comments.common.model.Submission;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@ExtendWith(MockitoExtension.class)
class SubmissionPublisherTest {

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Captor
    private ArgumentCaptor<ProducerRecord<String, String>> recordCaptor;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private CaptureProperties properties;
    private SubmissionPublisher publisher;

    @BeforeEach
    void setUp() {
        properties = new CaptureProperties();
        properties.setPublishTimeout(Duration.ofMillis(200));
        publisher = new SubmissionPublisher(kafkaTemplate, objectMapper, properties, meterRegistry);
    }

    @Test
    void publishesKeyedEnvelopeWithHeaders() throws Exception {
        when(kafkaTemplate.send(recordCaptor.capture())).thenAnswer(inv -> acknowledged(inv.getArgument(0)));

        publisher.publish(envelope("r1"));

        ProducerRecord<String, String> record = recordCaptor.getValue();
        assertThat(record.topic()).isEqualTo(KafkaTopics.COMMENT_SUBMISSIONS);
        assertThat(record.key()).isEqualTo("r1");
        assertThat(record.headers().lastHeader(SubmissionHeaders.REQUEST_ID).value())
                .isEqualTo("r1".getBytes(StandardCharsets.UTF_8));
        assertThat(record.headers().lastHeader(SubmissionHeaders.SOURCE).value())
                .isEqualTo("/comment".getBytes(StandardCharsets.UTF_8));

        JsonNode body = objectMapper.readTree(record.value());
        assertThat(body.path("submission").path("requestId").asText()).isEqualTo("r1");
        assertThat(body.path("submission").path("fields").path("author").asText()).isEqualTo("alice");
        assertThat(body.path("rawQuery").asText()).isEqualTo("requestId=r1&author=alice");

        assertThat(meterRegistry.counter("comments.capture.published", "topic", KafkaTopics.COMMENT_SUBMISSIONS)
                .count()).isEqualTo(1.0);
    }

    @Test
    void sendsExactlyOnceEvenWhenBrokerRejects() {
        when(kafkaTemplate.send(any(ProducerRecord.class)))
                .thenReturn(CompletableFuture.failedFuture(new NotLeaderOrFollowerException("leader moved")));

        assertThatThrownBy(() -> publisher.publish(envelope("r2")))
                .isInstanceOf(CaptureException.class)
                .hasCauseInstanceOf(NotLeaderOrFollowerException.class)
                .extracting("requestId").isEqualTo("r2");

        verify(kafkaTemplate, times(1)).send(any(ProducerRecord.class));
        assertThat(meterRegistry.counter("comments.capture.failed", "topic", KafkaTopics.COMMENT_SUBMISSIONS)
                .count()).isEqualTo(1.0);
    }

    @Test
    void missingAcknowledgmentTimesOut() {
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(new CompletableFuture<>());

        assertThatThrownBy(() -> publisher.publish(envelope("r3")))
                .isInstanceOf(CaptureException.class)
                .hasCauseInstanceOf(TimeoutException.class)
                .hasMessageContaining("200ms");
    }

    @Test
    void synchronousProducerFailureIsWrapped() {
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenThrow(new KafkaException("buffer exhausted"));

        assertThatThrownBy(() -> publisher.publish(envelope("r4")))
                .isInstanceOf(CaptureException.class)
                .hasCauseInstanceOf(KafkaException.class);
        assertThat(meterRegistry.counter("comments.capture.published", "topic", KafkaTopics.COMMENT_SUBMISSIONS)
                .count()).isZero();
    }

    @Test
    void interruptedWaitRestoresInterruptFlag() {
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(new CompletableFuture<>());
        Thread.currentThread().interrupt();

        try {
            assertThatThrownBy(() -> publisher.publish(envelope("r5")))
                    .isInstanceOf(CaptureException.class)
                    .hasCauseInstanceOf(InterruptedException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    private static CompletableFuture<SendResult<String, String>> acknowledged(ProducerRecord<String, String> record) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(record.topic(), 0), 7L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }

    private static Envelope envelope(String requestId) {
        Instant now = Instant.parse("2026-03-01T12:00:00Z");
        return Envelope.builder()
                .submission(Submission.builder()
                        .requestId(requestId)
                        .field("requestId", requestId)
                        .field("author", "alice")
                        .receivedAt(now)
                        .build())
                .rawQuery("requestId=" + requestId + "&author=alice")
                .source("/comment")
                .publishedAt(now)
                .build();
    }
}
