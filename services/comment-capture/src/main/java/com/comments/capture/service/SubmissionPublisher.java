package com.comments.capture.service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import com.comments.capture.config.CaptureProperties;
import com.comments.common.kafka.SubmissionHeaders;
import com.comments.common.model.Envelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Publishes envelopes to the submissions topic.
 * One send per call, blocking for the broker acknowledgment up to the configured timeout.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final CaptureProperties properties;
    private final MeterRegistry meterRegistry;

    public void publish(Envelope envelope) {
        String requestId = envelope.getSubmission().getRequestId();
        String topic = properties.getTopic();

        String payload;
        try {
            payload = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw failed(requestId, topic, "Failed to serialize envelope", e);
        }

        ProducerRecord<String, String> record = new ProducerRecord<>(topic, requestId, payload);
        SubmissionHeaders.write(record.headers(), requestId, envelope.getSource());

        long timeoutMs = properties.getPublishTimeout().toMillis();
        try {
            SendResult<String, String> result = kafkaTemplate.send(record).get(timeoutMs, TimeUnit.MILLISECONDS);
            log.debug("Published submission {} to {}-{}@{}", requestId, topic,
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());

            Counter.builder("comments.capture.published")
                    .tag("topic", topic)
                    .register(meterRegistry)
                    .increment();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failed(requestId, topic, "Interrupted while publishing", e);
        } catch (ExecutionException e) {
            throw failed(requestId, topic, "Broker rejected submission", e.getCause());
        } catch (TimeoutException e) {
            throw failed(requestId, topic, "No broker acknowledgment within " + timeoutMs + "ms", e);
        } catch (KafkaException e) {
            throw failed(requestId, topic, "Producer failed", e);
        }
    }

    private CaptureException failed(String requestId, String topic, String message, Throwable cause) {
        log.error("Failed to publish submission {} to {}: {}", requestId, topic, message, cause);

        Counter.builder("comments.capture.failed")
                .tag("topic", topic)
                .register(meterRegistry)
                .increment();

        return new CaptureException(requestId, message, cause);
    }
}
