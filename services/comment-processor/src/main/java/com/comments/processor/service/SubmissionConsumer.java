package com.comments.processor.service;

import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

import com.comments.processor.service.SubmissionProcessor.ProcessingOutcome;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Kafka consumer for the submissions topic.
 * 
 * Flow:
 * 1. Receive envelope (delivered at least once, in no particular order)
 * 2. Validate and conditionally create the item
 * 3. Acknowledge on created, duplicate, or permanently invalid
 * 4. Leave unacknowledged and rethrow otherwise, so the container redelivers
 *
 * Not transactional: the store's conditional insert runs in its own transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionConsumer {

    private final SubmissionProcessor processor;
    private final MeterRegistry meterRegistry;

    @KafkaListener(
        topics = "${comments.processor.topics.submissions}",
        groupId = "${spring.kafka.consumer.group-id}",
        containerFactory = "kafkaListenerContainerFactory"
    )
    public void consumeSubmission(
            @Payload String envelopeJson,
            @Header(name = KafkaHeaders.RECEIVED_KEY, required = false) String key,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset,
            Acknowledgment acknowledgment) {

        log.debug("Consuming submission from partition {} offset {}: key={}", partition, offset, key);

        try {
            ProcessingOutcome outcome = processor.process(envelopeJson);

            if (outcome == ProcessingOutcome.CREATED) {
                log.info("Stored submission {} as pending", key);
                incrementCounter("items.created");
            } else {
                log.info("Submission {} already stored, skipping", key);
                incrementCounter("items.duplicate");
            }
            acknowledgment.acknowledge();

        } catch (PermanentProcessingException e) {
            log.warn("Dropping invalid submission {} from partition {} offset {}: {}",
                    e.getRequestId() != null ? e.getRequestId() : key, partition, offset, e.getMessage());
            incrementCounter("items.invalid");
            acknowledgment.acknowledge(); // Skip bad message

        } catch (RuntimeException e) {
            log.error("Error processing submission {} from partition {} offset {}: {}",
                    key, partition, offset, e.getMessage(), e);
            incrementCounter("items.errors");
            // Don't acknowledge - message will be redelivered
            throw e;
        }
    }

    private void incrementCounter(String name) {
        Counter.builder("comments.processor." + name)
                .tag("service", "comment-processor")
                .register(meterRegistry)
                .increment();
    }
}
