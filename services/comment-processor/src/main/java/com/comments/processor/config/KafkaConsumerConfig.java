package com.comments.processor.config;

import java.util.HashMap;
import java.util.Map;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

import com.comments.common.kafka.KafkaTopics;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class KafkaConsumerConfig {

    @Bean
    public ConsumerFactory<String, String> stringConsumerFactory(Environment environment) {
        Map<String, Object> consumerProps = new HashMap<>();

        consumerProps.put(
                ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG,
                environment.getProperty("spring.kafka.bootstrap-servers", "localhost:9092"));
        consumerProps.put(
                ConsumerConfig.GROUP_ID_CONFIG,
                environment.getProperty("spring.kafka.consumer.group-id", "comment-processor"));
        consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);

        // Offsets are committed only after the listener acknowledges
        consumerProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        consumerProps.put(
                ConsumerConfig.AUTO_OFFSET_RESET_CONFIG,
                environment.getProperty("spring.kafka.consumer.auto-offset-reset", "earliest"));

        String maxPollRecords = environment.getProperty("spring.kafka.consumer.max-poll-records");
        if (maxPollRecords != null && !maxPollRecords.isBlank()) {
            consumerProps.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, Integer.parseInt(maxPollRecords));
        }

        return new DefaultKafkaConsumerFactory<>(consumerProps);
    }

    @Bean
    public ProducerFactory<String, String> deadLetterProducerFactory(Environment environment) {
        Map<String, Object> producerProps = new HashMap<>();

        producerProps.put(
                ProducerConfig.BOOTSTRAP_SERVERS_CONFIG,
                environment.getProperty("spring.kafka.bootstrap-servers", "localhost:9092"));
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, environment.getProperty("spring.kafka.producer.acks", "all"));
        producerProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);

        return new DefaultKafkaProducerFactory<>(producerProps);
    }

    @Bean
    public KafkaTemplate<String, String> deadLetterTemplate(ProducerFactory<String, String> deadLetterProducerFactory) {
        return new KafkaTemplate<>(deadLetterProducerFactory);
    }

    /**
     * Redelivers a failed record in place, then parks it on {@code <topic>.dlq}
     * once the attempt budget is spent.
     */
    @Bean
    public DefaultErrorHandler submissionErrorHandler(
            KafkaTemplate<String, String> deadLetterTemplate, ProcessorProperties properties) {
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(deadLetterTemplate,
                (record, ex) -> {
                    log.error("Retries exhausted for {}-{}@{}, moving to dead letter topic",
                            record.topic(), record.partition(), record.offset());
                    return deadLetterDestination(record);
                });

        return new DefaultErrorHandler(recoverer, retryBackOff(properties.getRetry()));
    }

    /** {@code maxAttempts} counts deliveries, the first one included. */
    static FixedBackOff retryBackOff(ProcessorProperties.Retry retry) {
        long retries = Math.max(0, retry.getMaxAttempts() - 1);
        return new FixedBackOff(retry.getInterval().toMillis(), retries);
    }

    // Negative partition lets the producer choose
    static TopicPartition deadLetterDestination(ConsumerRecord<?, ?> record) {
        return new TopicPartition(KafkaTopics.deadLetterOf(record.topic()), -1);
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, String> kafkaListenerContainerFactory(
            ConsumerFactory<String, String> stringConsumerFactory,
            DefaultErrorHandler submissionErrorHandler,
            ProcessorProperties properties) {
        ConcurrentKafkaListenerContainerFactory<String, String> factory = new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(stringConsumerFactory);
        factory.setConcurrency(properties.getConcurrency());
        factory.setCommonErrorHandler(submissionErrorHandler);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
        // Continues the trace started at the edge
        factory.getContainerProperties().setObservationEnabled(true);
        return factory;
    }
}
