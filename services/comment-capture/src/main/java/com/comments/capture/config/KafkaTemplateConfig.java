package com.comments.capture.config;

import java.util.HashMap;
import java.util.Map;

import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

@Configuration
public class KafkaTemplateConfig {

    @Bean
    public ProducerFactory<String, String> stringProducerFactory(Environment environment) {
        Map<String, Object> producerProps = new HashMap<>();

        producerProps.put(
                ProducerConfig.BOOTSTRAP_SERVERS_CONFIG,
                environment.getProperty("spring.kafka.bootstrap-servers", "localhost:9092"));
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);

        // The 204 is sent only after all in-sync replicas have the record.
        producerProps.put(ProducerConfig.ACKS_CONFIG, environment.getProperty("spring.kafka.producer.acks", "all"));
        producerProps.put(
                ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG,
                Boolean.parseBoolean(environment.getProperty("spring.kafka.producer.enable-idempotence", "true")));

        // Bounds metadata and buffer waits on the request path (client default is 60s).
        producerProps.put(
                ProducerConfig.MAX_BLOCK_MS_CONFIG,
                Integer.parseInt(environment.getProperty("spring.kafka.producer.properties.max.block.ms", "2000")));

        String requestTimeoutMs = environment.getProperty("spring.kafka.producer.properties.request.timeout.ms");
        if (requestTimeoutMs != null && !requestTimeoutMs.isBlank()) {
            producerProps.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, Integer.parseInt(requestTimeoutMs));
        }

        String deliveryTimeoutMs = environment.getProperty("spring.kafka.producer.properties.delivery.timeout.ms");
        if (deliveryTimeoutMs != null && !deliveryTimeoutMs.isBlank()) {
            producerProps.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, Integer.parseInt(deliveryTimeoutMs));
        }

        String lingerMs = environment.getProperty("spring.kafka.producer.properties.linger.ms");
        if (lingerMs != null && !lingerMs.isBlank()) {
            producerProps.put(ProducerConfig.LINGER_MS_CONFIG, Integer.parseInt(lingerMs));
        }

        return new DefaultKafkaProducerFactory<>(producerProps);
    }

    @Bean
    public KafkaTemplate<String, String> kafkaTemplate(ProducerFactory<String, String> stringProducerFactory) {
        KafkaTemplate<String, String> template = new KafkaTemplate<>(stringProducerFactory);
        // Carries the edge trace context to the processor in record headers
        template.setObservationEnabled(true);
        return template;
    }
}
