package com.comments.processor.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.comments.common.kafka.KafkaTopics;

import lombok.Data;

/**
 * Configuration properties for the comment processor service
 */
@Data
@ConfigurationProperties(prefix = "comments.processor")
public class ProcessorProperties {

    private Topics topics = new Topics();
    private Retry retry = new Retry();
    private int concurrency = 1;

    @Data
    public static class Topics {
        private String submissions = KafkaTopics.COMMENT_SUBMISSIONS;
    }

    @Data
    public static class Retry {
        private Duration interval = Duration.ofSeconds(1);
        /** Deliveries per envelope, first one included, before it goes to the dead letter topic. */
        private int maxAttempts = 5;
    }
}
