package com.comments.capture.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.comments.common.kafka.KafkaTopics;

import lombok.Data;

/**
 * Configuration properties for the comment capture service
 */
@Data
@ConfigurationProperties(prefix = "comments.capture")
public class CaptureProperties {

    /** Reserved edge path; must match the mapping in CommentCaptureController. */
    private String path = "/comment";

    private String topic = KafkaTopics.COMMENT_SUBMISSIONS;

    /** Upper bound on waiting for the broker acknowledgment. */
    private Duration publishTimeout = Duration.ofSeconds(3);
}
