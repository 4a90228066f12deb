package com.comments.common.kafka;

/**
 * Centralized Kafka topic names for the comment pipeline.
 */
public final class KafkaTopics {

    public static final String COMMENT_SUBMISSIONS = "comments.submissions";

    // Dead letter queue
    public static final String DLQ_SUFFIX = ".dlq";

    private KafkaTopics() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String deadLetterOf(String topic) {
        return topic + DLQ_SUFFIX;
    }
}
