package com.comments.processor;

import java.time.Clock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.annotation.EnableKafka;

/**
 * Comment Processor Service - durable half of the pipeline
 * 
 * Responsibilities:
 * - Consume envelopes from the submissions topic
 * - Reject envelopes without a usable key (acknowledged and dropped)
 * - Create the item as PENDING if its (itemType, itemId) key is new
 * - Leave the envelope unacknowledged when the store is unavailable
 * - Serve single-key reads and moderation decisions to outside actors
 */
@SpringBootApplication
@EnableKafka
@ConfigurationPropertiesScan
public class ProcessorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProcessorApplication.class, args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
