package com.comments.capture;

import java.time.Clock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;

/**
 * Comment Capture Service - the edge half of the pipeline.
 * 
 * Responsibilities:
 * - Accept submissions on the reserved path as query parameters
 * - Wrap them in an envelope and publish to the submissions topic
 * - Answer the caller as soon as the broker acknowledges (204) or fails (500)
 * 
 * Nothing is stored here; persistence is the processor's job.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CaptureApplication {

    public static void main(String[] args) {
        SpringApplication.run(CaptureApplication.class, args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
