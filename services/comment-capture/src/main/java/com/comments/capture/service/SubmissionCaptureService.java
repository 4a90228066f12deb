package com.comments.capture.service;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import com.comments.capture.config.CaptureProperties;
import com.comments.common.model.Envelope;
import com.comments.common.model.Submission;
import com.github.f4b6a3.uuid.UuidCreator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds a submission from an edge request and hands it to the bus.
 * No field is required here; validation belongs to the processor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionCaptureService {

    private final SubmissionPublisher publisher;
    private final CaptureProperties properties;
    private final Clock clock;

    public Submission capture(String rawQuery, String requestIdHeader) {
        Map<String, String> fields = parseQuery(rawQuery);
        Instant now = clock.instant();

        Submission submission = Submission.builder()
                .requestId(resolveRequestId(fields, requestIdHeader))
                .fields(fields)
                .receivedAt(now)
                .build();

        Envelope envelope = Envelope.builder()
                .submission(submission)
                .rawQuery(rawQuery != null ? rawQuery : "")
                .source(properties.getPath())
                .publishedAt(now)
                .build();

        publisher.publish(envelope);
        log.info("Accepted submission: requestId={}, fields={}", submission.getRequestId(), fields.keySet());
        return submission;
    }

    /**
     * Query parameter first (even when empty), then the X-Request-Id header,
     * then a freshly generated time-ordered UUID.
     */
    String resolveRequestId(Map<String, String> fields, String requestIdHeader) {
        if (fields.containsKey(Submission.REQUEST_ID_PARAM)) {
            return fields.get(Submission.REQUEST_ID_PARAM);
        }
        if (requestIdHeader != null && !requestIdHeader.isBlank()) {
            return requestIdHeader.trim();
        }
        return UuidCreator.getTimeOrdered().toString();
    }

    Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return fields;
        }

        // Split on the first '=' only; a pair with an empty name is dropped whole
        for (String pair : StringUtils.delimitedListToStringArray(rawQuery, "&")) {
            int separator = pair.indexOf('=');
            String name = decode(separator < 0 ? pair : pair.substring(0, separator));
            String value = separator < 0 ? "" : decode(pair.substring(separator + 1));

            // First value wins for repeated names
            if (!name.isEmpty() && !fields.containsKey(name)) {
                fields.put(name, value);
            }
        }
        return fields;
    }

    private String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("Keeping undecodable query component as sent: {}", e.getMessage());
            return value;
        }
    }
}
