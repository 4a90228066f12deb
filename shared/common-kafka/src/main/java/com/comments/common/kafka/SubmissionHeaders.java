package com.comments.common.kafka;

import java.nio.charset.StandardCharsets;

import org.apache.kafka.common.header.Headers;

/**
 * Record headers that let consumers and operators identify a submission without
 * parsing the envelope body.
 */
public final class SubmissionHeaders {

    public static final String REQUEST_ID = "comments-request-id";
    public static final String SOURCE = "comments-source";

    private SubmissionHeaders() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static void write(Headers headers, String requestId, String source) {
        headers.remove(REQUEST_ID);
        headers.add(REQUEST_ID, bytes(requestId));
        if (source != null) {
            headers.remove(SOURCE);
            headers.add(SOURCE, bytes(source));
        }
    }

    private static byte[] bytes(String value) {
        return (value == null ? "" : value).getBytes(StandardCharsets.UTF_8);
    }
}
