package com.comments.common.model;

import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A single captured request: its idempotency key, the raw query parameters and
 * the capture time. Schema-free at this layer; the processor decides what is valid.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Submission {

    // Reserved query parameter names
    public static final String REQUEST_ID_PARAM = "requestId";
    public static final String TYPE_PARAM = "type";

    String requestId;

    @Singular(ignoreNullCollections = true)
    Map<String, String> fields;

    Instant receivedAt;

    public boolean hasRequestId() {
        return requestId != null && !requestId.isBlank();
    }
}
