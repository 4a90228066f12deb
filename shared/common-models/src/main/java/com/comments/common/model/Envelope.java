package com.comments.common.model;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * What travels on the submissions topic. Immutable once published.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Envelope {

    Submission submission;

    /** Query string exactly as the caller sent it, empty when there was none. */
    String rawQuery;

    /** Reserved path the request was captured on. */
    String source;

    Instant publishedAt;
}
