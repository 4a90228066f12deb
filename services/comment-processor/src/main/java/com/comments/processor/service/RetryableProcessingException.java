package com.comments.processor.service;

/**
 * Processing failed for a reason outside the envelope; leave it unacknowledged
 * so the bus delivers it again.
 */
public class RetryableProcessingException extends ProcessingException {

    public RetryableProcessingException(String requestId, String message, Throwable cause) {
        super(requestId, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
