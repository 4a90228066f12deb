package com.comments.processor.service;

/**
 * A delivery could not be turned into a stored item. Subclasses say whether
 * another delivery of the same envelope could succeed.
 */
public abstract class ProcessingException extends RuntimeException {

    private final String requestId;

    protected ProcessingException(String requestId, String message, Throwable cause) {
        super(message, cause);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }

    public abstract boolean isRetryable();
}
