package com.docverify.exception;

/**
 * Thrown by the verification processor to hand a job back to the queue for another attempt.
 * The request has already been returned to ACCEPTED when this is thrown.
 */
public class RetryableVerificationException extends RuntimeException {

    private final String requestId;

    public RetryableVerificationException(String requestId, String message, Throwable cause) {
        super(message, cause);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
