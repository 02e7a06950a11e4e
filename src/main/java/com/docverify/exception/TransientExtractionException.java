package com.docverify.exception;

/**
 * Network error, timeout, 5xx or 429 from the document host or the extraction service.
 * Worth retrying.
 */
public class TransientExtractionException extends ExtractionException {

    public TransientExtractionException(String message) {
        super(message);
    }

    public TransientExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
