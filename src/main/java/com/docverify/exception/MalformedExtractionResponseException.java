package com.docverify.exception;

/**
 * The collaborator answered but its payload is not usable. Retrying would give the same answer.
 */
public class MalformedExtractionResponseException extends ExtractionException {

    public MalformedExtractionResponseException(String message) {
        super(message);
    }

    public MalformedExtractionResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
