package com.docverify.model;

import java.util.Map;

/**
 * One document of a submission: the claimed type, where to fetch it, and the caller's
 * reference and metadata.
 */
public record DocumentSubmission(String clientReferenceId,
                                 String documentType,
                                 String fileUrl,
                                 Map<String, String> metadata) {
}
