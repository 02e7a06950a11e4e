package com.docverify.client;

import com.docverify.model.ExtractionResult;

/**
 * Parsed collaborator verdict together with the JSON it was parsed from.
 */
public record ExtractionOutcome(ExtractionResult result, String rawResponse) {}
