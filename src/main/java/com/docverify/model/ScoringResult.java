package com.docverify.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final verdict produced by the rule engine for one request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoringResult {
    private VerificationStatus status;
    private double confidence;
    private double riskScore;

    @Builder.Default
    private List<String> issues = new ArrayList<>();

    // check name -> outcome, e.g. "pan_number" -> {status=failed, message=...}
    @Builder.Default
    private Map<String, CheckOutcome> validationResults = new LinkedHashMap<>();

    @Builder.Default
    private List<String> fraudIndicators = new ArrayList<>();

    private boolean wrongDocument;
    private boolean forceRejected;
    private String detectedDocumentType;
    private String expectedDocumentType;
}
