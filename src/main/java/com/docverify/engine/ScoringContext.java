package com.docverify.engine;

import com.docverify.model.CheckOutcome;
import com.docverify.model.DocumentTypeConfig;
import com.docverify.model.ExtractionResult;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Working state shared by the score adjusters while one request is scored.
 * Adjusters only accumulate deltas; clamping and the verdict happen in the engine.
 */
@Getter
public class ScoringContext {

    private final String documentType;
    private final Map<String, String> extractedData;
    private final ExtractionResult extraction;
    // null when the document type is not configured
    private final DocumentTypeConfig config;

    private final List<String> issues;
    private final Map<String, CheckOutcome> validationResults = new LinkedHashMap<>();
    private double confidenceDelta;
    private double riskDelta;
    private boolean forceReject;

    public ScoringContext(String documentType, Map<String, String> extractedData,
                          ExtractionResult extraction, DocumentTypeConfig config) {
        this.documentType = documentType;
        this.extractedData = extractedData != null ? extractedData : Map.of();
        this.extraction = extraction;
        this.config = config;
        this.issues = new ArrayList<>(extraction.getIssues() != null ? extraction.getIssues() : List.of());
    }

    public void penalize(double confidencePenalty, double riskIncrease) {
        confidenceDelta -= confidencePenalty;
        riskDelta += riskIncrease;
    }

    public void addIssue(String issue) {
        issues.add(issue);
    }

    public void recordCheck(String checkName, CheckOutcome outcome) {
        validationResults.put(checkName, outcome);
    }

    public void forceReject() {
        this.forceReject = true;
    }
}
