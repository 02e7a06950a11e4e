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
 * A submitted document awaiting (or holding) a verdict.
 * Confidence and risk score stay null until the request reaches a terminal status.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationRequest {
    private String systemReferenceId;
    private String clientReferenceId;
    private String ownerId;
    private String documentType;
    private String fileUrl;

    @Builder.Default
    private Map<String, String> metadata = new LinkedHashMap<>();

    private VerificationStatus status;
    private Double confidence;
    private Double riskScore;

    @Builder.Default
    private Map<String, String> extractedData = new LinkedHashMap<>();

    @Builder.Default
    private List<String> issues = new ArrayList<>();

    private String aiResponse;          // raw collaborator JSON, kept for debugging
    private String bulkJobId;           // null unless submitted as part of a bulk job
    private long createdAt;
    private long processedAt;           // 0 until terminal
}
