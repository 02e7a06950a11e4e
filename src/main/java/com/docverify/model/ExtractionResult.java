package com.docverify.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response of the AI extraction collaborator. Optional booleans are nullable: null means
 * "not reported", which never triggers a penalty.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExtractionResult {

    private Boolean documentTypeMatch;
    private String detectedDocumentType;
    private String expectedDocumentType;
    private String documentTypeMismatchReason;

    @Builder.Default
    private String status = "verified";

    private double confidence;
    private double riskScore;

    @Builder.Default
    private Map<String, String> extractedData = new LinkedHashMap<>();

    @Builder.Default
    private List<String> issues = new ArrayList<>();

    @Builder.Default
    private List<String> fraudIndicators = new ArrayList<>();

    @Builder.Default
    private Map<String, MetadataMatch> metadataMatch = new LinkedHashMap<>();

    @JsonProperty("is_genuine")
    private Boolean genuine;

    private AuthenticityChecks authenticityChecks;

    private DataConsistency dataConsistency;

    private String remarks;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MetadataMatch {
        private Boolean matches;
        private String extracted;
        private String expected;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class AuthenticityChecks {
        private Boolean tamperingDetected;
        @JsonProperty("is_original_document")
        private Boolean originalDocument;
        private Boolean hasSecurityFeatures;
        private Boolean fontConsistency;
        private Boolean layoutMatchesOfficial;
        private Boolean photoIntegrity;
        private ImageQuality imageQuality;
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class DataConsistency {
        private Boolean datesValid;
        private Boolean idFormatValid;
        private Boolean logicalChecksPassed;
        private String details;
    }
}
