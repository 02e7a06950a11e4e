package com.docverify.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Fields written when a request changes status. Null fields are left untouched in the store.
 */
@Data
@Builder
public class VerdictUpdate {
    private VerificationStatus status;
    private Double confidence;
    private Double riskScore;
    private Map<String, String> extractedData;
    private String aiResponse;
    private List<String> issues;

    public static VerdictUpdate statusOnly(VerificationStatus status) {
        return VerdictUpdate.builder().status(status).build();
    }

    public static VerdictUpdate failed(String issue) {
        return VerdictUpdate.builder()
                .status(VerificationStatus.FAILED)
                .issues(List.of(issue != null ? issue : "Unknown processing error"))
                .build();
    }
}
