package com.docverify.testutil;

import com.docverify.model.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final String OWNER = "owner-1";

    private TestDataFactory() {}

    public static VerificationRequest createRequest(String requestId, String documentType, VerificationStatus status) {
        return VerificationRequest.builder()
                .systemReferenceId(requestId)
                .clientReferenceId("client-" + requestId)
                .ownerId(OWNER)
                .documentType(documentType)
                .fileUrl("https://files.example.com/" + requestId + ".jpg")
                .status(status)
                .createdAt(System.currentTimeMillis())
                .build();
    }

    public static ExtractionResult createExtraction(Map<String, String> extractedData, double confidence, double risk) {
        return ExtractionResult.builder()
                .documentTypeMatch(true)
                .status("verified")
                .confidence(confidence)
                .riskScore(risk)
                .extractedData(new LinkedHashMap<>(extractedData))
                .issues(new ArrayList<>())
                .fraudIndicators(new ArrayList<>())
                .genuine(true)
                .build();
    }

    public static DocumentTypeConfig createDocumentType(String code, List<String> requiredFields,
                                                        Map<String, String> validationRules) {
        return DocumentTypeConfig.builder()
                .code(code)
                .name("Test " + code)
                .requiredFields(new ArrayList<>(requiredFields))
                .validationRules(new LinkedHashMap<>(validationRules))
                .active(true)
                .build();
    }

    public static Webhook createWebhook(String webhookId, int failureCount, WebhookEvent... events) {
        return Webhook.builder()
                .webhookId(webhookId)
                .ownerId(OWNER)
                .url("https://hooks.example.com/" + webhookId)
                .secret("whsec_test_" + webhookId)
                .events(events.length > 0 ? new ArrayList<>(List.of(events)) : new ArrayList<>(WebhookEvent.DEFAULT_SUBSCRIPTION))
                .active(true)
                .failureCount(failureCount)
                .createdAt(System.currentTimeMillis())
                .build();
    }

    public static BulkJob createBulkJob(String bulkId, int total) {
        return BulkJob.builder()
                .bulkId(bulkId)
                .ownerId(OWNER)
                .totalDocuments(total)
                .status(BulkJobStatus.PROCESSING)
                .createdAt(System.currentTimeMillis())
                .build();
    }

    public static List<BulkJobItem> createBulkItems(String bulkId, String... requestIds) {
        List<BulkJobItem> items = new ArrayList<>();
        for (int i = 0; i < requestIds.length; i++) {
            items.add(BulkJobItem.builder()
                    .bulkId(bulkId)
                    .requestId(requestIds[i])
                    .itemIndex(i)
                    .build());
        }
        return items;
    }
}
