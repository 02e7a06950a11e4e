package com.docverify.service;

import com.docverify.client.ExtractionClient;
import com.docverify.client.ExtractionOutcome;
import com.docverify.config.MetricsConfig;
import com.docverify.engine.RuleEngine;
import com.docverify.exception.MalformedExtractionResponseException;
import com.docverify.exception.RetryableVerificationException;
import com.docverify.exception.TransientExtractionException;
import com.docverify.model.AuditAction;
import com.docverify.model.DocumentTypeConfig;
import com.docverify.model.ExtractionResult;
import com.docverify.model.ScoringResult;
import com.docverify.model.VerdictUpdate;
import com.docverify.model.VerificationRequest;
import com.docverify.model.VerificationStatus;
import com.docverify.model.WebhookEvent;
import com.docverify.repository.DocumentTypeRepository;
import com.docverify.repository.VerificationRequestRepository;
import com.docverify.validation.ValidationReport;
import com.docverify.validation.DocumentDataValidator;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one verification request through the pipeline.
 *
 * Flow:
 * 1. Load the request; only ACCEPTED requests are processed
 * 2. Mark it PROCESSING
 * 3. Resolve the document type configuration (owner's, else global)
 * 4. Download the document and call the extraction service
 * 5. Run the deterministic validators and merge their findings
 * 6. Score with the RuleEngine
 * 7. Persist the verdict
 * 8. Write the audit entry
 * 9. Notify webhooks
 * 10. Recompute the bulk job, if any
 *
 * Transient extraction failures put the request back to ACCEPTED and are rethrown as
 * {@link RetryableVerificationException} so the queue retries it. Every other failure marks the
 * request FAILED here.
 */
@Service
public class VerificationProcessor {

    private static final Logger log = LoggerFactory.getLogger(VerificationProcessor.class);

    private final VerificationRequestRepository requestRepository;
    private final DocumentTypeRepository documentTypeRepository;
    private final ExtractionClient extractionClient;
    private final DocumentDataValidator dataValidator;
    private final RuleEngine ruleEngine;
    private final AuditService auditService;
    private final WebhookDispatcher webhookDispatcher;
    private final BulkAggregator bulkAggregator;
    private final MetricsConfig metricsConfig;

    public VerificationProcessor(VerificationRequestRepository requestRepository,
                                 DocumentTypeRepository documentTypeRepository,
                                 ExtractionClient extractionClient,
                                 DocumentDataValidator dataValidator,
                                 RuleEngine ruleEngine,
                                 AuditService auditService,
                                 WebhookDispatcher webhookDispatcher,
                                 BulkAggregator bulkAggregator,
                                 MetricsConfig metricsConfig) {
        this.requestRepository = requestRepository;
        this.documentTypeRepository = documentTypeRepository;
        this.extractionClient = extractionClient;
        this.dataValidator = dataValidator;
        this.ruleEngine = ruleEngine;
        this.auditService = auditService;
        this.webhookDispatcher = webhookDispatcher;
        this.bulkAggregator = bulkAggregator;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "verification.process", contextualName = "process-verification")
    public void process(String requestId) {
        // 1. Load
        VerificationRequest request = requestRepository.findById(requestId);
        if (request == null) {
            log.warn("Verification request {} not found, skipping", requestId);
            return;
        }
        if (request.getStatus() != VerificationStatus.ACCEPTED) {
            log.info("Request {} is {}, not ACCEPTED. Skipping.", requestId, request.getStatus());
            return;
        }

        // 2. Claim
        if (!requestRepository.transition(requestId, VerificationStatus.ACCEPTED, VerificationStatus.PROCESSING)) {
            log.info("Request {} was claimed by another worker", requestId);
            return;
        }
        request.setStatus(VerificationStatus.PROCESSING);

        try {
            verify(request);
        } catch (RetryableVerificationException e) {
            throw e;
        } catch (Exception e) {
            log.error("Verification of request {} failed: {}", requestId, e.getMessage(), e);
            fail(request, e.getMessage());
        }
    }

    /**
     * Side effects of a request the queue gave up on. The FAILED write has already been attempted.
     */
    public void onPermanentFailure(String requestId, String message) {
        VerificationRequest request;
        try {
            request = requestRepository.findById(requestId);
        } catch (Exception e) {
            log.error("Failed to load request {} after permanent failure", requestId, e);
            return;
        }
        if (request == null) {
            log.warn("Request {} vanished after permanent failure", requestId);
            return;
        }
        metricsConfig.recordVerificationFailed();
        notifyFailure(request, message);
    }

    private void verify(VerificationRequest request) {
        String requestId = request.getSystemReferenceId();
        String documentType = request.getDocumentType();

        // 3. Document type configuration
        DocumentTypeConfig typeConfig = documentTypeRepository.findByCodeForOwner(documentType, request.getOwnerId());
        if (typeConfig == null) {
            log.warn("No document type configuration for '{}' (owner {})", documentType, request.getOwnerId());
        }

        // 4. Extraction
        ExtractionOutcome outcome;
        try {
            outcome = extractionClient.extract(request.getFileUrl(), documentType, typeConfig, request.getMetadata());
        } catch (TransientExtractionException e) {
            log.warn("Transient extraction failure for request {}: {}", requestId, e.getMessage());
            requestRepository.updateVerdict(requestId, VerdictUpdate.statusOnly(VerificationStatus.ACCEPTED));
            throw new RetryableVerificationException(requestId, e.getMessage(), e);
        } catch (MalformedExtractionResponseException e) {
            log.warn("Unusable extraction response for request {}: {}", requestId, e.getMessage());
            fail(request, e.getMessage());
            return;
        }
        ExtractionResult extraction = outcome.result();
        Map<String, String> extractedData = extraction.getExtractedData();

        // 5. Deterministic validation
        ValidationReport report = dataValidator.validate(documentType, extractedData, request.getMetadata());
        ExtractionResult merged = mergeValidation(extraction, report);

        // 6. Scoring
        ScoringResult scoring = ruleEngine.score(documentType, extractedData, merged, typeConfig);
        VerificationStatus finalStatus = scoring.getStatus() == VerificationStatus.VERIFIED
                ? VerificationStatus.VERIFIED : VerificationStatus.REJECTED;

        // 7. Persist
        Map<String, String> storedData = scoring.isWrongDocument() ? new LinkedHashMap<>() : extractedData;
        requestRepository.updateVerdict(requestId, VerdictUpdate.builder()
                .status(finalStatus)
                .confidence(scoring.getConfidence())
                .riskScore(scoring.getRiskScore())
                .extractedData(storedData)
                .issues(scoring.getIssues())
                .aiResponse(outcome.rawResponse())
                .build());
        metricsConfig.recordVerification(finalStatus.value(), scoring.getConfidence());
        log.info("Request {} ({}) -> {} (confidence={}, risk={}, issues={})",
                requestId, documentType, finalStatus, scoring.getConfidence(), scoring.getRiskScore(),
                scoring.getIssues().size());

        request.setStatus(finalStatus);
        request.setConfidence(scoring.getConfidence());
        request.setRiskScore(scoring.getRiskScore());
        request.setExtractedData(storedData);
        request.setIssues(scoring.getIssues());

        // 8. Audit
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", finalStatus.value());
        details.put("confidence", scoring.getConfidence());
        details.put("risk_score", scoring.getRiskScore());
        details.put("issues_count", scoring.getIssues().size());
        if (scoring.isWrongDocument()) {
            details.put("wrong_document", true);
            details.put("detected_type", scoring.getDetectedDocumentType());
            details.put("expected_type", scoring.getExpectedDocumentType());
        }
        if (!report.isPassed()) {
            details.put("failed_checks", report.getFailedChecks());
        }
        auditService.recordVerification(request.getOwnerId(), categorize(scoring, merged, report), requestId, details);

        // 9. Webhooks
        notifyWebhooks(request, WebhookEvent.forVerdict(finalStatus));

        // 10. Bulk job
        recomputeBulk(request);
    }

    /**
     * Append validator issues to the collaborator's and AND the validator verdicts into its
     * data-consistency flags. A flag the collaborator left out counts as passed.
     */
    static ExtractionResult mergeValidation(ExtractionResult extraction, ValidationReport report) {
        List<String> issues = new ArrayList<>(extraction.getIssues() != null ? extraction.getIssues() : List.of());
        for (String issue : report.getIssues()) {
            if (!issues.contains(issue)) {
                issues.add(issue);
            }
        }

        ExtractionResult.DataConsistency reported = extraction.getDataConsistency() != null
                ? extraction.getDataConsistency()
                : new ExtractionResult.DataConsistency();
        boolean noData = report.getFailedChecks().contains(ValidationReport.CHECK_NO_DATA);

        boolean datesValid = !Boolean.FALSE.equals(reported.getDatesValid())
                && (noData || report.isDatesValid());
        boolean idFormatValid = !Boolean.FALSE.equals(reported.getIdFormatValid())
                && (noData || report.isIdFormatValid());
        boolean validatorLogical = !noData && report.isLogicalChecksPassed() && report.isDataConsistent();
        boolean logicalChecksPassed = !Boolean.FALSE.equals(reported.getLogicalChecksPassed()) && validatorLogical;

        String details = report.isPassed() ? reported.getDetails() : report.getDetails();

        return extraction.toBuilder()
                .issues(issues)
                .dataConsistency(reported.toBuilder()
                        .datesValid(datesValid)
                        .idFormatValid(idFormatValid)
                        .logicalChecksPassed(logicalChecksPassed)
                        .details(details)
                        .build())
                .build();
    }

    static AuditAction categorize(ScoringResult scoring, ExtractionResult extraction, ValidationReport report) {
        if (scoring.isWrongDocument()) {
            return AuditAction.DOCUMENT_WRONG_TYPE;
        }
        ExtractionResult.AuthenticityChecks authenticity = extraction.getAuthenticityChecks();
        if (authenticity != null && Boolean.TRUE.equals(authenticity.getTamperingDetected())) {
            return AuditAction.DOCUMENT_TAMPERING_SUSPECTED;
        }
        if (Boolean.FALSE.equals(extraction.getGenuine())
                || (extraction.getFraudIndicators() != null && !extraction.getFraudIndicators().isEmpty())) {
            return AuditAction.DOCUMENT_FRAUD_SUSPECTED;
        }
        if (!report.isPassed()) {
            return AuditAction.DOCUMENT_VALIDATION_FAILED;
        }
        return AuditAction.DOCUMENT_PROCESSED;
    }

    private void fail(VerificationRequest request, String message) {
        String requestId = request.getSystemReferenceId();
        VerdictUpdate update = VerdictUpdate.failed(message);
        try {
            requestRepository.updateVerdict(requestId, update);
            metricsConfig.recordVerificationFailed();
        } catch (Exception e) {
            log.error("Failed to mark request {} as FAILED", requestId, e);
        }
        request.setStatus(VerificationStatus.FAILED);
        request.setIssues(update.getIssues());
        notifyFailure(request, message);
    }

    private void notifyFailure(VerificationRequest request, String message) {
        request.setStatus(VerificationStatus.FAILED);

        notifyWebhooks(request, WebhookEvent.DOCUMENT_FAILED);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error", message);
        auditService.recordVerification(request.getOwnerId(), AuditAction.DOCUMENT_FAILED,
                request.getSystemReferenceId(), details);

        recomputeBulk(request);
    }

    private void notifyWebhooks(VerificationRequest request, WebhookEvent event) {
        try {
            webhookDispatcher.trigger(request.getOwnerId(), event, request);
        } catch (Exception e) {
            log.error("Failed to dispatch {} for request {}", event.getEventName(), request.getSystemReferenceId(), e);
        }
    }

    private void recomputeBulk(VerificationRequest request) {
        if (request.getBulkJobId() == null) {
            return;
        }
        try {
            bulkAggregator.recompute(request.getBulkJobId());
        } catch (Exception e) {
            log.error("Failed to update bulk job {} after request {}",
                    request.getBulkJobId(), request.getSystemReferenceId(), e);
        }
    }
}
