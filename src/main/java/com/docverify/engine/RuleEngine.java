package com.docverify.engine;

import com.docverify.config.VerificationProperties;
import com.docverify.model.CheckOutcome;
import com.docverify.model.DocumentTypeConfig;
import com.docverify.model.ExtractionResult;
import com.docverify.model.ScoringResult;
import com.docverify.model.VerificationStatus;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the collaborator's output (with validator flags already merged in) into the final
 * status, confidence and risk score.
 *
 * Wrong-document detection short-circuits everything else. Otherwise each registered
 * {@link ScoreAdjuster} contributes penalties in order, the totals are clamped and rounded,
 * and the thresholds from {@link VerificationProperties.Scoring} pick the verdict.
 */
@Component
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final List<ScoreAdjuster> adjusters;
    private final DocumentTypeCrossCheck crossCheck;
    private final VerificationProperties properties;
    private final Tracer tracer;

    public RuleEngine(List<ScoreAdjuster> adjusters, DocumentTypeCrossCheck crossCheck,
                      VerificationProperties properties, Tracer tracer) {
        this.adjusters = List.copyOf(adjusters);
        this.crossCheck = crossCheck;
        this.properties = properties;
        this.tracer = tracer;

        for (ScoreAdjuster adjuster : this.adjusters) {
            log.info("Registered score adjuster: {} -> {}", adjuster.name(), adjuster.getClass().getSimpleName());
        }
    }

    /**
     * Score one extraction.
     *
     * @param documentType  the claimed document type code
     * @param extractedData fields extracted from the document
     * @param extraction    collaborator output, with validator flags merged into data consistency
     * @param config        document type configuration, or null when the type is unknown
     * @return the verdict
     */
    @Observed(name = "rules.score", contextualName = "score-document")
    public ScoringResult score(String documentType, Map<String, String> extractedData,
                               ExtractionResult extraction, DocumentTypeConfig config) {
        if (Boolean.FALSE.equals(extraction.getDocumentTypeMatch())) {
            String detected = extraction.getDetectedDocumentType() != null
                    ? extraction.getDetectedDocumentType() : "Unknown";
            String expected = extraction.getExpectedDocumentType() != null
                    ? extraction.getExpectedDocumentType() : documentType;
            String reason = extraction.getDocumentTypeMismatchReason() != null
                    ? extraction.getDocumentTypeMismatchReason()
                    : String.format("Expected \"%s\" but received \"%s\"", expected, detected);
            return wrongDocument(extraction, expected, detected, "Wrong document submitted: " + reason, reason);
        }

        Optional<DocumentTypeCrossCheck.TypeMismatch> mismatch =
                crossCheck.check(documentType, extractedData, extraction.getRemarks());
        if (mismatch.isPresent()) {
            DocumentTypeCrossCheck.TypeMismatch m = mismatch.get();
            log.info("Keyword cross-check rejected {} document: detected {}", documentType, m.detected());
            return wrongDocument(extraction, m.expected(), m.detected(), m.reason(), m.reason());
        }

        ScoringContext context = new ScoringContext(documentType, extractedData, extraction, config);
        if (config == null) {
            context.addIssue("Unknown document type: " + documentType);
        }

        for (ScoreAdjuster adjuster : adjusters) {
            Span span = tracer.nextSpan()
                    .name("rules.adjust." + adjuster.name())
                    .tag("document.type", String.valueOf(documentType))
                    .start();
            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                adjuster.apply(context);
            } catch (Exception e) {
                span.error(e);
                log.error("Error applying score adjuster {} for document type {}: {}",
                        adjuster.name(), documentType, e.getMessage(), e);
            } finally {
                span.end();
            }
        }

        double confidence = round(clamp(extraction.getConfidence() + context.getConfidenceDelta(), 0, 100), 2);
        double risk = round(clamp(extraction.getRiskScore() + context.getRiskDelta(), 0, 1), 4);
        VerificationStatus status = decide(context.isForceReject(), confidence, risk, extraction.getStatus());

        log.debug("Scored {} document: status={}, confidence={}, risk={}, adjustments=({}, {})",
                documentType, status, confidence, risk, context.getConfidenceDelta(), context.getRiskDelta());

        return ScoringResult.builder()
                .status(status)
                .confidence(confidence)
                .riskScore(risk)
                .issues(context.getIssues())
                .validationResults(context.getValidationResults())
                .fraudIndicators(copyOrEmpty(extraction.getFraudIndicators()))
                .wrongDocument(false)
                .forceRejected(context.isForceReject())
                .detectedDocumentType(extraction.getDetectedDocumentType())
                .expectedDocumentType(extraction.getExpectedDocumentType() != null
                        ? extraction.getExpectedDocumentType() : documentType)
                .build();
    }

    VerificationStatus decide(boolean forceReject, double confidence, double risk, String suggested) {
        VerificationProperties.Scoring scoring = properties.getScoring();
        if (forceReject || confidence < scoring.getRejectBelowConfidence() || risk > scoring.getRejectAboveRisk()) {
            return VerificationStatus.REJECTED;
        }
        if (confidence >= scoring.getVerifyMinConfidence() && risk < scoring.getVerifyBelowRisk()) {
            return VerificationStatus.VERIFIED;
        }
        return VerificationStatus.fromSuggestion(suggested);
    }

    private ScoringResult wrongDocument(ExtractionResult extraction, String expected, String detected,
                                        String issue, String message) {
        List<String> issues = new ArrayList<>(copyOrEmpty(extraction.getIssues()));
        issues.add(issue);

        ScoringResult result = ScoringResult.builder()
                .status(VerificationStatus.REJECTED)
                .confidence(0)
                .riskScore(1.0)
                .issues(issues)
                .fraudIndicators(copyOrEmpty(extraction.getFraudIndicators()))
                .wrongDocument(true)
                .forceRejected(true)
                .detectedDocumentType(detected)
                .expectedDocumentType(expected)
                .build();
        result.getValidationResults().put("document_type_check", CheckOutcome.builder()
                .status("failed")
                .message(message)
                .value(detected)
                .build());
        return result;
    }

    private static List<String> copyOrEmpty(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
