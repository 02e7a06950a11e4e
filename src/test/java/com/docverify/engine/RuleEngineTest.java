package com.docverify.engine;

import com.docverify.config.VerificationProperties;
import com.docverify.engine.adjusters.AuthenticityChecksAdjuster;
import com.docverify.engine.adjusters.DataConsistencyAdjuster;
import com.docverify.engine.adjusters.FieldPatternAdjuster;
import com.docverify.engine.adjusters.FraudIndicatorAdjuster;
import com.docverify.engine.adjusters.GenuinenessAdjuster;
import com.docverify.engine.adjusters.MetadataMismatchAdjuster;
import com.docverify.engine.adjusters.RequiredFieldsAdjuster;
import com.docverify.model.DocumentTypeConfig;
import com.docverify.model.ExtractionResult;
import com.docverify.model.ImageQuality;
import com.docverify.model.ScoringResult;
import com.docverify.model.VerificationStatus;
import com.docverify.testutil.TestDataFactory;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RuleEngineTest {

    private static final DocumentTypeConfig PAN = TestDataFactory.createDocumentType(
            "pan", List.of("pan_number"), Map.of());

    private RuleEngine ruleEngine;
    private VerificationProperties properties;

    @BeforeEach
    void setUp() {
        properties = new VerificationProperties();
        ruleEngine = new RuleEngine(defaultAdjusters(), new DocumentTypeCrossCheck(), properties, Tracer.NOOP);
    }

    private static List<ScoreAdjuster> defaultAdjusters() {
        return List.of(
                new RequiredFieldsAdjuster(),
                new FieldPatternAdjuster(),
                new MetadataMismatchAdjuster(),
                new FraudIndicatorAdjuster(),
                new GenuinenessAdjuster(),
                new AuthenticityChecksAdjuster(),
                new DataConsistencyAdjuster());
    }

    @Test
    void score_cleanPan_verifiedWithCollaboratorScores() {
        Map<String, String> data = Map.of("pan_number", "ABCDE1234F");
        ExtractionResult extraction = TestDataFactory.createExtraction(data, 92, 0.05);

        ScoringResult result = ruleEngine.score("pan", data, extraction, PAN);

        assertThat(result.getStatus()).isEqualTo(VerificationStatus.VERIFIED);
        assertThat(result.getConfidence()).isEqualTo(92.0);
        assertThat(result.getRiskScore()).isEqualTo(0.05);
        assertThat(result.getIssues()).isEmpty();
        assertThat(result.getValidationResults().get("pan_number").getStatus()).isEqualTo("present");
    }

    @Test
    void score_invalidIdFormat_costsTenPointsAndRejects() {
        Map<String, String> data = Map.of("pan_number", "1234ABCDEF");
        ExtractionResult extraction = TestDataFactory.createExtraction(data, 55, 0.05);
        extraction.setDataConsistency(ExtractionResult.DataConsistency.builder()
                .datesValid(true).idFormatValid(false).logicalChecksPassed(true).build());

        ScoringResult result = ruleEngine.score("pan", data, extraction, PAN);

        assertThat(result.getConfidence()).isEqualTo(45.0);
        assertThat(result.getRiskScore()).isEqualTo(0.15);
        assertThat(result.getStatus()).isEqualTo(VerificationStatus.REJECTED);
        assertThat(result.getIssues())
                .containsExactly("ID number format does not match expected pattern for this document type");
    }

    @Test
    void score_missingRequiredFieldAndPatternFailure_bothPenalized() {
        DocumentTypeConfig config = TestDataFactory.createDocumentType("pan",
                List.of("name", "pan_number"), Map.of("pan_number", "^[A-Z]{5}[0-9]{4}[A-Z]$"));
        Map<String, String> data = Map.of("pan_number", "1234ABCDEF");
        ExtractionResult extraction = TestDataFactory.createExtraction(data, 90, 0.0);

        ScoringResult result = ruleEngine.score("pan", data, extraction, config);

        assertThat(result.getConfidence()).isEqualTo(75.0);
        assertThat(result.getRiskScore()).isEqualTo(0.15);
        assertThat(result.getIssues()).containsExactly(
                "Required field missing: name",
                "Field 'pan_number' does not match expected pattern");
        assertThat(result.getValidationResults().get("name").getStatus()).isEqualTo("missing");
    }

    @Test
    void score_largePenalties_clampedToBounds() {
        Map<String, String> data = Map.of("pan_number", "ABCDE1234F");
        ExtractionResult extraction = TestDataFactory.createExtraction(data, 20, 0.6);
        extraction.setFraudIndicators(new ArrayList<>(List.of("edited text", "mismatched photo", "fake seal")));

        ScoringResult result = ruleEngine.score("pan", data, extraction, PAN);

        assertThat(result.getConfidence()).isEqualTo(0.0);
        assertThat(result.getRiskScore()).isEqualTo(1.0);
        assertThat(result.getStatus()).isEqualTo(VerificationStatus.REJECTED);
        assertThat(result.getFraudIndicators()).hasSize(3);
    }

    @Test
    void score_notGenuine_forceRejected() {
        Map<String, String> data = Map.of("pan_number", "ABCDE1234F");
        ExtractionResult extraction = TestDataFactory.createExtraction(data, 99, 0.0);
        extraction.setGenuine(false);

        ScoringResult result = ruleEngine.score("pan", data, extraction, PAN);

        assertThat(result.isForceRejected()).isTrue();
        assertThat(result.getStatus()).isEqualTo(VerificationStatus.REJECTED);
        assertThat(result.getConfidence()).isEqualTo(59.0);
        assertThat(result.getRiskScore()).isEqualTo(0.5);
    }

    @Test
    void score_tamperingDetected_forceRejectedEvenAboveThresholds() {
        properties.getScoring().setVerifyMinConfidence(10);
        properties.getScoring().setVerifyBelowRisk(0.9);
        Map<String, String> data = Map.of("pan_number", "ABCDE1234F");
        ExtractionResult extraction = TestDataFactory.createExtraction(data, 100, 0.0);
        extraction.setAuthenticityChecks(ExtractionResult.AuthenticityChecks.builder()
                .tamperingDetected(true)
                .imageQuality(ImageQuality.GOOD)
                .build());

        ScoringResult result = ruleEngine.score("pan", data, extraction, PAN);

        assertThat(result.getConfidence()).isEqualTo(70.0);
        assertThat(result.getRiskScore()).isEqualTo(0.4);
        assertThat(result.getStatus()).isEqualTo(VerificationStatus.REJECTED);
        assertThat(result.getValidationResults()).containsKey("tampering");
    }

    @Test
    void score_middleBand_followsCollaboratorSuggestion() {
        Map<String, String> data = Map.of("pan_number", "ABCDE1234F");
        ExtractionResult suggestedVerified = TestDataFactory.createExtraction(data, 70, 0.3);
        ExtractionResult suggestedRejected = TestDataFactory.createExtraction(data, 70, 0.3);
        suggestedRejected.setStatus("rejected");

        assertThat(ruleEngine.score("pan", data, suggestedVerified, PAN).getStatus())
                .isEqualTo(VerificationStatus.VERIFIED);
        assertThat(ruleEngine.score("pan", data, suggestedRejected, PAN).getStatus())
                .isEqualTo(VerificationStatus.REJECTED);
    }

    @Test
    void score_collaboratorReportsWrongType_shortCircuits() {
        Map<String, String> data = Map.of("aadhaar_number", "2345 6789 0123");
        ExtractionResult extraction = TestDataFactory.createExtraction(data, 95, 0.01);
        extraction.setDocumentTypeMatch(false);
        extraction.setDetectedDocumentType("aadhaar");
        extraction.setExpectedDocumentType("pan");
        extraction.setDocumentTypeMismatchReason("Document is an Aadhaar card");

        ScoringResult result = ruleEngine.score("pan", data, extraction, PAN);

        assertThat(result.isWrongDocument()).isTrue();
        assertThat(result.getStatus()).isEqualTo(VerificationStatus.REJECTED);
        assertThat(result.getConfidence()).isZero();
        assertThat(result.getRiskScore()).isEqualTo(1.0);
        assertThat(result.getIssues()).containsExactly("Wrong document submitted: Document is an Aadhaar card");
        assertThat(result.getValidationResults().get("document_type_check").getValue()).isEqualTo("aadhaar");
    }

    @Test
    void score_marksheetKeywordCrossCheck_rejectsAsWrongDocument() {
        Map<String, String> data = Map.of(
                "name", "Priya Singh",
                "board", "Council of Higher Secondary Education",
                "percentage", "88");
        ExtractionResult extraction = TestDataFactory.createExtraction(data, 93, 0.02);

        ScoringResult result = ruleEngine.score("marksheet_10", data, extraction, null);

        assertThat(result.isWrongDocument()).isTrue();
        assertThat(result.getStatus()).isEqualTo(VerificationStatus.REJECTED);
        assertThat(result.getConfidence()).isZero();
        assertThat(result.getDetectedDocumentType()).startsWith("12th Class Marksheet");
        assertThat(result.getIssues()).hasSize(1);
        assertThat(result.getIssues().get(0)).contains("\"higher secondary\"");
    }

    @Test
    void score_unknownDocumentType_noteAddedWithoutPenalty() {
        Map<String, String> data = Map.of("field", "value");
        ExtractionResult extraction = TestDataFactory.createExtraction(data, 85, 0.1);

        ScoringResult result = ruleEngine.score("library_card", data, extraction, null);

        assertThat(result.getIssues()).containsExactly("Unknown document type: library_card");
        assertThat(result.getConfidence()).isEqualTo(85.0);
        assertThat(result.getStatus()).isEqualTo(VerificationStatus.VERIFIED);
    }

    @Test
    void score_failingAdjuster_isIsolated() {
        ScoreAdjuster broken = new ScoreAdjuster() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public void apply(ScoringContext context) {
                throw new IllegalStateException("boom");
            }
        };
        List<ScoreAdjuster> adjusters = new ArrayList<>(List.of(broken));
        adjusters.addAll(defaultAdjusters());
        RuleEngine engine = new RuleEngine(adjusters, new DocumentTypeCrossCheck(), properties, Tracer.NOOP);
        Map<String, String> data = Map.of("name", "Ravi");
        ExtractionResult extraction = TestDataFactory.createExtraction(data, 92, 0.05);

        ScoringResult result = engine.score("pan", data, extraction, PAN);

        assertThat(result.getIssues()).containsExactly("Required field missing: pan_number");
        assertThat(result.getConfidence()).isEqualTo(87.0);
    }

    @Test
    void decide_thresholdBoundaries() {
        assertThat(ruleEngine.decide(false, 50.0, 0.7, "rejected")).isEqualTo(VerificationStatus.REJECTED);
        assertThat(ruleEngine.decide(false, 49.99, 0.0, "verified")).isEqualTo(VerificationStatus.REJECTED);
        assertThat(ruleEngine.decide(false, 90.0, 0.71, "verified")).isEqualTo(VerificationStatus.REJECTED);
        assertThat(ruleEngine.decide(false, 80.0, 0.19, "rejected")).isEqualTo(VerificationStatus.VERIFIED);
        assertThat(ruleEngine.decide(false, 80.0, 0.2, "verified")).isEqualTo(VerificationStatus.VERIFIED);
        assertThat(ruleEngine.decide(true, 100.0, 0.0, "verified")).isEqualTo(VerificationStatus.REJECTED);
    }
}
