package com.docverify.engine.adjusters;

import com.docverify.engine.ScoreAdjuster;
import com.docverify.engine.ScoringContext;
import com.docverify.model.CheckOutcome;
import com.docverify.model.ExtractionResult.AuthenticityChecks;
import com.docverify.model.ImageQuality;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Prices the detailed forensic signals reported by the collaborator. Only an explicit false
 * (or a suspicious/poor image quality) costs anything; unreported signals are neutral.
 * Tampering forces a rejection.
 */
@Component
@Order(60)
public class AuthenticityChecksAdjuster implements ScoreAdjuster {

    @Override
    public String name() {
        return "authenticity_checks";
    }

    @Override
    public void apply(ScoringContext context) {
        AuthenticityChecks checks = context.getExtraction().getAuthenticityChecks();
        if (checks == null) return;

        if (Boolean.TRUE.equals(checks.getTamperingDetected())) {
            context.addIssue("Tampering detected: Document appears to have been digitally altered");
            context.penalize(30, 0.40);
            context.forceReject();
            context.recordCheck("tampering", CheckOutcome.failed("Tampering evidence found"));
        }
        if (Boolean.FALSE.equals(checks.getOriginalDocument())) {
            context.addIssue("Document does not appear to be an original - possible photocopy or digitally recreated");
            context.penalize(15, 0.15);
            context.recordCheck("originality", CheckOutcome.failed("Not an original document"));
        }
        if (Boolean.FALSE.equals(checks.getFontConsistency())) {
            context.addIssue("Inconsistent fonts detected across the document");
            context.penalize(15, 0.15);
            context.recordCheck("font_check", CheckOutcome.failed("Font inconsistency detected"));
        }
        if (Boolean.FALSE.equals(checks.getLayoutMatchesOfficial())) {
            context.addIssue("Document layout does not match known official format");
            context.penalize(20, 0.20);
            context.recordCheck("layout_check", CheckOutcome.failed("Layout mismatch with official format"));
        }
        if (Boolean.FALSE.equals(checks.getPhotoIntegrity())) {
            context.addIssue("Photo on document appears altered or digitally pasted");
            context.penalize(20, 0.20);
            context.recordCheck("photo_check", CheckOutcome.failed("Photo integrity compromised"));
        }

        if (checks.getImageQuality() == ImageQuality.SUSPICIOUS) {
            context.addIssue("Image quality is suspicious - may indicate digital manipulation");
            context.penalize(20, 0.20);
            context.recordCheck("image_quality", CheckOutcome.failed("Suspicious image quality"));
        } else if (checks.getImageQuality() == ImageQuality.POOR) {
            context.addIssue("Image quality is too poor for reliable verification");
            context.penalize(10, 0.10);
            context.recordCheck("image_quality", CheckOutcome.warning("Poor image quality"));
        }

        if (Boolean.FALSE.equals(checks.getHasSecurityFeatures())) {
            context.addIssue("Expected security features (watermarks, holograms, official seals) not found");
            context.penalize(15, 0.15);
            context.recordCheck("security_features", CheckOutcome.failed("Security features missing"));
        }
    }
}
