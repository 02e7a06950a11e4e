package com.docverify.engine.adjusters;

import com.docverify.engine.ScoreAdjuster;
import com.docverify.engine.ScoringContext;
import com.docverify.model.ExtractionResult.MetadataMatch;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Client metadata the collaborator reported as not matching the document: -15 / +0.15 per field.
 */
@Component
@Order(30)
public class MetadataMismatchAdjuster implements ScoreAdjuster {

    @Override
    public String name() {
        return "metadata_match";
    }

    @Override
    public void apply(ScoringContext context) {
        Map<String, MetadataMatch> matches = context.getExtraction().getMetadataMatch();
        if (matches == null) return;

        for (Map.Entry<String, MetadataMatch> entry : matches.entrySet()) {
            MetadataMatch match = entry.getValue();
            if (match != null && Boolean.FALSE.equals(match.getMatches())) {
                context.addIssue(String.format("Metadata mismatch on '%s': expected '%s', got '%s'",
                        entry.getKey(), match.getExpected(), match.getExtracted()));
                context.penalize(15, 0.15);
            }
        }
    }
}
