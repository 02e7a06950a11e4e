package com.docverify.engine.adjusters;

import com.docverify.engine.ScoreAdjuster;
import com.docverify.engine.ScoringContext;
import com.docverify.model.CheckOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Applies the per-field regular expressions configured for the document type.
 * A configured pattern that does not compile is skipped.
 */
@Component
@Order(20)
public class FieldPatternAdjuster implements ScoreAdjuster {

    private static final Logger log = LoggerFactory.getLogger(FieldPatternAdjuster.class);

    @Override
    public String name() {
        return "field_patterns";
    }

    @Override
    public void apply(ScoringContext context) {
        if (context.getConfig() == null) return;

        for (Map.Entry<String, String> rule : context.getConfig().getValidationRules().entrySet()) {
            String field = rule.getKey();
            String value = context.getExtractedData().get(field);
            if (value == null || value.isEmpty() || rule.getValue() == null) continue;

            Pattern pattern;
            try {
                pattern = Pattern.compile(rule.getValue());
            } catch (PatternSyntaxException e) {
                log.warn("Skipping invalid validation pattern for {}.{}: {}",
                        context.getDocumentType(), field, e.getDescription());
                continue;
            }

            if (!pattern.matcher(value).find()) {
                context.addIssue(String.format("Field '%s' does not match expected pattern", field));
                context.penalize(10, 0.10);
                context.recordCheck(field + "_pattern",
                        CheckOutcome.failed("Does not match pattern: " + rule.getValue()));
            }
        }
    }
}
