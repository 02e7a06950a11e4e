package com.docverify.engine.adjusters;

import com.docverify.engine.ScoreAdjuster;
import com.docverify.engine.ScoringContext;
import com.docverify.model.CheckOutcome;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Every field the document type declares as required must be extracted with a non-blank value.
 * Each missing field costs 5 confidence and 0.05 risk.
 */
@Component
@Order(10)
public class RequiredFieldsAdjuster implements ScoreAdjuster {

    @Override
    public String name() {
        return "required_fields";
    }

    @Override
    public void apply(ScoringContext context) {
        if (context.getConfig() == null) return;

        for (String field : context.getConfig().getRequiredFields()) {
            String value = context.getExtractedData().get(field);
            if (value == null || value.trim().isEmpty()) {
                context.addIssue("Required field missing: " + field);
                context.penalize(5, 0.05);
                context.recordCheck(field, CheckOutcome.builder()
                        .status("missing").message("Required field not found").build());
            } else {
                context.recordCheck(field, CheckOutcome.builder().status("present").value(value).build());
            }
        }
    }
}
