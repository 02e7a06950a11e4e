package com.docverify.engine.adjusters;

import com.docverify.engine.ScoreAdjuster;
import com.docverify.engine.ScoringContext;
import com.docverify.model.CheckOutcome;
import com.docverify.model.ExtractionResult.DataConsistency;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Date, ID-format and logical flags. By the time scoring runs these already combine the
 * collaborator's opinion with the deterministic validator's.
 */
@Component
@Order(70)
public class DataConsistencyAdjuster implements ScoreAdjuster {

    private static final String DEFAULT_LOGICAL_DETAILS = "Logical inconsistencies found in document data";

    @Override
    public String name() {
        return "data_consistency";
    }

    @Override
    public void apply(ScoringContext context) {
        DataConsistency consistency = context.getExtraction().getDataConsistency();
        if (consistency == null) return;

        if (Boolean.FALSE.equals(consistency.getDatesValid())) {
            context.addIssue("Date inconsistency detected in document fields");
            context.penalize(10, 0.10);
            context.recordCheck("date_consistency", CheckOutcome.failed("Invalid or inconsistent dates"));
        }
        if (Boolean.FALSE.equals(consistency.getIdFormatValid())) {
            context.addIssue("ID number format does not match expected pattern for this document type");
            context.penalize(10, 0.10);
            context.recordCheck("id_format", CheckOutcome.failed("ID format mismatch"));
        }
        if (Boolean.FALSE.equals(consistency.getLogicalChecksPassed())) {
            String details = consistency.getDetails() != null ? consistency.getDetails() : DEFAULT_LOGICAL_DETAILS;
            context.addIssue("Data consistency issue: " + details);
            context.penalize(10, 0.10);
            context.recordCheck("logical_consistency", CheckOutcome.failed(details));
        }
    }
}
