package com.docverify.engine.adjusters;

import com.docverify.engine.ScoreAdjuster;
import com.docverify.engine.ScoringContext;
import com.docverify.model.CheckOutcome;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * A document the collaborator judged not genuine is rejected whatever its remaining score.
 */
@Component
@Order(50)
public class GenuinenessAdjuster implements ScoreAdjuster {

    @Override
    public String name() {
        return "genuineness";
    }

    @Override
    public void apply(ScoringContext context) {
        if (!Boolean.FALSE.equals(context.getExtraction().getGenuine())) return;

        context.addIssue("Document failed authenticity check: AI determined document is not genuine");
        context.penalize(40, 0.50);
        context.forceReject();
        context.recordCheck("authenticity", CheckOutcome.failed("Document is not genuine"));
    }
}
