package com.docverify.engine.adjusters;

import com.docverify.engine.ScoreAdjuster;
import com.docverify.engine.ScoringContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Order(40)
public class FraudIndicatorAdjuster implements ScoreAdjuster {

    @Override
    public String name() {
        return "fraud_indicators";
    }

    @Override
    public void apply(ScoringContext context) {
        List<String> indicators = context.getExtraction().getFraudIndicators();
        if (indicators == null || indicators.isEmpty()) return;

        int count = indicators.size();
        context.penalize(10.0 * count, 0.20 * count);
    }
}
