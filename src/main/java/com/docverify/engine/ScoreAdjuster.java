package com.docverify.engine;

/**
 * One scoring rule. Implementations inspect the collaborator output and the merged validator
 * flags, add issues and move confidence down or risk up. They run in {@code @Order} order.
 */
public interface ScoreAdjuster {

    /**
     * Short name used in logs and trace spans.
     */
    String name();

    void apply(ScoringContext context);
}
