package com.docverify.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "verification")
public class VerificationProperties {

    private Queue queue = new Queue();

    private Scoring scoring = new Scoring();

    private Webhook webhook = new Webhook();

    @Data
    public static class Queue {
        // Maximum number of jobs running at the same time across the process.
        private int concurrency = 3;
        private int maxAttempts = 3;
        // Retry delay is backoffBaseMs * 2^attempts.
        private long backoffBaseMs = 1000;
        private boolean pollingEnabled = true;
        private long pollIntervalMs = 2000;
        // Upper bound of ACCEPTED rows picked up by a single poll.
        private int pollBatchSize = 10;
    }

    @Data
    public static class Scoring {
        private double rejectBelowConfidence = 50.0;
        private double rejectAboveRisk = 0.7;
        private double verifyMinConfidence = 80.0;
        private double verifyBelowRisk = 0.2;
    }

    @Data
    public static class Webhook {
        // Subscriptions at or above this failure count are skipped.
        private int maxFailureCount = 10;
        private long timeoutMs = 10000;
        private int responseBodyLimit = 1000;
        private String userAgent = "DocumentVerificationPlatform/1.0";
    }
}
