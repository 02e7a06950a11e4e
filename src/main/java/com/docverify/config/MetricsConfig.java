package com.docverify.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger queueDepth;
    private final AtomicInteger activeJobs;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.queueDepth = registry.gauge("verification.queue.depth", new AtomicInteger(0));
        this.activeJobs = registry.gauge("verification.queue.active", new AtomicInteger(0));
    }

    public void recordVerification(String status, double confidence) {
        Counter.builder("verification.count")
                .tag("status", status)
                .register(registry)
                .increment();

        DistributionSummary.builder("verification.confidence")
                .tag("status", status)
                .register(registry)
                .record(confidence);
    }

    public void recordVerificationFailed() {
        Counter.builder("verification.count")
                .tag("status", "failed")
                .register(registry)
                .increment();
    }

    public void recordJobRetry(String jobType) {
        Counter.builder("job.retry.count")
                .tag("job_type", jobType)
                .register(registry)
                .increment();
    }

    public void recordJobPermanentFailure(String jobType) {
        Counter.builder("job.failed.count")
                .tag("job_type", jobType)
                .register(registry)
                .increment();
    }

    public void recordWebhookDelivery(String event, String status) {
        Counter.builder("webhook.delivery.count")
                .tag("event", event)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordBulkFinished(String status) {
        Counter.builder("bulk.finished.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateQueueState(int depth, int active) {
        queueDepth.set(depth);
        activeJobs.set(active);
    }
}
