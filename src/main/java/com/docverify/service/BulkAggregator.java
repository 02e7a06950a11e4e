package com.docverify.service;

import com.docverify.config.MetricsConfig;
import com.docverify.model.BulkJob;
import com.docverify.model.BulkJobItem;
import com.docverify.model.BulkJobStatus;
import com.docverify.model.VerificationRequest;
import com.docverify.repository.BulkJobRepository;
import com.docverify.repository.VerificationRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Recomputes a bulk job's counters from the statuses of its linked requests.
 *
 * Once all items are terminal the job is COMPLETED when every item was verified, FAILED when
 * every item failed, and PARTIAL otherwise. Until then it stays PROCESSING.
 */
@Service
public class BulkAggregator {

    private static final Logger log = LoggerFactory.getLogger(BulkAggregator.class);

    private final BulkJobRepository bulkJobRepository;
    private final VerificationRequestRepository requestRepository;
    private final WebhookDispatcher webhookDispatcher;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public BulkAggregator(BulkJobRepository bulkJobRepository,
                          VerificationRequestRepository requestRepository,
                          WebhookDispatcher webhookDispatcher,
                          MetricsConfig metricsConfig,
                          Clock clock) {
        this.bulkJobRepository = bulkJobRepository;
        this.requestRepository = requestRepository;
        this.webhookDispatcher = webhookDispatcher;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public Optional<BulkJob> recompute(String bulkId) {
        BulkJob job = bulkJobRepository.findById(bulkId);
        if (job == null) {
            log.warn("Bulk job {} not found, nothing to recompute", bulkId);
            return Optional.empty();
        }

        List<String> requestIds = bulkJobRepository.findItems(bulkId).stream()
                .map(BulkJobItem::getRequestId)
                .toList();
        List<VerificationRequest> requests = requestRepository.findByIds(requestIds);

        int verified = 0;
        int rejected = 0;
        int failed = 0;
        for (VerificationRequest request : requests) {
            switch (request.getStatus()) {
                case VERIFIED -> verified++;
                case REJECTED -> rejected++;
                case FAILED -> failed++;
                default -> { }
            }
        }
        int completed = verified + rejected + failed;

        BulkJobStatus status = resolveStatus(job.getTotalDocuments(), completed, verified, failed);
        job.setCompleted(completed);
        job.setVerified(verified);
        job.setRejected(rejected);
        job.setFailed(failed);
        job.setStatus(status);
        job.setCompletedAt(status.isFinished() ? clock.millis() : 0L);
        bulkJobRepository.updateProgress(job);

        log.debug("Bulk job {}: {}/{} done (verified={}, rejected={}, failed={}) -> {}",
                bulkId, completed, job.getTotalDocuments(), verified, rejected, failed, status);

        if (status.isFinished()) {
            log.info("Bulk job {} finished with status {}", bulkId, status);
            metricsConfig.recordBulkFinished(status.value());
            webhookDispatcher.triggerBulkCompleted(job);
        }
        return Optional.of(job);
    }

    static BulkJobStatus resolveStatus(int total, int completed, int verified, int failed) {
        if (total <= 0 || completed < total) {
            return BulkJobStatus.PROCESSING;
        }
        if (verified == total) {
            return BulkJobStatus.COMPLETED;
        }
        if (failed == total) {
            return BulkJobStatus.FAILED;
        }
        return BulkJobStatus.PARTIAL;
    }
}
