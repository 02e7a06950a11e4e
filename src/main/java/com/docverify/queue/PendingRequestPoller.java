package com.docverify.queue;

import com.docverify.config.VerificationProperties;
import com.docverify.model.VerificationRequest;
import com.docverify.repository.VerificationRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Bridges the store and the in-memory queue: ACCEPTED requests that the queue does not know
 * about (left over from a restart, or written by another process) are enqueued here.
 */
@Component
@ConditionalOnProperty(name = "verification.queue.polling-enabled", havingValue = "true", matchIfMissing = true)
public class PendingRequestPoller {

    private static final Logger log = LoggerFactory.getLogger(PendingRequestPoller.class);

    private final VerificationRequestRepository requestRepository;
    private final VerificationJobQueue queue;
    private final VerificationProperties properties;

    public PendingRequestPoller(VerificationRequestRepository requestRepository,
                                VerificationJobQueue queue,
                                VerificationProperties properties) {
        this.requestRepository = requestRepository;
        this.queue = queue;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${verification.queue.poll-interval-ms:2000}",
               initialDelayString = "${verification.queue.poll-interval-ms:2000}")
    public void pollPending() {
        try {
            List<VerificationRequest> pending = requestRepository.findPending(properties.getQueue().getPollBatchSize());
            int enqueued = 0;
            for (VerificationRequest request : pending) {
                if (queue.isTracked(request.getSystemReferenceId())) continue;
                if (queue.enqueue(JobType.VERIFY_DOCUMENT, new JobPayload(request.getSystemReferenceId())) != null) {
                    enqueued++;
                }
            }
            if (enqueued > 0) {
                log.info("Picked up {} pending verification request(s) from the store", enqueued);
            }
        } catch (Exception e) {
            log.error("Polling for pending verification requests failed", e);
        }
    }
}
