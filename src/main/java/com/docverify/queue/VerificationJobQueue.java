package com.docverify.queue;

import com.docverify.config.MetricsConfig;
import com.docverify.config.VerificationProperties;
import com.docverify.model.VerdictUpdate;
import com.docverify.repository.VerificationRequestRepository;
import com.docverify.service.VerificationProcessor;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process FIFO job queue with bounded concurrency and exponential-backoff retries.
 *
 * A job that throws is retried after {@code backoffBaseMs * 2^attempts} ms until it has run
 * {@code maxAttempts} times; then its request is forced to FAILED and the processor's failure
 * side effects run. A request id stays tracked from enqueue until its job finishes, including
 * while it waits out a backoff, so the same request is never queued twice.
 */
@Component
public class VerificationJobQueue {

    private static final Logger log = LoggerFactory.getLogger(VerificationJobQueue.class);

    private final VerificationProperties.Queue config;
    private final VerificationProcessor processor;
    private final VerificationRequestRepository requestRepository;
    private final MetricsConfig metricsConfig;
    private final ExecutorService workers;
    private final ScheduledExecutorService retryScheduler;

    private final Deque<Job> pending = new ArrayDeque<>();
    private final Set<String> trackedRequestIds = ConcurrentHashMap.newKeySet();
    private int activeJobs;                     // guarded by this
    private volatile boolean running = true;

    @Autowired
    public VerificationJobQueue(VerificationProperties properties,
                                VerificationProcessor processor,
                                VerificationRequestRepository requestRepository,
                                MetricsConfig metricsConfig) {
        this(properties, processor, requestRepository, metricsConfig,
                Executors.newFixedThreadPool(properties.getQueue().getConcurrency(), namedThreads("verification-worker")),
                Executors.newSingleThreadScheduledExecutor(namedThreads("verification-retry")));
    }

    VerificationJobQueue(VerificationProperties properties,
                         VerificationProcessor processor,
                         VerificationRequestRepository requestRepository,
                         MetricsConfig metricsConfig,
                         ExecutorService workers,
                         ScheduledExecutorService retryScheduler) {
        this.config = properties.getQueue();
        this.processor = processor;
        this.requestRepository = requestRepository;
        this.metricsConfig = metricsConfig;
        this.workers = workers;
        this.retryScheduler = retryScheduler;
        log.info("Verification queue started: concurrency={}, maxAttempts={}, backoffBaseMs={}",
                config.getConcurrency(), config.getMaxAttempts(), config.getBackoffBaseMs());
    }

    /**
     * Queue a job and start it if a worker slot is free.
     *
     * @return the job id, or null if the request is already queued, running or waiting to retry
     */
    public String enqueue(JobType type, JobPayload payload) {
        if (!running) {
            throw new IllegalStateException("Verification queue is shut down");
        }
        if (!trackedRequestIds.add(payload.requestId())) {
            log.debug("Request {} is already in flight, not enqueuing again", payload.requestId());
            return null;
        }

        Job job = new Job(newJobId(), type, payload, config.getMaxAttempts(), System.currentTimeMillis());
        synchronized (this) {
            pending.addLast(job);
        }
        log.debug("Enqueued job {} ({}) for request {}", job.getId(), type, payload.requestId());
        drain();
        return job.getId();
    }

    public boolean isTracked(String requestId) {
        return trackedRequestIds.contains(requestId);
    }

    /**
     * Start queued jobs, oldest first, while fewer than {@code concurrency} are running.
     */
    void drain() {
        while (running) {
            Job next;
            synchronized (this) {
                if (activeJobs >= config.getConcurrency() || pending.isEmpty()) {
                    publishState();
                    return;
                }
                next = pending.pollFirst();
                activeJobs++;
                publishState();
            }
            workers.execute(() -> run(next));
        }
    }

    private void run(Job job) {
        int attempt = job.recordAttempt();
        boolean finished = true;
        try {
            dispatch(job);
        } catch (Exception e) {
            log.warn("Job {} for request {} failed (attempt {}/{}): {}",
                    job.getId(), job.getPayload().requestId(), attempt, job.getMaxAttempts(), e.getMessage());
            finished = !scheduleRetry(job);
            if (finished) {
                failPermanently(job, e);
            }
        } finally {
            if (finished) {
                trackedRequestIds.remove(job.getPayload().requestId());
            }
            synchronized (this) {
                activeJobs--;
            }
            drain();
        }
    }

    private void dispatch(Job job) {
        switch (job.getType()) {
            case VERIFY_DOCUMENT -> processor.process(job.getPayload().requestId());
        }
    }

    private boolean scheduleRetry(Job job) {
        if (!job.hasAttemptsLeft() || !running) {
            return false;
        }
        long delayMs = backoffDelayMs(job.getAttempts());
        metricsConfig.recordJobRetry(job.getType().name());
        log.info("Retrying job {} in {} ms", job.getId(), delayMs);
        retryScheduler.schedule(() -> {
            synchronized (this) {
                pending.addLast(job);
            }
            drain();
        }, delayMs, TimeUnit.MILLISECONDS);
        return true;
    }

    long backoffDelayMs(int attempts) {
        return config.getBackoffBaseMs() * (1L << attempts);
    }

    private void failPermanently(Job job, Exception cause) {
        String requestId = job.getPayload().requestId();
        log.error("Job {} permanently failed after {} attempts for request {}",
                job.getId(), job.getAttempts(), requestId, cause);
        metricsConfig.recordJobPermanentFailure(job.getType().name());

        try {
            requestRepository.updateVerdict(requestId, VerdictUpdate.failed(
                    "Processing failed after maximum retry attempts: " + cause.getMessage()));
        } catch (Exception e) {
            log.error("Failed to mark request {} as failed", requestId, e);
        }
        processor.onPermanentFailure(requestId, cause.getMessage());
    }

    public QueueStatus status() {
        synchronized (this) {
            return new QueueStatus(running, pending.size(), activeJobs, config.getConcurrency());
        }
    }

    private void publishState() {
        metricsConfig.updateQueueState(pending.size(), activeJobs);
    }

    @PreDestroy
    public void shutdown() {
        running = false;
        retryScheduler.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Verification workers did not finish within 10s, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Verification queue stopped with {} job(s) still queued", status().queueLength());
    }

    private static String newJobId() {
        String suffix = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return "job_" + System.currentTimeMillis() + "_" + suffix.substring(0, Math.min(9, suffix.length()));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
