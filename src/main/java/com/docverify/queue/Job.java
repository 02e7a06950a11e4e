package com.docverify.queue;

import lombok.Getter;

/**
 * A unit of queued work. attempts counts executions started so far.
 */
@Getter
public class Job {

    private final String id;
    private final JobType type;
    private final JobPayload payload;
    private final int maxAttempts;
    private final long createdAt;
    private volatile int attempts;

    public Job(String id, JobType type, JobPayload payload, int maxAttempts, long createdAt) {
        this.id = id;
        this.type = type;
        this.payload = payload;
        this.maxAttempts = maxAttempts;
        this.createdAt = createdAt;
    }

    int recordAttempt() {
        return ++attempts;
    }

    boolean hasAttemptsLeft() {
        return attempts < maxAttempts;
    }
}
