package com.docverify.queue;

public record QueueStatus(boolean running, int queueLength, int activeJobs, int concurrency) {}
