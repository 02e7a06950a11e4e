package com.docverify.queue;

public record JobPayload(String requestId) {}
