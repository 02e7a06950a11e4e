package com.docverify.model;

import java.util.Arrays;
import java.util.List;

public enum WebhookEvent {
    DOCUMENT_VERIFIED("document.verified"),
    DOCUMENT_REJECTED("document.rejected"),
    DOCUMENT_FAILED("document.failed"),
    BULK_COMPLETED("bulk.completed");

    public static final List<WebhookEvent> DEFAULT_SUBSCRIPTION =
            List.of(DOCUMENT_VERIFIED, DOCUMENT_REJECTED, DOCUMENT_FAILED);

    private final String eventName;

    WebhookEvent(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }

    public static WebhookEvent fromEventName(String eventName) {
        return Arrays.stream(values())
                .filter(e -> e.eventName.equals(eventName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown webhook event: " + eventName));
    }

    public static WebhookEvent forVerdict(VerificationStatus status) {
        return switch (status) {
            case VERIFIED -> DOCUMENT_VERIFIED;
            case REJECTED -> DOCUMENT_REJECTED;
            case FAILED -> DOCUMENT_FAILED;
            default -> throw new IllegalArgumentException("No webhook event for status " + status);
        };
    }
}
