package com.docverify.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Webhook {
    private String webhookId;
    private String ownerId;
    private String url;
    private String secret;

    @Builder.Default
    private List<WebhookEvent> events = new ArrayList<>(WebhookEvent.DEFAULT_SUBSCRIPTION);

    @Builder.Default
    private boolean active = true;

    private int failureCount;
    private long lastTriggeredAt;
    private long createdAt;

    public boolean isSubscribedTo(WebhookEvent event) {
        return events != null && events.contains(event);
    }
}
