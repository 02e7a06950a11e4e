package com.docverify.service;

import com.docverify.model.AuditAction;
import com.docverify.model.Webhook;
import com.docverify.model.WebhookDelivery;
import com.docverify.model.WebhookEvent;
import com.docverify.repository.WebhookDeliveryRepository;
import com.docverify.repository.WebhookRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Webhook subscription management. The signing secret is returned once, on registration.
 */
@Service
public class WebhookService {

    private static final Logger log = LoggerFactory.getLogger(WebhookService.class);

    private static final int DEFAULT_DELIVERY_LIMIT = 50;

    private final WebhookRepository webhookRepository;
    private final WebhookDeliveryRepository deliveryRepository;
    private final WebhookSigner signer;
    private final AuditService auditService;
    private final Clock clock;

    public WebhookService(WebhookRepository webhookRepository,
                          WebhookDeliveryRepository deliveryRepository,
                          WebhookSigner signer,
                          AuditService auditService,
                          Clock clock) {
        this.webhookRepository = webhookRepository;
        this.deliveryRepository = deliveryRepository;
        this.signer = signer;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * @param eventNames event names to subscribe to, or null/empty for the document events
     */
    public Webhook register(String ownerId, String url, List<String> eventNames) {
        checkUrl(url);
        List<WebhookEvent> events = eventNames == null || eventNames.isEmpty()
                ? new ArrayList<>(WebhookEvent.DEFAULT_SUBSCRIPTION)
                : parseEvents(eventNames);

        Webhook webhook = Webhook.builder()
                .webhookId(UUID.randomUUID().toString())
                .ownerId(ownerId)
                .url(url)
                .secret(signer.newSecret())
                .events(events)
                .active(true)
                .createdAt(clock.millis())
                .build();
        webhookRepository.save(webhook);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("url", url);
        details.put("events", events.stream().map(WebhookEvent::getEventName).toList());
        auditService.record(ownerId, AuditAction.WEBHOOK_REGISTERED, AuditService.RESOURCE_WEBHOOK,
                webhook.getWebhookId(), details);

        log.info("Registered webhook {} for owner {} -> {}", webhook.getWebhookId(), ownerId, url);
        return webhook;
    }

    /**
     * Change the URL, the subscribed events or the active flag. Null arguments are left as they are.
     */
    public Webhook update(String ownerId, String webhookId, String url, List<String> eventNames, Boolean active) {
        Webhook webhook = findOwned(ownerId, webhookId);

        Map<String, Object> details = new LinkedHashMap<>();
        if (url != null) {
            checkUrl(url);
            webhook.setUrl(url);
            details.put("url", url);
        }
        if (eventNames != null) {
            if (eventNames.isEmpty()) {
                throw new IllegalArgumentException("A webhook must subscribe to at least one event");
            }
            webhook.setEvents(parseEvents(eventNames));
            details.put("events", eventNames);
        }
        if (active != null) {
            webhook.setActive(active);
            details.put("is_active", active);
        }
        webhookRepository.save(webhook);
        auditService.record(ownerId, AuditAction.WEBHOOK_UPDATED, AuditService.RESOURCE_WEBHOOK, webhookId, details);
        return redact(webhook);
    }

    public void delete(String ownerId, String webhookId) {
        findOwned(ownerId, webhookId);
        webhookRepository.delete(webhookId);
        auditService.record(ownerId, AuditAction.WEBHOOK_DELETED, AuditService.RESOURCE_WEBHOOK, webhookId, null);
    }

    public List<Webhook> list(String ownerId) {
        return webhookRepository.findByOwner(ownerId).stream()
                .map(WebhookService::redact)
                .toList();
    }

    public List<WebhookDelivery> deliveries(String ownerId, String webhookId, Integer limit) {
        findOwned(ownerId, webhookId);
        int effectiveLimit = limit == null || limit <= 0 ? DEFAULT_DELIVERY_LIMIT : limit;
        return deliveryRepository.findByWebhook(webhookId, effectiveLimit);
    }

    private Webhook findOwned(String ownerId, String webhookId) {
        Webhook webhook = webhookRepository.findById(webhookId);
        if (webhook == null || !webhook.getOwnerId().equals(ownerId)) {
            throw new IllegalArgumentException("Webhook not found: " + webhookId);
        }
        return webhook;
    }

    private static List<WebhookEvent> parseEvents(List<String> eventNames) {
        List<WebhookEvent> events = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        for (String name : eventNames) {
            try {
                WebhookEvent event = WebhookEvent.fromEventName(name);
                if (!events.contains(event)) {
                    events.add(event);
                }
            } catch (IllegalArgumentException e) {
                invalid.add(name);
            }
        }
        if (!invalid.isEmpty()) {
            throw new IllegalArgumentException("Invalid events: " + String.join(", ", invalid));
        }
        return events;
    }

    private static void checkUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Webhook URL is required");
        }
        try {
            URI uri = new URI(url);
            if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())
                    || uri.getHost() == null) {
                throw new IllegalArgumentException("Invalid webhook URL: " + url);
            }
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid webhook URL: " + url, e);
        }
    }

    private static Webhook redact(Webhook webhook) {
        webhook.setSecret(null);
        return webhook;
    }
}
