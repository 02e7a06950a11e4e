package com.docverify.service;

import com.docverify.config.MetricsConfig;
import com.docverify.config.VerificationProperties;
import com.docverify.model.BulkJob;
import com.docverify.model.DeliveryStatus;
import com.docverify.model.VerificationRequest;
import com.docverify.model.Webhook;
import com.docverify.model.WebhookDelivery;
import com.docverify.model.WebhookEvent;
import com.docverify.repository.WebhookDeliveryRepository;
import com.docverify.repository.WebhookRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Delivers signed event notifications to the owner's subscriptions.
 *
 * One attempt per subscription and event. Each attempt is recorded as a {@link WebhookDelivery};
 * a 2xx answer resets the subscription's failure count, anything else (including no answer at
 * all) increments it. Subscriptions at {@code maxFailureCount} or above are no longer called.
 */
@Service
public class WebhookDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WebhookDispatcher.class);

    private final WebhookRepository webhookRepository;
    private final WebhookDeliveryRepository deliveryRepository;
    private final WebhookSigner signer;
    private final HttpClient httpClient;
    private final VerificationProperties.Webhook config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public WebhookDispatcher(WebhookRepository webhookRepository,
                             WebhookDeliveryRepository deliveryRepository,
                             WebhookSigner signer,
                             HttpClient httpClient,
                             VerificationProperties properties,
                             MetricsConfig metricsConfig,
                             Clock clock) {
        this.webhookRepository = webhookRepository;
        this.deliveryRepository = deliveryRepository;
        this.signer = signer;
        this.httpClient = httpClient;
        this.config = properties.getWebhook();
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
    }

    @Async
    @Observed(name = "webhook.trigger", contextualName = "trigger-webhooks")
    public void trigger(String ownerId, WebhookEvent event, VerificationRequest request) {
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("event", event.getEventName());
            payload.put("reference_id", request.getSystemReferenceId());
            payload.put("client_reference_id", request.getClientReferenceId());
            payload.put("document_type", request.getDocumentType());
            payload.put("status", request.getStatus() != null ? request.getStatus().value() : null);
            payload.put("confidence", request.getConfidence());
            payload.put("risk_score", request.getRiskScore());
            payload.put("timestamp", Instant.now(clock).toString());

            deliver(ownerId, event, request.getSystemReferenceId(), payload);
        } catch (Exception e) {
            log.error("Failed to dispatch {} for request {}: {}",
                    event.getEventName(), request.getSystemReferenceId(), e.getMessage(), e);
        }
    }

    @Async
    @Observed(name = "webhook.trigger", contextualName = "trigger-bulk-webhooks")
    public void triggerBulkCompleted(BulkJob job) {
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("event", WebhookEvent.BULK_COMPLETED.getEventName());
            payload.put("bulk_id", job.getBulkId());
            payload.put("status", job.getStatus().value());
            payload.put("total", job.getTotalDocuments());
            payload.put("verified", job.getVerified());
            payload.put("rejected", job.getRejected());
            payload.put("failed", job.getFailed());
            payload.put("timestamp", Instant.now(clock).toString());

            deliver(job.getOwnerId(), WebhookEvent.BULK_COMPLETED, job.getBulkId(), payload);
        } catch (Exception e) {
            log.error("Failed to dispatch bulk.completed for bulk job {}: {}", job.getBulkId(), e.getMessage(), e);
        }
    }

    /**
     * Send one payload to every eligible subscription concurrently and wait for all outcomes.
     */
    List<WebhookDelivery> deliver(String ownerId, WebhookEvent event, String subjectId,
                                  Map<String, Object> payload) throws JsonProcessingException {
        List<Webhook> targets = webhookRepository.findByOwner(ownerId).stream()
                .filter(Webhook::isActive)
                .filter(w -> w.getFailureCount() < config.getMaxFailureCount())
                .filter(w -> w.isSubscribedTo(event))
                .toList();
        if (targets.isEmpty()) {
            log.debug("No webhooks subscribed to {} for owner {}", event.getEventName(), ownerId);
            return List.of();
        }

        String body = objectMapper.writeValueAsString(payload);
        String timestamp = Instant.now(clock).toString();

        List<CompletableFuture<WebhookDelivery>> attempts = targets.stream()
                .map(webhook -> send(webhook, event, subjectId, body, timestamp))
                .toList();
        CompletableFuture.allOf(attempts.toArray(new CompletableFuture[0])).join();
        return attempts.stream().map(CompletableFuture::join).toList();
    }

    private CompletableFuture<WebhookDelivery> send(Webhook webhook, WebhookEvent event, String subjectId,
                                                    String body, String timestamp) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(webhook.getUrl()))
                    .timeout(Duration.ofMillis(config.getTimeoutMs()))
                    .header("Content-Type", "application/json")
                    .header("X-Webhook-Signature", signer.sign(body, webhook.getSecret()))
                    .header("X-Webhook-Event", event.getEventName())
                    .header("X-Webhook-Timestamp", timestamp)
                    .header("User-Agent", config.getUserAgent())
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(record(webhook, event, subjectId, body, null, e));
        }

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> record(webhook, event, subjectId, body, response, unwrap(error)));
    }

    private WebhookDelivery record(Webhook webhook, WebhookEvent event, String subjectId, String body,
                                   HttpResponse<String> response, Throwable error) {
        boolean delivered = error == null && response != null
                && response.statusCode() >= 200 && response.statusCode() < 300;

        String responseBody;
        if (error != null) {
            responseBody = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        } else {
            responseBody = response != null ? response.body() : null;
        }

        WebhookDelivery delivery = WebhookDelivery.builder()
                .deliveryId(UUID.randomUUID().toString())
                .webhookId(webhook.getWebhookId())
                .subjectId(subjectId)
                .event(event.getEventName())
                .payload(body)
                .responseStatus(error == null && response != null ? response.statusCode() : null)
                .responseBody(truncate(responseBody))
                .status(delivered ? DeliveryStatus.DELIVERED : DeliveryStatus.FAILED)
                .attemptedAt(clock.millis())
                .build();

        try {
            deliveryRepository.save(delivery);
            if (delivered) {
                webhookRepository.recordSuccess(webhook.getWebhookId(), delivery.getAttemptedAt());
            } else {
                long failures = webhookRepository.incrementFailureCount(webhook.getWebhookId());
                if (failures >= config.getMaxFailureCount()) {
                    log.warn("Webhook {} reached {} consecutive failures and will no longer be called",
                            webhook.getWebhookId(), failures);
                }
            }
        } catch (Exception e) {
            log.error("Failed to record delivery of {} to webhook {}", event.getEventName(), webhook.getWebhookId(), e);
        }

        metricsConfig.recordWebhookDelivery(event.getEventName(), delivery.getStatus().name().toLowerCase());
        if (delivered) {
            log.info("Delivered {} for {} to webhook {} (HTTP {})",
                    event.getEventName(), subjectId, webhook.getWebhookId(), delivery.getResponseStatus());
        } else {
            log.warn("Delivery of {} for {} to webhook {} failed: status={}, response={}",
                    event.getEventName(), subjectId, webhook.getWebhookId(),
                    delivery.getResponseStatus(), delivery.getResponseBody());
        }
        return delivery;
    }

    private String truncate(String value) {
        if (value == null || value.length() <= config.getResponseBodyLimit()) {
            return value;
        }
        return value.substring(0, config.getResponseBodyLimit());
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
