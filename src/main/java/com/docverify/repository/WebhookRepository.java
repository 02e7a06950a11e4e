package com.docverify.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.docverify.config.AerospikeConfig;
import com.docverify.model.Webhook;
import com.docverify.model.WebhookEvent;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class WebhookRepository {

    private static final Logger log = LoggerFactory.getLogger(WebhookRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public WebhookRepository(AerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                             @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(Webhook webhook) {
        client.put(writePolicy, key(webhook.getWebhookId()),
                new Bin("webhookId", webhook.getWebhookId()),
                new Bin("ownerId", webhook.getOwnerId()),
                new Bin("url", webhook.getUrl()),
                new Bin("secret", webhook.getSecret()),
                new Bin("events", serializeEvents(webhook.getEvents())),
                new Bin("active", webhook.isActive() ? 1 : 0),
                new Bin("failureCount", webhook.getFailureCount()),
                new Bin("lastTrigAt", webhook.getLastTriggeredAt()),
                new Bin("createdAt", webhook.getCreatedAt()));
    }

    public Webhook findById(String webhookId) {
        Record record = client.get(readPolicy, key(webhookId));
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<Webhook> findByOwner(String ownerId) {
        List<Webhook> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_WEBHOOKS,
                (key, record) -> {
                    try {
                        if (ownerId.equals(record.getString("ownerId"))) {
                            synchronized (results) {
                                results.add(mapRecord(record));
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read webhook record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(Webhook::getCreatedAt));
        return results;
    }

    public boolean delete(String webhookId) {
        boolean deleted = client.delete(writePolicy, key(webhookId));
        if (deleted) {
            log.info("Deleted webhook: {}", webhookId);
        }
        return deleted;
    }

    /**
     * Atomically bump the consecutive failure counter.
     * @return the new failure count
     */
    public long incrementFailureCount(String webhookId) {
        Record record = client.operate(writePolicy, key(webhookId),
                Operation.add(new Bin("failureCount", 1)),
                Operation.get("failureCount"));
        return record != null ? record.getLong("failureCount") : 0;
    }

    public void recordSuccess(String webhookId, long triggeredAt) {
        client.put(writePolicy, key(webhookId),
                new Bin("failureCount", 0),
                new Bin("lastTrigAt", triggeredAt));
    }

    private Key key(String webhookId) {
        return new Key(namespace, AerospikeConfig.SET_WEBHOOKS, webhookId);
    }

    private Webhook mapRecord(Record record) {
        return Webhook.builder()
                .webhookId(record.getString("webhookId"))
                .ownerId(record.getString("ownerId"))
                .url(record.getString("url"))
                .secret(record.getString("secret"))
                .events(deserializeEvents(record.getString("events")))
                .active(record.getInt("active") == 1)
                .failureCount(record.getInt("failureCount"))
                .lastTriggeredAt(record.getLong("lastTrigAt"))
                .createdAt(record.getLong("createdAt"))
                .build();
    }

    private String serializeEvents(List<WebhookEvent> events) {
        List<String> names = new ArrayList<>();
        if (events != null) {
            for (WebhookEvent event : events) {
                names.add(event.getEventName());
            }
        }
        try {
            return objectMapper.writeValueAsString(names);
        } catch (Exception e) {
            log.error("Failed to serialize webhook events", e);
            return "[]";
        }
    }

    private List<WebhookEvent> deserializeEvents(String json) {
        List<WebhookEvent> events = new ArrayList<>();
        if (json == null || json.isEmpty()) return events;
        try {
            List<String> names = objectMapper.readValue(json, new TypeReference<List<String>>() {});
            for (String name : names) {
                try {
                    events.add(WebhookEvent.fromEventName(name));
                } catch (IllegalArgumentException e) {
                    log.warn("Ignoring unknown webhook event '{}' in stored subscription", name);
                }
            }
        } catch (Exception e) {
            log.error("Failed to deserialize webhook events", e);
        }
        return events;
    }
}
