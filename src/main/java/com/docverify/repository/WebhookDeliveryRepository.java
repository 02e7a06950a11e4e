package com.docverify.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.docverify.config.AerospikeConfig;
import com.docverify.model.DeliveryStatus;
import com.docverify.model.WebhookDelivery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Append-only log of webhook delivery attempts.
 */
@Repository
public class WebhookDeliveryRepository {

    private static final Logger log = LoggerFactory.getLogger(WebhookDeliveryRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public WebhookDeliveryRepository(AerospikeClient client,
                                     @Qualifier("aerospikeNamespace") String namespace,
                                     @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    public void save(WebhookDelivery delivery) {
        Key key = new Key(namespace, AerospikeConfig.SET_WEBHOOK_DELIVERIES, delivery.getDeliveryId());

        client.put(writePolicy, key,
                new Bin("deliveryId", delivery.getDeliveryId()),
                new Bin("webhookId", delivery.getWebhookId()),
                new Bin("subjectId", delivery.getSubjectId()),
                new Bin("event", delivery.getEvent()),
                new Bin("payload", delivery.getPayload()),
                delivery.getResponseStatus() != null
                        ? new Bin("respStatus", delivery.getResponseStatus().intValue())
                        : Bin.asNull("respStatus"),
                new Bin("respBody", delivery.getResponseBody() != null ? delivery.getResponseBody() : ""),
                new Bin("status", delivery.getStatus().name()),
                new Bin("attemptedAt", delivery.getAttemptedAt()));
    }

    /**
     * Most recent attempts for one webhook, newest first.
     */
    public List<WebhookDelivery> findByWebhook(String webhookId, int limit) {
        List<WebhookDelivery> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_WEBHOOK_DELIVERIES,
                (key, record) -> {
                    try {
                        if (webhookId.equals(record.getString("webhookId"))) {
                            synchronized (results) {
                                results.add(mapRecord(record));
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read webhook delivery record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(WebhookDelivery::getAttemptedAt).reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    private WebhookDelivery mapRecord(Record record) {
        return WebhookDelivery.builder()
                .deliveryId(record.getString("deliveryId"))
                .webhookId(record.getString("webhookId"))
                .subjectId(record.getString("subjectId"))
                .event(record.getString("event"))
                .payload(record.getString("payload"))
                .responseStatus(record.getValue("respStatus") != null ? record.getInt("respStatus") : null)
                .responseBody(record.getString("respBody"))
                .status(DeliveryStatus.valueOf(record.getString("status")))
                .attemptedAt(record.getLong("attemptedAt"))
                .build();
    }
}
