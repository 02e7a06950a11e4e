package com.docverify.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.docverify.config.AerospikeConfig;
import com.docverify.model.BulkJob;
import com.docverify.model.BulkJobItem;
import com.docverify.model.BulkJobStatus;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bulk jobs and their item links. Items live in their own set keyed by request id, so a request
 * belongs to at most one bulk job.
 */
@Repository
public class BulkJobRepository {

    private static final Logger log = LoggerFactory.getLogger(BulkJobRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public BulkJobRepository(AerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                             @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(BulkJob job) {
        Key key = new Key(namespace, AerospikeConfig.SET_BULK_JOBS, job.getBulkId());

        client.put(writePolicy, key,
                new Bin("bulkId", job.getBulkId()),
                new Bin("ownerId", job.getOwnerId()),
                new Bin("total", job.getTotalDocuments()),
                new Bin("completed", job.getCompleted()),
                new Bin("verified", job.getVerified()),
                new Bin("rejected", job.getRejected()),
                new Bin("failed", job.getFailed()),
                new Bin("status", job.getStatus().name()),
                new Bin("callbackUrl", job.getCallbackUrl() != null ? job.getCallbackUrl() : ""),
                new Bin("metadata", serializeMap(job.getMetadata())),
                new Bin("createdAt", job.getCreatedAt()),
                new Bin("completedAt", job.getCompletedAt()));
    }

    public BulkJob findById(String bulkId) {
        Key key = new Key(namespace, AerospikeConfig.SET_BULK_JOBS, bulkId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Overwrite the derived counters and status of a job.
     */
    public void updateProgress(BulkJob job) {
        Key key = new Key(namespace, AerospikeConfig.SET_BULK_JOBS, job.getBulkId());
        client.put(writePolicy, key,
                new Bin("completed", job.getCompleted()),
                new Bin("verified", job.getVerified()),
                new Bin("rejected", job.getRejected()),
                new Bin("failed", job.getFailed()),
                new Bin("status", job.getStatus().name()),
                new Bin("completedAt", job.getCompletedAt()));
    }

    public void updateStatus(String bulkId, BulkJobStatus status) {
        Key key = new Key(namespace, AerospikeConfig.SET_BULK_JOBS, bulkId);
        client.put(writePolicy, key, new Bin("status", status.name()));
    }

    public void saveItem(BulkJobItem item) {
        Key key = new Key(namespace, AerospikeConfig.SET_BULK_ITEMS, item.getRequestId());
        client.put(writePolicy, key,
                new Bin("bulkId", item.getBulkId()),
                new Bin("requestId", item.getRequestId()),
                new Bin("itemIndex", item.getItemIndex()),
                new Bin("createdAt", item.getCreatedAt()));
    }

    /**
     * Items of a bulk job in submission order.
     */
    public List<BulkJobItem> findItems(String bulkId) {
        List<BulkJobItem> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_BULK_ITEMS,
                (key, record) -> {
                    try {
                        if (bulkId.equals(record.getString("bulkId"))) {
                            synchronized (results) {
                                results.add(BulkJobItem.builder()
                                        .bulkId(record.getString("bulkId"))
                                        .requestId(record.getString("requestId"))
                                        .itemIndex(record.getInt("itemIndex"))
                                        .createdAt(record.getLong("createdAt"))
                                        .build());
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read bulk item record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingInt(BulkJobItem::getItemIndex));
        return results;
    }

    private BulkJob mapRecord(Record record) {
        String callbackUrl = record.getString("callbackUrl");
        return BulkJob.builder()
                .bulkId(record.getString("bulkId"))
                .ownerId(record.getString("ownerId"))
                .totalDocuments(record.getInt("total"))
                .completed(record.getInt("completed"))
                .verified(record.getInt("verified"))
                .rejected(record.getInt("rejected"))
                .failed(record.getInt("failed"))
                .status(BulkJobStatus.valueOf(record.getString("status")))
                .callbackUrl(callbackUrl != null && !callbackUrl.isEmpty() ? callbackUrl : null)
                .metadata(deserializeMap(record.getString("metadata")))
                .createdAt(record.getLong("createdAt"))
                .completedAt(record.getLong("completedAt"))
                .build();
    }

    private String serializeMap(Map<String, String> map) {
        try {
            return objectMapper.writeValueAsString(map != null ? map : Map.of());
        } catch (Exception e) {
            log.error("Failed to serialize map", e);
            return "{}";
        }
    }

    private Map<String, String> deserializeMap(String json) {
        if (json == null || json.isEmpty()) return new LinkedHashMap<>();
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, String>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize map", e);
            return new LinkedHashMap<>();
        }
    }
}
