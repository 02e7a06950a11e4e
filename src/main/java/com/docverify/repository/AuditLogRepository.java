package com.docverify.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.docverify.config.AerospikeConfig;
import com.docverify.model.AuditEntry;
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

@Repository
public class AuditLogRepository {

    private static final Logger log = LoggerFactory.getLogger(AuditLogRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    public AuditLogRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace,
                              @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(AuditEntry entry) {
        Key key = new Key(namespace, AerospikeConfig.SET_AUDIT_LOG, entry.getEntryId());

        client.put(writePolicy, key,
                new Bin("entryId", entry.getEntryId()),
                new Bin("ownerId", entry.getOwnerId() != null ? entry.getOwnerId() : ""),
                new Bin("action", entry.getAction()),
                new Bin("resType", entry.getResourceType()),
                new Bin("resId", entry.getResourceId()),
                new Bin("details", serializeDetails(entry.getDetails())),
                new Bin("createdAt", entry.getCreatedAt()));
    }

    /**
     * Audit trail of one resource, oldest first.
     */
    public List<AuditEntry> findByResource(String resourceId) {
        List<AuditEntry> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_AUDIT_LOG,
                (key, record) -> {
                    try {
                        if (resourceId.equals(record.getString("resId"))) {
                            synchronized (results) {
                                results.add(mapRecord(record));
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read audit record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(AuditEntry::getCreatedAt));
        return results;
    }

    private AuditEntry mapRecord(Record record) {
        String ownerId = record.getString("ownerId");
        return AuditEntry.builder()
                .entryId(record.getString("entryId"))
                .ownerId(ownerId != null && !ownerId.isEmpty() ? ownerId : null)
                .action(record.getString("action"))
                .resourceType(record.getString("resType"))
                .resourceId(record.getString("resId"))
                .details(deserializeDetails(record.getString("details")))
                .createdAt(record.getLong("createdAt"))
                .build();
    }

    private String serializeDetails(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details != null ? details : Map.of());
        } catch (Exception e) {
            log.error("Failed to serialize audit details", e);
            return "{}";
        }
    }

    private Map<String, Object> deserializeDetails(String json) {
        if (json == null || json.isEmpty()) return new LinkedHashMap<>();
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize audit details", e);
            return new LinkedHashMap<>();
        }
    }
}
