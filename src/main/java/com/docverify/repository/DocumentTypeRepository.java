package com.docverify.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.docverify.config.AerospikeConfig;
import com.docverify.model.DocumentTypeConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Document type definitions keyed by owner and code. Global definitions use the "global" scope.
 */
@Repository
public class DocumentTypeRepository {

    private static final Logger log = LoggerFactory.getLogger(DocumentTypeRepository.class);
    private static final String GLOBAL_SCOPE = "global";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public DocumentTypeRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(DocumentTypeConfig config) {
        Key key = key(config.getOwnerId(), config.getCode());

        client.put(writePolicy, key,
                new Bin("code", config.getCode()),
                new Bin("name", config.getName()),
                new Bin("ownerId", config.getOwnerId() != null ? config.getOwnerId() : ""),
                new Bin("reqFields", serialize(config.getRequiredFields())),
                new Bin("valRules", serialize(config.getValidationRules())),
                new Bin("formats", serialize(config.getAllowedFormats())),
                new Bin("maxSizeMb", config.getMaxSizeMb()),
                new Bin("active", config.isActive() ? 1 : 0));
    }

    /**
     * The owner's own active definition if there is one, else the active global definition.
     */
    public DocumentTypeConfig findByCodeForOwner(String code, String ownerId) {
        if (ownerId != null) {
            DocumentTypeConfig own = find(ownerId, code);
            if (own != null && own.isActive()) return own;
        }
        DocumentTypeConfig global = find(null, code);
        return global != null && global.isActive() ? global : null;
    }

    public boolean exists(String code, String ownerId) {
        return client.exists(readPolicy, key(ownerId, code));
    }

    private DocumentTypeConfig find(String ownerId, String code) {
        Record record = client.get(readPolicy, key(ownerId, code));
        if (record == null) return null;
        return mapRecord(record);
    }

    private Key key(String ownerId, String code) {
        String scope = ownerId != null ? ownerId : GLOBAL_SCOPE;
        return new Key(namespace, AerospikeConfig.SET_DOCUMENT_TYPES, scope + ":" + code);
    }

    private DocumentTypeConfig mapRecord(Record record) {
        String ownerId = record.getString("ownerId");
        return DocumentTypeConfig.builder()
                .code(record.getString("code"))
                .name(record.getString("name"))
                .ownerId(ownerId != null && !ownerId.isEmpty() ? ownerId : null)
                .requiredFields(deserialize(record.getString("reqFields"), new TypeReference<ArrayList<String>>() {}, new ArrayList<>()))
                .validationRules(deserialize(record.getString("valRules"), new TypeReference<LinkedHashMap<String, String>>() {}, new LinkedHashMap<>()))
                .allowedFormats(deserialize(record.getString("formats"), new TypeReference<ArrayList<String>>() {}, new ArrayList<>()))
                .maxSizeMb(record.getInt("maxSizeMb"))
                .active(record.getInt("active") == 1)
                .build();
    }

    private String serialize(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            log.error("Failed to serialize document type field", e);
            return value instanceof Map ? "{}" : "[]";
        }
    }

    private <T> T deserialize(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isEmpty()) return fallback;
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception e) {
            log.error("Failed to deserialize document type field", e);
            return fallback;
        }
    }
}
