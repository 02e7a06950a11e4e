package com.docverify.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.docverify.config.AerospikeConfig;
import com.docverify.model.VerdictUpdate;
import com.docverify.model.VerificationRequest;
import com.docverify.model.VerificationStatus;
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
import java.util.function.Predicate;

@Repository
public class VerificationRequestRepository {

    private static final Logger log = LoggerFactory.getLogger(VerificationRequestRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public VerificationRequestRepository(AerospikeClient client,
                                         @Qualifier("aerospikeNamespace") String namespace,
                                         @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                         @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(VerificationRequest request) {
        Key key = key(request.getSystemReferenceId());

        List<Bin> bins = new ArrayList<>();
        bins.add(new Bin("refId", request.getSystemReferenceId()));
        bins.add(new Bin("clientRef", request.getClientReferenceId() != null ? request.getClientReferenceId() : ""));
        bins.add(new Bin("ownerId", request.getOwnerId()));
        bins.add(new Bin("docType", request.getDocumentType()));
        bins.add(new Bin("fileUrl", request.getFileUrl()));
        bins.add(new Bin("metadata", serialize(request.getMetadata())));
        bins.add(new Bin("status", request.getStatus().name()));
        bins.add(request.getConfidence() != null ? new Bin("confidence", request.getConfidence().doubleValue()) : Bin.asNull("confidence"));
        bins.add(request.getRiskScore() != null ? new Bin("riskScore", request.getRiskScore().doubleValue()) : Bin.asNull("riskScore"));
        bins.add(new Bin("extracted", serialize(request.getExtractedData())));
        bins.add(new Bin("issues", serialize(request.getIssues())));
        bins.add(new Bin("aiResponse", request.getAiResponse() != null ? request.getAiResponse() : ""));
        bins.add(new Bin("bulkJobId", request.getBulkJobId() != null ? request.getBulkJobId() : ""));
        bins.add(new Bin("createdAt", request.getCreatedAt()));
        bins.add(new Bin("processedAt", request.getProcessedAt()));

        client.put(writePolicy, key, bins.toArray(new Bin[0]));
    }

    public VerificationRequest findById(String requestId) {
        Record record = client.get(readPolicy, key(requestId));
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Move a request to {@code next} only if it is currently in {@code expected}. The write is
     * conditional on the record generation that was read, so concurrent claims cannot both win.
     * @return true if the status was changed
     */
    public boolean transition(String requestId, VerificationStatus expected, VerificationStatus next) {
        Key key = key(requestId);
        Record record = client.get(readPolicy, key, "status");
        if (record == null) return false;

        String current = record.getString("status");
        if (!expected.name().equals(current)) {
            log.debug("Request {} is {} not {}, skipping transition to {}", requestId, current, expected, next);
            return false;
        }

        WritePolicy conditional = new WritePolicy(writePolicy);
        conditional.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        conditional.generation = record.generation;
        try {
            client.put(conditional, key, new Bin("status", next.name()));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                log.debug("Request {} changed concurrently, transition to {} lost", requestId, next);
                return false;
            }
            throw e;
        }
    }

    /**
     * Write a status change and whatever verdict fields are set. processedAt is stamped when the
     * new status is terminal.
     */
    public void updateVerdict(String requestId, VerdictUpdate update) {
        List<Bin> bins = new ArrayList<>();
        bins.add(new Bin("status", update.getStatus().name()));
        if (update.getConfidence() != null) bins.add(new Bin("confidence", update.getConfidence().doubleValue()));
        if (update.getRiskScore() != null) bins.add(new Bin("riskScore", update.getRiskScore().doubleValue()));
        if (update.getExtractedData() != null) bins.add(new Bin("extracted", serialize(update.getExtractedData())));
        if (update.getIssues() != null) bins.add(new Bin("issues", serialize(update.getIssues())));
        if (update.getAiResponse() != null) bins.add(new Bin("aiResponse", update.getAiResponse()));
        if (update.getStatus().isTerminal()) bins.add(new Bin("processedAt", System.currentTimeMillis()));

        client.put(writePolicy, key(requestId), bins.toArray(new Bin[0]));
    }

    /**
     * Return a request to ACCEPTED with every scoring field cleared.
     */
    public void resetForReprocess(String requestId) {
        client.put(writePolicy, key(requestId),
                new Bin("status", VerificationStatus.ACCEPTED.name()),
                Bin.asNull("confidence"),
                Bin.asNull("riskScore"),
                new Bin("extracted", "{}"),
                new Bin("issues", "[]"),
                new Bin("aiResponse", ""),
                new Bin("processedAt", 0L));
    }

    /**
     * ACCEPTED requests, oldest first.
     */
    public List<VerificationRequest> findPending(int limit) {
        List<VerificationRequest> results = scan(record ->
                VerificationStatus.ACCEPTED.name().equals(record.getString("status")));
        results.sort(Comparator.comparingLong(VerificationRequest::getCreatedAt));
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    /**
     * Requests of one owner, newest first, optionally filtered by status.
     */
    public List<VerificationRequest> findByOwner(String ownerId, VerificationStatus status, int limit) {
        List<VerificationRequest> results = scan(record ->
                ownerId.equals(record.getString("ownerId"))
                        && (status == null || status.name().equals(record.getString("status"))));
        results.sort(Comparator.comparingLong(VerificationRequest::getCreatedAt).reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    public List<VerificationRequest> findByIds(List<String> requestIds) {
        List<VerificationRequest> results = new ArrayList<>();
        for (String requestId : requestIds) {
            VerificationRequest request = findById(requestId);
            if (request != null) {
                results.add(request);
            }
        }
        return results;
    }

    private List<VerificationRequest> scan(Predicate<Record> filter) {
        List<VerificationRequest> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_VERIFICATION_REQUESTS,
                (key, record) -> {
                    try {
                        if (filter.test(record)) {
                            synchronized (results) {
                                results.add(mapRecord(record));
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read verification request record: {}", e.getMessage());
                    }
                });
        return results;
    }

    private Key key(String requestId) {
        return new Key(namespace, AerospikeConfig.SET_VERIFICATION_REQUESTS, requestId);
    }

    private VerificationRequest mapRecord(Record record) {
        return VerificationRequest.builder()
                .systemReferenceId(record.getString("refId"))
                .clientReferenceId(emptyToNull(record.getString("clientRef")))
                .ownerId(record.getString("ownerId"))
                .documentType(record.getString("docType"))
                .fileUrl(record.getString("fileUrl"))
                .metadata(deserializeMap(record.getString("metadata")))
                .status(VerificationStatus.valueOf(record.getString("status")))
                .confidence(record.getValue("confidence") != null ? record.getDouble("confidence") : null)
                .riskScore(record.getValue("riskScore") != null ? record.getDouble("riskScore") : null)
                .extractedData(deserializeMap(record.getString("extracted")))
                .issues(deserializeList(record.getString("issues")))
                .aiResponse(emptyToNull(record.getString("aiResponse")))
                .bulkJobId(emptyToNull(record.getString("bulkJobId")))
                .createdAt(record.getLong("createdAt"))
                .processedAt(record.getLong("processedAt"))
                .build();
    }

    private static String emptyToNull(String value) {
        return value != null && !value.isEmpty() ? value : null;
    }

    private String serialize(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            log.error("Failed to serialize verification request field", e);
            return value instanceof Map ? "{}" : "[]";
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

    private List<String> deserializeList(String json) {
        if (json == null || json.isEmpty()) return new ArrayList<>();
        try {
            return objectMapper.readValue(json, new TypeReference<ArrayList<String>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize list", e);
            return new ArrayList<>();
        }
    }
}
