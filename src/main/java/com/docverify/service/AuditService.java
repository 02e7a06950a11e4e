package com.docverify.service;

import com.docverify.model.AuditAction;
import com.docverify.model.AuditEntry;
import com.docverify.repository.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    static final String RESOURCE_VERIFICATION_REQUEST = "verification_request";
    static final String RESOURCE_BULK_JOB = "bulk_job";
    static final String RESOURCE_WEBHOOK = "webhook";

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    public void recordVerification(String ownerId, AuditAction action, String requestId,
                                   Map<String, Object> details) {
        record(ownerId, action, RESOURCE_VERIFICATION_REQUEST, requestId, details);
    }

    /**
     * Append an audit entry. Audit writes never fail the caller.
     */
    public void record(String ownerId, AuditAction action, String resourceType, String resourceId,
                       Map<String, Object> details) {
        AuditEntry entry = AuditEntry.builder()
                .entryId(UUID.randomUUID().toString())
                .ownerId(ownerId)
                .action(action.getAction())
                .resourceType(resourceType)
                .resourceId(resourceId)
                .details(details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>())
                .createdAt(clock.millis())
                .build();
        try {
            auditLogRepository.save(entry);
        } catch (Exception e) {
            log.error("Failed to write audit entry {} for {} {}", action.getAction(), resourceType, resourceId, e);
        }
    }

    public List<AuditEntry> history(String requestId) {
        return auditLogRepository.findByResource(requestId);
    }
}
