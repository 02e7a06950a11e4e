package com.docverify.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntry {
    private String entryId;
    private String ownerId;
    private String action;
    private String resourceType;
    private String resourceId;

    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();

    private long createdAt;
}
