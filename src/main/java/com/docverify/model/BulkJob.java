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
public class BulkJob {
    private String bulkId;
    private String ownerId;
    private int totalDocuments;
    private int completed;
    private int verified;
    private int rejected;
    private int failed;
    private BulkJobStatus status;
    private String callbackUrl;

    @Builder.Default
    private Map<String, String> metadata = new LinkedHashMap<>();

    private long createdAt;
    private long completedAt;           // 0 while unfinished
}
