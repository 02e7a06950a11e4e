package com.docverify.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Membership link between a bulk job and one of its verification requests.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkJobItem {
    private String bulkId;
    private String requestId;
    private int itemIndex;
    private long createdAt;
}
