package com.docverify.model;

import java.util.List;

public record BulkJobDetails(BulkJob job, List<VerificationRequest> documents) {
}
