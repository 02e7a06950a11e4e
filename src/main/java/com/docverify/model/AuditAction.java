package com.docverify.model;

/**
 * Actions written to the audit log: pipeline outcomes plus submissions and webhook changes.
 */
public enum AuditAction {
    DOCUMENT_PROCESSED("document.processed"),
    DOCUMENT_WRONG_TYPE("document.wrong_type"),
    DOCUMENT_FRAUD_SUSPECTED("document.fraud_suspected"),
    DOCUMENT_TAMPERING_SUSPECTED("document.tampering_suspected"),
    DOCUMENT_VALIDATION_FAILED("document.validation_failed"),
    DOCUMENT_FAILED("document.failed"),
    DOCUMENT_REPROCESSED("document.reprocessed"),
    VERIFICATION_SUBMITTED("verification.submitted"),
    BULK_SUBMITTED("bulk_verification.submitted"),
    WEBHOOK_REGISTERED("webhook.registered"),
    WEBHOOK_UPDATED("webhook.updated"),
    WEBHOOK_DELETED("webhook.deleted");

    private final String action;

    AuditAction(String action) {
        this.action = action;
    }

    public String getAction() {
        return action;
    }
}
