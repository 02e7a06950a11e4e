package com.docverify.queue;

/**
 * Kinds of background work. Dispatch in {@link VerificationJobQueue} switches over every constant.
 */
public enum JobType {
    VERIFY_DOCUMENT
}
