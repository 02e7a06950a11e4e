package com.docverify.model;

/**
 * Lifecycle of a verification request: ACCEPTED -> PROCESSING -> {VERIFIED | REJECTED | FAILED}.
 */
public enum VerificationStatus {
    ACCEPTED,
    PROCESSING,
    VERIFIED,
    REJECTED,
    FAILED;

    public boolean isTerminal() {
        return this == VERIFIED || this == REJECTED || this == FAILED;
    }

    public String value() {
        return name().toLowerCase();
    }

    /**
     * Maps a collaborator-suggested status onto a verdict. Anything other than "verified" is a rejection.
     */
    public static VerificationStatus fromSuggestion(String suggested) {
        if (suggested != null && "verified".equalsIgnoreCase(suggested.trim())) {
            return VERIFIED;
        }
        return REJECTED;
    }
}
