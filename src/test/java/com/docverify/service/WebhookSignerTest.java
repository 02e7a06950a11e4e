package com.docverify.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookSignerTest {

    private final WebhookSigner signer = new WebhookSigner();

    @Test
    void sign_matchesKnownHmacSha256Vector() {
        assertThat(signer.sign("what do ya want for nothing?", "Jefe"))
                .isEqualTo("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843");
    }

    @Test
    void sign_differentSecrets_differentSignatures() {
        String payload = "{\"event\":\"document.verified\"}";

        assertThat(signer.sign(payload, "whsec_a")).isNotEqualTo(signer.sign(payload, "whsec_b"));
        assertThat(signer.sign(payload, "whsec_a")).isEqualTo(signer.sign(payload, "whsec_a"));
    }

    @Test
    void newSecret_prefixedRandomHex() {
        String first = signer.newSecret();
        String second = signer.newSecret();

        assertThat(first).startsWith("whsec_").hasSize(54).matches("whsec_[0-9a-f]{48}");
        assertThat(first).isNotEqualTo(second);
    }
}
