package app.taxguide.ask.billing.service;

import app.taxguide.ask.provider.paystack.PaystackProps;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class PaystackSignatureVerifierTest {

    private static final byte[] BODY = "{\"event\":\"charge.success\",\"data\":{\"reference\":\"ref_1\"}}"
            .getBytes(StandardCharsets.UTF_8);

    private final PaystackSignatureVerifier verifier = verifier("sk_test_secret");

    @Test
    void knownDigestMatches() {
        // HMAC-SHA512("abc", key="key")
        PaystackSignatureVerifier keyed = verifier("key");
        String expected = "3926a207c8c42b0c41792cbd3e1a1aaaf5f7a25704f62dfc939c4987dd7ce060"
                + "009c5bb1c2447355b3216f10b537e9afa7b64a4e5391b0d631172d07939e087a";

        assertThat(keyed.sign("abc".getBytes(StandardCharsets.UTF_8))).isEqualTo(expected);
    }

    @Test
    void acceptsOwnSignatureInAnyCase() {
        String signature = verifier.sign(BODY);

        assertThat(verifier.verify(BODY, signature)).isTrue();
        assertThat(verifier.verify(BODY, signature.toUpperCase(Locale.ROOT))).isTrue();
    }

    @Test
    void rejectsTamperedBodyOrForeignKey() {
        String signature = verifier.sign(BODY);
        byte[] tampered = "{\"event\":\"charge.success\",\"data\":{\"reference\":\"ref_2\"}}"
                .getBytes(StandardCharsets.UTF_8);

        assertThat(verifier.verify(tampered, signature)).isFalse();
        assertThat(verifier("sk_other").verify(BODY, signature)).isFalse();
    }

    @Test
    void rejectsMissingSignatureOrUnconfiguredSecret() {
        assertThat(verifier.verify(BODY, null)).isFalse();
        assertThat(verifier.verify(BODY, " ")).isFalse();
        assertThat(verifier("").verify(BODY, verifier.sign(BODY))).isFalse();
    }

    private static PaystackSignatureVerifier verifier(String secret) {
        return new PaystackSignatureVerifier(
                new PaystackProps("https://api.paystack.co", secret, null, "NGN", 1000, 1000));
    }
}
