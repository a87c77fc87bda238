package app.taxguide.ask.billing.service;

import app.taxguide.ask.provider.paystack.PaystackProps;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Paystack signs the raw body with HMAC-SHA512 keyed by the secret key and sends the hex
 * digest in {@code x-paystack-signature}.
 */
@Component
public class PaystackSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA512";

    private final String secretKey;

    public PaystackSignatureVerifier(PaystackProps props) {
        this.secretKey = props.secretKey() == null ? "" : props.secretKey().trim();
    }

    public boolean verify(byte[] rawBody, String signature) {
        if (rawBody == null || signature == null || signature.isBlank() || secretKey.isEmpty()) {
            return false;
        }
        byte[] expected = sign(rawBody).getBytes(StandardCharsets.UTF_8);
        byte[] actual = signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, actual);
    }

    public String sign(byte[] rawBody) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(rawBody));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HMAC calculation failed", ex);
        }
    }
}
