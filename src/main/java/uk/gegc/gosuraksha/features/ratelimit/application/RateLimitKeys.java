package uk.gegc.gosuraksha.features.ratelimit.application;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Builds counter store keys of the form {@code <prefix>:<namespace>:<sha256(parts joined by "|")>}.
 * Subject parts such as e-mail addresses and IPs are hashed so they never appear in the store.
 */
@Component
public class RateLimitKeys {

    private final String prefix;

    public RateLimitKeys(RateLimitProperties properties) {
        this.prefix = properties.getKeyPrefix();
    }

    public String build(String namespace, String... parts) {
        String payload = String.join("|", parts);
        return prefix + ":" + namespace + ":" + sha256Hex(payload);
    }

    private static String sha256Hex(String payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
