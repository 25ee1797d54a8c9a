package com.clientsync.security;

import com.clientsync.config.ClientSyncProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Checks the X-Notion-Signature header: hex HMAC-SHA256 of {@code timestamp + "." + body}
 * keyed with the shared webhook secret, optionally prefixed with {@code sha256=}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookSignatureVerifier {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String SIGNATURE_PREFIX = "sha256=";

    private final ClientSyncProperties properties;

    public enum Verdict {
        VERIFIED,
        /** No secret configured; the delivery is accepted without verification. */
        UNVERIFIED,
        REJECTED
    }

    public Verdict verify(String timestamp, String body, String signature) {
        ClientSyncProperties.Webhook webhook = properties.getWebhook();
        String secret = webhook.getSecret();

        if (secret == null || secret.isBlank()) {
            if (webhook.isRequireSignature()) {
                log.warn("Rejecting webhook: signatures are required but no secret is configured");
                return Verdict.REJECTED;
            }
            log.warn("Accepting unverified webhook delivery, clientsync.webhook.secret is not set");
            return Verdict.UNVERIFIED;
        }

        if (signature == null || signature.isBlank() || timestamp == null || timestamp.isBlank()) {
            log.warn("Rejecting webhook: missing signature or timestamp header");
            return Verdict.REJECTED;
        }

        String hex = signature.trim();
        if (hex.startsWith(SIGNATURE_PREFIX)) {
            hex = hex.substring(SIGNATURE_PREFIX.length());
        }

        byte[] provided;
        try {
            provided = HexFormat.of().parseHex(hex);
        } catch (IllegalArgumentException e) {
            log.warn("Rejecting webhook: signature is not hex");
            return Verdict.REJECTED;
        }

        byte[] expected = computeHmac(secret, timestamp + "." + (body == null ? "" : body));
        if (!MessageDigest.isEqual(expected, provided)) {
            log.warn("Rejecting webhook: invalid signature");
            return Verdict.REJECTED;
        }
        return Verdict.VERIFIED;
    }

    /**
     * Hex signature for a payload, as Notion would send it.
     */
    public static String sign(String secret, String timestamp, String body) {
        return HexFormat.of().formatHex(computeHmac(secret, timestamp + "." + body));
    }

    private static byte[] computeHmac(String secret, String content) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal(content.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute webhook HMAC", e);
        }
    }
}
