package com.clientsync.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Utility class for comparing admin API keys without leaking timing information.
 */
public class ApiKeyUtil {

    private ApiKeyUtil() {
    }

    /**
     * Hash an API key using SHA-256.
     *
     * @param apiKey The API key to hash
     * @return SHA-256 hash of the API key
     */
    public static byte[] hashApiKey(String apiKey) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(apiKey.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not found", e);
        }
    }

    /**
     * Compare a presented key with the configured one. Hashing first keeps the
     * comparison length-independent.
     */
    public static boolean matches(String presented, String expected) {
        if (presented == null || expected == null || expected.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(hashApiKey(presented), hashApiKey(expected));
    }

    /**
     * First characters of a key, safe to log.
     */
    public static String getKeyPrefix(String apiKey) {
        if (apiKey == null || apiKey.length() < 7) {
            return "";
        }
        return apiKey.substring(0, 7);
    }
}
