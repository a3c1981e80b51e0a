package com.stlmonitor.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class HashingUtils {
    private HashingUtils() {
    }

    public static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * First {@code length} hex characters of the SHA-256 of {@code value}; stable across runs.
     */
    public static String shortId(String value, int length) {
        return sha256(value).substring(0, Math.min(64, Math.max(1, length)));
    }
}
