package com.aurelius.core.tool;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Content-derived artifact identifiers (lowercase SHA-256 hex, 64 chars).
 */
public final class ArtifactIds {

    public static final Pattern PATTERN = Pattern.compile("[a-f0-9]{64}");

    private ArtifactIds() {
    }

    public static String sha256(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String sha256(String content) {
        return sha256(content.getBytes(StandardCharsets.UTF_8));
    }

    public static boolean isArtifactId(String value) {
        return value != null && PATTERN.matcher(value).matches();
    }
}
