package com.vidnyan.reqtrace.domain.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Content fingerprints of rule text.
 */
public final class Fingerprints {

    public static final int LENGTH = 8;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern CAPTURED = Pattern.compile("[0-9a-fA-F]{4,8}");

    private Fingerprints() {
    }

    /**
     * First 8 lowercase hex chars of SHA-256 over the whitespace-normalized text.
     */
    public static String of(String text) {
        String normalized = normalize(text);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(normalized.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, LENGTH);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String normalize(String text) {
        return text == null ? "" : WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Whether a value may appear after {@code @} in an annotation.
     */
    public static boolean isValidCaptured(String value) {
        return value != null && CAPTURED.matcher(value).matches();
    }

    /**
     * A captured fingerprint still matches when the current one starts with it.
     */
    public static boolean matches(String current, String captured) {
        return current.toLowerCase(Locale.ROOT).startsWith(captured.toLowerCase(Locale.ROOT));
    }
}
