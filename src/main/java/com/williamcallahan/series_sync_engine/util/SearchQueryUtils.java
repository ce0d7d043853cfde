package com.williamcallahan.series_sync_engine.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Utility methods for working with search queries.
 * Keeps cooldown keys and discovery job keys derived from the same canonical form.
 */
public final class SearchQueryUtils {

    private static final int KEY_HASH_LENGTH = 32;

    private SearchQueryUtils() {
        // Utility class
    }

    /**
     * Produces a canonical, case-insensitive representation suitable for
     * keys and comparisons. Returns {@code null} only when the input is null.
     */
    public static String canonicalize(String query) {
        if (query == null) {
            return null;
        }
        return query.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
    }

    /**
     * Short stable hash of the canonical query for use inside Redis and job keys.
     */
    public static String keyHash(String query) {
        String canonical = canonicalize(query);
        if (canonical == null) {
            canonical = "";
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashed).substring(0, KEY_HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
