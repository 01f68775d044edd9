package com.mouse.listings.utils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.List;

public final class GroupKeys {

    private GroupKeys() {
    }

    /**
     * Identifiers sorted so that equal sets yield equal lists.
     */
    public static List<String> sortedIds(Collection<String> ids) {
        return ids.stream().distinct().sorted().toList();
    }

    /**
     * SHA-256 hex of the sorted identifiers joined by newlines.
     */
    public static String groupKey(Collection<String> ids) {
        return sha256Hex(String.join("\n", sortedIds(ids)));
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder();
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
