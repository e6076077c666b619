package com.pgbroker.core;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Set;

/**
 * Quoting helpers for SQL identifiers and literals that cannot be bound as
 * parameters (DDL, trigger bodies, NOTIFY channel names).
 */
public final class Identifiers {
    private static final Set<String> ROLE_KEYWORDS = Set.of("PUBLIC", "CURRENT_USER", "CURRENT_ROLE", "SESSION_USER");

    private Identifiers() {}

    public static String quote(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw BrokerException.validation("identifier must not be blank");
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    public static String literal(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Role names are quoted except for the pseudo-roles Postgres accepts as keywords.
     */
    public static String role(String role) {
        String upper = role.trim().toUpperCase(Locale.ROOT);
        return ROLE_KEYWORDS.contains(upper) ? upper : quote(role.trim());
    }

    /**
     * Folds an arbitrary channel name into a stem for generated function and
     * trigger names: a readable prefix plus a digest of the full name, so channels
     * that fold to the same prefix still get distinct objects. The stem leaves room
     * for the longest suffix within the 63 byte identifier limit.
     */
    public static String objectName(String value) {
        String slug = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
        if (slug.length() > 30) {
            slug = slug.substring(0, 30);
        }
        return slug + "_" + digest(value);
    }

    private static String digest(String value) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 4);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
