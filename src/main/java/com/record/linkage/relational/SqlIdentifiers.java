package com.record.linkage.relational;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Validation and quoting for identifiers written into SQL text.
 * Values never appear in generated SQL; identifiers (schema, table and column
 * names) do, so they are restricted to a safe character set and always quoted.
 */
public final class SqlIdentifiers {

    /** Maximum identifier length accepted (PostgreSQL truncates at 63). */
    public static final int MAX_IDENTIFIER_LENGTH = 63;

    /** Hex characters of the name hash appended to shortened table names. */
    static final int HASH_SUFFIX_LENGTH = 10;

    private static final Pattern VALID_IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
    private static final Pattern UNSAFE_CHARACTERS = Pattern.compile("[^A-Za-z0-9_]");

    private SqlIdentifiers() {
        // utility class
    }

    /**
     * Validates an identifier.
     *
     * @param identifier the identifier to validate
     * @return the identifier, unchanged
     * @throws IllegalArgumentException if it is blank, too long or contains
     *                                  anything but letters, digits and underscores
     */
    public static String requireValid(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("SQL identifier must not be null or blank");
        }
        if (identifier.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(
                    "SQL identifier exceeds maximum length of " + MAX_IDENTIFIER_LENGTH +
                            " characters (was " + identifier.length() + ")");
        }
        if (!VALID_IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException(
                    "SQL identifier must contain only alphanumeric characters and underscores, " +
                            "got: '" + identifier + "'");
        }
        return identifier;
    }

    /**
     * Validates and double-quotes an identifier, preserving its case.
     */
    public static String quote(String identifier) {
        return "\"" + requireValid(identifier) + "\"";
    }

    /**
     * Quotes an optionally schema-qualified table name.
     *
     * @param schema schema name, or {@code null} for the connection's default schema
     * @param table  table name
     */
    public static String qualify(String schema, String table) {
        if (schema == null || schema.isBlank()) {
            return quote(table);
        }
        return quote(schema) + "." + quote(table);
    }

    /**
     * Turns an arbitrary name (a record set name, a pass key) into a fragment usable in
     * an identifier by replacing unsafe characters with underscores and lower-casing it.
     */
    public static String toIdentifierFragment(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Name must not be null or blank");
        }
        return UNSAFE_CHARACTERS.matcher(name.trim()).replaceAll("_").toLowerCase();
    }

    /**
     * Builds a table name from a prefix and an arbitrary name. Names longer than
     * {@link #MAX_IDENTIFIER_LENGTH} are cut and suffixed with a hash of the full
     * name, so distinct long names stay distinct after shortening.
     */
    public static String tableName(String prefix, String name) {
        String full = prefix + toIdentifierFragment(name);
        if (full.length() <= MAX_IDENTIFIER_LENGTH) {
            return full;
        }
        String hash = sha256Hex(full).substring(0, HASH_SUFFIX_LENGTH);
        return full.substring(0, MAX_IDENTIFIER_LENGTH - HASH_SUFFIX_LENGTH - 1) + "_" + hash;
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
