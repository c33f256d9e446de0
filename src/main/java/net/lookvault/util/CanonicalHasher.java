package net.lookvault.util;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Produces stable content hashes for cache keys.
 *
 * <p>Field maps are normalized (strings trimmed and lower-cased, nulls replaced by
 * the empty string, numbers kept as numbers), sorted by key and serialized to compact
 * JSON before hashing, so incidental casing, whitespace and map iteration order never
 * change the digest. Callers pass only the fields that affect the produced output.</p>
 */
public final class CanonicalHasher {

    static final String SOURCE_IMAGE_URL_FIELD = "source_image_url";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private CanonicalHasher() {
        // Utility class
    }

    /**
     * Hashes a set of output-affecting fields.
     *
     * @param fields field name to primitive value; {@code null} values hash like {@code ""}
     * @return lowercase SHA-256 hex digest (64 characters)
     */
    public static String hash(Map<String, ?> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("Fields cannot be null");
        }
        Map<String, Object> canonical = new TreeMap<>();
        fields.forEach((key, value) -> canonical.put(key, normalizeValue(value)));
        return digest(canonical);
    }

    /**
     * Hashes a product image URL into the asset cache key.
     * Scheme and host are case-insensitive in URLs and are folded; path and query keep their case.
     */
    public static String hashSourceImageUrl(String sourceImageUrl) {
        return digest(Map.of(SOURCE_IMAGE_URL_FIELD, canonicalizeImageUrl(sourceImageUrl)));
    }

    private static String digest(Map<String, ?> sortedFields) {
        try {
            return HashUtils.sha256Hex(OBJECT_MAPPER.writeValueAsString(sortedFields));
        } catch (JacksonException ex) {
            throw new IllegalStateException("Failed to serialize canonical hash input", ex);
        }
    }

    static String canonicalizeImageUrl(String sourceImageUrl) {
        if (sourceImageUrl == null) {
            return "";
        }
        String trimmed = sourceImageUrl.trim();
        int schemeEnd = trimmed.indexOf("://");
        if (schemeEnd <= 0) {
            return trimmed;
        }
        int authorityStart = schemeEnd + 3;
        int authorityEnd = indexOfAny(trimmed, authorityStart, '/', '?', '#');
        String prefix = trimmed.substring(0, authorityEnd).toLowerCase(Locale.ROOT);
        return prefix + trimmed.substring(authorityEnd);
    }

    private static int indexOfAny(String value, int from, char... candidates) {
        for (int i = from; i < value.length(); i++) {
            char c = value.charAt(i);
            for (char candidate : candidates) {
                if (c == candidate) {
                    return i;
                }
            }
        }
        return value.length();
    }

    private static Object normalizeValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value;
        }
        return value.toString().trim().toLowerCase(Locale.ROOT);
    }
}
