package net.lookvault.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Utility methods for working with product search queries.
 * Centralizes normalization so controllers, services and the asset store
 * agree on what a query, a token and a merge key look like.
 */
public final class SearchQueryUtils {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern LIKE_SPECIALS = Pattern.compile("([\\\\%_])");

    private SearchQueryUtils() {
        // Utility class
    }

    /**
     * Produces a canonical, case-insensitive representation suitable for
     * map keys and cache lookups. Returns {@code null} only when the input is null.
     */
    public static String canonicalize(String query) {
        if (query == null) {
            return null;
        }
        return query.toLowerCase(Locale.ROOT).trim();
    }

    /**
     * Indicates whether a value carries any non-whitespace text.
     */
    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * Splits free text into distinct lowercase alphanumeric tokens, in first-seen order.
     */
    public static List<String> tokens(String text) {
        if (!hasText(text)) {
            return List.of();
        }
        Set<String> tokens = new LinkedHashSet<>();
        for (String part : NON_ALPHANUMERIC.split(text.toLowerCase(Locale.ROOT))) {
            if (!part.isEmpty()) {
                tokens.add(part);
            }
        }
        return new ArrayList<>(tokens);
    }

    /**
     * Lowercases a title and collapses punctuation and whitespace runs to single spaces.
     */
    public static String normalizeTitle(String title) {
        if (title == null) {
            return "";
        }
        return NON_ALPHANUMERIC.matcher(title.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    /**
     * Escapes LIKE wildcards so user input is matched literally (escape character is backslash).
     */
    public static String escapeLike(String value) {
        if (value == null) {
            return "";
        }
        return LIKE_SPECIALS.matcher(value).replaceAll("\\\\$1");
    }
}
