package net.lookvault.service.provider;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import tools.jackson.databind.JsonNode;

/**
 * Null-tolerant readers for loosely typed upstream JSON.
 */
final class JsonFields {

    private static final Pattern PRICE_PATTERN = Pattern.compile("[\\d,]+\\.?\\d*");

    private JsonFields() {
    }

    /**
     * Reads a scalar as trimmed text; missing, null and blank values become {@code null}.
     */
    static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.isArray() || node.isObject()) {
            return null;
        }
        String value = node.asString();
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    static String firstText(JsonNode... nodes) {
        for (JsonNode node : nodes) {
            String value = text(node);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * Reads a price given either as a JSON number or as display text such as {@code "$1,250.00"}.
     */
    static BigDecimal price(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue().setScale(2, RoundingMode.HALF_UP);
        }
        String raw = text(node);
        if (raw == null) {
            return null;
        }
        Matcher matcher = PRICE_PATTERN.matcher(raw);
        if (!matcher.find()) {
            return null;
        }
        String digits = matcher.group().replace(",", "");
        if (digits.isEmpty() || digits.equals(".")) {
            return null;
        }
        return new BigDecimal(digits).setScale(2, RoundingMode.HALF_UP);
    }
}
