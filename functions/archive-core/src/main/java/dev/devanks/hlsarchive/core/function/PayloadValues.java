package dev.devanks.hlsarchive.core.function;

import java.util.Locale;
import java.util.Map;

/**
 * Typed access to the loosely typed JSON payloads that trigger the functions.
 */
public final class PayloadValues {

    private PayloadValues() {
    }

    /**
     * @return the trimmed value, or null when the key is absent or blank
     */
    public static String optionalString(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    public static String requiredString(Map<String, Object> payload, String key) {
        String value = optionalString(payload, key);
        if (value == null) {
            throw new IllegalArgumentException("Missing required parameter: '" + key + "'");
        }
        return value;
    }

    /**
     * Accepts JSON booleans and the strings "true"/"false" in any case.
     */
    public static boolean flag(Map<String, Object> payload, String key, boolean defaultValue) {
        Object value = payload.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        return switch (value.toString().trim().toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new IllegalArgumentException("Invalid " + key + ": " + value + ". Must be true or false");
        };
    }

    /**
     * The payload's {@code dest}, falling back to the configured default destination.
     */
    public static String destination(Map<String, Object> payload, String defaultDestination) {
        String dest = optionalString(payload, "dest");
        if (dest == null) {
            dest = defaultDestination == null || defaultDestination.isBlank() ? null : defaultDestination;
        }
        if (dest == null) {
            throw new IllegalArgumentException("Missing required parameter: 'dest' and no default destination is configured");
        }
        return dest;
    }
}
