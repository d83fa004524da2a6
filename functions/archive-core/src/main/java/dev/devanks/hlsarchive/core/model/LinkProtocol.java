package dev.devanks.hlsarchive.core.model;

import java.util.Locale;

public enum LinkProtocol {

    OBJECT_STORE("s3://"),
    HTTPS("https://");

    private final String scheme;

    LinkProtocol(String scheme) {
        this.scheme = scheme;
    }

    public String getScheme() {
        return scheme;
    }

    public boolean matches(String href) {
        return href != null && href.startsWith(scheme);
    }

    /**
     * Accepts "s3", "object-store" and "https" (case-insensitive).
     */
    public static LinkProtocol fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Invalid protocol: null. Must be 's3' or 'https'");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "s3", "object-store", "object_store" -> OBJECT_STORE;
            case "https" -> HTTPS;
            default -> throw new IllegalArgumentException("Invalid protocol: " + value + ". Must be 's3' or 'https'");
        };
    }
}
