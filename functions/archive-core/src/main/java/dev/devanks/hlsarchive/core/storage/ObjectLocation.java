package dev.devanks.hlsarchive.core.storage;

import lombok.Value;

import java.net.URI;
import java.util.Locale;

/**
 * A parsed {@code scheme://bucket/key} object URI.
 */
@Value
public class ObjectLocation {

    String scheme;
    String bucket;
    String key;

    public static ObjectLocation parse(String uri) {
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("Object location cannot be blank.");
        }
        URI parsed = URI.create(uri.trim());
        if (parsed.getScheme() == null || parsed.getAuthority() == null) {
            throw new IllegalArgumentException("Object location must look like scheme://bucket/key, got " + uri);
        }
        String path = parsed.getPath() == null ? "" : parsed.getPath();
        String key = path.startsWith("/") ? path.substring(1) : path;
        return new ObjectLocation(parsed.getScheme().toLowerCase(Locale.ROOT), parsed.getAuthority(), key);
    }

    public String toUri() {
        return scheme + "://" + bucket + "/" + key;
    }
}
