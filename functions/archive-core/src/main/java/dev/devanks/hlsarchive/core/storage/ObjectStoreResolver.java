package dev.devanks.hlsarchive.core.storage;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Picks the {@link ObjectStore} that serves a URI's scheme.
 */
@Component
@RequiredArgsConstructor
public class ObjectStoreResolver {

    private final List<ObjectStore> objectStores;

    public ObjectStore forUri(String uri) {
        String scheme = ObjectLocation.parse(uri).getScheme();
        return objectStores.stream()
                .filter(store -> store.supports(scheme))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No object store supports scheme '" + scheme + "' (" + uri + ")"));
    }
}
