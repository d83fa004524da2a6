package dev.devanks.hlsarchive.core.storage;

import com.google.cloud.spring.storage.GoogleStorageResource;
import com.google.cloud.storage.Storage;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.WritableResource;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class GcsResourceProvider {
    private final Storage gcsClient;

    public WritableResource createResource(String gcsPath) {
        return new GoogleStorageResource(gcsClient, gcsPath);
    }
}
