package dev.devanks.hlsarchive.core.storage;

import dev.devanks.hlsarchive.core.exception.ObjectNotFoundException;
import dev.devanks.hlsarchive.core.exception.ObjectStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.WritableResource;
import org.springframework.stereotype.Component;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Google Cloud Storage backed store. The resource output stream commits the object on close.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GcsObjectStore implements ObjectStore {

    private final GcsResourceProvider resourceProvider;

    @Override
    public boolean supports(String scheme) {
        return "gs".equals(scheme);
    }

    @Override
    public boolean exists(String uri) {
        return resourceProvider.createResource(uri).exists();
    }

    @Override
    public byte[] read(String uri) {
        WritableResource resource = resourceProvider.createResource(uri);
        try (InputStream is = resource.getInputStream()) {
            return is.readAllBytes();
        } catch (FileNotFoundException e) {
            throw new ObjectNotFoundException(uri, e);
        } catch (IOException e) {
            throw new ObjectStoreException("GCS read failed for path " + uri, e);
        }
    }

    @Override
    public void write(String uri, byte[] content, String contentType) {
        WritableResource resource = resourceProvider.createResource(uri);
        try (OutputStream os = resource.getOutputStream()) {
            os.write(content);
            os.flush();
        } catch (IOException e) {
            throw new ObjectStoreException("GCS write failed for path " + uri, e);
        }
        log.debug("Wrote {} bytes ({}) to {}", content.length, contentType, uri);
    }
}
