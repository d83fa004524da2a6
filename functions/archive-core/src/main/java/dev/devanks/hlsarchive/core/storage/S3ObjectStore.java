package dev.devanks.hlsarchive.core.storage;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.SdkClientException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.S3Object;
import com.google.common.base.Supplier;
import dev.devanks.hlsarchive.core.exception.ObjectNotFoundException;
import dev.devanks.hlsarchive.core.exception.ObjectStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Amazon S3 backed store. Used for s3:// roots and for s3:// STAC item links.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class S3ObjectStore implements ObjectStore {

    private static final int NOT_FOUND = 404;

    private final Supplier<AmazonS3> amazonS3Supplier;

    @Override
    public boolean supports(String scheme) {
        return "s3".equals(scheme);
    }

    @Override
    public boolean exists(String uri) {
        var location = ObjectLocation.parse(uri);
        try {
            return amazonS3Supplier.get().doesObjectExist(location.getBucket(), location.getKey());
        } catch (SdkClientException e) {
            throw new ObjectStoreException("S3 existence check failed for path " + uri, e);
        }
    }

    @Override
    public byte[] read(String uri) {
        var location = ObjectLocation.parse(uri);
        try (S3Object object = amazonS3Supplier.get().getObject(location.getBucket(), location.getKey());
             InputStream is = object.getObjectContent()) {
            return is.readAllBytes();
        } catch (AmazonServiceException e) {
            if (e.getStatusCode() == NOT_FOUND) {
                throw new ObjectNotFoundException(uri, e);
            }
            throw new ObjectStoreException("S3 read failed for path " + uri + " (status " + e.getStatusCode() + ")", e);
        } catch (SdkClientException | IOException e) {
            throw new ObjectStoreException("S3 read failed for path " + uri, e);
        }
    }

    @Override
    public void write(String uri, byte[] content, String contentType) {
        var location = ObjectLocation.parse(uri);
        var metadata = new ObjectMetadata();
        metadata.setContentLength(content.length);
        metadata.setContentType(contentType);
        try {
            amazonS3Supplier.get().putObject(location.getBucket(), location.getKey(),
                    new ByteArrayInputStream(content), metadata);
        } catch (SdkClientException e) {
            throw new ObjectStoreException("S3 write failed for path " + uri, e);
        }
        log.debug("Wrote {} bytes ({}) to {}", content.length, contentType, uri);
    }
}
