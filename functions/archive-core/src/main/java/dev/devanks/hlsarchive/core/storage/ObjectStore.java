package dev.devanks.hlsarchive.core.storage;

/**
 * Whole-object access to a blob store. Writes are single puts: readers see the previous object
 * or the new one, never a partial one.
 */
public interface ObjectStore {

    boolean supports(String scheme);

    boolean exists(String uri);

    /**
     * @throws dev.devanks.hlsarchive.core.exception.ObjectNotFoundException if nothing is stored at {@code uri}
     */
    byte[] read(String uri);

    void write(String uri, byte[] content, String contentType);
}
