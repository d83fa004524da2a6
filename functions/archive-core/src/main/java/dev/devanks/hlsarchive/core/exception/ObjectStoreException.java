package dev.devanks.hlsarchive.core.exception;

public class ObjectStoreException extends HlsArchiveException {
    public ObjectStoreException(String message) {
        super(message);
    }

    public ObjectStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
