package dev.devanks.hlsarchive.core.exception;

import lombok.Getter;

@Getter
public class StorageWriteException extends HlsArchiveException {

    private final String location;

    public StorageWriteException(String location, Throwable cause) {
        super("Storage write failed for path " + location, cause);
        this.location = location;
    }
}
