package dev.devanks.hlsarchive.harvester.exception;

import dev.devanks.hlsarchive.core.exception.HlsArchiveException;

public class CatalogQueryException extends HlsArchiveException {
    public CatalogQueryException(String message) {
        super(message);
    }

    public CatalogQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
