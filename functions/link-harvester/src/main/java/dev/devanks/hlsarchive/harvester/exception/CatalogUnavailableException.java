package dev.devanks.hlsarchive.harvester.exception;

import dev.devanks.hlsarchive.core.exception.HlsArchiveException;

public class CatalogUnavailableException extends HlsArchiveException {
    public CatalogUnavailableException(String message) {
        super(message);
    }

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
