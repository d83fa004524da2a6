package dev.devanks.hlsarchive.core.exception;

/**
 * Root of the archive's failure taxonomy. All subclasses are unchecked.
 */
public class HlsArchiveException extends RuntimeException {
    public HlsArchiveException(String message) {
        super(message);
    }

    public HlsArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
