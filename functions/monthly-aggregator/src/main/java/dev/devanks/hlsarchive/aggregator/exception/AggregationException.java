package dev.devanks.hlsarchive.aggregator.exception;

import dev.devanks.hlsarchive.core.exception.HlsArchiveException;
import lombok.Getter;

@Getter
public class AggregationException extends HlsArchiveException {

    public enum Kind {
        INCOMPLETE_LINKS,
        HIGH_FAILURE_RATE,
        NO_LINKS,
        WRITE_FAILED,
        CANCELLED
    }

    private final Kind kind;

    public AggregationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AggregationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
