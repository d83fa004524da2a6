package dev.devanks.hlsarchive.aggregator.fetch;

import dev.devanks.hlsarchive.aggregator.model.FetchErrorKind;
import dev.devanks.hlsarchive.core.exception.HlsArchiveException;
import lombok.Getter;

/**
 * Classified item fetch error. Never leaves {@link ItemFetcher}; it becomes a failed outcome.
 */
@Getter
public class FetchException extends HlsArchiveException {

    private final FetchErrorKind kind;

    public FetchException(FetchErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FetchException(FetchErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isTransient() {
        return kind == FetchErrorKind.TRANSIENT;
    }
}
