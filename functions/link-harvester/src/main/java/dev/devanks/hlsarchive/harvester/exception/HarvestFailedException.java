package dev.devanks.hlsarchive.harvester.exception;

import dev.devanks.hlsarchive.core.exception.HlsArchiveException;
import lombok.Getter;

import java.time.LocalDate;

/**
 * The catalog could not be queried for a day. No manifest was written for it.
 */
@Getter
public class HarvestFailedException extends HlsArchiveException {

    private final LocalDate date;

    public HarvestFailedException(LocalDate date, Throwable cause) {
        super("Harvest failed for " + date + ": " + cause.getMessage(), cause);
        this.date = date;
    }
}
