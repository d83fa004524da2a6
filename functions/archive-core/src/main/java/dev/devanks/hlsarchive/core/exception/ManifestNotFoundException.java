package dev.devanks.hlsarchive.core.exception;

import dev.devanks.hlsarchive.core.model.HlsCollection;
import lombok.Getter;

import java.time.LocalDate;

@Getter
public class ManifestNotFoundException extends HlsArchiveException {

    private final HlsCollection collection;
    private final LocalDate date;

    public ManifestNotFoundException(HlsCollection collection, LocalDate date, String location) {
        super("No link manifest for " + collection.getCollectionId() + " on " + date + " at " + location);
        this.collection = collection;
        this.date = date;
    }
}
