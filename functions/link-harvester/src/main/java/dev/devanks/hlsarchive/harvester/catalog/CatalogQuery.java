package dev.devanks.hlsarchive.harvester.catalog;

import dev.devanks.hlsarchive.core.model.BoundingBox;
import dev.devanks.hlsarchive.core.model.HlsCollection;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.LocalDate;

/**
 * Granule search for one collection and UTC day, optionally limited to a bounding box.
 */
@Value
@Builder(toBuilder = true)
public class CatalogQuery {

    @NonNull
    HlsCollection collection;

    @NonNull
    LocalDate date;

    BoundingBox boundingBox;

    /**
     * CMR {@code temporal} value covering the whole day.
     */
    public String temporal() {
        return date + "T00:00:00Z," + date + "T23:59:59Z";
    }
}
