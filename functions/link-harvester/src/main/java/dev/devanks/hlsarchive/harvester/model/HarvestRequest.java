package dev.devanks.hlsarchive.harvester.model;

import dev.devanks.hlsarchive.core.model.BoundingBox;
import dev.devanks.hlsarchive.core.model.HlsCollection;
import dev.devanks.hlsarchive.core.model.LinkProtocol;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder(toBuilder = true)
public class HarvestRequest {

    @NonNull
    HlsCollection collection;

    @NonNull
    LocalDate date;

    /**
     * Optional spatial filter; null harvests the whole globe.
     */
    BoundingBox boundingBox;

    @NonNull
    @Builder.Default
    LinkProtocol protocol = LinkProtocol.OBJECT_STORE;

    @NonNull
    String destination;

    @Builder.Default
    boolean skipExisting = true;
}
