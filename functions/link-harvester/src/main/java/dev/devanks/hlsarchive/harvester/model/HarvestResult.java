package dev.devanks.hlsarchive.harvester.model;

import dev.devanks.hlsarchive.core.model.HlsCollection;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class HarvestResult {

    HlsCollection collection;
    LocalDate date;
    String manifestLocation;

    /**
     * False when an existing manifest was kept.
     */
    boolean written;

    int linkCount;
}
