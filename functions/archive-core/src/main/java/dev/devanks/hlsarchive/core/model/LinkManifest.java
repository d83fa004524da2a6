package dev.devanks.hlsarchive.core.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

/**
 * Cached STAC JSON links for one collection and day.
 */
@Value
@Builder
@Jacksonized
public class LinkManifest {

    String collection;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate date;

    @Singular
    List<String> links;
}
