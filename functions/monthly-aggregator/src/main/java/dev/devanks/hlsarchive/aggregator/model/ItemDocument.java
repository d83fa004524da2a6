package dev.devanks.hlsarchive.aggregator.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A parsed STAC item. Nested structures stay as JSON trees; they are re-serialized when written.
 */
@Value
@Builder
public class ItemDocument {

    String id;
    String stacVersion;

    @Singular
    List<String> stacExtensions;

    String datetime;
    String startDatetime;
    String endDatetime;

    /**
     * GeoJSON geometry object, or null.
     */
    JsonNode geometry;

    /**
     * [west, south, east, north], or the 3D form [west, south, min z, east, north, max z]. Empty when absent.
     */
    @Singular("bboxValue")
    List<Double> bbox;

    /**
     * Item properties other than the datetime fields.
     */
    JsonNode properties;

    JsonNode assets;
    JsonNode links;

    /**
     * Link the document was fetched from.
     */
    String sourceLink;
}
