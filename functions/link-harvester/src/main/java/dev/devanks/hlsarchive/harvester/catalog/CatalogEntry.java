package dev.devanks.hlsarchive.harvester.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Envelope;

import java.util.List;

/**
 * One granule from a CMR JSON search response: its id, link hrefs and spatial extent.
 */
@Value
@Builder
@Slf4j
public class CatalogEntry {

    String id;
    String title;

    @Singular
    List<String> hrefs;

    /**
     * Extent from the entry's {@code boxes} or {@code polygons}; null when it has neither.
     */
    Envelope envelope;

    public static CatalogEntry fromJson(JsonNode node) {
        var builder = CatalogEntry.builder()
                .id(node.path("id").asText(null))
                .title(node.path("title").asText(null))
                .envelope(parseEnvelope(node));
        for (JsonNode link : node.path("links")) {
            var href = link.path("href");
            if (href.isTextual()) {
                builder.href(href.asText());
            }
        }
        return builder.build();
    }

    /**
     * CMR boxes are "south west north east"; polygon rings are flat "lat lon lat lon ..." lists.
     */
    private static Envelope parseEnvelope(JsonNode node) {
        var envelope = new Envelope();
        try {
            for (JsonNode box : node.path("boxes")) {
                double[] v = parseNumbers(box.asText());
                if (v.length == 4) {
                    envelope.expandToInclude(v[1], v[0]);
                    envelope.expandToInclude(v[3], v[2]);
                }
            }
            for (JsonNode polygon : node.path("polygons")) {
                for (JsonNode ring : polygon) {
                    double[] v = parseNumbers(ring.asText());
                    for (int i = 0; i + 1 < v.length; i += 2) {
                        envelope.expandToInclude(v[i + 1], v[i]);
                    }
                }
            }
        } catch (NumberFormatException e) {
            log.warn("Ignoring unparseable geometry on granule {}: {}", node.path("id").asText(), e.getMessage());
            return null;
        }
        return envelope.isNull() ? null : envelope;
    }

    private static double[] parseNumbers(String text) {
        var trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            return new double[0];
        }
        String[] parts = trimmed.split("\\s+");
        double[] values = new double[parts.length];
        for (int i = 0; i < parts.length; i++) {
            values[i] = Double.parseDouble(parts[i]);
        }
        return values;
    }
}
