package dev.devanks.hlsarchive.aggregator.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.devanks.hlsarchive.aggregator.model.ItemDocument;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;

import static dev.devanks.hlsarchive.aggregator.model.FetchErrorKind.PERMANENT;

@Component
@RequiredArgsConstructor
public class ItemDocumentParser {

    private final ObjectMapper objectMapper;

    /**
     * @throws FetchException (permanent) when the body is not a STAC item with an id
     */
    public ItemDocument parse(String link, byte[] body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new FetchException(PERMANENT, "Malformed STAC item at " + link + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new FetchException(PERMANENT, "STAC item at " + link + " is not a JSON object");
        }
        var id = root.path("id");
        if (!id.isTextual() || id.asText().isBlank()) {
            throw new FetchException(PERMANENT, "STAC item at " + link + " has no id");
        }

        ObjectNode properties = root.path("properties").isObject()
                ? ((ObjectNode) root.get("properties")).deepCopy()
                : objectMapper.createObjectNode();
        var datetime = textOrNull(properties.remove("datetime"));
        var startDatetime = textOrNull(properties.remove("start_datetime"));
        var endDatetime = textOrNull(properties.remove("end_datetime"));

        var builder = ItemDocument.builder()
                .id(id.asText())
                .stacVersion(textOrNull(root.get("stac_version")))
                .datetime(datetime)
                .startDatetime(startDatetime)
                .endDatetime(endDatetime)
                .geometry(root.path("geometry").isObject() ? root.get("geometry") : null)
                .properties(properties)
                .assets(root.path("assets").isObject() ? root.get("assets") : objectMapper.createObjectNode())
                .links(root.path("links").isArray() ? root.get("links") : objectMapper.createArrayNode())
                .sourceLink(link);
        root.path("stac_extensions").forEach(extension -> builder.stacExtension(extension.asText()));
        for (JsonNode value : root.path("bbox")) {
            if (!value.isNumber()) {
                throw new FetchException(PERMANENT, "STAC item " + id.asText() + " has a non-numeric bbox");
            }
            builder.bboxValue(value.asDouble());
        }
        return builder.build();
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
