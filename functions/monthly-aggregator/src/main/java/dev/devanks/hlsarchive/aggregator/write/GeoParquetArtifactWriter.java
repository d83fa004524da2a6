package dev.devanks.hlsarchive.aggregator.write;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.annotations.VisibleForTesting;
import dev.devanks.hlsarchive.aggregator.model.ItemDocument;
import dev.devanks.hlsarchive.core.config.ArchiveProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKBWriter;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes STAC items as GeoParquet: one row per item, WKB geometry, a bbox struct used as the
 * covering column, and the GeoParquet {@code geo} file metadata.
 */
@Component
@Slf4j
public class GeoParquetArtifactWriter implements ColumnarArtifactWriter {

    static final String GEO_METADATA_KEY = "geo";
    static final String GEOPARQUET_VERSION = "1.1.0";

    static final Schema BBOX_SCHEMA = SchemaBuilder.record("bbox").fields()
            .requiredDouble("xmin")
            .requiredDouble("ymin")
            .requiredDouble("xmax")
            .requiredDouble("ymax")
            .endRecord();

    static final Schema TIMESTAMP_SCHEMA = LogicalTypes.timestampMicros().addToSchema(Schema.create(Schema.Type.LONG));

    static final Schema ITEM_SCHEMA = SchemaBuilder.record("StacItem").namespace("dev.devanks.hlsarchive")
            .fields()
            .requiredString("type")
            .requiredString("stac_version")
            .name("stac_extensions").type().array().items().stringType().noDefault()
            .requiredString("id")
            .requiredString("collection")
            .name("geometry").type().nullable().bytesType().noDefault()
            .name("bbox").type().optional().type(BBOX_SCHEMA)
            .name("datetime").type().optional().type(TIMESTAMP_SCHEMA)
            .name("start_datetime").type().optional().type(TIMESTAMP_SCHEMA)
            .name("end_datetime").type().optional().type(TIMESTAMP_SCHEMA)
            .requiredString("properties")
            .requiredString("assets")
            .requiredString("links")
            .endRecord();

    private static final String DEFAULT_STAC_VERSION = "1.0.0";

    private final ObjectMapper objectMapper;
    private final CompressionCodecName compressionCodec;

    public GeoParquetArtifactWriter(ObjectMapper objectMapper, ArchiveProperties archiveProperties) {
        this.objectMapper = objectMapper;
        this.compressionCodec = CompressionCodecName.valueOf(
                archiveProperties.getAggregation().getCompression().toUpperCase(Locale.ROOT));
    }

    @Override
    public String contentType() {
        return "application/vnd.apache.parquet";
    }

    @Override
    public byte[] encode(String collectionId, List<ItemDocument> items) throws IOException {
        var geoJsonReader = new GeoJsonReader();
        var wkbWriter = new WKBWriter();
        var extent = new Envelope();
        List<GenericRecord> records = items.stream()
                .map(item -> toRecord(collectionId, item, geoJsonReader, wkbWriter, extent))
                .toList();

        var tempDir = Files.createTempDirectory("geoparquet-");
        try {
            var file = tempDir.resolve(collectionId + ".parquet");
            try (ParquetWriter<GenericRecord> writer = AvroParquetWriter.<GenericRecord>builder(new Path(file.toUri()))
                    .withConf(new Configuration())
                    .withSchema(ITEM_SCHEMA)
                    .withCompressionCodec(compressionCodec)
                    .withExtraMetaData(Map.of(GEO_METADATA_KEY, geoMetadata(extent)))
                    .build()) {
                for (GenericRecord record : records) {
                    writer.write(record);
                }
            }
            byte[] content = Files.readAllBytes(file);
            log.info("Encoded {} items for {} as GeoParquet ({} bytes, {})", records.size(), collectionId, content.length, compressionCodec);
            return content;
        } finally {
            FileSystemUtils.deleteRecursively(tempDir);
        }
    }

    private GenericRecord toRecord(String collectionId, ItemDocument item, GeoJsonReader geoJsonReader,
                                   WKBWriter wkbWriter, Envelope extent) {
        GenericRecord record = new GenericData.Record(ITEM_SCHEMA);
        record.put("type", "Feature");
        record.put("stac_version", item.getStacVersion() == null ? DEFAULT_STAC_VERSION : item.getStacVersion());
        record.put("stac_extensions", item.getStacExtensions());
        record.put("id", item.getId());
        record.put("collection", collectionId);

        Geometry geometry = readGeometry(item, geoJsonReader);
        record.put("geometry", geometry == null ? null : ByteBuffer.wrap(wkbWriter.write(geometry)));
        Envelope bounds = bounds(item, geometry);
        if (bounds != null) {
            extent.expandToInclude(bounds);
            GenericRecord bbox = new GenericData.Record(BBOX_SCHEMA);
            bbox.put("xmin", bounds.getMinX());
            bbox.put("ymin", bounds.getMinY());
            bbox.put("xmax", bounds.getMaxX());
            bbox.put("ymax", bounds.getMaxY());
            record.put("bbox", bbox);
        }

        record.put("datetime", toMicros(item.getDatetime()));
        record.put("start_datetime", toMicros(item.getStartDatetime()));
        record.put("end_datetime", toMicros(item.getEndDatetime()));
        record.put("properties", toJson(item.getProperties(), "{}"));
        record.put("assets", toJson(item.getAssets(), "{}"));
        record.put("links", toJson(item.getLinks(), "[]"));
        return record;
    }

    private static Geometry readGeometry(ItemDocument item, GeoJsonReader geoJsonReader) {
        if (item.getGeometry() == null) {
            return null;
        }
        try {
            return geoJsonReader.read(item.getGeometry().toString());
        } catch (ParseException | RuntimeException e) {
            log.warn("Item {} has an unreadable geometry, writing it without one: {}", item.getId(), e.getMessage());
            return null;
        }
    }

    /**
     * The item's own bbox when present, otherwise the geometry's envelope.
     */
    @VisibleForTesting
    static Envelope bounds(ItemDocument item, Geometry geometry) {
        List<Double> bbox = item.getBbox();
        if (bbox.size() == 4) {
            return new Envelope(bbox.get(0), bbox.get(2), bbox.get(1), bbox.get(3));
        }
        if (bbox.size() == 6) {
            return new Envelope(bbox.get(0), bbox.get(3), bbox.get(1), bbox.get(4));
        }
        return geometry == null || geometry.isEmpty() ? null : geometry.getEnvelopeInternal();
    }

    @VisibleForTesting
    static Long toMicros(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return null;
        }
        try {
            Instant instant = OffsetDateTime.parse(timestamp).toInstant();
            return ChronoUnit.MICROS.between(Instant.EPOCH, instant);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable timestamp '{}': {}", timestamp, e.getMessage());
            return null;
        }
    }

    private String toJson(JsonNode node, String empty) {
        if (node == null || node.isNull()) {
            return empty;
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize JSON tree", e);
        }
    }

    @VisibleForTesting
    String geoMetadata(Envelope extent) {
        ObjectNode geo = objectMapper.createObjectNode();
        geo.put("version", GEOPARQUET_VERSION);
        geo.put("primary_column", "geometry");
        ObjectNode column = geo.putObject("columns").putObject("geometry");
        column.put("encoding", "WKB");
        column.putArray("geometry_types");
        if (!extent.isNull()) {
            ArrayNode bbox = column.putArray("bbox");
            bbox.add(extent.getMinX()).add(extent.getMinY()).add(extent.getMaxX()).add(extent.getMaxY());
        }
        ObjectNode covering = column.putObject("covering").putObject("bbox");
        for (String corner : List.of("xmin", "ymin", "xmax", "ymax")) {
            covering.putArray(corner).add("bbox").add(corner);
        }
        try {
            return objectMapper.writeValueAsString(geo);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize GeoParquet metadata", e);
        }
    }
}
