package dev.devanks.hlsarchive.aggregator.write;

import dev.devanks.hlsarchive.aggregator.model.ItemDocument;

import java.io.IOException;
import java.util.List;

/**
 * Encodes a month of items as one columnar file.
 */
public interface ColumnarArtifactWriter {

    /**
     * @param collectionId value of the {@code collection} column on every row
     * @param items rows in output order
     * @return the complete file content
     */
    byte[] encode(String collectionId, List<ItemDocument> items) throws IOException;

    String contentType();
}
