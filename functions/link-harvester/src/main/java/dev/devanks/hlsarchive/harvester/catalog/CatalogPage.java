package dev.devanks.hlsarchive.harvester.catalog;

import lombok.Value;

import java.util.List;

@Value
public class CatalogPage {

    List<CatalogEntry> entries;

    /**
     * Cursor for the following page; null when the catalog sent none.
     */
    String nextCursor;
}
