package dev.devanks.hlsarchive.harvester.catalog;

/**
 * Fetches a single page of catalog results.
 */
public interface CatalogPageSource {

    /**
     * @param cursor cursor returned with the previous page, or null for the first page
     * @throws dev.devanks.hlsarchive.harvester.exception.CatalogUnavailableException when the catalog cannot be reached
     * @throws dev.devanks.hlsarchive.harvester.exception.CatalogQueryException when the response is malformed
     */
    CatalogPage fetchPage(CatalogQuery query, String cursor);
}
