package dev.devanks.hlsarchive.harvester.catalog;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Cursor-driven pagination over one query. Exhausted once a page comes back without a cursor
 * or without entries. Not thread-safe.
 */
public class CatalogPager {

    private final CatalogPageSource pageSource;
    private final CatalogQuery query;

    private String cursor;
    private boolean exhausted;

    public CatalogPager(CatalogPageSource pageSource, CatalogQuery query) {
        this.pageSource = pageSource;
        this.query = query;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    public String getCursor() {
        return cursor;
    }

    /**
     * Fetches the page at the current cursor and advances.
     *
     * @throws NoSuchElementException when the pager is already exhausted
     */
    public List<CatalogEntry> nextPage() {
        if (exhausted) {
            throw new NoSuchElementException("Catalog pager for " + query.getCollection() + " on " + query.getDate() + " is exhausted");
        }
        CatalogPage page = pageSource.fetchPage(query, cursor);
        cursor = page.getNextCursor();
        exhausted = cursor == null || page.getEntries().isEmpty();
        return page.getEntries();
    }

    /**
     * Back to the first page.
     */
    public void reset() {
        cursor = null;
        exhausted = false;
    }
}
