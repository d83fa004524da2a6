package dev.devanks.hlsarchive.harvester.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import dev.devanks.hlsarchive.core.config.ArchiveProperties;
import dev.devanks.hlsarchive.core.retry.RetryPolicy;
import dev.devanks.hlsarchive.core.retry.Sleeper;
import dev.devanks.hlsarchive.harvester.client.CmrSearchClient;
import dev.devanks.hlsarchive.harvester.exception.CatalogQueryException;
import dev.devanks.hlsarchive.harvester.exception.CatalogUnavailableException;
import feign.FeignException;
import feign.RetryableException;
import feign.codec.DecodeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link CatalogPageSource} backed by the CMR granule search, with retries on transient failures.
 */
@Component
@Slf4j
public class CmrPageSource implements CatalogPageSource {

    static final int MAX_PAGE_SIZE = 2000;

    private final CmrSearchClient cmrSearchClient;
    private final Sleeper sleeper;
    private final RetryPolicy retryPolicy;
    private final int pageSize;

    public CmrPageSource(CmrSearchClient cmrSearchClient, Sleeper sleeper, ArchiveProperties archiveProperties) {
        this.cmrSearchClient = cmrSearchClient;
        this.sleeper = sleeper;
        var retry = archiveProperties.getRetry();
        this.retryPolicy = RetryPolicy.exponential(retry.getMaxAttempts(),
                Duration.ofMillis(retry.getBaseDelayMs()), Duration.ofMillis(retry.getMaxDelayMs()),
                CmrPageSource::isTransient);
        this.pageSize = Math.max(1, Math.min(MAX_PAGE_SIZE, archiveProperties.getCatalog().getPageSize()));
    }

    /**
     * Connection failures, timeouts, 408, 429 and 5xx.
     */
    static boolean isTransient(Throwable error) {
        if (error instanceof RetryableException) {
            return true;
        }
        if (error instanceof DecodeException || !(error instanceof FeignException feignException)) {
            return false;
        }
        int status = feignException.status();
        return status == 408 || status == 429 || status >= 500;
    }

    @Override
    public CatalogPage fetchPage(CatalogQuery query, String cursor) {
        var boundingBox = query.getBoundingBox() == null ? null : query.getBoundingBox().toCmrParameter();
        ResponseEntity<JsonNode> response;
        try {
            response = retryPolicy.execute(() -> cmrSearchClient.searchGranules(
                    query.getCollection().getConceptId(), query.temporal(), boundingBox, pageSize, cursor), sleeper);
        } catch (DecodeException e) {
            throw new CatalogQueryException("CMR returned an undecodable response for "
                    + query.getCollection() + " on " + query.getDate(), e);
        } catch (FeignException e) {
            log.error("CMR search failed for {} on {} with status {}: {}",
                    query.getCollection(), query.getDate(), e.status(), e.getMessage());
            throw new CatalogUnavailableException("CMR search unavailable (status " + e.status() + ") for "
                    + query.getCollection() + " on " + query.getDate(), e);
        }

        JsonNode entryNodes = response.getBody() == null ? null : response.getBody().path("feed").path("entry");
        if (entryNodes == null || !entryNodes.isArray()) {
            throw new CatalogQueryException("CMR response for " + query.getCollection() + " on "
                    + query.getDate() + " has no feed.entry array");
        }
        List<CatalogEntry> entries = new ArrayList<>(entryNodes.size());
        entryNodes.forEach(node -> entries.add(CatalogEntry.fromJson(node)));

        var nextCursor = response.getHeaders().getFirst(CmrSearchClient.SEARCH_AFTER_HEADER);
        log.debug("CMR page for {} on {}: {} entries, next cursor {}",
                query.getCollection(), query.getDate(), entries.size(), nextCursor);
        return new CatalogPage(entries, nextCursor);
    }
}
