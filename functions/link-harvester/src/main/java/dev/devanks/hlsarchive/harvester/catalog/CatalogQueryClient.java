package dev.devanks.hlsarchive.harvester.catalog;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Streams;
import dev.devanks.hlsarchive.core.config.ArchiveProperties;
import dev.devanks.hlsarchive.core.model.BoundingBox;
import dev.devanks.hlsarchive.core.model.HlsCollection;
import dev.devanks.hlsarchive.core.model.LinkProtocol;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Iterator;
import java.util.Optional;
import java.util.stream.Stream;

@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogQueryClient {

    private final CatalogPageSource pageSource;
    private final ArchiveProperties archiveProperties;

    /**
     * Lazily pages through every granule of the collection on the given day. Pages are fetched as
     * the stream is consumed; a new call starts again from the first page.
     */
    public Stream<CatalogEntry> search(HlsCollection collection, LocalDate date, BoundingBox boundingBox) {
        var query = CatalogQuery.builder()
                .collection(collection)
                .date(date)
                .boundingBox(boundingBox)
                .build();
        var pager = new CatalogPager(pageSource, query);
        log.info("Searching CMR for {} granules on {} (bbox: {})", collection, date, boundingBox);
        return Streams.stream(new AbstractIterator<CatalogEntry>() {
            private Iterator<CatalogEntry> current = Collections.emptyIterator();

            @Override
            protected CatalogEntry computeNext() {
                while (!current.hasNext()) {
                    if (pager.isExhausted()) {
                        return endOfData();
                    }
                    current = pager.nextPage().iterator();
                }
                return current.next();
            }
        });
    }

    /**
     * First href that ends with the STAC document suffix and uses the protocol's scheme.
     */
    public Optional<String> extractLink(CatalogEntry entry, LinkProtocol protocol) {
        var suffix = archiveProperties.getCatalog().getDocumentSuffix();
        var link = entry.getHrefs().stream()
                .filter(href -> href.endsWith(suffix) && protocol.matches(href))
                .findFirst();
        if (link.isEmpty()) {
            log.warn("Granule {} has no {} link ending in {}; skipping", entry.getId(), protocol.getScheme(), suffix);
        }
        return link;
    }
}
