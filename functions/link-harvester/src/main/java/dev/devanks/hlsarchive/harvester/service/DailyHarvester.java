package dev.devanks.hlsarchive.harvester.service;

import dev.devanks.hlsarchive.core.manifest.LinkManifestStore;
import dev.devanks.hlsarchive.core.model.BoundingBox;
import dev.devanks.hlsarchive.core.storage.StorageLayout;
import dev.devanks.hlsarchive.harvester.catalog.CatalogEntry;
import dev.devanks.hlsarchive.harvester.catalog.CatalogQueryClient;
import dev.devanks.hlsarchive.harvester.exception.CatalogQueryException;
import dev.devanks.hlsarchive.harvester.exception.CatalogUnavailableException;
import dev.devanks.hlsarchive.harvester.exception.HarvestFailedException;
import dev.devanks.hlsarchive.harvester.exception.RangeHarvestFailedException;
import dev.devanks.hlsarchive.harvester.model.HarvestRequest;
import dev.devanks.hlsarchive.harvester.model.HarvestResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Caches the STAC item links of one collection and day as a link manifest.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DailyHarvester {

    private final CatalogQueryClient catalogQueryClient;
    private final LinkManifestStore linkManifestStore;

    /**
     * Queries the catalog for the request's day and writes the manifest, unless one already
     * exists and {@code skipExisting} is set, in which case the catalog is not contacted.
     *
     * @throws HarvestFailedException when the catalog query fails; nothing is written for the day
     */
    public HarvestResult harvestDay(HarvestRequest request) {
        var collection = request.getCollection();
        var date = request.getDate();
        var manifestLocation = StorageLayout.manifestPath(request.getDestination(), collection, date);

        if (request.isSkipExisting() && linkManifestStore.exists(request.getDestination(), collection, date)) {
            log.info("Manifest {} already exists, skipping {} on {}", manifestLocation, collection, date);
            return HarvestResult.builder()
                    .collection(collection)
                    .date(date)
                    .manifestLocation(manifestLocation)
                    .written(false)
                    .build();
        }

        List<String> links;
        try (Stream<CatalogEntry> entries = catalogQueryClient.search(collection, date, request.getBoundingBox())) {
            links = entries
                    .filter(entry -> withinBoundingBox(entry, request.getBoundingBox()))
                    .map(entry -> catalogQueryClient.extractLink(entry, request.getProtocol()))
                    .flatMap(Optional::stream)
                    .toList();
        } catch (CatalogUnavailableException | CatalogQueryException e) {
            log.error("Catalog query failed for {} on {}: {}", collection, date, e.getMessage(), e);
            throw new HarvestFailedException(date, e);
        }

        linkManifestStore.write(request.getDestination(), collection, date, links);
        log.info("Harvested {} links for {} on {}", links.size(), collection, date);
        return HarvestResult.builder()
                .collection(collection)
                .date(date)
                .manifestLocation(manifestLocation)
                .written(true)
                .linkCount(links.size())
                .build();
    }

    /**
     * Harvests every day from {@code startDate} to {@code endDate} inclusive, one day at a time.
     * Days whose catalog query fails do not stop the remaining days.
     *
     * @param template request whose date is replaced for each day
     * @throws RangeHarvestFailedException naming the first failed day, after all days were attempted
     */
    public List<HarvestResult> harvestRange(HarvestRequest template, LocalDate startDate, LocalDate endDate) {
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("end_date (" + endDate + ") must not be before start_date (" + startDate + ")");
        }
        List<HarvestResult> results = new ArrayList<>();
        List<HarvestFailedException> failures = new ArrayList<>();
        for (LocalDate day = startDate; !day.isAfter(endDate); day = day.plusDays(1)) {
            try {
                results.add(harvestDay(template.toBuilder().date(day).build()));
            } catch (HarvestFailedException e) {
                failures.add(e);
            }
        }
        log.info("Harvested {} of {} days for {} between {} and {}", results.size(),
                results.size() + failures.size(), template.getCollection(), startDate, endDate);
        if (!failures.isEmpty()) {
            throw new RangeHarvestFailedException(failures, results);
        }
        return results;
    }

    /**
     * Entries without a known extent are kept.
     */
    private static boolean withinBoundingBox(CatalogEntry entry, BoundingBox boundingBox) {
        if (boundingBox == null || entry.getEnvelope() == null) {
            return true;
        }
        boolean intersects = boundingBox.intersects(entry.getEnvelope());
        if (!intersects) {
            log.debug("Granule {} lies outside {}", entry.getId(), boundingBox);
        }
        return intersects;
    }
}
