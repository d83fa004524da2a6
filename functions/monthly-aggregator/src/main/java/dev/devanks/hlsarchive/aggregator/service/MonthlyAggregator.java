package dev.devanks.hlsarchive.aggregator.service;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.hlsarchive.aggregator.exception.AggregationException;
import dev.devanks.hlsarchive.aggregator.exception.IncompleteLinksException;
import dev.devanks.hlsarchive.aggregator.model.AggregationResult;
import dev.devanks.hlsarchive.aggregator.model.FetchOutcome;
import dev.devanks.hlsarchive.aggregator.model.ItemDocument;
import dev.devanks.hlsarchive.aggregator.model.MonthlyAggregationRequest;
import dev.devanks.hlsarchive.aggregator.scheduler.BoundedFetchScheduler;
import dev.devanks.hlsarchive.aggregator.scheduler.CancellationToken;
import dev.devanks.hlsarchive.aggregator.write.ColumnarArtifactWriter;
import dev.devanks.hlsarchive.core.config.ArchiveProperties;
import dev.devanks.hlsarchive.core.exception.ManifestNotFoundException;
import dev.devanks.hlsarchive.core.manifest.LinkManifestStore;
import dev.devanks.hlsarchive.core.storage.ObjectStoreResolver;
import dev.devanks.hlsarchive.core.storage.StorageLayout;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dev.devanks.hlsarchive.aggregator.exception.AggregationException.Kind.CANCELLED;
import static dev.devanks.hlsarchive.aggregator.exception.AggregationException.Kind.HIGH_FAILURE_RATE;
import static dev.devanks.hlsarchive.aggregator.exception.AggregationException.Kind.NO_LINKS;
import static dev.devanks.hlsarchive.aggregator.exception.AggregationException.Kind.WRITE_FAILED;
import static reactor.core.scheduler.Schedulers.boundedElastic;

@Service
@RequiredArgsConstructor
@Slf4j
public class MonthlyAggregator {

    private final LinkManifestStore linkManifestStore;
    private final BoundedFetchScheduler fetchScheduler;
    private final ColumnarArtifactWriter artifactWriter;
    private final ObjectStoreResolver objectStoreResolver;
    private final ArchiveProperties properties;

    /**
     * Aggregates one collection-month into a single artifact. The run is subscribed independently of
     * the returned Mono: cancelling it only stops admitting new fetches, lets in-flight fetches finish,
     * and the run then ends with {@code CANCELLED} without writing anything.
     *
     * @param request The collection, month and destination to aggregate.
     * @return A Mono with the counts of the run, or an {@link AggregationException} describing why
     * no artifact was written.
     */
    public Mono<AggregationResult> aggregateMonth(MonthlyAggregationRequest request) {
        return Mono.defer(() -> {
            var cancellationToken = new CancellationToken();
            Sinks.One<AggregationResult> result = Sinks.one();
            aggregateMonth(request, cancellationToken).subscribe(
                    result::tryEmitValue,
                    error -> {
                        if (cancellationToken.isCancelled()) {
                            log.warn("Cancelled aggregation of {} {} ended: {}", request.getCollection(),
                                    request.getYearMonth(), error.getMessage());
                        }
                        result.tryEmitError(error);
                    });
            return result.asMono().doOnCancel(cancellationToken::cancel);
        });
    }

    /**
     * Same as {@link #aggregateMonth(MonthlyAggregationRequest)}, with a caller-owned cancellation token.
     *
     * @param request           The collection, month and destination to aggregate.
     * @param cancellationToken Checked before each day and link is admitted to the fetch scheduler.
     * @return A Mono with the counts of the run.
     */
    public Mono<AggregationResult> aggregateMonth(MonthlyAggregationRequest request, CancellationToken cancellationToken) {
        var version = request.getVersion() == null || request.getVersion().isBlank()
                ? properties.getAggregation().getDefaultVersion()
                : request.getVersion();
        String outputPath;
        try {
            outputPath = StorageLayout.artifactPath(request.getDestination(), version, request.getCollection(), request.getYearMonth());
        } catch (IllegalArgumentException e) {
            return Mono.error(e);
        }
        log.info("Aggregating {} for {} into {}", request.getCollection(), request.getYearMonth(), outputPath);

        return Mono.fromCallable(() -> request.isSkipExisting() && objectStoreResolver.forUri(outputPath).exists(outputPath))
                .subscribeOn(boundedElastic())
                .flatMap(exists -> {
                    if (exists) {
                        log.info("Artifact {} already exists, skipping {} {}", outputPath, request.getCollection(), request.getYearMonth());
                        return Mono.just(AggregationResult.builder()
                                .outputPath(outputPath)
                                .skipped(true)
                                .build());
                    }
                    return aggregate(request, outputPath, cancellationToken);
                });
    }

    private Mono<AggregationResult> aggregate(MonthlyAggregationRequest request, String outputPath,
                                              CancellationToken cancellationToken) {
        var fetch = properties.getFetch();
        return Mono.fromCallable(() -> loadManifests(request))
                .subscribeOn(boundedElastic())
                .flatMap(manifests -> fetchScheduler.runBatch(manifests.getLinksByDay(),
                                fetch.getMaxConcurrentDays(), fetch.getMaxConcurrentPerDay(), cancellationToken)
                        .flatMap(outcomes -> {
                            int fetched = outcomes.values().stream().mapToInt(List::size).sum();
                            if (cancellationToken.isCancelled() || fetched < manifests.getTotalLinks()) {
                                return Mono.error(new AggregationException(CANCELLED, String.format(
                                        "Aggregation of %s %s cancelled after %d of %d item fetches, nothing written to %s",
                                        request.getCollection().getCollectionId(), request.getYearMonth(), fetched,
                                        manifests.getTotalLinks(), outputPath)));
                            }
                            return writeArtifact(request, outputPath, manifests, outcomes.values());
                        }));
    }

    /**
     * Reads the manifest of every expected day. Days without a manifest are either reported as
     * missing or, when complete links are required, fail the run before anything is fetched.
     *
     * @param request The aggregation request.
     * @return The links of every present day, in day order, and the missing days.
     */
    @VisibleForTesting
    MonthManifests loadManifests(MonthlyAggregationRequest request) {
        var collection = request.getCollection();
        Map<LocalDate, List<String>> linksByDay = new LinkedHashMap<>();
        List<LocalDate> missingDays = new ArrayList<>();
        for (LocalDate day : collection.expectedDays(request.getYearMonth())) {
            try {
                linksByDay.put(day, linkManifestStore.read(request.getDestination(), collection, day).getLinks());
            } catch (ManifestNotFoundException e) {
                log.debug("No manifest for {} on {}", collection, day);
                missingDays.add(day);
            }
        }

        if (!missingDays.isEmpty()) {
            if (request.isRequireCompleteLinks()) {
                throw new IncompleteLinksException(missingDays);
            }
            log.warn("{} of {} days have no link manifest for {} {}: {}", missingDays.size(),
                    missingDays.size() + linksByDay.size(), collection, request.getYearMonth(), missingDays);
        }

        int totalLinks = linksByDay.values().stream().mapToInt(List::size).sum();
        if (totalLinks == 0) {
            throw new AggregationException(NO_LINKS, "No item links for " + collection.getCollectionId()
                    + " in " + request.getYearMonth());
        }
        log.info("Loaded {} links from {} manifests for {} {}", totalLinks, linksByDay.size(), collection, request.getYearMonth());
        return new MonthManifests(linksByDay, missingDays, totalLinks);
    }

    /**
     * Applies the failure-rate and empty-result rules, then encodes and stores the artifact in a
     * single put.
     *
     * @param request    The aggregation request.
     * @param outputPath Where the artifact goes.
     * @param manifests  The manifests the fetches came from.
     * @param outcomes   Fetch outcomes per day.
     * @return A Mono with the result counts.
     */
    @VisibleForTesting
    Mono<AggregationResult> writeArtifact(MonthlyAggregationRequest request, String outputPath, MonthManifests manifests,
                                          Collection<List<FetchOutcome>> outcomes) {
        List<ItemDocument> items = new ArrayList<>();
        int failureCount = 0;
        for (List<FetchOutcome> dayOutcomes : outcomes) {
            for (FetchOutcome outcome : dayOutcomes) {
                if (outcome.isSuccess()) {
                    items.add(outcome.getItem());
                } else {
                    failureCount++;
                }
            }
        }

        double failureRate = (double) failureCount / manifests.getTotalLinks();
        double maxFailureRate = properties.getAggregation().getMaxFailureRate();
        if (request.isRequireCompleteLinks() && failureRate > maxFailureRate) {
            return Mono.error(new AggregationException(HIGH_FAILURE_RATE, String.format(
                    "%d of %d item fetches failed (%.2f%%), above the allowed %.2f%%",
                    failureCount, manifests.getTotalLinks(), failureRate * 100, maxFailureRate * 100)));
        }
        if (items.isEmpty()) {
            return Mono.error(new AggregationException(NO_LINKS, "All " + failureCount + " item fetches failed for "
                    + request.getCollection().getCollectionId() + " in " + request.getYearMonth()));
        }

        int successCount = items.size();
        int failures = failureCount;
        return Mono.fromCallable(() -> {
                    var rows = HilbertOrdering.sort(items);
                    byte[] content = artifactWriter.encode(request.getCollection().getCollectionId(), rows);
                    objectStoreResolver.forUri(outputPath).write(outputPath, content, artifactWriter.contentType());
                    log.info("Wrote {} items ({} failed fetches) to {}", rows.size(), failures, outputPath);
                    return AggregationResult.builder()
                            .outputPath(outputPath)
                            .itemCount(rows.size())
                            .successCount(successCount)
                            .failureCount(failures)
                            .missingDays(manifests.getMissingDays())
                            .build();
                })
                .subscribeOn(boundedElastic())
                .onErrorMap(e -> !(e instanceof AggregationException),
                        e -> new AggregationException(WRITE_FAILED, "Failed to write " + outputPath + ": " + e.getMessage(), e));
    }

    @Value
    static class MonthManifests {
        Map<LocalDate, List<String>> linksByDay;
        List<LocalDate> missingDays;
        int totalLinks;
    }
}
