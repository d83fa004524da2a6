package dev.devanks.hlsarchive.aggregator.scheduler;

import dev.devanks.hlsarchive.aggregator.fetch.ItemFetcher;
import dev.devanks.hlsarchive.aggregator.model.FetchOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.AbstractMap.SimpleEntry;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fetches a batch of item links grouped by day under two limits: at most {@code maxConcurrentDays}
 * days in progress, and at most {@code maxConcurrentPerDay} fetches within each day.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BoundedFetchScheduler {

    private final ItemFetcher itemFetcher;

    /**
     * @return outcomes per admitted day, ordered by day. A day's list is published once all of
     * its admitted links have an outcome. Days not admitted before cancellation are absent.
     */
    public Mono<Map<LocalDate, List<FetchOutcome>>> runBatch(Map<LocalDate, List<String>> linksByDay,
                                                             int maxConcurrentDays, int maxConcurrentPerDay,
                                                             CancellationToken cancellationToken) {
        if (maxConcurrentDays < 1 || maxConcurrentPerDay < 1) {
            return Mono.error(new IllegalArgumentException("Concurrency limits must be at least 1, got days="
                    + maxConcurrentDays + ", perDay=" + maxConcurrentPerDay));
        }
        return Flux.fromIterable(new TreeMap<>(linksByDay).entrySet())
                .takeWhile(day -> !cancellationToken.isCancelled())
                .flatMap(day -> fetchDay(day.getKey(), day.getValue(), maxConcurrentPerDay, cancellationToken),
                        maxConcurrentDays)
                .collectMap(SimpleEntry::getKey, SimpleEntry::getValue, TreeMap::new);
    }

    private Mono<SimpleEntry<LocalDate, List<FetchOutcome>>> fetchDay(LocalDate day, List<String> links,
                                                                      int maxConcurrentPerDay,
                                                                      CancellationToken cancellationToken) {
        log.debug("Fetching {} items for {}", links.size(), day);
        return Flux.fromIterable(links)
                .takeWhile(link -> !cancellationToken.isCancelled())
                .flatMap(itemFetcher::fetch, maxConcurrentPerDay)
                .collectList()
                .map(outcomes -> {
                    long failures = outcomes.stream().filter(outcome -> !outcome.isSuccess()).count();
                    log.info("Fetched {} of {} items for {} ({} failed)", outcomes.size(), links.size(), day, failures);
                    return new SimpleEntry<>(day, outcomes);
                });
    }
}
