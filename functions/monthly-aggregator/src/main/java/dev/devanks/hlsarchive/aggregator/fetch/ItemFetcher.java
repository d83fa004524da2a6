package dev.devanks.hlsarchive.aggregator.fetch;

import dev.devanks.hlsarchive.aggregator.model.FetchOutcome;
import dev.devanks.hlsarchive.core.config.ArchiveProperties;
import dev.devanks.hlsarchive.core.exception.ObjectNotFoundException;
import dev.devanks.hlsarchive.core.exception.ObjectStoreException;
import dev.devanks.hlsarchive.core.retry.RetryPolicy;
import dev.devanks.hlsarchive.core.storage.ObjectStoreResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static dev.devanks.hlsarchive.aggregator.model.FetchErrorKind.PERMANENT;
import static dev.devanks.hlsarchive.aggregator.model.FetchErrorKind.TRANSIENT;
import static reactor.core.scheduler.Schedulers.boundedElastic;

/**
 * Fetches and parses single STAC item documents over HTTPS or from object storage.
 */
@Component
@Slf4j
public class ItemFetcher {

    private final WebClient webClient;
    private final ObjectStoreResolver objectStoreResolver;
    private final ItemDocumentParser itemDocumentParser;
    private final RetryPolicy retryPolicy;
    private final Duration requestTimeout;

    public ItemFetcher(WebClient webClient, ObjectStoreResolver objectStoreResolver,
                       ItemDocumentParser itemDocumentParser, ArchiveProperties archiveProperties) {
        this.webClient = webClient;
        this.objectStoreResolver = objectStoreResolver;
        this.itemDocumentParser = itemDocumentParser;
        var retry = archiveProperties.getRetry();
        this.retryPolicy = RetryPolicy.exponential(retry.getMaxAttempts(),
                Duration.ofMillis(retry.getBaseDelayMs()), Duration.ofMillis(retry.getMaxDelayMs()),
                error -> error instanceof FetchException fetchException && fetchException.isTransient());
        this.requestTimeout = Duration.ofSeconds(archiveProperties.getFetch().getRequestTimeoutSeconds());
    }

    /**
     * Never signals an error: every failure, after retries where the error is transient, completes
     * with a failed outcome.
     */
    public Mono<FetchOutcome> fetch(String link) {
        var attempts = new AtomicInteger();
        return Mono.defer(() -> {
                    attempts.incrementAndGet();
                    return download(link)
                            .timeout(requestTimeout)
                            .onErrorMap(error -> classify(link, error));
                })
                .retryWhen(retryPolicy.toReactorRetry())
                .map(body -> itemDocumentParser.parse(link, body))
                .map(item -> FetchOutcome.success(link, item, attempts.get()))
                .onErrorResume(error -> {
                    var fetchException = classify(link, error);
                    log.warn("Giving up on {} after {} attempt(s): {} ({})",
                            link, attempts.get(), fetchException.getMessage(), fetchException.getKind());
                    return Mono.just(FetchOutcome.failure(link, fetchException.getKind(), attempts.get(),
                            fetchException.getMessage()));
                });
    }

    private Mono<byte[]> download(String link) {
        if (link.startsWith("https://") || link.startsWith("http://")) {
            return webClient.get()
                    .uri(URI.create(link))
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .switchIfEmpty(Mono.error(() -> new FetchException(PERMANENT, "Empty response body from " + link)));
        }
        return Mono.fromCallable(() -> objectStoreResolver.forUri(link).read(link))
                .subscribeOn(boundedElastic());
    }

    static FetchException classify(String link, Throwable error) {
        if (error instanceof FetchException fetchException) {
            return fetchException;
        }
        if (error instanceof TimeoutException) {
            return new FetchException(TRANSIENT, "Timed out fetching " + link, error);
        }
        if (error instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            var kind = status == 408 || status == 429 || status >= 500 ? TRANSIENT : PERMANENT;
            return new FetchException(kind, "HTTP " + status + " fetching " + link, error);
        }
        if (error instanceof WebClientRequestException || error instanceof IOException) {
            return new FetchException(TRANSIENT, "Connection failed fetching " + link + ": " + error.getMessage(), error);
        }
        if (error instanceof ObjectNotFoundException) {
            return new FetchException(PERMANENT, "Object not found: " + link, error);
        }
        if (error instanceof ObjectStoreException) {
            return new FetchException(TRANSIENT, error.getMessage(), error);
        }
        return new FetchException(PERMANENT, "Cannot fetch " + link + ": " + error.getMessage(), error);
    }
}
