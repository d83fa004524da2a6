package dev.devanks.hlsarchive.core.retry;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.function.IntFunction;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded retry with backoff: {maxAttempts, backoff, retryable}. The same policy drives blocking
 * calls through {@link #execute(Supplier, Sleeper)} and reactive calls through {@link #toReactorRetry()}.
 */
@Slf4j
public final class RetryPolicy {

    private final int maxAttempts;
    private final IntFunction<Duration> backoff;
    private final Predicate<Throwable> retryable;

    public RetryPolicy(int maxAttempts, IntFunction<Duration> backoff, Predicate<Throwable> retryable) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.retryable = retryable;
    }

    /**
     * Delay after attempt {@code n} is {@code base * 2^(n-1)}, capped at {@code max}.
     */
    public static RetryPolicy exponential(int maxAttempts, Duration base, Duration max, Predicate<Throwable> retryable) {
        return new RetryPolicy(maxAttempts, attempt -> exponentialDelay(base, max, attempt), retryable);
    }

    static Duration exponentialDelay(Duration base, Duration max, int attempt) {
        long factor = 1L << Math.min(30, Math.max(0, attempt - 1));
        long delayMs = base.toMillis() * factor;
        if (delayMs < 0 || delayMs > max.toMillis()) {
            return max;
        }
        return Duration.ofMillis(delayMs);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration backoffAfter(int attempt) {
        return backoff.apply(attempt);
    }

    public boolean isRetryable(Throwable error) {
        return retryable.test(error);
    }

    /**
     * Runs {@code call} until it succeeds, fails with a non-retryable error, or attempts run out.
     * The last error is rethrown unchanged.
     */
    public <T> T execute(Supplier<T> call, Sleeper sleeper) {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (attempt >= maxAttempts || !retryable.test(e)) {
                    throw e;
                }
                Duration delay = backoff.apply(attempt);
                log.warn("Attempt {}/{} failed ({}), retrying in {} ms", attempt, maxAttempts, e.getMessage(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    /**
     * Reactor equivalent of {@link #execute}. Delays run on the parallel scheduler, so tests can
     * drive them with virtual time. Exhaustion propagates the last error, not a wrapper.
     */
    public Retry toReactorRetry() {
        return Retry.from(signals -> signals.concatMap(signal -> {
            int attempt = (int) signal.totalRetries() + 1;
            Throwable failure = signal.failure();
            if (attempt >= maxAttempts || !retryable.test(failure)) {
                return Mono.<Long>error(failure);
            }
            Duration delay = backoff.apply(attempt);
            log.debug("Attempt {}/{} failed ({}), retrying in {} ms", attempt, maxAttempts, failure.getMessage(), delay.toMillis());
            return Mono.delay(delay);
        }));
    }
}
