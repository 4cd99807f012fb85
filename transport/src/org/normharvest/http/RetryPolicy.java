package org.normharvest.http;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * A named resilience4j {@link Retry} applied explicitly at the call site.
 *
 * <pre>{@code
 * var policy = RetryPolicy.exponential("listing", 3, Duration.ofSeconds(3));
 * String body = policy.call(attempt -> fetch(url));
 * }</pre>
 *
 * Interrupts are never retried. There is no jitter: the same policy always waits the same amounts.
 */
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);
    private final Retry retry;

    public RetryPolicy(String name, int maxAttempts, IntervalFunction interval) {
        this(name, maxAttempts, interval, e -> true);
    }

    public RetryPolicy(String name, int maxAttempts, IntervalFunction interval, Predicate<Throwable> retryable) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(interval)
                .retryOnException(e -> !(e instanceof InterruptedException) && retryable.test(e))
                .build();
        this.retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event -> log.debug("{}: attempt {}/{} failed: {}. Retrying in {} ms",
                event.getName(), event.getNumberOfRetryAttempts(), maxAttempts,
                event.getLastThrowable() == null ? null : event.getLastThrowable().getMessage(),
                event.getWaitInterval().toMillis()));
    }

    public static RetryPolicy fixed(String name, int maxAttempts, Duration delay) {
        return new RetryPolicy(name, maxAttempts, fixedInterval(delay));
    }

    public static RetryPolicy exponential(String name, int maxAttempts, Duration base) {
        return new RetryPolicy(name, maxAttempts, IntervalFunction.ofExponentialBackoff(base, 2));
    }

    /**
     * Like {@link IntervalFunction#of(Duration)}, but also accepts a zero delay.
     */
    static IntervalFunction fixedInterval(Duration delay) {
        if (delay.isZero()) return attempt -> 0L;
        return IntervalFunction.of(delay);
    }

    public int maxAttempts() {
        return retry.getRetryConfig().getMaxAttempts();
    }

    public Retry retry() {
        return retry;
    }

    /**
     * Calls {@code operation} until it returns normally or the attempts are used up.
     *
     * @return the first successful result
     * @throws Exception the failure of the last attempt, or the first non-retryable failure
     * @throws InterruptedException immediately, without further attempts, if the thread is interrupted
     */
    public <T> T call(Attempt<T> operation) throws Exception {
        var attempts = new AtomicInteger();
        try {
            return Retry.decorateCheckedSupplier(retry, () -> operation.run(attempts.getAndIncrement())).get();
        } catch (Exception | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new IllegalStateException(t);
        }
    }

    @FunctionalInterface
    public interface Attempt<T> {
        /**
         * @param attempt zero-based attempt number
         */
        T run(int attempt) throws Exception;
    }
}
