package org.normharvest.http;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.normharvest.util.jackson.DurationDeserializer;

import java.time.Duration;
import java.util.List;

/**
 * HTTP client behaviour.
 *
 * @param maxAttempts     attempts per request before giving up
 * @param retryDelay      fixed delay between attempts
 * @param timeout         per-attempt request timeout
 * @param userAgent       User-Agent header sent with every request
 * @param retryStatuses   status codes treated as "try again later"
 * @param overloadMarkers body snippets servers use to report overload with a 200 status
 * @param proxy           optional proxy as "host:port" or "http://host:port"
 */
public record HttpConfig(
        int maxAttempts,
        @JsonDeserialize(using = DurationDeserializer.class) Duration retryDelay,
        @JsonDeserialize(using = DurationDeserializer.class) Duration timeout,
        String userAgent,
        List<Integer> retryStatuses,
        List<String> overloadMarkers,
        @Nullable String proxy) {

    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) " +
                                                    "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/80.0.3987.149 Safari/537.36";
    public static final String SERVER_OVERLOADED = "O servidor encontrou um erro interno, ou está sobrecarregado";

    @JsonCreator
    public HttpConfig {
        if (maxAttempts <= 0) maxAttempts = 5;
        if (retryDelay == null) retryDelay = Duration.ofSeconds(5);
        if (timeout == null) timeout = Duration.ofSeconds(60);
        if (userAgent == null) userAgent = DEFAULT_USER_AGENT;
        if (retryStatuses == null) retryStatuses = List.of(429, 503);
        if (overloadMarkers == null) overloadMarkers = List.of(SERVER_OVERLOADED);
    }

    public HttpConfig() {
        this(0, null, null, null, null, null, null);
    }

    public HttpConfig withRetry(int maxAttempts, Duration retryDelay) {
        return new HttpConfig(maxAttempts, retryDelay, timeout, userAgent, retryStatuses, overloadMarkers, proxy);
    }

    public HttpConfig withProxy(@Nullable String proxy) {
        return new HttpConfig(maxAttempts, retryDelay, timeout, userAgent, retryStatuses, overloadMarkers, proxy);
    }
}
