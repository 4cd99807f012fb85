package org.normharvest.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.concurrent.atomic.AtomicLong;

/**
 * HTTP client for unreliable government servers.
 *
 * <p>Every request is retried up to {@link HttpConfig#maxAttempts()} times with a fixed delay when the server
 * answers with a retryable status, reports that it is overloaded, shows a block page or the transport fails.
 * When the attempts run out the request methods return {@code null}: callers skip the item rather than abort.</p>
 *
 * <p>In session mode cookies are kept across calls, for sites that hand out a session id on the first search
 * and expect it on every following page.</p>
 */
public class ResilientHttpClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResilientHttpClient.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private final HttpClient httpClient;
    private final HttpConfig config;
    private final RetryPolicy retryPolicy;
    private final BlockDetector blockDetector;
    private final EgressRotator egressRotator;
    private final @Nullable CookieManager cookieManager;
    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public ResilientHttpClient(HttpConfig config) {
        this(config, false, BlockDetector.NONE, EgressRotator.NONE);
    }

    public ResilientHttpClient(HttpConfig config, boolean session, BlockDetector blockDetector,
                               EgressRotator egressRotator) {
        this.config = config;
        this.blockDetector = blockDetector;
        this.egressRotator = egressRotator;
        this.retryPolicy = new RetryPolicy("http", config.maxAttempts(),
                RetryPolicy.fixedInterval(config.retryDelay()), e -> e instanceof IOException);
        var builder = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(config.timeout());
        if (session) {
            cookieManager = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
            builder.cookieHandler(cookieManager);
        } else {
            cookieManager = null;
        }
        if (config.proxy() != null && !config.proxy().isBlank()) {
            builder.proxy(ProxySelector.of(parseProxy(config.proxy())));
        }
        this.httpClient = builder.build();
    }

    static InetSocketAddress parseProxy(String proxy) {
        String value = proxy.trim();
        if (value.contains("://")) {
            URI uri = URI.create(value);
            int port = uri.getPort() == -1 ? 8080 : uri.getPort();
            return InetSocketAddress.createUnresolved(uri.getHost(), port);
        }
        int colon = value.lastIndexOf(':');
        if (colon < 0) return InetSocketAddress.createUnresolved(value, 8080);
        return InetSocketAddress.createUnresolved(value.substring(0, colon), Integer.parseInt(value.substring(colon + 1)));
    }

    public @Nullable HttpResponse<byte[]> get(String url) {
        return send("GET", url, null, Map.of());
    }

    public @Nullable HttpResponse<byte[]> postJson(String url, Object body) {
        String json;
        try {
            json = JSON.writeValueAsString(body);
        } catch (IOException e) {
            throw new IllegalArgumentException("Unserializable request body", e);
        }
        return send("POST", url, BodyPublishers.ofString(json), Map.of("Content-Type", "application/json"));
    }

    public @Nullable HttpResponse<byte[]> postForm(String url, Map<String, String> form) {
        var encoded = new StringJoiner("&");
        form.forEach((key, value) -> encoded.add(URLEncoder.encode(key, StandardCharsets.UTF_8) + "=" +
                                                 URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8)));
        return send("POST", url, BodyPublishers.ofString(encoded.toString()),
                Map.of("Content-Type", "application/x-www-form-urlencoded"));
    }

    /**
     * Sends a request, retrying as described in the class documentation.
     *
     * @return the response, or null once every attempt has failed
     */
    public @Nullable HttpResponse<byte[]> send(String method, String url, @Nullable BodyPublisher body,
                                               Map<String, String> headers) {
        HttpRequest request;
        try {
            var builder = HttpRequest.newBuilder(URI.create(url))
                    .timeout(config.timeout())
                    .header("User-Agent", config.userAgent())
                    .method(method, body == null ? BodyPublishers.noBody() : body);
            headers.forEach(builder::header);
            request = builder.build();
        } catch (IllegalArgumentException e) {
            log.warn("Invalid request {} {}: {}", method, url, e.getMessage());
            failures.incrementAndGet();
            return null;
        }
        requests.incrementAndGet();
        try {
            return retryPolicy.call(attempt -> sendOnce(request, attempt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failures.incrementAndGet();
            return null;
        } catch (Exception e) {
            log.atWarn().addKeyValue("url", url)
                    .addKeyValue("attempts", retryPolicy.maxAttempts())
                    .log("Giving up on {} {}: {}", method, url, e.getMessage());
            failures.incrementAndGet();
            return null;
        }
    }

    private HttpResponse<byte[]> sendOnce(HttpRequest request, int attempt) throws IOException, InterruptedException {
        log.trace("{} {} (attempt {})", request.method(), request.uri(), attempt + 1);
        long egressGeneration = egressRotator.generation();
        var response = httpClient.send(request, BodyHandlers.ofByteArray());
        if (config.retryStatuses().contains(response.statusCode())) {
            throw new RetryableResponseException("Status " + response.statusCode() + " from " + request.uri());
        }
        if (!config.overloadMarkers().isEmpty() || !blockDetector.markers().isEmpty()) {
            for (String text : bodyTexts(response)) {
                for (String marker : config.overloadMarkers()) {
                    if (text.contains(marker)) {
                        throw new RetryableResponseException("Server overloaded: " + request.uri());
                    }
                }
                if (blockDetector.isBlocked(text)) {
                    log.warn("Access blocked by {}, rotating egress", request.uri().getHost());
                    egressRotator.rotate(egressGeneration);
                    throw new RetryableResponseException("Access blocked: " + request.uri());
                }
            }
        }
        return response;
    }

    /**
     * The body decoded with the charset the response declares. Without a declaration both UTF-8 and
     * ISO-8859-1 readings are returned, since the government servers use either.
     */
    static List<String> bodyTexts(HttpResponse<byte[]> response) {
        Charset declared = declaredCharset(response).orElse(null);
        if (declared != null) return List.of(new String(response.body(), declared));
        return List.of(new String(response.body(), StandardCharsets.UTF_8),
                new String(response.body(), StandardCharsets.ISO_8859_1));
    }

    static Optional<Charset> declaredCharset(HttpResponse<?> response) {
        return response.headers().firstValue("Content-Type").flatMap(ResilientHttpClient::charsetParameter);
    }

    static Optional<Charset> charsetParameter(String contentType) {
        for (String parameter : contentType.split(";")) {
            String trimmed = parameter.trim();
            if (!trimmed.regionMatches(true, 0, "charset=", 0, 8)) continue;
            String name = trimmed.substring(8).replace("\"", "").trim();
            try {
                return Optional.of(Charset.forName(name));
            } catch (IllegalArgumentException e) {
                log.debug("Unknown charset {} in Content-Type, ignoring it", name);
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public boolean isSession() {
        return cookieManager != null;
    }

    public @Nullable CookieManager cookieManager() {
        return cookieManager;
    }

    public HttpConfig config() {
        return config;
    }

    public long requestCount() {
        return requests.get();
    }

    public long failureCount() {
        return failures.get();
    }

    @Override
    public void close() {
        // HttpClient only became AutoCloseable in JDK 21; its threads are daemons
        log.debug("Closing HTTP client after {} requests ({} failed)", requests.get(), failures.get());
    }

    /**
     * A response that should be treated like a transport failure and retried.
     */
    static class RetryableResponseException extends IOException {
        RetryableResponseException(String message) {
            super(message);
        }
    }
}
