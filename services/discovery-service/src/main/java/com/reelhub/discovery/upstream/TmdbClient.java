package com.reelhub.discovery.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URI;
import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Single point of contact with the metadata provider.
 *
 * <p>Identical concurrent requests (same endpoint and parameters) share one upstream call.
 * 429, 5xx and connection-level failures are retried with exponential backoff; every failed
 * attempt feeds the circuit breaker, which rejects calls without touching the network while open.
 */
@Component
public class TmdbClient {
    private static final Logger logger = LoggerFactory.getLogger(TmdbClient.class);

    private final RestTemplate restTemplate;
    private final TmdbProperties properties;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;
    private final CircuitBreaker circuitBreaker;
    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, CompletableFuture<JsonNode>> inFlight = new ConcurrentHashMap<>();

    @Autowired
    public TmdbClient(
        @Qualifier("tmdbRestTemplate") RestTemplate restTemplate,
        TmdbProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("discoveryExecutor") ExecutorService executor,
        MeterRegistry meterRegistry
    ) {
        this(
            restTemplate,
            properties,
            objectMapper,
            executor,
            meterRegistry,
            new CircuitBreaker(properties.getFailureThreshold(), properties.getResetTimeoutMs(), Clock.systemUTC())
        );
    }

    public TmdbClient(
        RestTemplate restTemplate,
        TmdbProperties properties,
        ObjectMapper objectMapper,
        ExecutorService executor,
        MeterRegistry meterRegistry,
        CircuitBreaker circuitBreaker
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.circuitBreaker = circuitBreaker;
    }

    public CompletableFuture<JsonNode> fetch(String endpoint, Map<String, ?> params) {
        String apiKey = properties.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            return CompletableFuture.failedFuture(new TmdbConfigurationException("tmdb_api_key_missing"));
        }
        String path = normalizePath(endpoint);
        Map<String, Object> sorted = new TreeMap<>();
        if (params != null) {
            params.forEach((name, value) -> {
                if (name != null && value != null) {
                    sorted.put(name, value);
                }
            });
        }
        String key = path + "_" + sorted;

        CompletableFuture<JsonNode> promise = new CompletableFuture<>();
        CompletableFuture<JsonNode> existing = inFlight.putIfAbsent(key, promise);
        if (existing != null) {
            meterRegistry.counter("tmdb.requests", "outcome", "coalesced").increment();
            return existing.copy();
        }

        if (!circuitBreaker.allowRequest()) {
            meterRegistry.counter("tmdb.circuit.rejected").increment();
            inFlight.remove(key, promise);
            promise.completeExceptionally(new TmdbUnavailableException("tmdb_circuit_open"));
            return promise.copy();
        }

        URI uri = buildUri(path, sorted, apiKey);
        execute(path, uri, 0).whenComplete((body, error) -> {
            inFlight.remove(key, promise);
            if (error != null) {
                promise.completeExceptionally(unwrap(error));
            } else {
                promise.complete(body);
            }
        });
        return promise.copy();
    }

    /**
     * Blocking variant of {@link #fetch(String, Map)} that rethrows the typed failure.
     */
    public JsonNode get(String endpoint, Map<String, ?> params) {
        return UpstreamFutures.join(fetch(endpoint, params));
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private CompletableFuture<JsonNode> execute(String path, URI uri, int attempt) {
        return CompletableFuture.supplyAsync(() -> exchange(uri), executor)
            .handle((body, error) -> {
                if (error == null) {
                    return CompletableFuture.completedFuture(body);
                }
                Throwable cause = unwrap(error);
                if (cause instanceof RetryableFailure && attempt < properties.getMaxRetries()) {
                    return retry(path, uri, attempt + 1, (RetryableFailure) cause);
                }
                return CompletableFuture.<JsonNode>failedFuture(translate(path, cause));
            })
            .thenCompose(Function.identity());
    }

    private CompletableFuture<JsonNode> retry(String path, URI uri, int attempt, RetryableFailure failure) {
        long delayMs = Math.max(0L, properties.getRetryBaseDelayMs()) * (1L << (attempt - 1));
        logger.warn(
            "tmdb_retry attempt={}/{} endpoint={} reason={} delay_ms={}",
            attempt,
            properties.getMaxRetries(),
            path,
            failure.getMessage(),
            delayMs
        );
        meterRegistry.counter("tmdb.retries").increment();
        Executor delayed = CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS, executor);
        return CompletableFuture.runAsync(() -> { }, delayed)
            .thenCompose(ignored -> {
                if (!circuitBreaker.allowRequest()) {
                    meterRegistry.counter("tmdb.circuit.rejected").increment();
                    return CompletableFuture.failedFuture(new TmdbUnavailableException("tmdb_circuit_open"));
                }
                return execute(path, uri, attempt);
            });
    }

    private JsonNode exchange(URI uri) {
        ResponseEntity<String> response;
        try {
            response = restTemplate.getForEntity(uri, String.class);
        } catch (ResourceAccessException e) {
            onFailure();
            throw new RetryableFailure("io_error", e);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 429 || status >= 500) {
                onFailure();
                throw new RetryableFailure("http_" + status, e);
            }
            // the provider answered; a rejected request says nothing about its health
            onSuccess();
            throw new TmdbRequestException(status, "tmdb_http_" + status, e.getResponseBodyAsString());
        }
        onSuccess();
        meterRegistry.counter("tmdb.requests", "outcome", "success").increment();
        String body = response.getBody();
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TmdbUnavailableException("tmdb_invalid_json", e);
        }
    }

    private void onSuccess() {
        if (circuitBreaker.recordSuccess()) {
            logger.info("tmdb_circuit_closed");
        }
    }

    private void onFailure() {
        meterRegistry.counter("tmdb.requests", "outcome", "failure").increment();
        if (circuitBreaker.recordFailure()) {
            logger.warn("tmdb_circuit_open failures={}", circuitBreaker.getFailureCount());
        }
    }

    private RuntimeException translate(String path, Throwable cause) {
        if (cause instanceof RetryableFailure) {
            return new TmdbUnavailableException("tmdb_unavailable endpoint=" + path + " reason=" + cause.getMessage(), cause.getCause());
        }
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new TmdbUnavailableException("tmdb_unavailable endpoint=" + path, cause);
    }

    private URI buildUri(String path, Map<String, Object> params, String apiKey) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(base + path);
        params.forEach((name, value) -> builder.queryParam(name, value));
        builder.queryParam("api_key", apiKey);
        return builder.encode().build().toUri();
    }

    private static String normalizePath(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            return "/";
        }
        return endpoint.startsWith("/") ? endpoint : "/" + endpoint;
    }

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static class RetryableFailure extends RuntimeException {
        RetryableFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
