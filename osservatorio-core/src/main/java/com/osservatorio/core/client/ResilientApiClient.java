package com.osservatorio.core.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.osservatorio.client.circuit.CircuitBreaker;
import com.osservatorio.client.circuit.CircuitBreakerRegistry;
import com.osservatorio.client.circuit.CircuitState;
import com.osservatorio.client.config.UpstreamProperties;
import com.osservatorio.client.http.RawResponse;
import com.osservatorio.client.http.UpstreamHttpClient;
import com.osservatorio.client.ratelimit.RateLimitDecision;
import com.osservatorio.client.ratelimit.RateLimiter;
import com.osservatorio.client.retry.RetryPolicy;
import com.osservatorio.client.retry.Sleeper;
import com.osservatorio.client.threat.ThreatScorer;
import com.osservatorio.common.concurrent.CancellationSignal;
import com.osservatorio.common.exception.CircuitOpenException;
import com.osservatorio.common.exception.OsservatorioException;
import com.osservatorio.common.exception.TransientUpstreamException;
import com.osservatorio.common.exception.UpstreamRejectedException;
import com.osservatorio.common.exception.ValidationException;
import com.osservatorio.common.util.HashUtils;
import com.osservatorio.core.cache.CachedResponse;
import com.osservatorio.core.cache.ResponseCache;
import com.osservatorio.core.config.CacheProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.LongAdder;

/**
 * Rate-governed, retrying, cached access to the upstream API.
 *
 * Every fetch goes through the same gates in order:
 * 1. circuit breaker for the upstream (open: retained cache entry or fail fast)
 * 2. fresh cache entry, unless the request asks for fresh data
 * 3. rate limiter for the caller (denials are never retried)
 * 4. attempts with exponential backoff on transient failures, re-checking the
 *    breaker, the limiter and cancellation before every retry
 *
 * Each attempt is reported to the breaker, its response time to the limiter and
 * its outcome to the threat scorer. Successful responses are written through to
 * the cache; when attempts are exhausted a retained entry is served if the
 * request allows it.
 */
@Service
@Slf4j
public class ResilientApiClient {

    private static final String METHOD = "GET";

    private final UpstreamHttpClient httpClient;
    private final CircuitBreakerRegistry breakerRegistry;
    private final RateLimiter rateLimiter;
    private final ThreatScorer threatScorer;
    private final ResponseCache cache;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final UpstreamProperties upstreamProperties;
    private final CacheProperties cacheProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ExecutorService batchExecutor;

    private final LongAdder totalRequests = new LongAdder();
    private final LongAdder successfulRequests = new LongAdder();
    private final LongAdder failedRequests = new LongAdder();
    private final LongAdder rateLimitedRequests = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder staleResponses = new LongAdder();
    private final LongAdder upstreamAttempts = new LongAdder();
    private final LongAdder responseTimeMillis = new LongAdder();

    public ResilientApiClient(UpstreamHttpClient httpClient,
                              CircuitBreakerRegistry breakerRegistry,
                              RateLimiter rateLimiter,
                              ThreatScorer threatScorer,
                              ResponseCache cache,
                              RetryPolicy retryPolicy,
                              Sleeper sleeper,
                              UpstreamProperties upstreamProperties,
                              CacheProperties cacheProperties,
                              ObjectMapper objectMapper,
                              Clock clock) {
        this.httpClient = httpClient;
        this.breakerRegistry = breakerRegistry;
        this.rateLimiter = rateLimiter;
        this.threatScorer = threatScorer;
        this.cache = cache;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.upstreamProperties = upstreamProperties;
        this.cacheProperties = cacheProperties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.batchExecutor = Executors.newFixedThreadPool(Math.max(1, upstreamProperties.getMaxConnections()));
    }

    /**
     * @throws CircuitOpenException        upstream circuit open and no usable cache entry
     * @throws OsservatorioException       rate limit or block denial, never retried
     * @throws TransientUpstreamException  attempts exhausted and no usable cache entry
     * @throws UpstreamRejectedException   upstream refused the request
     * @throws CancellationException       the request's signal was cancelled
     */
    public UpstreamResponse fetch(FetchRequest request) {
        ValidationException.requireNonBlank(request.getIdentifier(), "identifier");
        ValidationException.requireNonBlank(request.getPath(), "path");
        totalRequests.increment();

        String cacheKey = ResponseCache.key(METHOD, request.getPath(), request.getQuery());
        threatScorer.recordRequest(request.getIdentifier(), request.getPath());
        request.getCancellation().throwIfCancelled("upstream fetch");

        CircuitBreaker breaker = breaker();
        try {
            breaker.acquirePermission();
        } catch (CircuitOpenException e) {
            log.debug("[UPSTREAM] Circuit open, trying cache | path={} | retryAt={}", request.getPath(), e.getRetryAt());
            return fallback(request, cacheKey, e);
        }

        if (!request.isFresh()) {
            Optional<CachedResponse> cached = cache.getFresh(cacheKey);
            if (cached.isPresent()) {
                breaker.releasePermission();
                cacheHits.increment();
                successfulRequests.increment();
                return fromCache(cached.get(), ResponseSource.CACHE);
            }
        }

        checkRateLimit(request, breaker);
        return callWithRetry(request, cacheKey, breaker);
    }

    /**
     * Fetch and decode a JSON body.
     */
    public JsonNode fetchJson(FetchRequest request) {
        UpstreamResponse response = fetch(request);
        try {
            return objectMapper.readTree(response.getBody());
        } catch (IOException e) {
            throw new UpstreamRejectedException(response.getStatusCode(),
                    "Response body is not valid JSON: " + e.getMessage());
        }
    }

    /**
     * Fetch several requests concurrently. Each identifier gets at most as many
     * calls in flight as its current burst limit allows, capped by the configured
     * concurrency. Outcomes are returned in request order; a failed request does
     * not affect the others.
     */
    public List<FetchOutcome> fetchAll(List<FetchRequest> requests) {
        Map<String, Semaphore> permits = new HashMap<>();
        for (FetchRequest request : requests) {
            permits.computeIfAbsent(request.getIdentifier(), id -> new Semaphore(concurrencyFor(request)));
        }
        log.info("[UPSTREAM] Batch fetch started | requests={} | identifiers={}", requests.size(), permits.size());

        List<CompletableFuture<FetchOutcome>> futures = requests.stream()
                .map(request -> CompletableFuture.supplyAsync(
                    () -> fetchWithPermit(request, permits.get(request.getIdentifier())), batchExecutor))
                .toList();
        List<FetchOutcome> outcomes = futures.stream().map(CompletableFuture::join).toList();

        long failed = outcomes.stream().filter(o -> !o.isSuccess()).count();
        log.info("[UPSTREAM] Batch fetch finished | requests={} | failed={}", requests.size(), failed);
        return outcomes;
    }

    public ClientStatus status() {
        CircuitBreaker breaker = breaker();
        if (breaker.getState() != CircuitState.CLOSED) {
            return ClientStatus.CIRCUIT_OPEN;
        }
        if (breaker.snapshot().getFailureCount() > 0 || !rateLimiter.status().isBackendHealthy()) {
            return ClientStatus.DEGRADED;
        }
        return ClientStatus.HEALTHY;
    }

    public ClientMetrics metrics() {
        long attempts = upstreamAttempts.sum();
        return ClientMetrics.builder()
                .status(status())
                .totalRequests(totalRequests.sum())
                .successfulRequests(successfulRequests.sum())
                .failedRequests(failedRequests.sum())
                .rateLimitedRequests(rateLimitedRequests.sum())
                .cacheHits(cacheHits.sum())
                .staleResponses(staleResponses.sum())
                .upstreamAttempts(attempts)
                .averageResponseTimeMs(attempts == 0 ? 0.0 : (double) responseTimeMillis.sum() / attempts)
                .circuit(breaker().stats())
                .cache(cache.stats())
                .build();
    }

    @PreDestroy
    public void shutdown() {
        batchExecutor.shutdownNow();
    }

    private UpstreamResponse callWithRetry(FetchRequest request, String cacheKey, CircuitBreaker breaker) {
        String identifier = request.getIdentifier();
        String path = request.getPath();
        CancellationSignal cancellation = request.getCancellation();
        Duration timeout = Duration.ofSeconds(upstreamProperties.getTimeoutSeconds());
        int attempt = 0;

        while (true) {
            attempt++;
            if (attempt > 1) {
                try {
                    breaker.acquirePermission();
                } catch (CircuitOpenException e) {
                    log.warn("[UPSTREAM] Circuit opened during retries | path={} | attempts={}", path, attempt - 1);
                    return fallback(request, cacheKey, e);
                }
                checkRateLimit(request, breaker);
            }
            if (cancellation.isCancelled()) {
                breaker.releasePermission();
                cancellation.throwIfCancelled("upstream attempt " + attempt);
            }

            upstreamAttempts.increment();
            long started = System.nanoTime();
            try {
                RawResponse raw = httpClient.get(path, request.getQuery(), request.getHeaders(), timeout);
                Duration elapsed = elapsedSince(started);
                breaker.onSuccess();
                recordOutcome(identifier, path, elapsed, true);

                Duration ttl = request.getCacheTtl() != null ? request.getCacheTtl() : cacheProperties.getTtl();
                CachedResponse stored = cache.put(cacheKey, raw.getStatusCode(), raw.contentType(), raw.getBody(), ttl);
                successfulRequests.increment();
                log.debug("[UPSTREAM] Fetched | identifier={} | path={} | status={} | attempts={} | durationMs={}",
                        HashUtils.mask(identifier), path, raw.getStatusCode(), attempt, elapsed.toMillis());
                return UpstreamResponse.builder()
                        .statusCode(raw.getStatusCode())
                        .contentType(raw.contentType())
                        .body(raw.getBody())
                        .contentHash(stored.getContentHash())
                        .source(ResponseSource.LIVE)
                        .fetchedAt(clock.instant())
                        .attempts(attempt)
                        .build();
            } catch (RuntimeException e) {
                Duration elapsed = elapsedSince(started);
                breaker.onError(e);
                recordOutcome(identifier, path, elapsed, false);

                if (!retryPolicy.shouldRetry(attempt, e)) {
                    if (e instanceof TransientUpstreamException transientError) {
                        log.warn("[UPSTREAM] Attempts exhausted | path={} | attempts={} | error={}",
                                path, attempt, e.getMessage());
                        return fallback(request, cacheKey, new TransientUpstreamException(
                                "Upstream still failing after " + attempt + " attempt(s): " + e.getMessage(),
                                transientError.getStatusCode(), attempt, e));
                    }
                    failedRequests.increment();
                    throw e;
                }

                Duration backoff = retryPolicy.backoffAfter(attempt, ThreadLocalRandom.current().nextDouble());
                log.warn("[UPSTREAM] Attempt failed, retrying | path={} | attempt={} | backoffMs={} | error={}",
                        path, attempt, backoff.toMillis(), e.getMessage());
                pause(backoff);
            }
        }
    }

    private void checkRateLimit(FetchRequest request, CircuitBreaker breaker) {
        RateLimitDecision decision = rateLimiter.check(request.getIdentifier(), request.getPath(), request.getScope());
        if (!decision.isAllowed()) {
            breaker.releasePermission();
            rateLimitedRequests.increment();
            failedRequests.increment();
            throw decision.toException();
        }
    }

    private UpstreamResponse fallback(FetchRequest request, String cacheKey, OsservatorioException cause) {
        if (request.isAllowStale()) {
            Optional<CachedResponse> retained = cache.getStale(cacheKey);
            if (retained.isPresent()) {
                CachedResponse entry = retained.get();
                boolean fresh = entry.isFresh(clock.instant());
                if (fresh) {
                    cacheHits.increment();
                } else {
                    staleResponses.increment();
                }
                successfulRequests.increment();
                log.warn("[UPSTREAM] Serving cached response instead of upstream | path={} | cause={}",
                        request.getPath(), cause.getClass().getSimpleName());
                return fromCache(entry, fresh ? ResponseSource.CACHE : ResponseSource.STALE_CACHE);
            }
        }
        failedRequests.increment();
        throw cause;
    }

    private FetchOutcome fetchWithPermit(FetchRequest request, Semaphore permit) {
        try {
            permit.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new FetchOutcome(request, null, new CancellationException("Interrupted while waiting to fetch"));
        }
        try {
            return new FetchOutcome(request, fetch(request), null);
        } catch (RuntimeException e) {
            log.debug("[UPSTREAM] Batch request failed | path={} | error={}", request.getPath(), e.getMessage());
            return new FetchOutcome(request, null, e);
        } finally {
            permit.release();
        }
    }

    private int concurrencyFor(FetchRequest request) {
        if (request.getIdentifier() == null || request.getIdentifier().isBlank()) {
            return 1;
        }
        int limiterBound = rateLimiter.maxConcurrency(request.getIdentifier(), request.getScope());
        return Math.max(1, Math.min(upstreamProperties.getMaxConcurrency(), limiterBound));
    }

    private void recordOutcome(String identifier, String path, Duration elapsed, boolean success) {
        responseTimeMillis.add(elapsed.toMillis());
        rateLimiter.recordResponseTime(identifier, path, elapsed);
        threatScorer.recordOutcome(identifier, success);
    }

    private void pause(Duration backoff) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted during retry backoff");
        }
    }

    private UpstreamResponse fromCache(CachedResponse entry, ResponseSource source) {
        return UpstreamResponse.builder()
                .statusCode(entry.getStatusCode())
                .contentType(entry.getContentType())
                .body(entry.getBody())
                .contentHash(entry.getContentHash())
                .source(source)
                .fetchedAt(entry.getStoredAt())
                .attempts(0)
                .build();
    }

    private CircuitBreaker breaker() {
        return breakerRegistry.get(upstreamProperties.getName());
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
