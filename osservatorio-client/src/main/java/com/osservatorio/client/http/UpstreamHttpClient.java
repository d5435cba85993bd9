package com.osservatorio.client.http;

import com.osservatorio.client.config.UpstreamProperties;
import com.osservatorio.common.exception.TransientUpstreamException;
import com.osservatorio.common.exception.UpstreamRejectedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Single HTTP GET against the upstream API. No retries here: every call is one
 * attempt, and the outcome is classified for the resilience pipeline.
 *
 * - 2xx: returned as {@link RawResponse}
 * - retryable status, timeout, connection failure: {@link TransientUpstreamException}
 * - any other status: {@link UpstreamRejectedException}
 */
@Component
@Slf4j
public class UpstreamHttpClient {

    private static final int ERROR_PREVIEW_CHARS = 200;

    private final WebClient webClient;
    private final UpstreamProperties properties;

    public UpstreamHttpClient(WebClient upstreamWebClient, UpstreamProperties properties) {
        this.webClient = upstreamWebClient;
        this.properties = properties;
    }

    public RawResponse get(String path, Map<String, String> queryParams, Map<String, String> headers, Duration timeout) {
        MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
        queryParams.forEach(query::add);

        RawResponse response;
        try {
            response = webClient.get()
                    .uri(builder -> builder.path(path).queryParams(query).build())
                    .headers(h -> headers.forEach(h::set))
                    .exchangeToMono(r -> r.bodyToMono(byte[].class)
                        .defaultIfEmpty(new byte[0])
                        .map(body -> new RawResponse(r.statusCode().value(), copy(r.headers().asHttpHeaders()), body)))
                    .timeout(timeout)
                    .block();
        } catch (WebClientRequestException e) {
            log.warn("[UPSTREAM] Connection failure | path={} | error={}", path, e.getMessage());
            throw new TransientUpstreamException("Connection failure: " + e.getMessage(), 0, e);
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                log.warn("[UPSTREAM] Attempt timed out | path={} | timeoutMs={}", path, timeout.toMillis());
                throw new TransientUpstreamException("Timed out after " + timeout.toMillis() + " ms", 0, e);
            }
            throw e;
        }

        if (response == null) {
            throw new TransientUpstreamException("Empty response from upstream", 0, null);
        }
        int status = response.getStatusCode();
        if (status >= 200 && status < 300) {
            return response;
        }
        String preview = preview(response.getBody());
        if (properties.isRetryable(status)) {
            log.warn("[UPSTREAM] Retryable status | path={} | status={}", path, status);
            throw new TransientUpstreamException("Upstream returned " + status + ": " + preview, status, null);
        }
        log.warn("[UPSTREAM] Request rejected | path={} | status={} | body={}", path, status, preview);
        throw new UpstreamRejectedException(status, "Upstream returned " + status + ": " + preview);
    }

    private static HttpHeaders copy(HttpHeaders source) {
        HttpHeaders copy = new HttpHeaders();
        copy.putAll(source);
        return HttpHeaders.readOnlyHttpHeaders(copy);
    }

    private static String preview(byte[] body) {
        if (body == null || body.length == 0) {
            return "";
        }
        String text = new String(body, StandardCharsets.UTF_8);
        return text.length() > ERROR_PREVIEW_CHARS ? text.substring(0, ERROR_PREVIEW_CHARS) + "..." : text;
    }
}
