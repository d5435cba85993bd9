package com.osservatorio.client.http;

import com.osservatorio.client.config.UpstreamProperties;
import com.osservatorio.common.exception.TransientUpstreamException;
import com.osservatorio.common.exception.UpstreamRejectedException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UpstreamHttpClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private UpstreamHttpClient client(ExchangeFunction exchange) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://upstream.test/rest")
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return exchange.exchange(request);
                })
                .build();
        return new UpstreamHttpClient(webClient, new UpstreamProperties());
    }

    private static ExchangeFunction respond(HttpStatus status, String body) {
        return request -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_XML_VALUE)
                .body(body)
                .build());
    }

    @Test
    void successfulResponseCarriesBodyAndHeaders() {
        UpstreamHttpClient client = client(respond(HttpStatus.OK, "<data/>"));

        RawResponse response = client.get("/data/101_12", Map.of("startPeriod", "2020"),
                Map.of("Accept", "application/xml"), TIMEOUT);

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(new String(response.getBody(), StandardCharsets.UTF_8)).isEqualTo("<data/>");
        assertThat(response.contentType()).startsWith("application/xml");
        assertThat(lastRequest.get().url().toString())
                .isEqualTo("http://upstream.test/rest/data/101_12?startPeriod=2020");
        assertThat(lastRequest.get().headers().getFirst("Accept")).isEqualTo("application/xml");
    }

    @Test
    void emptyBodyBecomesEmptyArray() {
        UpstreamHttpClient client = client(request -> Mono.just(ClientResponse.create(HttpStatus.NO_CONTENT).build()));

        RawResponse response = client.get("/data/x", Map.of(), Map.of(), TIMEOUT);

        assertThat(response.getBody()).isEmpty();
    }

    @Test
    void retryableStatusIsTransient() {
        UpstreamHttpClient client = client(respond(HttpStatus.SERVICE_UNAVAILABLE, "maintenance"));

        assertThatThrownBy(() -> client.get("/data/x", Map.of(), Map.of(), TIMEOUT))
                .isInstanceOf(TransientUpstreamException.class)
                .satisfies(e -> assertThat(((TransientUpstreamException) e).getStatusCode()).isEqualTo(503));
    }

    @Test
    void tooManyRequestsIsTransient() {
        UpstreamHttpClient client = client(respond(HttpStatus.TOO_MANY_REQUESTS, ""));

        assertThatThrownBy(() -> client.get("/data/x", Map.of(), Map.of(), TIMEOUT))
                .isInstanceOf(TransientUpstreamException.class);
    }

    @Test
    void clientErrorIsRejected() {
        UpstreamHttpClient client = client(respond(HttpStatus.NOT_FOUND, "NoResultsFound"));

        assertThatThrownBy(() -> client.get("/data/missing", Map.of(), Map.of(), TIMEOUT))
                .isInstanceOf(UpstreamRejectedException.class)
                .hasMessageContaining("404")
                .hasMessageContaining("NoResultsFound");
    }

    @Test
    void connectionFailureIsTransient() {
        UpstreamHttpClient client = client(request -> Mono.error(new WebClientRequestException(
                new ConnectException("Connection refused"), HttpMethod.GET, URI.create("http://upstream.test"),
                new HttpHeaders())));

        assertThatThrownBy(() -> client.get("/data/x", Map.of(), Map.of(), TIMEOUT))
                .isInstanceOf(TransientUpstreamException.class)
                .satisfies(e -> assertThat(((TransientUpstreamException) e).hasStatus()).isFalse());
    }

    @Test
    void slowAttemptTimesOut() {
        UpstreamHttpClient client = client(request -> Mono.never());

        assertThatThrownBy(() -> client.get("/data/x", Map.of(), Map.of(), Duration.ofMillis(100)))
                .isInstanceOf(TransientUpstreamException.class)
                .hasMessageContaining("Timed out");
    }
}
