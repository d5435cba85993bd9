package com.osservatorio.client.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

/**
 * WebClient for the statistical API.
 *
 * - Bounded, shared connection pool
 * - Connect and response timeouts
 * - Larger in-memory buffer for SDMX payloads
 */
@Configuration
public class WebClientConfig {

    @Bean(destroyMethod = "dispose")
    public ConnectionProvider upstreamConnectionProvider(UpstreamProperties properties) {
        return ConnectionProvider.builder(properties.getName())
                .maxConnections(properties.getMaxConnections())
                .pendingAcquireTimeout(Duration.ofSeconds(properties.getPendingAcquireTimeoutSeconds()))
                .maxIdleTime(Duration.ofSeconds(properties.getMaxIdleSeconds()))
                .build();
    }

    @Bean
    public WebClient upstreamWebClient(UpstreamProperties properties, ConnectionProvider upstreamConnectionProvider) {
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer
                    .defaultCodecs()
                    .maxInMemorySize(properties.getMaxInMemorySizeMb() * 1024 * 1024))
                .build();

        HttpClient httpClient = HttpClient.create(upstreamConnectionProvider)
                .responseTimeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, properties.getConnectTimeoutMs());

        return WebClient.builder()
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, properties.getUserAgent())
                .defaultHeaders(headers -> properties.getHeaders().forEach(headers::set))
                .exchangeStrategies(strategies)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
