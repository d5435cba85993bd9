package com.osservatorio.core.config;

import com.osservatorio.client.circuit.CircuitBreakerRegistry;
import com.osservatorio.client.circuit.CircuitStateStore;
import com.osservatorio.client.ratelimit.AdaptiveLimitController;
import com.osservatorio.client.ratelimit.BlockList;
import com.osservatorio.client.ratelimit.CounterStore;
import com.osservatorio.client.ratelimit.FailoverCounterStore;
import com.osservatorio.client.ratelimit.InMemoryCounterStore;
import com.osservatorio.client.ratelimit.RateLimitProperties;
import com.osservatorio.client.ratelimit.RateLimiter;
import com.osservatorio.client.ratelimit.RedisCounterStore;
import com.osservatorio.client.retry.RetryPolicy;
import com.osservatorio.client.retry.Sleeper;
import com.osservatorio.client.threat.ThreatProperties;
import com.osservatorio.client.threat.ThreatScorer;
import com.osservatorio.core.persistence.PersistentBlockStore;
import com.osservatorio.core.persistence.PersistentCircuitStateStore;
import com.osservatorio.core.persistence.PersistentCounterStore;
import com.osservatorio.data.metadata.MetadataStoreAdapter;
import com.osservatorio.data.repository.BlockEntryRepository;
import com.osservatorio.data.repository.CircuitStateRepository;
import com.osservatorio.data.repository.RateWindowRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;

/**
 * Wires the breaker registry, the threat scorer and the rate limiter with the
 * counter backend selected by {@code osservatorio.rate-limit.backend}.
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(ResilienceProperties properties,
                                                         CircuitStateRepository circuitStateRepository,
                                                         Clock clock) {
        CircuitStateStore stateStore = properties.getCircuitBreaker().isPersistState()
                ? new PersistentCircuitStateStore(circuitStateRepository)
                : CircuitStateStore.NOOP;
        return new CircuitBreakerRegistry(properties.getCircuitBreaker().toSettings(), clock, stateStore);
    }

    @Bean
    public RetryPolicy retryPolicy(ResilienceProperties properties) {
        return properties.getRetry().toPolicy();
    }

    @Bean
    public ThreatScorer threatScorer(ThreatProperties properties, Clock clock) {
        return new ThreatScorer(properties, clock);
    }

    @Bean
    public BlockList blockList(BlockEntryRepository blockEntryRepository, MetadataStoreAdapter metadataStore,
                               Clock clock) {
        return new BlockList(new PersistentBlockStore(blockEntryRepository, metadataStore), clock);
    }

    @Bean
    public AdaptiveLimitController adaptiveLimitController(RateLimitProperties properties) {
        return new AdaptiveLimitController(properties.getAdaptive());
    }

    /**
     * Chosen once at startup. While Redis is unreachable its counters fall back
     * to windows in the local metadata database, so a restart during an outage
     * keeps them; the database backend falls back to process memory.
     */
    @Bean
    public CounterStore counterStore(RateLimitProperties properties,
                                     ObjectProvider<StringRedisTemplate> redisTemplate,
                                     RateWindowRepository rateWindowRepository,
                                     @Qualifier("transactionManager") PlatformTransactionManager transactionManager,
                                     Clock clock) {
        CounterStore store = switch (properties.getBackend()) {
            case LOCAL -> new InMemoryCounterStore();
            case REDIS -> new FailoverCounterStore(
                    new RedisCounterStore(redisTemplate.getObject(), properties.getRedisKeyPrefix(), clock),
                    new PersistentCounterStore(rateWindowRepository, transactionManager),
                    properties.getSharedRecheckInterval(), clock);
            case DATABASE -> new FailoverCounterStore(
                    new PersistentCounterStore(rateWindowRepository, transactionManager),
                    new InMemoryCounterStore(), properties.getSharedRecheckInterval(), clock);
        };
        log.info("[RATE_LIMIT] Counter backend selected | backend={} | store={}", properties.getBackend(), store.name());
        return store;
    }

    @Bean
    public RateLimiter rateLimiter(RateLimitProperties properties,
                                   CounterStore counterStore,
                                   ThreatScorer threatScorer,
                                   AdaptiveLimitController adaptiveLimitController,
                                   BlockList blockList,
                                   Clock clock) {
        return new RateLimiter(properties, counterStore, threatScorer, adaptiveLimitController, blockList, clock);
    }
}
