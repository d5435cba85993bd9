package com.osservatorio.client.ratelimit;

import com.osservatorio.common.model.RateTier;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SuppressWarnings("unchecked")
class RedisCounterStoreTest {

    private static final long NOW = Instant.parse("2024-05-01T08:00:00.250Z").toEpochMilli();

    private final StringRedisTemplate redis = mock(StringRedisTemplate.class);
    private final RedisCounterStore store = new RedisCounterStore(redis, "rl",
            Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));

    private static Map<RateTier, Integer> limits() {
        Map<RateTier, Integer> limits = new EnumMap<>(RateTier.class);
        limits.put(RateTier.BURST, 10);
        limits.put(RateTier.MINUTE, 60);
        return limits;
    }

    @Test
    void keysAreHashTaggedPerIdentifierAndAlignedToTheWindow() {
        assertThat(store.key("client-1", RateTier.MINUTE, NOW))
                .isEqualTo("rl:{client-1}:MINUTE:" + Instant.parse("2024-05-01T08:00:00Z").toEpochMilli());
    }

    @Test
    void parsesScriptResultIntoWindowUsage() {
        when(redis.execute(any(RedisScript.class), anyList(), any(), any(), any(), any()))
                .thenReturn(List.of(1L, 3L, 17L));

        CounterAcquisition acquisition = store.tryAcquire("client-1", limits(), NOW);

        assertThat(acquisition.isAcquired()).isTrue();
        assertThat(acquisition.getWindows().get(RateTier.BURST).getCount()).isEqualTo(3);
        assertThat(acquisition.getWindows().get(RateTier.MINUTE).getCount()).isEqualTo(17);

        ArgumentCaptor<List<String>> keys = ArgumentCaptor.forClass(List.class);
        // limits, then expiries: the burst window ends 750 ms from now, plus one second of grace
        verify(redis).execute(any(RedisScript.class), keys.capture(), eq("10"), eq("60"), eq("1750"), eq("60750"));
        assertThat(keys.getValue()).hasSize(2).allSatisfy(k -> assertThat(k).startsWith("rl:{client-1}:"));
    }

    @Test
    void deniedScriptResultIsNotAcquired() {
        when(redis.execute(any(RedisScript.class), anyList(), any(), any(), any(), any()))
                .thenReturn(List.of(0L, 10L, 40L));

        CounterAcquisition acquisition = store.tryAcquire("client-1", limits(), NOW);

        assertThat(acquisition.isAcquired()).isFalse();
        assertThat(acquisition.bindingDenial()).get().extracting(WindowUsage::getTier).isEqualTo(RateTier.BURST);
    }

    @Test
    void malformedScriptResultIsAnError() {
        when(redis.execute(any(RedisScript.class), anyList(), any(), any(), any(), any()))
                .thenReturn(List.of(1L));

        assertThatThrownBy(() -> store.tryAcquire("client-1", limits(), NOW))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void usageReadsCurrentWindowKeys() {
        ValueOperations<String, String> ops = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(ops);
        when(ops.multiGet(anyList())).thenReturn(Arrays.asList("4", null));

        Map<RateTier, WindowUsage> usage = store.usage("client-1", limits(), NOW);

        assertThat(usage.get(RateTier.BURST).getCount()).isEqualTo(4);
        assertThat(usage.get(RateTier.MINUTE).getCount()).isZero();
    }

    @Test
    void resetDeletesTheKeysOfTheCurrentWindows() {
        store.reset("client-1");

        ArgumentCaptor<List<String>> keys = ArgumentCaptor.forClass(List.class);
        verify(redis).delete(keys.capture());
        assertThat(keys.getValue())
                .hasSize(RateTier.values().length)
                .contains(store.key("client-1", RateTier.MINUTE, NOW), store.key("client-1", RateTier.DAY, NOW));
    }
}
