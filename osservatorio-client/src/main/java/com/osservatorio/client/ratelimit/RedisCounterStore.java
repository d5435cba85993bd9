package com.osservatorio.client.ratelimit;

import com.osservatorio.common.model.RateTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Shared counters in Redis. One key per identifier, tier and window start:
 * {@code rl:{identifier}:MINUTE:1700000040000}. The hash tag keeps all keys of an
 * identifier on one cluster slot so the check-and-increment script can touch
 * them atomically. Keys expire shortly after their window ends.
 */
@Slf4j
public class RedisCounterStore implements CounterStore {

    // Returns {allowed, count_1, ..., count_n}; increments only when every tier fits
    private static final String ACQUIRE_SCRIPT = """
        local n = #KEYS
        local counts = {}
        local allowed = 1
        for i = 1, n do
          counts[i] = tonumber(redis.call('GET', KEYS[i]) or '0')
          if counts[i] + 1 > tonumber(ARGV[i]) then
            allowed = 0
          end
        end
        if allowed == 1 then
          for i = 1, n do
            counts[i] = redis.call('INCR', KEYS[i])
            redis.call('PEXPIRE', KEYS[i], ARGV[n + i])
          end
        end
        local result = {allowed}
        for i = 1, n do
          result[i + 1] = counts[i]
        end
        return result
        """;

    private static final long EXPIRY_GRACE_MS = 1_000;

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final Clock clock;
    @SuppressWarnings("rawtypes")
    private final DefaultRedisScript<List> acquireScript;

    public RedisCounterStore(StringRedisTemplate redisTemplate, String keyPrefix, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
        this.clock = clock;
        this.acquireScript = new DefaultRedisScript<>(ACQUIRE_SCRIPT, List.class);
    }

    @Override
    public CounterAcquisition tryAcquire(String identifier, Map<RateTier, Integer> limits, long nowMillis) {
        List<RateTier> tiers = new ArrayList<>(limits.keySet());
        List<String> keys = new ArrayList<>(tiers.size());
        Object[] args = new Object[tiers.size() * 2];
        for (int i = 0; i < tiers.size(); i++) {
            RateTier tier = tiers.get(i);
            keys.add(key(identifier, tier, nowMillis));
            args[i] = String.valueOf(limits.get(tier));
            long ttl = tier.windowEndMillis(nowMillis) - nowMillis + EXPIRY_GRACE_MS;
            args[tiers.size() + i] = String.valueOf(ttl);
        }

        List<?> result = redisTemplate.execute(acquireScript, keys, args);
        if (result == null || result.size() != tiers.size() + 1) {
            throw new IllegalStateException("Unexpected rate limit script result: " + result);
        }

        boolean acquired = ((Number) result.get(0)).longValue() == 1L;
        Map<RateTier, WindowUsage> usage = new EnumMap<>(RateTier.class);
        for (int i = 0; i < tiers.size(); i++) {
            RateTier tier = tiers.get(i);
            int count = ((Number) result.get(i + 1)).intValue();
            usage.put(tier, new WindowUsage(tier, count, limits.get(tier),
                    tier.windowStartMillis(nowMillis), tier.windowEndMillis(nowMillis)));
        }
        return new CounterAcquisition(acquired, usage);
    }

    @Override
    public Map<RateTier, WindowUsage> usage(String identifier, Map<RateTier, Integer> limits, long nowMillis) {
        List<RateTier> tiers = new ArrayList<>(limits.keySet());
        List<String> keys = tiers.stream().map(t -> key(identifier, t, nowMillis)).toList();
        List<String> values = redisTemplate.opsForValue().multiGet(keys);

        Map<RateTier, WindowUsage> usage = new EnumMap<>(RateTier.class);
        for (int i = 0; i < tiers.size(); i++) {
            RateTier tier = tiers.get(i);
            String raw = values != null ? values.get(i) : null;
            int count = raw != null ? Integer.parseInt(raw) : 0;
            usage.put(tier, new WindowUsage(tier, count, limits.get(tier),
                    tier.windowStartMillis(nowMillis), tier.windowEndMillis(nowMillis)));
        }
        return usage;
    }

    @Override
    public void reset(String identifier) {
        long now = clock.millis();
        List<String> keys = new ArrayList<>();
        for (RateTier tier : RateTier.values()) {
            keys.add(key(identifier, tier, now));
        }
        redisTemplate.delete(keys);
    }

    @Override
    public int purgeStale(long nowMillis) {
        // keys carry their own expiry
        return 0;
    }

    @Override
    public String name() {
        return "redis";
    }

    String key(String identifier, RateTier tier, long nowMillis) {
        return keyPrefix + ":{" + identifier + "}:" + tier.name() + ":" + tier.windowStartMillis(nowMillis);
    }
}
