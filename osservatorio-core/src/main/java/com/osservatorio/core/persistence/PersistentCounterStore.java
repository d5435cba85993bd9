package com.osservatorio.core.persistence;

import com.osservatorio.client.ratelimit.CounterAcquisition;
import com.osservatorio.client.ratelimit.CounterStore;
import com.osservatorio.client.ratelimit.WindowUsage;
import com.osservatorio.common.exception.PersistenceException;
import com.osservatorio.common.model.RateTier;
import com.osservatorio.common.model.Subsystem;
import com.osservatorio.data.entity.RateWindowEntity;
import com.osservatorio.data.repository.RateWindowRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Counters in the {@code rate_windows} table, shared by every process using the
 * same database. All window rows of an identifier are locked for the duration of
 * one check-and-increment.
 */
@Slf4j
public class PersistentCounterStore implements CounterStore {

    private static final int TRANSACTION_TIMEOUT_SECONDS = 5;

    private final RateWindowRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate readTemplate;

    public PersistentCounterStore(RateWindowRepository repository, PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(TRANSACTION_TIMEOUT_SECONDS);
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
    }

    @Override
    public CounterAcquisition tryAcquire(String identifier, Map<RateTier, Integer> limits, long nowMillis) {
        return translate("tryAcquire", () -> {
            try {
                return transactionTemplate.execute(status -> acquireLocked(identifier, limits, nowMillis));
            } catch (DataIntegrityViolationException e) {
                // another process created the first window row for this identifier; its row is locked now
                log.debug("[RATE_LIMIT] Concurrent window creation, retrying | error={}", e.getMessage());
                return transactionTemplate.execute(status -> acquireLocked(identifier, limits, nowMillis));
            }
        });
    }

    @Override
    public Map<RateTier, WindowUsage> usage(String identifier, Map<RateTier, Integer> limits, long nowMillis) {
        return translate("usage", () -> readTemplate.execute(status ->
                toUsage(byTier(repository.findByIdentifier(identifier)), limits, nowMillis)));
    }

    @Override
    public void reset(String identifier) {
        translate("reset", () -> transactionTemplate.execute(status -> {
            repository.deleteAll(repository.findByIdentifierForUpdate(identifier));
            return null;
        }));
    }

    @Override
    public int purgeStale(long nowMillis) {
        // a window that started more than a day ago has ended for every tier
        long cutoff = nowMillis - RateTier.DAY.getWindow().toMillis();
        return translate("purgeStale", () -> repository.deleteStale(cutoff));
    }

    @Override
    public String name() {
        return "database";
    }

    private CounterAcquisition acquireLocked(String identifier, Map<RateTier, Integer> limits, long nowMillis) {
        Map<RateTier, RateWindowEntity> rows = byTier(repository.findByIdentifierForUpdate(identifier));

        boolean fits = true;
        for (Map.Entry<RateTier, Integer> entry : limits.entrySet()) {
            if (currentCount(rows.get(entry.getKey()), entry.getKey(), nowMillis) + 1 > entry.getValue()) {
                fits = false;
            }
        }

        if (fits) {
            List<RateWindowEntity> changed = new ArrayList<>();
            for (Map.Entry<RateTier, Integer> entry : limits.entrySet()) {
                RateTier tier = entry.getKey();
                RateWindowEntity row = rows.get(tier);
                int count = currentCount(row, tier, nowMillis) + 1;
                if (row == null) {
                    row = RateWindowEntity.builder()
                            .id(new RateWindowEntity.Key(identifier, tier.name()))
                            .build();
                    rows.put(tier, row);
                }
                row.setWindowStart(tier.windowStartMillis(nowMillis));
                row.setRequestCount(count);
                row.setRequestLimit(entry.getValue());
                changed.add(row);
            }
            repository.saveAll(changed);
        }
        return new CounterAcquisition(fits, toUsage(rows, limits, nowMillis));
    }

    private static Map<RateTier, WindowUsage> toUsage(Map<RateTier, RateWindowEntity> rows,
                                                      Map<RateTier, Integer> limits, long nowMillis) {
        Map<RateTier, WindowUsage> usage = new EnumMap<>(RateTier.class);
        limits.forEach((tier, limit) -> usage.put(tier, new WindowUsage(tier,
                currentCount(rows.get(tier), tier, nowMillis), limit,
                tier.windowStartMillis(nowMillis), tier.windowEndMillis(nowMillis))));
        return usage;
    }

    private static int currentCount(RateWindowEntity row, RateTier tier, long nowMillis) {
        if (row == null || row.getWindowStart() == null || row.getWindowStart() != tier.windowStartMillis(nowMillis)) {
            return 0;
        }
        return row.getRequestCount();
    }

    private static Map<RateTier, RateWindowEntity> byTier(List<RateWindowEntity> rows) {
        Map<RateTier, RateWindowEntity> byTier = new HashMap<>();
        for (RateWindowEntity row : rows) {
            byTier.put(RateTier.valueOf(row.getId().getTier()), row);
        }
        return byTier;
    }

    private static <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            throw new PersistenceException(Subsystem.COUNTERS, operation + " failed: " + e.getMessage(), e);
        }
    }
}
