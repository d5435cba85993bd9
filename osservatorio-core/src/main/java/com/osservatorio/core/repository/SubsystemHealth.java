package com.osservatorio.core.repository;

import com.osservatorio.common.exception.PersistenceException;
import com.osservatorio.common.model.Subsystem;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Availability of one store as seen by the repository. A store is marked
 * degraded when one of its operations fails with a {@link PersistenceException}
 * and restored by the next successful recheck. Rechecks of a degraded store run at
 * most once per recheck interval unless forced.
 */
@Slf4j
class SubsystemHealth {

    private final Subsystem subsystem;
    private final Runnable recheck;
    private final Duration recheckInterval;
    private final Clock clock;

    private boolean healthy = true;
    private String lastError;
    private Instant degradedSince;
    private Instant lastCheck;

    SubsystemHealth(Subsystem subsystem, Runnable recheck, Duration recheckInterval, Clock clock) {
        this.subsystem = subsystem;
        this.recheck = recheck;
        this.recheckInterval = recheckInterval;
        this.clock = clock;
    }

    synchronized boolean isHealthy() {
        return healthy;
    }

    synchronized void markDegraded(Throwable cause) {
        lastError = cause.getMessage();
        if (healthy) {
            healthy = false;
            degradedSince = clock.instant();
            lastCheck = degradedSince;
            log.warn("[REPOSITORY] Store degraded | subsystem={} | error={}", subsystem, lastError);
        }
    }

    /**
     * @throws PersistenceException when the store is degraded and a recheck does not restore it
     */
    void requireAvailable() {
        if (!checkAvailable(false)) {
            throw new PersistenceException(subsystem, "Store unavailable: " + lastError());
        }
    }

    boolean checkAvailable(boolean force) {
        synchronized (this) {
            if (healthy) {
                return true;
            }
            Instant now = clock.instant();
            if (!force && lastCheck != null && now.isBefore(lastCheck.plus(recheckInterval))) {
                return false;
            }
            lastCheck = now;
        }
        try {
            recheck.run();
        } catch (RuntimeException e) {
            synchronized (this) {
                lastError = e.getMessage();
            }
            log.debug("[REPOSITORY] Recheck failed | subsystem={} | error={}", subsystem, e.getMessage());
            return false;
        }
        synchronized (this) {
            if (!healthy) {
                log.info("[REPOSITORY] Store recovered | subsystem={} | degradedSince={}", subsystem, degradedSince);
            }
            healthy = true;
            lastError = null;
            degradedSince = null;
        }
        return true;
    }

    synchronized SubsystemStatus toStatus() {
        return SubsystemStatus.builder()
                .subsystem(subsystem)
                .healthy(healthy)
                .lastError(lastError)
                .degradedSince(degradedSince)
                .lastCheck(lastCheck)
                .build();
    }

    private synchronized String lastError() {
        return lastError;
    }
}
