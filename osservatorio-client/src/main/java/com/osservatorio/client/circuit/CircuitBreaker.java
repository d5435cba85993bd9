package com.osservatorio.client.circuit;

import com.osservatorio.common.exception.CircuitOpenException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Per-dependency failure state machine.
 *
 * CLOSED counts consecutive failures and opens at the configured threshold.
 * OPEN rejects every call until the recovery timeout has elapsed, then hands out
 * exactly one trial call (HALF_OPEN). A successful trial closes the circuit and
 * resets the timeout; a failed trial reopens it with the timeout doubled, up to
 * the configured maximum.
 *
 * All state lives in one immutable {@link CircuitSnapshot} swapped with CAS, so
 * concurrent callers never block each other and never observe a torn state.
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final CircuitBreakerSettings settings;
    private final Clock clock;
    private final CircuitStateStore stateStore;
    private final AtomicReference<CircuitSnapshot> state;

    private final LongAdder totalCalls = new LongAdder();
    private final LongAdder successfulCalls = new LongAdder();
    private final LongAdder failedCalls = new LongAdder();
    private final LongAdder rejectedCalls = new LongAdder();

    public CircuitBreaker(String name, CircuitBreakerSettings settings, Clock clock, CircuitStateStore stateStore) {
        this.name = name;
        this.settings = settings;
        this.clock = clock;
        this.stateStore = stateStore;
        this.state = new AtomicReference<>(restore());
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerSettings getSettings() {
        return settings;
    }

    /**
     * Run the call under the breaker. Failures matching the settings' predicate
     * are counted; every exception is rethrown unchanged.
     *
     * @throws CircuitOpenException when the circuit rejects the call; the
     *                              supplier is not invoked in that case
     */
    public <T> T execute(Supplier<T> call) {
        acquirePermission();
        try {
            T result = call.get();
            onSuccess();
            return result;
        } catch (RuntimeException e) {
            onError(e);
            throw e;
        }
    }

    /**
     * Claim permission for one call. Pipelines that drive the call themselves
     * must follow up with exactly one of {@link #onSuccess()},
     * {@link #onError(Throwable)} or {@link #releasePermission()}.
     */
    public void acquirePermission() {
        if (!tryAcquirePermission()) {
            rejectedCalls.increment();
            throw new CircuitOpenException(name, retryAt());
        }
        totalCalls.increment();
    }

    public boolean tryAcquirePermission() {
        while (true) {
            CircuitSnapshot current = state.get();
            switch (current.getState()) {
                case CLOSED:
                    return true;
                case OPEN: {
                    Instant now = clock.instant();
                    if (now.isBefore(current.retryAt())) {
                        return false;
                    }
                    CircuitSnapshot trial = current.toBuilder()
                            .state(CircuitState.HALF_OPEN)
                            .trialInFlight(true)
                            .build();
                    if (transition(current, trial)) {
                        log.info("[BREAKER] Half-open, admitting trial call | dependency={}", name);
                        return true;
                    }
                    break;
                }
                case HALF_OPEN: {
                    if (current.isTrialInFlight()) {
                        return false;
                    }
                    if (state.compareAndSet(current, current.toBuilder().trialInFlight(true).build())) {
                        return true;
                    }
                    break;
                }
                default:
                    throw new IllegalStateException("Unknown circuit state " + current.getState());
            }
        }
    }

    public void onSuccess() {
        successfulCalls.increment();
        update(current -> switch (current.getState()) {
            case HALF_OPEN -> CircuitSnapshot.closed(settings.getRecoveryTimeoutBase());
            case CLOSED -> current.getFailureCount() == 0
                    ? current
                    : current.toBuilder().failureCount(0).build();
            // late success from a call admitted before the circuit opened
            case OPEN -> current;
        });
    }

    public void onError(Throwable error) {
        if (!settings.getRecordFailure().test(error)) {
            releasePermission();
            return;
        }
        failedCalls.increment();
        Instant now = clock.instant();
        update(current -> switch (current.getState()) {
            case CLOSED -> {
                int failures = current.getFailureCount() + 1;
                if (failures >= settings.getFailureThreshold()) {
                    yield CircuitSnapshot.builder()
                            .state(CircuitState.OPEN)
                            .failureCount(failures)
                            .openedAt(now)
                            .recoveryTimeout(settings.getRecoveryTimeoutBase())
                            .build();
                }
                yield current.toBuilder().failureCount(failures).build();
            }
            case HALF_OPEN -> CircuitSnapshot.builder()
                    .state(CircuitState.OPEN)
                    .failureCount(current.getFailureCount() + 1)
                    .openedAt(now)
                    .recoveryTimeout(settings.nextRecoveryTimeout(current.getRecoveryTimeout()))
                    .build();
            case OPEN -> current;
        });
    }

    /**
     * Give back a permission that was not used to contact the dependency, for
     * example because a later gate rejected the call. Frees the half-open trial slot.
     */
    public void releasePermission() {
        update(current -> current.getState() == CircuitState.HALF_OPEN && current.isTrialInFlight()
                ? current.toBuilder().trialInFlight(false).build()
                : current);
    }

    /**
     * Force the circuit closed. Administrative override.
     */
    public void reset() {
        CircuitSnapshot closed = CircuitSnapshot.closed(settings.getRecoveryTimeoutBase());
        CircuitSnapshot previous = state.getAndSet(closed);
        if (previous.getState() != CircuitState.CLOSED) {
            log.info("[BREAKER] Manually reset | dependency={} | previousState={}", name, previous.getState());
        }
        persist(closed);
    }

    public CircuitSnapshot snapshot() {
        return state.get();
    }

    public CircuitState getState() {
        return state.get().getState();
    }

    public CircuitStats stats() {
        CircuitSnapshot current = state.get();
        return CircuitStats.builder()
                .dependency(name)
                .state(current.getState())
                .failureCount(current.getFailureCount())
                .recoveryTimeout(current.getRecoveryTimeout())
                .retryAt(current.retryAt())
                .totalCalls(totalCalls.sum())
                .successfulCalls(successfulCalls.sum())
                .failedCalls(failedCalls.sum())
                .rejectedCalls(rejectedCalls.sum())
                .build();
    }

    private Instant retryAt() {
        CircuitSnapshot current = state.get();
        Instant retryAt = current.retryAt();
        return retryAt != null ? retryAt : clock.instant();
    }

    private void update(UnaryOperator<CircuitSnapshot> change) {
        while (true) {
            CircuitSnapshot current = state.get();
            CircuitSnapshot next = change.apply(current);
            if (next == current || transition(current, next)) {
                return;
            }
        }
    }

    private boolean transition(CircuitSnapshot from, CircuitSnapshot to) {
        if (!state.compareAndSet(from, to)) {
            return false;
        }
        if (from.getState() != to.getState()) {
            if (to.getState() == CircuitState.OPEN) {
                log.warn("[BREAKER] Circuit opened | dependency={} | failures={} | recoveryTimeoutMs={}",
                        name, to.getFailureCount(), to.getRecoveryTimeout().toMillis());
            } else if (to.getState() == CircuitState.CLOSED) {
                log.info("[BREAKER] Circuit closed | dependency={}", name);
            }
            persist(to);
        }
        return true;
    }

    private void persist(CircuitSnapshot snapshot) {
        try {
            stateStore.save(name, snapshot);
        } catch (RuntimeException e) {
            log.warn("[BREAKER] Could not persist circuit state | dependency={} | error={}", name, e.getMessage());
        }
    }

    private CircuitSnapshot restore() {
        try {
            return stateStore.load(name)
                    .map(saved -> saved.getState() == CircuitState.HALF_OPEN
                    // the trial was lost with the previous process; let the next caller retry it
                        ? saved.toBuilder().state(CircuitState.OPEN).trialInFlight(false).build()
                        : saved)
                    .orElseGet(() -> CircuitSnapshot.closed(settings.getRecoveryTimeoutBase()));
        } catch (RuntimeException e) {
            log.warn("[BREAKER] Could not restore circuit state, starting closed | dependency={} | error={}",
                    name, e.getMessage());
            return CircuitSnapshot.closed(settings.getRecoveryTimeoutBase());
        }
    }
}
