package com.osservatorio.client.circuit;

import java.util.Optional;

/**
 * Optional persistence of breaker state so that an open circuit survives a restart.
 */
public interface CircuitStateStore {

    CircuitStateStore NOOP = new CircuitStateStore() {
        @Override
        public Optional<CircuitSnapshot> load(String dependency) {
            return Optional.empty();
        }

        @Override
        public void save(String dependency, CircuitSnapshot snapshot) {
            // nothing to persist
        }
    };

    Optional<CircuitSnapshot> load(String dependency);

    void save(String dependency, CircuitSnapshot snapshot);
}
