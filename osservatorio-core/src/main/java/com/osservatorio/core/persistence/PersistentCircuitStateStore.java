package com.osservatorio.core.persistence;

import com.osservatorio.client.circuit.CircuitSnapshot;
import com.osservatorio.client.circuit.CircuitState;
import com.osservatorio.client.circuit.CircuitStateStore;
import com.osservatorio.common.exception.PersistenceException;
import com.osservatorio.common.model.Subsystem;
import com.osservatorio.data.entity.CircuitStateEntity;
import com.osservatorio.data.repository.CircuitStateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;

import java.time.Duration;
import java.util.Optional;

/**
 * Keeps breaker state in {@code circuit_states} so an open circuit stays open
 * across a restart.
 */
@RequiredArgsConstructor
public class PersistentCircuitStateStore implements CircuitStateStore {

    private final CircuitStateRepository repository;

    @Override
    public Optional<CircuitSnapshot> load(String dependency) {
        try {
            return repository.findById(dependency).map(PersistentCircuitStateStore::toSnapshot);
        } catch (DataAccessException e) {
            throw new PersistenceException(Subsystem.METADATA, "Loading circuit state failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void save(String dependency, CircuitSnapshot snapshot) {
        try {
            repository.save(CircuitStateEntity.builder()
                    .dependencyName(dependency)
                    .state(snapshot.getState().name())
                    .failureCount(snapshot.getFailureCount())
                    .openedAt(snapshot.getOpenedAt())
                    .recoveryTimeoutMs(snapshot.getRecoveryTimeout().toMillis())
                    .build());
        } catch (DataAccessException e) {
            throw new PersistenceException(Subsystem.METADATA, "Saving circuit state failed: " + e.getMessage(), e);
        }
    }

    private static CircuitSnapshot toSnapshot(CircuitStateEntity entity) {
        return CircuitSnapshot.builder()
                .state(CircuitState.valueOf(entity.getState()))
                .failureCount(entity.getFailureCount())
                .openedAt(entity.getOpenedAt())
                .recoveryTimeout(Duration.ofMillis(entity.getRecoveryTimeoutMs()))
                .build();
    }
}
