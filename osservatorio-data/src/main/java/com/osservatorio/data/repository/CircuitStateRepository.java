package com.osservatorio.data.repository;

import com.osservatorio.data.entity.CircuitStateEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CircuitStateRepository extends JpaRepository<CircuitStateEntity, String> {
}
