package com.osservatorio.data.repository;

import com.osservatorio.data.entity.ApiCredential;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ApiCredentialRepository extends JpaRepository<ApiCredential, Long> {

    Optional<ApiCredential> findByServiceName(String serviceName);

    Optional<ApiCredential> findByServiceNameAndActiveTrue(String serviceName);
}
