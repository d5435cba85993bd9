package com.osservatorio.data.repository;

import com.osservatorio.data.entity.BlockEntryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface BlockEntryRepository extends JpaRepository<BlockEntryEntity, String> {

    List<BlockEntryEntity> findByExpiresAtAfter(Instant now);

    @Modifying
    @Transactional
    @Query("DELETE FROM BlockEntryEntity b WHERE b.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
