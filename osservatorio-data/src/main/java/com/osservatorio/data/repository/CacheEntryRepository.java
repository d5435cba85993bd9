package com.osservatorio.data.repository;

import com.osservatorio.data.entity.CacheEntryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface CacheEntryRepository extends JpaRepository<CacheEntryEntity, String> {

    /**
     * Delete entries that expired before the cutoff. Callers pass a cutoff earlier
     * than now to keep recently expired entries around for stale reads.
     */
    @Modifying
    @Transactional
    @Query("DELETE FROM CacheEntryEntity c WHERE c.expiresAt < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") Instant cutoff);

    @Query("SELECT COUNT(c) FROM CacheEntryEntity c WHERE c.expiresAt > :now")
    long countFresh(@Param("now") Instant now);
}
