package com.osservatorio.data.repository;

import com.osservatorio.data.entity.RateWindowEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface RateWindowRepository extends JpaRepository<RateWindowEntity, RateWindowEntity.Key> {

    /**
     * Lock every window row of an identifier for the duration of the caller's
     * transaction, so that check-and-increment across tiers is atomic between
     * processes sharing the database.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM RateWindowEntity w WHERE w.id.identifier = :identifier")
    List<RateWindowEntity> findByIdentifierForUpdate(@Param("identifier") String identifier);

    @Query("SELECT w FROM RateWindowEntity w WHERE w.id.identifier = :identifier")
    List<RateWindowEntity> findByIdentifier(@Param("identifier") String identifier);

    @Modifying
    @Transactional
    @Query("DELETE FROM RateWindowEntity w WHERE w.windowStart < :cutoffMillis")
    int deleteStale(@Param("cutoffMillis") long cutoffMillis);
}
