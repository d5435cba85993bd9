package com.osservatorio.data.repository;

import com.osservatorio.common.model.DatasetStatus;
import com.osservatorio.data.entity.DatasetRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DatasetRecordRepository extends JpaRepository<DatasetRecord, String> {

    List<DatasetRecord> findByStatusOrderByPriorityDescNameAsc(DatasetStatus status);

    List<DatasetRecord> findByCategoryAndStatusOrderByPriorityDescNameAsc(String category, DatasetStatus status);

    List<DatasetRecord> findByCategoryOrderByPriorityDescNameAsc(String category);

    List<DatasetRecord> findAllByOrderByPriorityDescNameAsc();

    long countByStatus(DatasetStatus status);

    /**
     * Row counts per status, as (status, count) pairs.
     */
    @Query("SELECT d.status, COUNT(d) FROM DatasetRecord d GROUP BY d.status")
    List<Object[]> countGroupedByStatus();

    @Query("SELECT COUNT(DISTINCT d.category) FROM DatasetRecord d WHERE d.status = :status")
    long countCategoriesByStatus(@Param("status") DatasetStatus status);
}
