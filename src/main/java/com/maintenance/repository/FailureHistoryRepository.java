package com.maintenance.repository;

import com.maintenance.model.FailureHistoryEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for recorded failures.
 */
@Repository
public interface FailureHistoryRepository extends JpaRepository<FailureHistoryEntry, Long> {

    /**
     * Failures within a time window. Start is inclusive, end is exclusive.
     */
    @Query("SELECT f FROM FailureHistoryEntry f WHERE f.eventTime >= :start AND f.eventTime < :end " +
           "ORDER BY f.eventTime, f.id")
    List<FailureHistoryEntry> findInTimeRange(
        @Param("start") Instant start,
        @Param("end") Instant end
    );
}
