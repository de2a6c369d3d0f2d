package com.maintenance.repository;

import com.maintenance.model.TrainingFeature;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface TrainingFeatureRepository extends JpaRepository<TrainingFeature, Long> {

    Optional<TrainingFeature> findByMachineIdAndWindowStartAndWindowEnd(String machineId, Instant windowStart, Instant windowEnd);

    /**
     * Most recent row of a machine whose window ended at or before {@code notAfter}.
     */
    Optional<TrainingFeature> findFirstByMachineIdAndWindowEndLessThanEqualOrderByWindowEndDesc(String machineId, Instant notAfter);

    List<TrainingFeature> findByMachineIdOrderByWindowStartAsc(String machineId);
}
