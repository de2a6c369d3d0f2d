package com.maintenance.repository;

import com.maintenance.model.ServingFeature;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Keyed serving store, one row per machine.
 */
@Repository
public interface ServingFeatureRepository extends JpaRepository<ServingFeature, String> {

    List<ServingFeature> findAllByOrderByMachineIdAsc();
}
