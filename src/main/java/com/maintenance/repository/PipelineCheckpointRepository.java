package com.maintenance.repository;

import com.maintenance.model.PipelineCheckpoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PipelineCheckpointRepository extends JpaRepository<PipelineCheckpoint, String> {
}
