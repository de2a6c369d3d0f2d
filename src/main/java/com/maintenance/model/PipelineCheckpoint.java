package com.maintenance.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted pipeline checkpoint.
 *
 * One row per pipeline name; lastProcessed is the exclusive upper bound of
 * the last feature window that was fully loaded.
 */
@Entity
@Table(name = "pipeline_checkpoints")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineCheckpoint {

    @Id
    @Column(length = 100)
    private String name;

    @Column(nullable = false)
    private Instant lastProcessed;

    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;
}
