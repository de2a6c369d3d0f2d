package com.maintenance.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Row of the training corpus: the features of one machine for one feature window.
 *
 * (machineId, windowStart, windowEnd) is unique so a replayed window
 * replaces its rows rather than adding duplicates. Each row also keeps the
 * unrounded EMA and rolling maximum reached at the end of its window; the run
 * for the following window continues the recurrences from there.
 */
@Entity
@Table(name = "training_features",
    uniqueConstraints = @UniqueConstraint(name = "uk_training_machine_window",
        columnNames = {"machineId", "windowStart", "windowEnd"}),
    indexes = {
        @Index(name = "idx_training_window", columnList = "windowStart,windowEnd"),
        @Index(name = "idx_training_machine_end", columnList = "machineId,windowEnd")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingFeature {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50)
    private String machineId;

    @Column(nullable = false)
    private Instant windowStart;

    @Column(nullable = false)
    private Instant windowEnd;

    @Column(nullable = false)
    private Instant timestampProcessed;

    @Column(name = "vib_media_5h", nullable = false)
    private Double vibMedia5h;

    @Column(name = "temp_max_24h", nullable = false)
    private Double tempMax24h;

    @Column(nullable = false)
    private Long labelHorizonHours;

    @Column(nullable = false)
    private Integer labelFailure;

    @Column(nullable = false)
    private Double emaVibration;

    @Column(nullable = false)
    private Double rollingMaxTemp;

    @Column(nullable = false)
    private Instant rollingMaxAsOf;
}
