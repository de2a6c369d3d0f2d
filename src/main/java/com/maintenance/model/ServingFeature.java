package com.maintenance.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Latest features of a machine, as read by the dashboard and inference.
 */
@Entity
@Table(name = "serving_features")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServingFeature {

    @Id
    @Column(length = 50)
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

    @Version
    private Long version;
}
