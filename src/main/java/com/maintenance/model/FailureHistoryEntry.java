package com.maintenance.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A recorded machine failure, used to label features of the preceding window.
 */
@Entity
@Table(name = "failure_history", indexes = {
    @Index(name = "idx_failure_time", columnList = "eventTime"),
    @Index(name = "idx_failure_machine_time", columnList = "machineId,eventTime")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailureHistoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50)
    private String machineId;

    @Column(nullable = false)
    private Instant eventTime;

    @Column(nullable = false, length = 100)
    private String failureCode;

    /**
     * Reading that triggered the failure, when the reporter sent one.
     */
    private Double measuredValue;

    @Column(nullable = false)
    private Instant receivedTime;
}
