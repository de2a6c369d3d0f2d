package com.maintenance.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response for telemetry batch ingestion.
 *
 * Tracks:
 * - accepted: events written to the data lake
 * - rejected: invalid events, with a reason per event index
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchIngestResponse {

    private int accepted;
    private int rejected;

    @Builder.Default
    private List<RejectionDetail> rejections = new ArrayList<>();

    /**
     * Files written, relative to the bucket.
     */
    @Builder.Default
    private List<String> files = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RejectionDetail {
        private int index;
        private String machineId;
        private String reason;
    }
}
