package com.z254.watchtower.vigil.reports;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time KPIs over a filtered incident population.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KpiSnapshot {

    private long openCount;
    private long resolvedCount;
    private long closedCount;
    private MttrStats mttrSeconds;
    /** Percentage with one decimal, null when nothing was resolved */
    private Double slaCompliancePct;

    /**
     * Mean time to resolve in seconds. All fields are null when no incident was resolved.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MttrStats {
        private Double avg;
        private Double median;
        private Double p90;

        public static MttrStats empty() {
            return new MttrStats();
        }
    }
}
