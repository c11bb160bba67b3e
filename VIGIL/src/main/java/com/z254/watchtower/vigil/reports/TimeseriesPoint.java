package com.z254.watchtower.vigil.reports;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Number of incidents created in the bucket starting at {@code date} (UTC).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeseriesPoint {
    private LocalDate date;
    private long count;
}
