package com.z254.watchtower.vigil.reports.export;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

import java.time.Instant;
import java.util.List;

/**
 * Format-independent document handed to a {@link DocumentRenderer}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportDocument {

    private String title;
    private Instant generatedAt;
    @Singular
    private List<Section> sections;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Section {
        private String heading;
        @Singular
        private List<String> lines;
    }
}
