package com.z254.watchtower.vigil.reports.export;

import com.z254.watchtower.vigil.domain.model.IncidentStatus;
import com.z254.watchtower.vigil.domain.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One incident flattened for tabular export. Team, service and people are display labels.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportRow {

    public static final List<String> COLUMNS = List.of(
            "id", "createdAt", "title", "severity", "status", "team", "service", "assignee", "reporter",
            "mttrSeconds", "slaTargetSeconds", "slaMet", "resolvedAt", "closedAt", "categories", "tags");

    static final String LIST_SEPARATOR = ";";

    private String id;
    private Instant createdAt;
    private String title;
    private Severity severity;
    private IncidentStatus status;
    private String team;
    private String service;
    private String assignee;
    private String reporter;
    /** Whole seconds from creation to first resolution */
    private Long mttrSeconds;
    private Long slaTargetSeconds;
    private Boolean slaMet;
    private Instant resolvedAt;
    private Instant closedAt;
    private List<String> categories;
    private List<String> tags;

    /**
     * Cell values in {@link #COLUMNS} order; absent values are null.
     */
    public List<String> cells() {
        List<String> cells = new ArrayList<>(COLUMNS.size());
        cells.add(id);
        cells.add(text(createdAt));
        cells.add(title);
        cells.add(text(severity));
        cells.add(text(status));
        cells.add(team);
        cells.add(service);
        cells.add(assignee);
        cells.add(reporter);
        cells.add(text(mttrSeconds));
        cells.add(text(slaTargetSeconds));
        cells.add(text(slaMet));
        cells.add(text(resolvedAt));
        cells.add(text(closedAt));
        cells.add(categories == null ? null : String.join(LIST_SEPARATOR, categories));
        cells.add(tags == null ? null : String.join(LIST_SEPARATOR, tags));
        return cells;
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
