package com.z254.watchtower.vigil.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Filters for the incident list view. Every criterion is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentQuery {
    private IncidentStatus status;
    private Severity severity;
    private String assigneeId;
    private String teamId;
    private String primaryServiceId;
    private String primaryServiceKey;
    /** Case-insensitive match on title or description */
    private String search;
    private Instant createdFrom;
    private Instant createdTo;
}
