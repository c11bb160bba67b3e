package com.z254.watchtower.vigil.api.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * DTO for incident representation in API responses.
 */
@Data
@Builder
public class IncidentDto {
    private String id;
    private String title;
    private String description;
    private String status;
    private String severity;
    private Instant createdAt;
    private Instant triagedAt;
    private Instant inProgressAt;
    private Instant resolvedAt;
    private Instant closedAt;
    private Instant updatedAt;
    private String teamId;
    private String primaryServiceId;
    private String reporterId;
    private String assigneeId;
    private Set<String> categoryIds;
    private Set<String> tagIds;
    /** Statuses the incident may move to next */
    private List<String> allowedTransitions;
}
