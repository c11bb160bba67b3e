package com.z254.watchtower.vigil.api.mapper;

import com.z254.watchtower.vigil.api.dto.CommentDto;
import com.z254.watchtower.vigil.api.dto.IncidentDto;
import com.z254.watchtower.vigil.api.dto.TimelineEventDto;
import com.z254.watchtower.vigil.domain.model.Incident;
import com.z254.watchtower.vigil.domain.model.IncidentComment;
import com.z254.watchtower.vigil.domain.model.TimelineEvent;
import com.z254.watchtower.vigil.domain.service.IncidentTransitions;

import java.util.LinkedHashSet;

/**
 * Mapper for incident, timeline and comment to DTO conversion.
 */
public final class IncidentMapper {

    private IncidentMapper() {}

    public static IncidentDto toDto(Incident incident) {
        return IncidentDto.builder()
                .id(incident.getId())
                .title(incident.getTitle())
                .description(incident.getDescription())
                .status(incident.getStatus().name())
                .severity(incident.getSeverity().name())
                .createdAt(incident.getCreatedAt())
                .triagedAt(incident.getTriagedAt())
                .inProgressAt(incident.getInProgressAt())
                .resolvedAt(incident.getResolvedAt())
                .closedAt(incident.getClosedAt())
                .updatedAt(incident.getUpdatedAt())
                .teamId(incident.getTeamId())
                .primaryServiceId(incident.getPrimaryServiceId())
                .reporterId(incident.getReporterId())
                .assigneeId(incident.getAssigneeId())
                .categoryIds(new LinkedHashSet<>(incident.getCategoryIds()))
                .tagIds(new LinkedHashSet<>(incident.getTagIds()))
                .allowedTransitions(IncidentTransitions.allowedNext(incident.getStatus()).stream()
                        .map(Enum::name)
                        .toList())
                .build();
    }

    public static TimelineEventDto toDto(TimelineEvent event) {
        return TimelineEventDto.builder()
                .id(event.getId())
                .type(event.getType().name())
                .fromStatus(event.getFromStatus() == null ? null : event.getFromStatus().name())
                .toStatus(event.getToStatus() == null ? null : event.getToStatus().name())
                .message(event.getMessage())
                .authorId(event.getAuthorId())
                .createdAt(event.getCreatedAt())
                .build();
    }

    public static CommentDto toDto(IncidentComment comment) {
        return CommentDto.builder()
                .id(comment.getId())
                .incidentId(comment.getIncidentId())
                .authorId(comment.getAuthorId())
                .body(comment.getBody())
                .createdAt(comment.getCreatedAt())
                .build();
    }
}
