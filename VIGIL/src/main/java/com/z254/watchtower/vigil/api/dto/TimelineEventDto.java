package com.z254.watchtower.vigil.api.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class TimelineEventDto {
    private Long id;
    private String type;
    private String fromStatus;
    private String toStatus;
    private String message;
    private String authorId;
    private Instant createdAt;
}
