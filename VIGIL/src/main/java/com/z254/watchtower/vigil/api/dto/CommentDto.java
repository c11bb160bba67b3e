package com.z254.watchtower.vigil.api.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class CommentDto {
    private String id;
    private String incidentId;
    private String authorId;
    private String body;
    private Instant createdAt;
}
