package com.z254.watchtower.vigil.domain.model;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Partial update of an incident's descriptive fields.
 * <p>
 * A {@code null} field is left untouched. For the optional references
 * (assignee, team, primary service) an empty string clears the value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentUpdate {

    @Size(max = 300)
    private String title;

    @Size(max = 10000)
    private String description;

    private Severity severity;

    private String assigneeId;

    private String teamId;

    private String primaryServiceId;

    private String primaryServiceKey;

    private Set<String> categoryIds;

    private Set<String> tagIds;

    public boolean isEmpty() {
        return title == null && description == null && severity == null && assigneeId == null
                && teamId == null && primaryServiceId == null && primaryServiceKey == null
                && categoryIds == null && tagIds == null;
    }
}
