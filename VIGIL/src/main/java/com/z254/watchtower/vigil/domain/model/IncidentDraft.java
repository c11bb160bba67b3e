package com.z254.watchtower.vigil.domain.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Input for opening a new incident. The status is never taken from the caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentDraft {

    @NotBlank
    @Size(max = 300)
    private String title;

    @NotBlank
    @Size(max = 10000)
    private String description;

    /** Defaults to SEV3 */
    private Severity severity;

    private String teamId;

    private String assigneeId;

    /** Service id; takes precedence over {@link #primaryServiceKey} */
    private String primaryServiceId;

    private String primaryServiceKey;

    @Builder.Default
    private Set<String> categoryIds = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> tagIds = new LinkedHashSet<>();
}
