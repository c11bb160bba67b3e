package com.z254.watchtower.vigil.api.dto;

import com.z254.watchtower.vigil.api.mapper.IncidentMapper;
import com.z254.watchtower.vigil.domain.model.Incident;
import lombok.Builder;
import lombok.Data;
import org.springframework.data.domain.Page;

import java.util.List;

/**
 * One page of incidents, newest first, with the paging metadata of the query.
 */
@Data
@Builder
public class IncidentListResponse {
    private List<IncidentDto> incidents;
    /** Matches across all pages */
    private long total;
    private int page;
    private int size;
    private int totalPages;
    private boolean hasNext;

    public static IncidentListResponse from(Page<Incident> result) {
        return IncidentListResponse.builder()
                .incidents(result.getContent().stream().map(IncidentMapper::toDto).toList())
                .total(result.getTotalElements())
                .page(result.getNumber())
                .size(result.getSize())
                .totalPages(result.getTotalPages())
                .hasNext(result.hasNext())
                .build();
    }
}
