package com.z254.watchtower.vigil.api.v1;

import com.z254.watchtower.vigil.api.dto.CommentDto;
import com.z254.watchtower.vigil.api.dto.IncidentDto;
import com.z254.watchtower.vigil.api.dto.IncidentListResponse;
import com.z254.watchtower.vigil.api.dto.TimelineEventDto;
import com.z254.watchtower.vigil.api.mapper.IncidentMapper;
import com.z254.watchtower.vigil.domain.model.IncidentDraft;
import com.z254.watchtower.vigil.domain.model.IncidentQuery;
import com.z254.watchtower.vigil.domain.model.IncidentStatus;
import com.z254.watchtower.vigil.domain.model.IncidentUpdate;
import com.z254.watchtower.vigil.domain.model.Severity;
import com.z254.watchtower.vigil.domain.service.IncidentQueryService;
import com.z254.watchtower.vigil.domain.service.IncidentStateMachine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * REST API controller for the incident lifecycle.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/incidents")
@Tag(name = "Incidents", description = "Incident lifecycle, comments and timeline")
public class IncidentController {

    private final IncidentStateMachine stateMachine;
    private final IncidentQueryService queryService;

    public IncidentController(IncidentStateMachine stateMachine, IncidentQueryService queryService) {
        this.stateMachine = stateMachine;
        this.queryService = queryService;
    }

    @PostMapping
    @Operation(summary = "Create incident", description = "Open a new incident in status NEW")
    public Mono<ResponseEntity<IncidentDto>> createIncident(
            @Parameter(description = "Acting user") @RequestHeader(ApiHeaders.USER_ID) String actorId,
            @Valid @RequestBody IncidentDraft draft) {

        return blocking(() -> ResponseEntity.status(HttpStatus.CREATED)
                .body(IncidentMapper.toDto(stateMachine.createIncident(draft, actorId))));
    }

    @GetMapping
    @Operation(summary = "List incidents", description = "List incidents with optional filters, newest first")
    public Mono<ResponseEntity<IncidentListResponse>> listIncidents(
            @Parameter(description = "Filter by status") @RequestParam(required = false) IncidentStatus status,
            @Parameter(description = "Filter by severity") @RequestParam(required = false) Severity severity,
            @Parameter(description = "Filter by assignee") @RequestParam(required = false) String assigneeId,
            @Parameter(description = "Filter by team") @RequestParam(required = false) String teamId,
            @Parameter(description = "Filter by primary service id") @RequestParam(required = false) String serviceId,
            @Parameter(description = "Filter by primary service key") @RequestParam(required = false) String serviceKey,
            @Parameter(description = "Text search on title and description") @RequestParam(required = false) String search,
            @Parameter(description = "Created at or after (ISO-8601)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant createdFrom,
            @Parameter(description = "Created before (ISO-8601)")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant createdTo,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {

        IncidentQuery query = IncidentQuery.builder()
                .status(status)
                .severity(severity)
                .assigneeId(assigneeId)
                .teamId(teamId)
                .primaryServiceId(serviceId)
                .primaryServiceKey(serviceKey)
                .search(search)
                .createdFrom(createdFrom)
                .createdTo(createdTo)
                .build();

        return blocking(() -> ResponseEntity.ok(IncidentListResponse.from(queryService.listIncidents(query, page, size))));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get incident", description = "Get incident details by ID")
    public Mono<ResponseEntity<IncidentDto>> getIncident(
            @Parameter(description = "Incident ID") @PathVariable String id) {

        return blocking(() -> ResponseEntity.ok(IncidentMapper.toDto(queryService.getIncident(id))));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Update incident", description = "Update descriptive fields; each change is recorded on the timeline")
    public Mono<ResponseEntity<IncidentDto>> updateIncident(
            @Parameter(description = "Incident ID") @PathVariable String id,
            @Parameter(description = "Acting user") @RequestHeader(ApiHeaders.USER_ID) String actorId,
            @Valid @RequestBody IncidentUpdate update) {

        return blocking(() -> ResponseEntity.ok(IncidentMapper.toDto(stateMachine.updateFields(id, update, actorId))));
    }

    @PatchMapping("/{id}/status")
    @Operation(summary = "Change status", description = "Apply a status transition allowed by the lifecycle")
    public Mono<ResponseEntity<IncidentDto>> changeStatus(
            @Parameter(description = "Incident ID") @PathVariable String id,
            @Parameter(description = "Acting user") @RequestHeader(ApiHeaders.USER_ID) String actorId,
            @Valid @RequestBody StatusChangeRequest request) {

        return blocking(() -> ResponseEntity.ok(IncidentMapper.toDto(
                stateMachine.changeStatus(id, request.getStatus(), request.getMessage(), actorId))));
    }

    @PostMapping("/{id}/comments")
    @Operation(summary = "Add comment", description = "Add a comment to an incident")
    public Mono<ResponseEntity<CommentDto>> addComment(
            @Parameter(description = "Incident ID") @PathVariable String id,
            @Parameter(description = "Acting user") @RequestHeader(ApiHeaders.USER_ID) String actorId,
            @Valid @RequestBody CommentRequest request) {

        return blocking(() -> ResponseEntity.status(HttpStatus.CREATED)
                .body(IncidentMapper.toDto(stateMachine.addComment(id, request.getBody(), actorId))));
    }

    @GetMapping("/{id}/comments")
    @Operation(summary = "List comments", description = "Comments of an incident, oldest first")
    public Mono<ResponseEntity<List<CommentDto>>> listComments(
            @Parameter(description = "Incident ID") @PathVariable String id) {

        return blocking(() -> ResponseEntity.ok(queryService.listComments(id).stream()
                .map(IncidentMapper::toDto)
                .toList()));
    }

    @GetMapping("/{id}/timeline")
    @Operation(summary = "Get incident timeline", description = "Audit trail of an incident, oldest first")
    public Mono<ResponseEntity<List<TimelineEventDto>>> getTimeline(
            @Parameter(description = "Incident ID") @PathVariable String id) {

        return blocking(() -> ResponseEntity.ok(queryService.listTimeline(id).stream()
                .map(IncidentMapper::toDto)
                .toList()));
    }

    @PostMapping("/{id}/subscription")
    @Operation(summary = "Subscribe", description = "Follow an incident")
    public Mono<ResponseEntity<Map<String, Boolean>>> subscribe(
            @Parameter(description = "Incident ID") @PathVariable String id,
            @Parameter(description = "Acting user") @RequestHeader(ApiHeaders.USER_ID) String actorId) {

        return blocking(() -> ResponseEntity.ok(Map.of("subscribed", stateMachine.subscribe(id, actorId))));
    }

    @DeleteMapping("/{id}/subscription")
    @Operation(summary = "Unsubscribe", description = "Stop following an incident")
    public Mono<ResponseEntity<Map<String, Boolean>>> unsubscribe(
            @Parameter(description = "Incident ID") @PathVariable String id,
            @Parameter(description = "Acting user") @RequestHeader(ApiHeaders.USER_ID) String actorId) {

        return blocking(() -> ResponseEntity.ok(Map.of("subscribed", stateMachine.unsubscribe(id, actorId))));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete incident", description = "Hard-delete an incident; reporter only")
    public Mono<ResponseEntity<Map<String, Boolean>>> deleteIncident(
            @Parameter(description = "Incident ID") @PathVariable String id,
            @Parameter(description = "Acting user") @RequestHeader(ApiHeaders.USER_ID) String actorId) {

        return blocking(() -> {
            stateMachine.deleteIncident(id, actorId);
            return ResponseEntity.ok(Map.of("deleted", true));
        });
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    // ========== Request DTOs ==========

    @lombok.Data
    public static class StatusChangeRequest {
        @NotNull
        private IncidentStatus status;
        @Size(max = 10000)
        private String message;
    }

    @lombok.Data
    public static class CommentRequest {
        @NotBlank
        @Size(max = 10000)
        private String body;
    }
}
