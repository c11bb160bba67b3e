package com.z254.watchtower.vigil.reports;

import com.z254.watchtower.vigil.domain.exception.RequestValidationException;
import com.z254.watchtower.vigil.domain.model.Incident;
import com.z254.watchtower.vigil.domain.model.IncidentStatus;
import com.z254.watchtower.vigil.domain.model.Severity;
import com.z254.watchtower.vigil.domain.service.DirectoryLabels;
import com.z254.watchtower.vigil.observability.VigilMetrics;
import com.z254.watchtower.vigil.support.Incidents;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BreakdownEngineTest {

    private static final Instant T0 = Instant.parse("2025-01-06T00:00:00Z");

    @Mock
    private ReportScope scope;
    @Mock
    private DirectoryLabels directory;

    private BreakdownEngine engine;

    @BeforeEach
    void setUp() {
        engine = new BreakdownEngine(scope, directory, new VigilMetrics(new SimpleMeterRegistry()));
    }

    @Test
    @DisplayName("should partition by severity so counts add up to the population")
    void severityPartitions() {
        List<Incident> incidents = List.of(
                Incidents.open(Severity.SEV1, T0),
                Incidents.open(Severity.SEV3, T0),
                Incidents.open(Severity.SEV3, T0));

        List<BreakdownItem> items = engine.computeBreakdown(incidents, GroupBy.SEVERITY);

        assertThat(items).extracting(BreakdownItem::getKey, BreakdownItem::getLabel, BreakdownItem::getCount)
                .containsExactly(tuple("SEV3", "SEV3", 2L), tuple("SEV1", "SEV1", 1L));
        assertThat(items.stream().mapToLong(BreakdownItem::getCount).sum()).isEqualTo(3L);
        verifyNoInteractions(directory);
    }

    @Test
    void statusUsesCurrentStatus() {
        Incident resolved = Incidents.open(Severity.SEV2, T0);
        resolved.setStatus(IncidentStatus.RESOLVED);

        List<BreakdownItem> items = engine.computeBreakdown(List.of(resolved, Incidents.open(Severity.SEV2, T0)),
                GroupBy.STATUS);

        assertThat(items).extracting(BreakdownItem::getKey).containsExactly("NEW", "RESOLVED");
    }

    @Test
    @DisplayName("should count an incident once per category and bucket uncategorised ones as unassigned")
    void categoryFansOut() {
        Incident both = withCategories(Incidents.open(Severity.SEV2, T0), "cat-db", "cat-net");
        Incident dbOnly = withCategories(Incidents.open(Severity.SEV2, T0), "cat-db");
        Incident none = Incidents.open(Severity.SEV2, T0);
        when(directory.categoryLabels(anyCollection())).thenReturn(Map.of("cat-db", "Database", "cat-net", "Network"));

        List<BreakdownItem> items = engine.computeBreakdown(List.of(both, dbOnly, none), GroupBy.CATEGORY);

        assertThat(items).extracting(BreakdownItem::getKey, BreakdownItem::getLabel, BreakdownItem::getCount)
                .containsExactly(
                        tuple("cat-db", "Database", 2L),
                        tuple("cat-net", "Network", 1L),
                        tuple(BreakdownEngine.UNASSIGNED_KEY, BreakdownEngine.UNASSIGNED_LABEL, 1L));
        assertThat(items.stream().mapToLong(BreakdownItem::getCount).sum()).isEqualTo(4L);
    }

    @Test
    void teamFallsBackToIdWhenLabelMissing() {
        Incident core = Incidents.open(Severity.SEV3, T0);
        core.setTeamId("team-core");
        Incident ghost = Incidents.open(Severity.SEV3, T0);
        ghost.setTeamId("team-ghost");
        Incident orphan = Incidents.open(Severity.SEV3, T0);
        when(directory.teamLabels(anyCollection())).thenReturn(Map.of("team-core", "Core Platform"));

        List<BreakdownItem> items = engine.computeBreakdown(List.of(core, ghost, orphan), GroupBy.TEAM);

        assertThat(items).extracting(BreakdownItem::getKey, BreakdownItem::getLabel)
                .containsExactly(
                        tuple("team-core", "Core Platform"),
                        tuple("team-ghost", "team-ghost"),
                        tuple(BreakdownEngine.UNASSIGNED_KEY, BreakdownEngine.UNASSIGNED_LABEL));
    }

    @Test
    void assigneeUsesUserLabels() {
        Incident assigned = Incidents.open(Severity.SEV3, T0);
        assigned.setAssigneeId("user-alice");
        when(directory.userLabels(anyCollection())).thenReturn(Map.of("user-alice", "Alice"));

        List<BreakdownItem> items = engine.computeBreakdown(List.of(assigned, assigned), GroupBy.ASSIGNEE);

        assertThat(items).singleElement()
                .extracting(BreakdownItem::getLabel, BreakdownItem::getCount)
                .containsExactly("Alice", 2L);
    }

    @Test
    void loadsPopulationThroughScope() {
        ReportFilter filter = ReportFilter.builder().severity(Severity.SEV1).build();
        when(scope.incidents(filter)).thenReturn(List.of(Incidents.open(Severity.SEV1, T0)));

        assertThat(engine.getBreakdown(filter, GroupBy.SEVERITY)).singleElement()
                .extracting(BreakdownItem::getKey).isEqualTo("SEV1");
    }

    @Test
    void emptyPopulationGivesNoItems() {
        assertThat(engine.computeBreakdown(List.of(), GroupBy.SERVICE)).isEmpty();
    }

    @Test
    void parsesGroupByParameter() {
        assertThat(GroupBy.fromParam("Category")).isEqualTo(GroupBy.CATEGORY);
        assertThatThrownBy(() -> GroupBy.fromParam("region"))
                .isInstanceOf(RequestValidationException.class)
                .hasMessageContaining("region");
        assertThatThrownBy(() -> GroupBy.fromParam(null))
                .isInstanceOf(RequestValidationException.class);
    }

    private static Incident withCategories(Incident incident, String... categoryIds) {
        incident.setCategoryIds(new LinkedHashSet<>(List.of(categoryIds)));
        return incident;
    }
}
