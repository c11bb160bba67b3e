package com.z254.watchtower.vigil.domain.service;

import com.z254.watchtower.vigil.domain.model.IncidentStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static com.z254.watchtower.vigil.domain.model.IncidentStatus.*;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IncidentTransitions")
class IncidentTransitionsTest {

    private static final Map<IncidentStatus, Set<IncidentStatus>> EXPECTED = Map.of(
            NEW, EnumSet.of(TRIAGED, IN_PROGRESS),
            TRIAGED, EnumSet.of(IN_PROGRESS, ON_HOLD, RESOLVED),
            IN_PROGRESS, EnumSet.of(ON_HOLD, RESOLVED),
            ON_HOLD, EnumSet.of(IN_PROGRESS, RESOLVED),
            RESOLVED, EnumSet.of(CLOSED, REOPENED),
            CLOSED, EnumSet.of(REOPENED),
            REOPENED, EnumSet.of(IN_PROGRESS, ON_HOLD, RESOLVED));

    static Stream<Arguments> allPairs() {
        List<Arguments> pairs = new ArrayList<>();
        for (IncidentStatus from : IncidentStatus.values()) {
            for (IncidentStatus to : IncidentStatus.values()) {
                pairs.add(Arguments.of(from, to, EXPECTED.get(from).contains(to)));
            }
        }
        return pairs.stream();
    }

    @ParameterizedTest(name = "{0} -> {1} allowed={2}")
    @MethodSource("allPairs")
    void matchesTransitionTable(IncidentStatus from, IncidentStatus to, boolean allowed) {
        assertThat(IncidentTransitions.isAllowed(from, to)).isEqualTo(allowed);
    }

    @ParameterizedTest
    @EnumSource(IncidentStatus.class)
    @DisplayName("should never allow staying in the same status")
    void rejectsSelfTransition(IncidentStatus status) {
        assertThat(IncidentTransitions.isAllowed(status, status)).isFalse();
        assertThat(IncidentTransitions.allowedNext(status)).doesNotContain(status);
    }

    @ParameterizedTest
    @EnumSource(IncidentStatus.class)
    @DisplayName("should leave every status with at least one way out")
    void noTerminalStatus(IncidentStatus status) {
        assertThat(IncidentTransitions.allowedNext(status)).isNotEmpty();
    }

    @Test
    void nullsAreNeverAllowed() {
        assertThat(IncidentTransitions.isAllowed(null, TRIAGED)).isFalse();
        assertThat(IncidentTransitions.isAllowed(NEW, null)).isFalse();
    }

    @Test
    void newCannotJumpToResolved() {
        assertThat(IncidentTransitions.isAllowed(NEW, RESOLVED)).isFalse();
        assertThat(IncidentTransitions.isAllowed(NEW, CLOSED)).isFalse();
    }
}
