package com.z254.watchtower.vigil.reports;

import com.z254.watchtower.vigil.domain.model.Incident;
import com.z254.watchtower.vigil.domain.service.DirectoryLabels;
import com.z254.watchtower.vigil.observability.VigilMetrics;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.function.Function;

/**
 * Counts incidents per value of a dimension.
 * <p>
 * Incidents without a value are counted under {@value #UNASSIGNED_KEY}. Results are ordered by
 * count descending, then key ascending.
 */
@Service
public class BreakdownEngine {

    public static final String UNASSIGNED_KEY = "unassigned";
    public static final String UNASSIGNED_LABEL = "Unassigned";

    private static final Comparator<BreakdownItem> ORDER =
            Comparator.comparingLong(BreakdownItem::getCount).reversed()
                    .thenComparing(BreakdownItem::getKey);

    private final ReportScope scope;
    private final DirectoryLabels directory;
    private final VigilMetrics metrics;

    public BreakdownEngine(ReportScope scope, DirectoryLabels directory, VigilMetrics metrics) {
        this.scope = scope;
        this.directory = directory;
        this.metrics = metrics;
    }

    @Transactional(readOnly = true)
    public List<BreakdownItem> getBreakdown(ReportFilter filter, GroupBy groupBy) {
        return metrics.timeReport("breakdown", () -> computeBreakdown(scope.incidents(filter), groupBy));
    }

    public List<BreakdownItem> computeBreakdown(List<Incident> incidents, GroupBy groupBy) {
        Map<String, Long> counts = new HashMap<>();
        for (Incident incident : incidents) {
            Collection<String> keys = keysOf(incident, groupBy);
            if (keys.isEmpty()) {
                counts.merge(UNASSIGNED_KEY, 1L, Long::sum);
            } else {
                for (String key : keys) {
                    counts.merge(key, 1L, Long::sum);
                }
            }
        }

        Map<String, String> labels = labelsFor(groupBy, counts.keySet());
        List<BreakdownItem> items = new ArrayList<>(counts.size());
        counts.forEach((key, count) -> items.add(BreakdownItem.builder()
                .key(key)
                .label(UNASSIGNED_KEY.equals(key) ? UNASSIGNED_LABEL : labels.getOrDefault(key, key))
                .count(count)
                .build()));
        items.sort(ORDER);
        return items;
    }

    private Collection<String> keysOf(Incident incident, GroupBy groupBy) {
        return switch (groupBy) {
            case SEVERITY -> List.of(incident.getSeverity().name());
            case STATUS -> List.of(incident.getStatus().name());
            case TEAM -> single(incident.getTeamId());
            case SERVICE -> single(incident.getPrimaryServiceId());
            case ASSIGNEE -> single(incident.getAssigneeId());
            case CATEGORY -> incident.getCategoryIds();
        };
    }

    private Map<String, String> labelsFor(GroupBy groupBy, Set<String> keys) {
        Set<String> ids = new HashSet<>(keys);
        ids.remove(UNASSIGNED_KEY);
        Function<Collection<String>, Map<String, String>> resolver = switch (groupBy) {
            case TEAM -> directory::teamLabels;
            case SERVICE -> directory::serviceLabels;
            case ASSIGNEE -> directory::userLabels;
            case CATEGORY -> directory::categoryLabels;
            case SEVERITY, STATUS -> k -> Map.of();
        };
        return resolver.apply(ids);
    }

    private static Collection<String> single(String value) {
        return value == null ? List.of() : List.of(value);
    }
}
