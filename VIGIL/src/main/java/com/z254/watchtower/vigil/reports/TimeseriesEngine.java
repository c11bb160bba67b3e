package com.z254.watchtower.vigil.reports;

import com.z254.watchtower.vigil.config.VigilProperties;
import com.z254.watchtower.vigil.domain.exception.RequestValidationException;
import com.z254.watchtower.vigil.domain.model.Incident;
import com.z254.watchtower.vigil.observability.VigilMetrics;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.*;

/**
 * Creation counts per day or week, UTC.
 * <p>
 * Every bucket from the one containing {@code from} up to the one containing the last instant
 * before {@code to} is emitted, empty buckets included. Without {@code to} the range ends now;
 * without {@code from} it starts at the earliest matching incident.
 */
@Service
public class TimeseriesEngine {

    private final ReportScope scope;
    private final VigilProperties properties;
    private final VigilMetrics metrics;
    private final Clock clock;

    public TimeseriesEngine(ReportScope scope, VigilProperties properties, VigilMetrics metrics, Clock clock) {
        this.scope = scope;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<TimeseriesPoint> getTimeseries(ReportFilter filter, Interval interval) {
        return metrics.timeReport("timeseries", () -> computeTimeseries(scope.incidents(filter), filter, interval));
    }

    public List<TimeseriesPoint> computeTimeseries(List<Incident> incidents, ReportFilter filter, Interval interval) {
        Instant to = filter.getTo() != null ? filter.getTo() : Instant.now(clock);
        Instant from = filter.getFrom();
        if (from == null) {
            Optional<Instant> earliest = incidents.stream()
                    .map(Incident::getCreatedAt)
                    .filter(created -> created.isBefore(to))
                    .min(Comparator.naturalOrder());
            if (earliest.isEmpty()) {
                return List.of();
            }
            from = earliest.get();
        }
        if (!from.isBefore(to)) {
            throw new RequestValidationException("from must be before to");
        }

        LocalDate first = interval.truncate(utcDate(from));
        LocalDate last = interval.truncate(utcDate(to.minusNanos(1)));

        Map<LocalDate, Long> counts = new TreeMap<>();
        int buckets = 0;
        for (LocalDate bucket = first; !bucket.isAfter(last); bucket = interval.next(bucket)) {
            if (++buckets > properties.getReports().getMaxTimeseriesBuckets()) {
                throw new RequestValidationException("Range spans more than "
                        + properties.getReports().getMaxTimeseriesBuckets() + " " + interval.name().toLowerCase(Locale.ROOT) + " buckets");
            }
            counts.put(bucket, 0L);
        }

        for (Incident incident : incidents) {
            Instant created = incident.getCreatedAt();
            if (created.isBefore(from) || !created.isBefore(to)) {
                continue;
            }
            counts.merge(interval.truncate(utcDate(created)), 1L, Long::sum);
        }

        List<TimeseriesPoint> points = new ArrayList<>(counts.size());
        counts.forEach((date, count) -> points.add(new TimeseriesPoint(date, count)));
        return points;
    }

    private static LocalDate utcDate(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).toLocalDate();
    }
}
