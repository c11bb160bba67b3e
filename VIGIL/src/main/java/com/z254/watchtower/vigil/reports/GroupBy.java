package com.z254.watchtower.vigil.reports;

import com.z254.watchtower.vigil.domain.exception.RequestValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Breakdown dimensions. CATEGORY fans out; every other dimension partitions.
 */
public enum GroupBy {
    SEVERITY,
    STATUS,
    TEAM,
    SERVICE,
    CATEGORY,
    ASSIGNEE;

    public String param() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static GroupBy fromParam(String value) {
        if (value != null) {
            for (GroupBy groupBy : values()) {
                if (groupBy.param().equalsIgnoreCase(value.trim())) {
                    return groupBy;
                }
            }
        }
        throw new RequestValidationException("Unknown groupBy '" + value + "', expected one of "
                + Arrays.stream(values()).map(GroupBy::param).collect(Collectors.joining(", ")));
    }
}
