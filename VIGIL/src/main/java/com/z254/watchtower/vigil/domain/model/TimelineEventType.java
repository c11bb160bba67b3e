package com.z254.watchtower.vigil.domain.model;

/**
 * Kinds of entries recorded on an incident timeline.
 */
public enum TimelineEventType {
    STATUS_CHANGE,
    COMMENT,
    FIELD_UPDATE,
    ASSIGNMENT
}
