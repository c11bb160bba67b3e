package com.z254.watchtower.vigil.domain.model;

/**
 * Incident severity, SEV1 being the most critical.
 */
public enum Severity {
    SEV1,
    SEV2,
    SEV3,
    SEV4;

    public static final Severity DEFAULT = SEV3;

    /**
     * Severities that page people the moment an incident is opened.
     */
    public boolean isHighSeverity() {
        return this == SEV1 || this == SEV2;
    }
}
