package com.z254.watchtower.vigil.ingestion;

/**
 * Outcome of one alert delivery.
 *
 * @param incidentId incident that was opened or updated
 * @param created    false when the alert was a repeat of a known one
 */
public record AlertIngestionResult(String incidentId, boolean created) {
}
