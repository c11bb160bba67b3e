package com.z254.watchtower.vigil.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.watchtower.vigil.domain.model.Severity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads {@code key:value} tags from a monitoring alert.
 * <p>
 * Tags arrive either as a JSON array of strings or as one string separated by commas or
 * spaces. Keys are lower-cased; values keep any further colons. Entries without a colon are
 * ignored and a later duplicate key wins.
 */
final class AlertTags {

    static final String SERVICE = "service";
    static final String SEVERITY = "severity";

    private static final Pattern SEPARATORS = Pattern.compile("[, ]+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Z0-9]");

    private AlertTags() {}

    static Map<String, String> parse(JsonNode tags) {
        if (tags == null || tags.isNull() || tags.isMissingNode()) {
            return Collections.emptyMap();
        }
        Map<String, String> parsed = new LinkedHashMap<>();
        if (tags.isArray()) {
            tags.forEach(tag -> put(parsed, tag.asText()));
        } else if (tags.isValueNode()) {
            for (String part : SEPARATORS.split(tags.asText())) {
                put(parsed, part.trim());
            }
        }
        return parsed;
    }

    private static void put(Map<String, String> parsed, String tag) {
        int colon = tag.indexOf(':');
        if (colon <= 0) {
            return;
        }
        String key = tag.substring(0, colon).trim().toLowerCase(Locale.ROOT);
        if (!key.isEmpty()) {
            parsed.put(key, tag.substring(colon + 1).trim());
        }
    }

    /**
     * Severity from a {@code severity:} tag such as {@code sev-1}, else SEV1 or SEV2 named in
     * the title, else the default.
     */
    static Severity severity(Map<String, String> tags, String title) {
        String tagged = tags.get(SEVERITY);
        if (tagged != null) {
            String normalized = NON_ALPHANUMERIC.matcher(tagged.toUpperCase(Locale.ROOT)).replaceAll("");
            for (Severity severity : Severity.values()) {
                if (severity.name().equals(normalized)) {
                    return severity;
                }
            }
        }
        String upperTitle = title == null ? "" : title.toUpperCase(Locale.ROOT);
        if (upperTitle.contains(Severity.SEV1.name())) {
            return Severity.SEV1;
        }
        if (upperTitle.contains(Severity.SEV2.name())) {
            return Severity.SEV2;
        }
        return Severity.DEFAULT;
    }
}
