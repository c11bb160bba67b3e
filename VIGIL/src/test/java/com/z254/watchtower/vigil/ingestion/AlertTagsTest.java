package com.z254.watchtower.vigil.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.z254.watchtower.vigil.domain.model.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class AlertTagsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private JsonNode json(String singleQuoted) throws Exception {
        return objectMapper.readTree(singleQuoted.replace('\'', '"'));
    }

    @Test
    void parsesArrayTagsKeepingColonsInValues() throws Exception {
        Map<String, String> tags = AlertTags.parse(json(
                "['Service:payments-api', 'env: prod', 'url:https://status.example.test:8443', 'orphan', ':nokey', 42]"));

        assertThat(tags).containsExactly(
                entry("service", "payments-api"),
                entry("env", "prod"),
                entry("url", "https://status.example.test:8443"));
    }

    @Test
    void parsesStringTagsSplitOnCommasAndSpaces() throws Exception {
        Map<String, String> tags = AlertTags.parse(json("'service:payments-api, severity:sev-1 team:core'"));

        assertThat(tags).containsExactly(
                entry("service", "payments-api"),
                entry("severity", "sev-1"),
                entry("team", "core"));
    }

    @Test
    void laterDuplicateKeyWins() throws Exception {
        assertThat(AlertTags.parse(json("['service:old', 'SERVICE:new']"))).containsExactly(entry("service", "new"));
    }

    @Test
    void absentOrStructuredTagsAreEmpty() throws Exception {
        assertThat(AlertTags.parse(null)).isEmpty();
        assertThat(AlertTags.parse(NullNode.getInstance())).isEmpty();
        assertThat(AlertTags.parse(MissingNode.getInstance())).isEmpty();
        assertThat(AlertTags.parse(json("{'service':'payments-api'}"))).isEmpty();
        assertThat(AlertTags.parse(json("''"))).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
            "sev-1, Anything, SEV1",
            "SEV 2, Anything, SEV2",
            "Sev4, [SEV1] tag wins, SEV4",
            "critical, Checkout SEV1 outage, SEV1",
            "critical, sev2 latency, SEV2",
            "critical, SEV4 noise, SEV3",
            "'', Plain title, SEV3"
    })
    void severityFromTagThenTitle(String tag, String title, Severity expected) {
        Map<String, String> tags = tag.isEmpty() ? Map.of() : Map.of(AlertTags.SEVERITY, tag);

        assertThat(AlertTags.severity(tags, title)).isEqualTo(expected);
    }

    @Test
    void severityDefaultsWithoutTitle() {
        assertThat(AlertTags.severity(Map.of(), null)).isEqualTo(Severity.DEFAULT);
    }
}
