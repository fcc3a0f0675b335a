package com.eainde.compliance.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SeverityTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        void exactLabelsIgnoreCaseAndWhitespace() {
            assertThat(Severity.parse(" High ", Severity.LOW)).isEqualTo(Severity.HIGH);
            assertThat(Severity.parse("CRITICAL", Severity.LOW)).isEqualTo(Severity.CRITICAL);
        }

        @Test
        void synonyms() {
            assertThat(Severity.parse("major", Severity.LOW)).isEqualTo(Severity.CRITICAL);
            assertThat(Severity.parse("moderate", Severity.LOW)).isEqualTo(Severity.MEDIUM);
            assertThat(Severity.parse("minor", Severity.HIGH)).isEqualTo(Severity.LOW);
        }

        @Test
        void unknownOrBlankFallsBack() {
            assertThat(Severity.parse("catastrophic", Severity.MEDIUM)).isEqualTo(Severity.MEDIUM);
            assertThat(Severity.parse(null, Severity.LOW)).isEqualTo(Severity.LOW);
            assertThat(Severity.parse("  ", Severity.HIGH)).isEqualTo(Severity.HIGH);
        }
    }

    @Test
    @DisplayName("rank follows declaration order, critical first")
    void rank() {
        assertThat(Severity.CRITICAL.rank()).isZero();
        assertThat(Severity.LOW.rank()).isEqualTo(3);
    }

    @Test
    @DisplayName("JSON uses lowercase labels and reads leniently")
    void json() throws Exception {
        assertThat(mapper.writeValueAsString(Severity.HIGH)).isEqualTo("\"high\"");
        assertThat(mapper.readValue("\"Serious\"", Severity.class)).isEqualTo(Severity.HIGH);
        assertThat(mapper.readValue("\"unheard-of\"", Severity.class)).isEqualTo(Severity.MEDIUM);
    }

    @Test
    @DisplayName("a failed report omits every body field")
    void failedReportJson() throws Exception {
        JsonNode json = mapper.valueToTree(CombinedReport.failed(PipelineStage.SCAN, "scan stage failed: x"));

        assertThat(json.size()).isEqualTo(3);
        assertThat(json.get("status").asText()).isEqualTo("failed");
        assertThat(json.get("failed_stage").asText()).isEqualTo("scan");
        assertThat(json.get("warnings").get(0).asText()).isEqualTo("scan stage failed: x");
    }
}
