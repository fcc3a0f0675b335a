package com.eainde.compliance.citation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegulationCitationTableTest {

    private final RegulationCitationTable table = RegulationCitationTable.loadDefault(new ObjectMapper());

    @Nested
    @DisplayName("Classpath table")
    class DefaultTable {

        @Test
        @DisplayName("covers every standard rule kind")
        void coversRuleKinds() {
            assertThat(table.knownKinds()).contains(
                    "gdpr.cookie_banner", "gdpr.privacy_policy", "gdpr.contact_info",
                    "wcag.missing_alt", "wcag.missing_h1", "wcag.multiple_h1", "wcag.unlabeled_inputs",
                    "wcag.generic_links", "ada.keyboard_access", "ada.missing_landmarks",
                    "security.no_encryption", "security.external_scripts",
                    "seo.missing_meta_description", "seo.missing_title");
        }

        @Test
        @DisplayName("primary citation is the first listed")
        void primaryCitation() {
            assertThat(table.primaryCitation("gdpr.cookie_banner")).startsWith("GDPR Article 7");
            assertThat(table.citationsFor("wcag.missing_alt")).hasSizeGreaterThan(1);
            assertThat(table.estimatedEffort("wcag.missing_alt")).isEqualTo("2-4 hours");
        }

        @Test
        @DisplayName("unknown kinds fall back to the default entry")
        void unknownKind() {
            assertThat(table.isKnown("ccpa.do_not_sell")).isFalse();
            assertThat(table.citationsFor("ccpa.do_not_sell")).containsExactly("General compliance requirements");
            assertThat(table.estimatedEffort("ccpa.do_not_sell")).isEqualTo("Variable");
        }

        @Test
        @DisplayName("family resolves display names and upper-cases unknown prefixes")
        void family() {
            assertThat(table.family("gdpr.cookie_banner")).isEqualTo("GDPR");
            assertThat(table.family("wcag.missing_alt")).isEqualTo("WCAG 2.1");
            assertThat(table.family("ccpa.do_not_sell")).isEqualTo("CCPA");
            assertThat(table.family("")).isEqualTo("OTHER");
        }
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("missing resource is an IllegalStateException")
        void missingResource() {
            assertThatThrownBy(() -> RegulationCitationTable.load(new ObjectMapper(), "no-such-file.json"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("no-such-file.json");
        }

        @Test
        @DisplayName("of() builds an in-memory table")
        void inMemory() {
            RegulationCitationTable custom = RegulationCitationTable.of(
                    Map.of("gdpr", "GDPR"),
                    Map.of("gdpr.cookie_banner", new CitationEntry(List.of("Art. 7"), "1 day")),
                    new CitationEntry(List.of("fallback"), "Variable"));

            assertThat(custom.primaryCitation("gdpr.cookie_banner")).isEqualTo("Art. 7");
            assertThat(custom.primaryCitation("other.kind")).isEqualTo("fallback");
        }
    }
}
