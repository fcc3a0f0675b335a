package com.eainde.compliance.citation;

import com.eainde.compliance.model.Violation;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Static lookup from violation kind to regulation citations, loaded once from
 * {@code regulation-citations.json} and read-only afterwards.
 *
 * <h3>File shape</h3>
 * <pre>
 * {
 *   "families":      { "gdpr": "GDPR", ... },
 *   "default_entry": { "citations": [...], "estimated_effort": "Variable" },
 *   "kinds":         { "gdpr.cookie_banner": { "citations": [...], "estimated_effort": "1-2 days" }, ... }
 * }
 * </pre>
 */
public final class RegulationCitationTable {

    private static final Logger log = LoggerFactory.getLogger(RegulationCitationTable.class);

    public static final String DEFAULT_RESOURCE = "regulation-citations.json";

    private final Map<String, String> families;
    private final Map<String, CitationEntry> kinds;
    private final CitationEntry defaultEntry;

    private RegulationCitationTable(Map<String, String> families,
                                    Map<String, CitationEntry> kinds,
                                    CitationEntry defaultEntry) {
        this.families = Collections.unmodifiableMap(new LinkedHashMap<>(families));
        this.kinds = Collections.unmodifiableMap(new LinkedHashMap<>(kinds));
        this.defaultEntry = defaultEntry;
    }

    public static RegulationCitationTable loadDefault(ObjectMapper objectMapper) {
        return load(objectMapper, DEFAULT_RESOURCE);
    }

    /**
     * @throws IllegalStateException when the resource is missing or malformed
     */
    public static RegulationCitationTable load(ObjectMapper objectMapper, String resource) {
        ClassLoader loader = RegulationCitationTable.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Citation resource not found on classpath: " + resource);
            }
            CitationFile file = objectMapper.readValue(in, CitationFile.class);
            if (file.kinds() == null || file.kinds().isEmpty()) {
                throw new IllegalStateException("Citation resource has no kinds: " + resource);
            }
            CitationEntry fallback = file.defaultEntry() != null
                    ? file.defaultEntry()
                    : new CitationEntry(List.of("General compliance requirements"), "Variable");
            log.info("Loaded {} citation kinds from {}", file.kinds().size(), resource);
            return new RegulationCitationTable(
                    file.families() == null ? Map.of() : file.families(), file.kinds(), fallback);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read citation resource " + resource, e);
        }
    }

    public static RegulationCitationTable of(Map<String, String> families,
                                             Map<String, CitationEntry> kinds,
                                             CitationEntry defaultEntry) {
        return new RegulationCitationTable(families, kinds, defaultEntry);
    }

    public CitationEntry entry(String kind) {
        return kinds.getOrDefault(kind, defaultEntry);
    }

    public List<String> citationsFor(String kind) {
        return entry(kind).citations();
    }

    public String primaryCitation(String kind) {
        String primary = entry(kind).primary();
        return primary != null ? primary : defaultEntry.primary();
    }

    public String estimatedEffort(String kind) {
        return entry(kind).estimatedEffort();
    }

    public boolean isKnown(String kind) {
        return kinds.containsKey(kind);
    }

    public Set<String> knownKinds() {
        return kinds.keySet();
    }

    /** Display name of the kind's regulation family, e.g. {@code "GDPR"}; unknown families are upper-cased. */
    public String family(String kind) {
        String prefix = Violation.familyOf(kind);
        return families.getOrDefault(prefix, prefix.isEmpty() ? "OTHER" : prefix.toUpperCase(Locale.ROOT));
    }

    record CitationFile(
            @JsonProperty("families")      Map<String, String> families,
            @JsonProperty("default_entry") CitationEntry defaultEntry,
            @JsonProperty("kinds")         Map<String, CitationEntry> kinds
    ) {}
}
