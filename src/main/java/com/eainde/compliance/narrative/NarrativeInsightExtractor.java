package com.eainde.compliance.narrative;

import com.eainde.compliance.model.ImplementationRoadmap;
import com.eainde.compliance.model.LegalContext;
import com.eainde.compliance.model.NarrativeRecord;
import com.eainde.compliance.model.NarratorRole;
import com.eainde.compliance.model.RiskAssessment;
import com.eainde.compliance.model.ScanEnhancement;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Turns untrusted narrator text into a total, role-specific record.
 *
 * <h3>Tiers</h3>
 * <ol>
 *   <li><b>Strict</b> - the first balanced {@code {...}} block, decoded with Jackson and
 *       checked for the role's required fields. Source {@code narrative-strict}.</li>
 *   <li><b>Heuristic</b> - sentence-level keyword classification. Source {@code narrative-heuristic}.</li>
 *   <li><b>Default</b> - {@link NarrativeDefaults}. Source {@code narrative-default}.</li>
 * </ol>
 *
 * <p>Never throws for any text, including null. Pure: the same role and text always give
 * an equal record.</p>
 */
public class NarrativeInsightExtractor {

    private static final Logger log = LoggerFactory.getLogger(NarrativeInsightExtractor.class);

    private final ObjectReader reader;
    private final StrictNarrativeParser strict = new StrictNarrativeParser();
    private final HeuristicNarrativeParser heuristic = new HeuristicNarrativeParser();

    public NarrativeInsightExtractor(ObjectMapper objectMapper) {
        this.reader = objectMapper.reader()
                .with(JsonReadFeature.ALLOW_TRAILING_COMMA.mappedFeature())
                .with(JsonReadFeature.ALLOW_SINGLE_QUOTES.mappedFeature())
                .with(JsonReadFeature.ALLOW_JAVA_COMMENTS.mappedFeature());
    }

    /**
     * @param role must not be null
     */
    public NarrativeRecord extract(NarratorRole role, String text) {
        Objects.requireNonNull(role, "role");
        try {
            Optional<NarrativeRecord> parsed = decode(text).flatMap(root -> strict.parse(role, root));
            if (parsed.isPresent()) {
                log.debug("Role {} parsed strictly", role);
                return parsed.get();
            }
            parsed = heuristic.parse(role, text);
            if (parsed.isPresent()) {
                log.debug("Role {} parsed heuristically", role);
                return parsed.get();
            }
        } catch (RuntimeException e) {
            log.warn("Narrative extraction for role {} failed, using defaults: {}", role, e.getMessage());
        }
        log.debug("Role {} fell back to defaults", role);
        return NarrativeDefaults.forRole(role);
    }

    public ScanEnhancement scanEnhancement(String text) {
        return (ScanEnhancement) extract(NarratorRole.SCAN_ENHANCE, text);
    }

    public LegalContext legalContext(String text) {
        return (LegalContext) extract(NarratorRole.LEGAL_CONTEXT, text);
    }

    public RiskAssessment riskAssessment(String text) {
        return (RiskAssessment) extract(NarratorRole.RISK_ASSESSMENT, text);
    }

    public ImplementationRoadmap roadmap(String text) {
        return (ImplementationRoadmap) extract(NarratorRole.ROADMAP, text);
    }

    private Optional<JsonNode> decode(String text) {
        Optional<String> block = BalancedBlockLocator.firstObject(text);
        if (block.isEmpty()) return Optional.empty();
        try {
            return Optional.of(reader.readTree(block.get()));
        } catch (JsonProcessingException e) {
            log.debug("Balanced block is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
