package com.eainde.compliance.narrative;

import com.eainde.compliance.model.ComplianceReport;
import com.eainde.compliance.model.ImplementationRoadmap;
import com.eainde.compliance.model.LegalContext;
import com.eainde.compliance.model.NarrativeRecord;
import com.eainde.compliance.model.NarratorRole;
import com.eainde.compliance.model.RecordSource;
import com.eainde.compliance.model.RiskAssessment;
import com.eainde.compliance.model.RoadmapAction;
import com.eainde.compliance.model.ScanEnhancement;
import com.eainde.compliance.model.Severity;
import com.eainde.compliance.model.Violation;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * First tier: maps a decoded JSON object onto the role's record. Returns empty when a
 * required top-level field is missing or has the wrong shape; optional fields fall back
 * to defaults.
 *
 * <pre>
 *   scan_enhance     findings (array)
 *   legal_context    relevant_regulations (array)
 *   risk_assessment  overall_risk_level (text) + risk_factors (array)
 *   roadmap          immediate + short_term + long_term + ongoing_maintenance (arrays)
 * </pre>
 */
final class StrictNarrativeParser {

    static final Set<String> RISK_LEVELS = Set.of("critical", "high", "medium", "low");

    Optional<NarrativeRecord> parse(NarratorRole role, JsonNode root) {
        if (root == null || !root.isObject()) return Optional.empty();
        return switch (role) {
            case SCAN_ENHANCE -> scanEnhancement(root);
            case LEGAL_CONTEXT -> legalContext(root);
            case RISK_ASSESSMENT -> riskAssessment(root);
            case ROADMAP -> roadmap(root);
        };
    }

    // =========================================================================
    //  Roles
    // =========================================================================

    private Optional<NarrativeRecord> scanEnhancement(JsonNode root) {
        JsonNode findingsNode = root.get("findings");
        if (findingsNode == null || !findingsNode.isArray()) return Optional.empty();

        List<Violation> findings = new ArrayList<>();
        for (JsonNode f : findingsNode) {
            if (!f.isObject()) continue;
            String kind = normalizeKind(text(f, "kind", ""));
            if (kind.isEmpty()) continue;
            String description = text(f, "description", kind);
            findings.add(new Violation(
                    kind,
                    Severity.parse(text(f, "severity", ""), Severity.MEDIUM),
                    text(f, "subject", "document"),
                    description,
                    text(f, "regulation", null),
                    text(f, "suggestion", "Review and address this finding")));
        }

        Map<String, List<String>> byCategory = categories(root.get("by_category"));
        if (byCategory.isEmpty()) {
            for (Violation f : findings) {
                byCategory.computeIfAbsent(f.family(), k -> new ArrayList<>()).add(f.description());
            }
        }

        String summary = text(root, "summary",
                "Narrative scan review reported " + findings.size() + " additional findings.");
        return Optional.of(new ScanEnhancement(findings, byCategory, severityBreakdown(findings), summary,
                RecordSource.NARRATIVE_STRICT));
    }

    private Optional<NarrativeRecord> legalContext(JsonNode root) {
        JsonNode regulations = root.get("relevant_regulations");
        if (regulations == null || !regulations.isArray()) return Optional.empty();
        List<String> relevant = strings(regulations);
        return Optional.of(new LegalContext(
                strings(root.get("recent_updates")),
                relevant,
                strings(root.get("enforcement_trends")),
                strings(root.get("compliance_deadlines")),
                strings(root.get("regional_variations")),
                text(root, "update_summary", "Legal context covering " + relevant.size() + " regulations."),
                RecordSource.NARRATIVE_STRICT));
    }

    private Optional<NarrativeRecord> riskAssessment(JsonNode root) {
        JsonNode level = root.get("overall_risk_level");
        JsonNode factors = root.get("risk_factors");
        if (level == null || !level.isTextual() || level.asText().isBlank()
                || factors == null || !factors.isArray()) {
            return Optional.empty();
        }
        String normalized = normalizeRiskLevel(level.asText());
        return Optional.of(new RiskAssessment(
                normalized,
                strings(factors),
                strings(root.get("potential_penalties")),
                text(root, "business_impact", NarrativeDefaults.DEFAULT_BUSINESS_IMPACT),
                text(root, "risk_summary", "Overall risk assessed as " + normalized + "."),
                RecordSource.NARRATIVE_STRICT));
    }

    private Optional<NarrativeRecord> roadmap(JsonNode root) {
        for (String phase : List.of("immediate", "short_term", "long_term", "ongoing_maintenance")) {
            JsonNode node = root.get(phase);
            if (node == null || !node.isArray()) return Optional.empty();
        }
        List<RoadmapAction> immediate = actions(root.get("immediate"));
        List<RoadmapAction> shortTerm = actions(root.get("short_term"));
        List<RoadmapAction> longTerm = actions(root.get("long_term"));
        List<RoadmapAction> ongoing = actions(root.get("ongoing_maintenance"));
        int total = immediate.size() + shortTerm.size() + longTerm.size() + ongoing.size();
        return Optional.of(new ImplementationRoadmap(immediate, shortTerm, longTerm, ongoing,
                text(root, "roadmap_summary", "Roadmap with " + total + " actions across four phases."),
                RecordSource.NARRATIVE_STRICT));
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    /**
     * {@code "WCAG Missing Alt"} and {@code "wcag_missing_alt"} both become {@code "wcag.missing_alt"};
     * a kind with no family becomes {@code general.<kind>}.
     */
    static String normalizeKind(String raw) {
        String kind = raw.strip().toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        if (kind.isEmpty()) return kind;
        if (kind.indexOf('.') < 0) {
            int underscore = kind.indexOf('_');
            kind = underscore > 0 ? kind.substring(0, underscore) + "." + kind.substring(underscore + 1) : "general." + kind;
        }
        return kind;
    }

    static String normalizeRiskLevel(String raw) {
        String level = raw.strip().toLowerCase(Locale.ROOT);
        if (RISK_LEVELS.contains(level)) return level;
        return Severity.parse(level, Severity.MEDIUM).label();
    }

    static Map<String, Integer> severityBreakdown(List<Violation> findings) {
        Map<String, Integer> breakdown = ComplianceReport.emptySeverityBreakdown();
        for (Violation f : findings) {
            breakdown.merge(f.severity().label(), 1, Integer::sum);
        }
        return breakdown;
    }

    private static List<RoadmapAction> actions(JsonNode array) {
        List<RoadmapAction> out = new ArrayList<>();
        for (JsonNode item : array) {
            if (item.isTextual() && !item.asText().isBlank()) {
                String action = item.asText().strip();
                out.add(new RoadmapAction(action, RoadmapHeuristics.reasonFor(action),
                        RoadmapHeuristics.effortFor(action), RoadmapHeuristics.validationFor(action)));
            } else if (item.isObject()) {
                String action = text(item, "action", "");
                if (action.isEmpty()) continue;
                out.add(new RoadmapAction(action,
                        text(item, "reason", RoadmapHeuristics.reasonFor(action)),
                        text(item, "effort", RoadmapHeuristics.effortFor(action)),
                        text(item, "validation", RoadmapHeuristics.validationFor(action))));
            }
        }
        return out;
    }

    private static Map<String, List<String>> categories(JsonNode node) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        if (node == null || !node.isObject()) return out;
        for (Map.Entry<String, JsonNode> e : node.properties()) {
            List<String> values = strings(e.getValue());
            if (!values.isEmpty()) out.put(e.getKey().toLowerCase(Locale.ROOT), values);
        }
        return out;
    }

    private static List<String> strings(JsonNode node) {
        if (node == null || !node.isArray()) return List.of();
        List<String> out = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isValueNode() && !item.isNull() && !item.asText().isBlank()) {
                out.add(item.asText().strip());
            }
        }
        return out;
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || !value.isValueNode() || value.isNull() || value.asText().isBlank()) return fallback;
        return value.asText().strip();
    }
}
