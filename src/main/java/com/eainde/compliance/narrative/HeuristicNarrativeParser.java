package com.eainde.compliance.narrative;

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

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Second tier: keyword classification of sentence units when the text holds no usable JSON.
 * Returns empty when nothing in the text matches the role's keyword sets.
 */
final class HeuristicNarrativeParser {

    static final int MAX_FINDINGS = 6;
    static final int MAX_LEGAL_ITEMS = 5;
    static final int MAX_RISK_FACTORS = 6;
    static final int MAX_PENALTIES = 4;
    static final int MAX_ROADMAP_ITEMS = 5;
    static final int MAX_SUBJECT_LENGTH = 80;

    // -- scan enhancement --
    private static final KeywordSet VIOLATION_WORDS = KeywordSet.of(
            "violation", "issue", "error", "missing", "invalid", "non-compliant", "lacks", "lacking", "without", "fails");
    private static final Map<String, KeywordSet> FAMILIES = new LinkedHashMap<>();
    private static final Map<String, KeywordSet> KIND_HINTS = new LinkedHashMap<>();
    private static final Map<Severity, KeywordSet> SEVERITY_WORDS = new EnumMap<>(Severity.class);

    // -- legal context --
    private static final KeywordSet UPDATE_WORDS = KeywordSet.of("update", "change", "new", "revised", "amended", "recent");
    private static final KeywordSet REGIONAL_WORDS = KeywordSet.of(
            "regional", "california", "european union", "eu member", "united states", "uk", "canada", "state law");
    private static final KeywordSet REGULATION_WORDS = KeywordSet.of(
            "gdpr", "wcag", "ada", "ccpa", "article", "section", "directive", "act");
    private static final KeywordSet ENFORCEMENT_WORDS = KeywordSet.of(
            "enforcement", "penalty", "penalties", "fine", "fined", "court", "lawsuit", "litigation");
    private static final KeywordSet DEADLINE_WORDS = KeywordSet.of("deadline", "must", "required", "by", "effective", "due");

    // -- risk --
    private static final KeywordSet RISK_FACTOR_WORDS = KeywordSet.of(
            "risk", "violation", "non-compliant", "missing", "inadequate", "exposure");
    private static final KeywordSet PENALTY_WORDS = KeywordSet.of(
            "fine", "fines", "penalty", "penalties", "sanction", "legal action", "lawsuit");
    private static final KeywordSet HIGH_RISK_WORDS = KeywordSet.of("critical", "severe", "major", "significant");
    private static final KeywordSet LOW_RISK_WORDS = KeywordSet.of("minor", "low", "cosmetic", "suggestion");
    private static final KeywordSet IMPACT_WORDS = KeywordSet.of(
            "business", "revenue", "reputation", "customer", "trust", "brand");

    // -- roadmap --
    private static final Map<String, KeywordSet> ROADMAP_SECTIONS = new LinkedHashMap<>();
    private static final Pattern BULLET = Pattern.compile("^(?:[-*•]|\\d+[.)])\\s*");

    static {
        FAMILIES.put("gdpr", KeywordSet.of("gdpr", "privacy", "cookie", "consent", "data protection"));
        FAMILIES.put("wcag", KeywordSet.of("wcag", "contrast", "alt text", "alternative text", "heading", "label", "color"));
        FAMILIES.put("ada", KeywordSet.of("ada", "accessibility", "screen reader", "keyboard", "aria", "landmark"));
        FAMILIES.put("security", KeywordSet.of("security", "ssl", "https", "tls", "certificate", "encryption", "script"));
        FAMILIES.put("seo", KeywordSet.of("seo", "meta", "title", "description", "robots"));

        KIND_HINTS.put("gdpr.cookie_banner", KeywordSet.of("cookie", "consent banner"));
        KIND_HINTS.put("gdpr.privacy_policy", KeywordSet.of("privacy policy", "privacy notice"));
        KIND_HINTS.put("wcag.missing_alt", KeywordSet.of("alt text", "alternative text", "alt attribute"));
        KIND_HINTS.put("wcag.unlabeled_inputs", KeywordSet.of("label", "labels", "unlabeled"));
        KIND_HINTS.put("wcag.missing_h1", KeywordSet.of("h1", "main heading"));
        KIND_HINTS.put("ada.keyboard_access", KeywordSet.of("keyboard"));
        KIND_HINTS.put("ada.missing_landmarks", KeywordSet.of("landmark", "landmarks"));
        KIND_HINTS.put("security.no_encryption", KeywordSet.of("https", "ssl", "tls", "encryption"));
        KIND_HINTS.put("seo.missing_meta_description", KeywordSet.of("meta description"));

        SEVERITY_WORDS.put(Severity.CRITICAL, KeywordSet.of("critical", "severe", "major"));
        SEVERITY_WORDS.put(Severity.HIGH, KeywordSet.of("high", "important", "urgent", "serious"));
        SEVERITY_WORDS.put(Severity.MEDIUM, KeywordSet.of("medium", "moderate"));
        SEVERITY_WORDS.put(Severity.LOW, KeywordSet.of("low", "minor", "suggestion"));

        ROADMAP_SECTIONS.put("immediate", KeywordSet.of("immediate", "immediately", "urgent", "critical", "0-2 weeks"));
        ROADMAP_SECTIONS.put("short_term", KeywordSet.of("short", "short-term", "1-3 months"));
        ROADMAP_SECTIONS.put("long_term", KeywordSet.of("long", "long-term", "strategic", "3-12 months"));
        ROADMAP_SECTIONS.put("ongoing_maintenance", KeywordSet.of("ongoing", "maintenance", "continuous", "continuously"));
    }

    private final SentenceSplitter sentences = SentenceSplitter.builder().minLength(15).build();
    private final SentenceSplitter legalSentences = SentenceSplitter.builder().minLength(20).build();

    Optional<NarrativeRecord> parse(NarratorRole role, String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        return switch (role) {
            case SCAN_ENHANCE -> scanEnhancement(text);
            case LEGAL_CONTEXT -> legalContext(text);
            case RISK_ASSESSMENT -> riskAssessment(text);
            case ROADMAP -> roadmap(text);
        };
    }

    // =========================================================================
    //  Scan enhancement
    // =========================================================================

    private Optional<NarrativeRecord> scanEnhancement(String text) {
        List<Violation> findings = new ArrayList<>();
        Map<String, List<String>> byCategory = new LinkedHashMap<>();
        for (String sentence : sentences.split(text)) {
            if (findings.size() >= MAX_FINDINGS) break;
            if (!VIOLATION_WORDS.matches(sentence)) continue;
            String family = familyOf(sentence);
            if (family == null) continue;

            String kind = KIND_HINTS.entrySet().stream()
                    .filter(e -> e.getKey().startsWith(family + ".") && e.getValue().matches(sentence))
                    .map(Map.Entry::getKey)
                    .findFirst()
                    .orElse(family + ".narrative_finding");
            findings.add(new Violation(kind, severityOf(sentence), subjectOf(sentence), sentence, null,
                    "Review this finding against the cited regulation"));
            byCategory.computeIfAbsent(family, k -> new ArrayList<>()).add(sentence);
        }
        if (findings.isEmpty()) return Optional.empty();
        return Optional.of(new ScanEnhancement(findings, byCategory, StrictNarrativeParser.severityBreakdown(findings),
                "Identified " + findings.size() + " findings in narrative text.", RecordSource.NARRATIVE_HEURISTIC));
    }

    private static String familyOf(String sentence) {
        for (Map.Entry<String, KeywordSet> e : FAMILIES.entrySet()) {
            if (e.getValue().matches(sentence)) return e.getKey();
        }
        return null;
    }

    private static Severity severityOf(String sentence) {
        for (Map.Entry<Severity, KeywordSet> e : SEVERITY_WORDS.entrySet()) {
            if (e.getValue().matches(sentence)) return e.getKey();
        }
        return Severity.MEDIUM;
    }

    private static String subjectOf(String sentence) {
        return sentence.length() <= MAX_SUBJECT_LENGTH ? sentence : sentence.substring(0, MAX_SUBJECT_LENGTH).strip();
    }

    // =========================================================================
    //  Legal context
    // =========================================================================

    private Optional<NarrativeRecord> legalContext(String text) {
        List<String> updates = new ArrayList<>();
        List<String> regional = new ArrayList<>();
        List<String> regulations = new ArrayList<>();
        List<String> enforcement = new ArrayList<>();
        List<String> deadlines = new ArrayList<>();
        List<String> units = legalSentences.split(text);
        for (String sentence : units) {
            if (UPDATE_WORDS.matches(sentence)) addCapped(updates, sentence, MAX_LEGAL_ITEMS);
            else if (REGIONAL_WORDS.matches(sentence)) addCapped(regional, sentence, MAX_LEGAL_ITEMS);
            else if (REGULATION_WORDS.matches(sentence)) addCapped(regulations, sentence, MAX_LEGAL_ITEMS);
            else if (ENFORCEMENT_WORDS.matches(sentence)) addCapped(enforcement, sentence, MAX_LEGAL_ITEMS);
            else if (DEADLINE_WORDS.matches(sentence)) addCapped(deadlines, sentence, MAX_LEGAL_ITEMS);
        }
        if (updates.isEmpty() && regional.isEmpty() && regulations.isEmpty()
                && enforcement.isEmpty() && deadlines.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new LegalContext(updates, regulations, enforcement, deadlines, regional,
                "Extracted legal context from " + units.size() + " statements.", RecordSource.NARRATIVE_HEURISTIC));
    }

    // =========================================================================
    //  Risk assessment
    // =========================================================================

    private Optional<NarrativeRecord> riskAssessment(String text) {
        List<String> factors = new ArrayList<>();
        List<String> penalties = new ArrayList<>();
        String businessImpact = null;
        int high = 0;
        int medium = 0;
        int low = 0;
        List<String> units = sentences.split(text);
        for (String sentence : units) {
            if (RISK_FACTOR_WORDS.matches(sentence)) {
                addCapped(factors, sentence, MAX_RISK_FACTORS);
                if (HIGH_RISK_WORDS.matches(sentence)) high++;
                else if (LOW_RISK_WORDS.matches(sentence)) low++;
                else medium++;
            }
            if (PENALTY_WORDS.matches(sentence)) addCapped(penalties, sentence, MAX_PENALTIES);
            if (businessImpact == null && IMPACT_WORDS.matches(sentence)) businessImpact = sentence;
        }
        if (factors.isEmpty() && penalties.isEmpty()) return Optional.empty();

        String level;
        if (high > 2) level = "high";
        else if (high > 0 || medium > 3) level = "medium";
        else if (low > 0) level = "low";
        else level = "medium";

        return Optional.of(new RiskAssessment(level, factors, penalties,
                businessImpact != null ? businessImpact : NarrativeDefaults.DEFAULT_BUSINESS_IMPACT,
                "Risk level: " + level.toUpperCase(Locale.ROOT) + " - based on " + units.size() + " narrative statements.",
                RecordSource.NARRATIVE_HEURISTIC));
    }

    // =========================================================================
    //  Roadmap
    // =========================================================================

    private Optional<NarrativeRecord> roadmap(String text) {
        Map<String, List<RoadmapAction>> phases = new LinkedHashMap<>();
        ROADMAP_SECTIONS.keySet().forEach(k -> phases.put(k, new ArrayList<>()));

        String current = null;
        for (String line : SentenceSplitter.lines(text)) {
            boolean bullet = BULLET.matcher(line).find();
            String header = bullet ? null : sectionHeader(line);
            if (header != null) {
                current = header;
                continue;
            }
            if (current == null || !bullet) continue;
            String action = SentenceSplitter.clean(line);
            if (action.length() <= 15) continue;
            List<RoadmapAction> phase = phases.get(current);
            if (phase.size() < MAX_ROADMAP_ITEMS) {
                phase.add(new RoadmapAction(action, RoadmapHeuristics.reasonFor(action),
                        RoadmapHeuristics.effortFor(action), RoadmapHeuristics.validationFor(action)));
            }
        }

        int total = phases.values().stream().mapToInt(List::size).sum();
        if (total == 0) return Optional.empty();
        return Optional.of(new ImplementationRoadmap(
                phases.get("immediate"), phases.get("short_term"), phases.get("long_term"),
                phases.get("ongoing_maintenance"),
                "Roadmap with " + total + " actions parsed from narrative text.", RecordSource.NARRATIVE_HEURISTIC));
    }

    /** Section name when {@code line} looks like a phase heading, else null. */
    private static String sectionHeader(String line) {
        String cleaned = line.replace("**", "").strip();
        boolean headingShape = cleaned.startsWith("#") || cleaned.endsWith(":")
                || cleaned.toLowerCase(Locale.ROOT).contains("phase");
        if (!headingShape) return null;
        for (Map.Entry<String, KeywordSet> e : ROADMAP_SECTIONS.entrySet()) {
            if (e.getValue().matches(cleaned)) return e.getKey();
        }
        return null;
    }

    private static void addCapped(List<String> list, String value, int cap) {
        if (list.size() < cap) list.add(value);
    }
}
