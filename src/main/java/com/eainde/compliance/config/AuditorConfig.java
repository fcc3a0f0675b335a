package com.eainde.compliance.config;

import com.eainde.compliance.citation.RegulationCitationTable;
import com.eainde.compliance.mapper.IssueMapper;
import com.eainde.compliance.mapper.ScoringPolicy;
import com.eainde.compliance.model.Severity;
import com.eainde.compliance.narrative.ComplianceNarratorAgent;
import com.eainde.compliance.narrative.LangChainNarrator;
import com.eainde.compliance.narrative.NarrativeInsightExtractor;
import com.eainde.compliance.narrative.Narrator;
import com.eainde.compliance.narrative.UnavailableNarrator;
import com.eainde.compliance.pipeline.ComplianceAuditOrchestrator;
import com.eainde.compliance.pipeline.MdcAwareExecutor;
import com.eainde.compliance.pipeline.ReportMerger;
import com.eainde.compliance.remediation.RemediationAdvisor;
import com.eainde.compliance.scanner.RuleRegistry;
import com.eainde.compliance.scanner.TechnicalScanner;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.service.AiServices;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Wires the audit pipeline.
 *
 * <pre>
 *   HtmlDocumentParser ──► TechnicalScanner ──► IssueMapper ──► RemediationAdvisor
 *                                                                    │
 *                                 Narrator (Gemini / unavailable) ◄──┤  ComplianceAuditOrchestrator
 *                                                                    │
 *                                 NarrativeInsightExtractor ──► ReportMerger
 * </pre>
 *
 * Every tunable lives under {@code auditor.*} and reaches the components as constructor values.
 */
@Log4j2
@Configuration
public class AuditorConfig {

    // ── Scoring ─────────────────────────────────────────────────────────

    @Value("${auditor.scoring.penalty.critical:30}")
    private int criticalPenalty;

    @Value("${auditor.scoring.penalty.high:20}")
    private int highPenalty;

    @Value("${auditor.scoring.penalty.medium:10}")
    private int mediumPenalty;

    @Value("${auditor.scoring.penalty.low:5}")
    private int lowPenalty;

    @Value("${auditor.scoring.bands.critical-max-priority:1}")
    private int criticalMaxPriority;

    @Value("${auditor.scoring.bands.high-max-priority:4}")
    private int highMaxPriority;

    @Value("${auditor.scoring.bands.medium-max-priority:7}")
    private int mediumMaxPriority;

    // ── Narrator ────────────────────────────────────────────────────────

    @Value("${auditor.narrator.role-timeout-seconds:30}")
    private long roleTimeoutSeconds;

    @Value("${auditor.narrator.gemini.api-key:}")
    private String geminiApiKey;

    @Value("${auditor.narrator.gemini.model-name:gemini-1.5-flash}")
    private String geminiModelName;

    @Value("${auditor.narrator.gemini.temperature:0.1}")
    private double geminiTemperature;

    // =========================================================================
    //  Technical pipeline
    // =========================================================================

    @Bean
    public RegulationCitationTable regulationCitationTable(ObjectMapper objectMapper) {
        return RegulationCitationTable.loadDefault(objectMapper);
    }

    @Bean
    public ScoringPolicy scoringPolicy() {
        return ScoringPolicy.builder()
                .penalty(Severity.CRITICAL, criticalPenalty)
                .penalty(Severity.HIGH, highPenalty)
                .penalty(Severity.MEDIUM, mediumPenalty)
                .penalty(Severity.LOW, lowPenalty)
                .criticalMaxPriority(criticalMaxPriority)
                .highMaxPriority(highMaxPriority)
                .mediumMaxPriority(mediumMaxPriority)
                .build();
    }

    @Bean
    public TechnicalScanner technicalScanner(RegulationCitationTable citations) {
        return new TechnicalScanner(RuleRegistry.standard(), citations);
    }

    @Bean
    public IssueMapper issueMapper(RegulationCitationTable citations, ScoringPolicy scoringPolicy) {
        return new IssueMapper(citations, scoringPolicy);
    }

    @Bean
    public RemediationAdvisor remediationAdvisor(ScoringPolicy scoringPolicy) {
        return new RemediationAdvisor(scoringPolicy);
    }

    // =========================================================================
    //  Narrative
    // =========================================================================

    @Bean
    public NarrativeInsightExtractor narrativeInsightExtractor(ObjectMapper objectMapper) {
        return new NarrativeInsightExtractor(objectMapper);
    }

    @Bean
    public ReportMerger reportMerger(IssueMapper issueMapper) {
        return new ReportMerger(issueMapper);
    }

    /**
     * Gemini-backed narrator when an API key is configured. Without one every role fails
     * and audits finish as {@code partial}.
     */
    @Bean
    public Narrator narrator() {
        if (geminiApiKey == null || geminiApiKey.isBlank()) {
            log.warn("auditor.narrator.gemini.api-key not set — narrative roles disabled");
            return new UnavailableNarrator("no Gemini API key configured");
        }
        ChatModel model = GoogleAiGeminiChatModel.builder()
                .apiKey(geminiApiKey)
                .modelName(geminiModelName)
                .temperature(geminiTemperature)
                .timeout(Duration.ofSeconds(roleTimeoutSeconds))
                .build();
        log.info("Narrator model {} (temperature {})", geminiModelName, geminiTemperature);
        ComplianceNarratorAgent agent = AiServices.builder(ComplianceNarratorAgent.class)
                .chatModel(model)
                .build();
        return new LangChainNarrator(agent);
    }

    @Bean(destroyMethod = "close")
    public MdcAwareExecutor narratorExecutor() {
        return new MdcAwareExecutor("narrator");
    }

    @Bean
    public ComplianceAuditOrchestrator complianceAuditOrchestrator(TechnicalScanner technicalScanner,
                                                                   IssueMapper issueMapper,
                                                                   RemediationAdvisor remediationAdvisor,
                                                                   NarrativeInsightExtractor extractor,
                                                                   ReportMerger reportMerger,
                                                                   MdcAwareExecutor narratorExecutor) {
        return new ComplianceAuditOrchestrator(
                technicalScanner,
                issueMapper,
                remediationAdvisor,
                extractor,
                reportMerger,
                narratorExecutor,
                Duration.ofSeconds(roleTimeoutSeconds));
    }
}
