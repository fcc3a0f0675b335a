package com.eainde.compliance.scanner;

import com.eainde.compliance.citation.RegulationCitationTable;
import com.eainde.compliance.document.DocumentNode;
import com.eainde.compliance.document.DocumentTree;
import com.eainde.compliance.document.RequestContext;
import com.eainde.compliance.model.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the rule battery over a parsed document.
 *
 * <h3>Contract</h3>
 * <ul>
 *   <li>Pure and deterministic: the same document and context always give the same list.</li>
 *   <li>Violations are reported in rule order, then in each rule's own order.</li>
 *   <li>A rule that throws contributes no violations and one warning; the other rules still run.</li>
 * </ul>
 */
public class TechnicalScanner {

    private static final Logger log = LoggerFactory.getLogger(TechnicalScanner.class);

    private final RuleRegistry registry;
    private final RegulationCitationTable citations;

    public TechnicalScanner(RuleRegistry registry, RegulationCitationTable citations) {
        this.registry = registry;
        this.citations = citations;
    }

    public List<Violation> scan(DocumentNode document, RequestContext context) {
        return scanWithWarnings(document, context).violations();
    }

    /**
     * @throws IllegalArgumentException when {@code document} or {@code context} is null
     */
    public ScanResult scanWithWarnings(DocumentNode document, RequestContext context) {
        if (context == null) {
            throw new IllegalArgumentException("request context must not be null");
        }
        RuleInput input = new RuleInput(DocumentTree.of(document), context, citations);

        List<Violation> violations = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (Map.Entry<RuleId, ComplianceRule> entry : registry.rules().entrySet()) {
            RuleId id = entry.getKey();
            try {
                List<Violation> found = entry.getValue().evaluate(input);
                if (found != null) {
                    violations.addAll(found);
                }
            } catch (RuntimeException e) {
                log.warn("Rule {} failed, skipping: {}", id, e.getMessage(), e);
                warnings.add("Rule " + id + " failed: " + e.getMessage());
            }
        }
        log.debug("Scan of {} complete: {} violations from {} rules", context.url(), violations.size(), registry.size());
        return new ScanResult(violations, warnings);
    }
}
