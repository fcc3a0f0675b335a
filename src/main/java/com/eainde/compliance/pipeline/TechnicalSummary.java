package com.eainde.compliance.pipeline;

import com.eainde.compliance.document.RequestContext;
import com.eainde.compliance.mapper.MappingResult;
import com.eainde.compliance.model.RemediationPlan;
import com.eainde.compliance.model.Severity;
import com.eainde.compliance.model.Violation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the technical stage results as the plain-text context handed to the first role.
 */
final class TechnicalSummary {

    private static final int EXAMPLES_PER_FAMILY = 3;

    private TechnicalSummary() {}

    static String describe(RequestContext context, List<Violation> violations, MappingResult mapping,
                           RemediationPlan plan) {
        Map<String, List<Violation>> byFamily = new LinkedHashMap<>();
        for (Violation v : violations) {
            byFamily.computeIfAbsent(v.family(), k -> new ArrayList<>()).add(v);
        }

        StringBuilder sb = new StringBuilder();
        sb.append("TECHNICAL COMPLIANCE ANALYSIS RESULTS:\n");
        sb.append("Website: ").append(context.url()).append('\n');
        sb.append("Total Violations Found: ").append(violations.size()).append('\n');
        sb.append("Compliance Score: ").append(mapping.report().complianceScore()).append("/100\n");
        sb.append("Severity: ");
        for (Severity s : Severity.values()) {
            sb.append(s.label()).append('=').append(mapping.report().count(s)).append(' ');
        }
        sb.append("\n\nVIOLATION BREAKDOWN BY CATEGORY:\n");
        for (Map.Entry<String, List<Violation>> e : byFamily.entrySet()) {
            sb.append(e.getKey().toUpperCase(Locale.ROOT)).append(": ").append(e.getValue().size()).append(" violations\n");
            e.getValue().stream().limit(EXAMPLES_PER_FAMILY).forEach(v ->
                    sb.append("  - [").append(v.severity()).append("] ").append(v.description())
                            .append(" (").append(v.regulation()).append(")\n"));
        }
        sb.append("\nREMEDIATION OVERVIEW:\n");
        sb.append("Fixes planned: ").append(plan.fixes().size()).append('\n');
        sb.append("Priority order: ").append(String.join(", ", plan.priorityOrder())).append('\n');
        sb.append("Estimated total time: ").append(plan.estimatedTotalTime());
        return sb.toString();
    }
}
