package com.eainde.compliance.remediation;

import com.eainde.compliance.mapper.ScoringPolicy;
import com.eainde.compliance.model.MappedIssue;
import com.eainde.compliance.model.RemediationFix;
import com.eainde.compliance.model.RemediationPlan;
import com.eainde.compliance.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns mapped issues into a remediation plan: one fix per distinct kind, a priority order
 * and three delivery phases.
 *
 * <h3>Phases</h3>
 * <p>A kind lands in the phase of its most urgent issue, using the {@link ScoringPolicy}
 * priority bands: critical band to {@code critical_immediate}, high band to
 * {@code high_priority}, everything else to {@code medium_priority}.</p>
 */
public class RemediationAdvisor {

    private static final Logger log = LoggerFactory.getLogger(RemediationAdvisor.class);

    private final ScoringPolicy policy;
    private final FixTemplates templates = new FixTemplates();

    public RemediationAdvisor(ScoringPolicy policy) {
        this.policy = policy;
    }

    public RemediationPlan plan(List<MappedIssue> issues) {
        Map<String, RemediationFix> fixesByKind = new LinkedHashMap<>();
        Map<String, Integer> bestPriority = new LinkedHashMap<>();
        for (MappedIssue issue : issues) {
            fixesByKind.computeIfAbsent(issue.kind(), k -> templates.fixFor(issue));
            bestPriority.merge(issue.kind(), issue.fixPriority(), Math::min);
        }

        List<String> priorityOrder = new ArrayList<>(fixesByKind.keySet());
        priorityOrder.sort(Comparator.comparingInt(kind -> FixCategory.of(kind).ordinal()));

        List<String> critical = new ArrayList<>();
        List<String> high = new ArrayList<>();
        List<String> medium = new ArrayList<>();
        for (Map.Entry<String, Integer> e : bestPriority.entrySet()) {
            Severity band = policy.bandOf(e.getValue());
            switch (band) {
                case CRITICAL -> critical.add(e.getKey());
                case HIGH -> high.add(e.getKey());
                default -> medium.add(e.getKey());
            }
        }

        int totalHours = fixesByKind.values().stream()
                .mapToInt(fix -> EffortEstimate.hours(fix.estimatedEffort()))
                .sum();

        log.debug("Remediation plan: {} fixes, {} hours", fixesByKind.size(), totalHours);
        return new RemediationPlan(
                List.copyOf(fixesByKind.values()),
                priorityOrder,
                new RemediationPlan.Phases(critical, high, medium),
                totalHours,
                EffortEstimate.format(totalHours));
    }

    /** The fix template for a single issue, generic when no template matches. */
    public RemediationFix fixFor(MappedIssue issue) {
        return templates.fixFor(issue);
    }
}
