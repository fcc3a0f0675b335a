package com.eainde.compliance.mapper;

import com.eainde.compliance.model.MappedIssue;
import com.eainde.compliance.model.Severity;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Hands out fix priorities within each severity band in call order. One instance per mapping
 * run; not thread-safe.
 */
public final class PriorityAssigner {

    private final ScoringPolicy policy;
    private final Map<Severity, Integer> assigned = new EnumMap<>(Severity.class);

    public PriorityAssigner(ScoringPolicy policy) {
        this.policy = policy;
    }

    /** An assigner that continues after the priorities already taken by {@code issues}. */
    public static PriorityAssigner continuing(ScoringPolicy policy, List<MappedIssue> issues) {
        PriorityAssigner assigner = new PriorityAssigner(policy);
        for (MappedIssue issue : issues) {
            assigner.assigned.merge(issue.severity(), 1, Integer::sum);
        }
        return assigner;
    }

    public int next(Severity severity) {
        int taken = assigned.merge(severity, 1, Integer::sum) - 1;
        long candidate = (long) policy.firstPriority(severity) + taken;
        return (int) Math.min(candidate, policy.lastPriority(severity));
    }
}
