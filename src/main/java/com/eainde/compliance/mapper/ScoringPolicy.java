package com.eainde.compliance.mapper;

import com.eainde.compliance.model.Severity;

import java.util.EnumMap;
import java.util.Map;

/**
 * Severity penalties for the compliance score and the fix-priority band of each severity.
 *
 * <h3>Defaults</h3>
 * <pre>
 *   severity   penalty   priority band
 *   critical   30        1
 *   high       20        2..4
 *   medium     10        5..7
 *   low         5        8..
 * </pre>
 *
 * <p>Within a band, issues take consecutive priorities in discovery order and the last
 * issues share the band's upper bound. Bands never overlap, so a more severe issue always
 * has a strictly lower priority than a less severe one.</p>
 */
public final class ScoringPolicy {

    public static final int MAX_SCORE = 100;

    private final Map<Severity, Integer> penalties;
    private final int criticalMaxPriority;
    private final int highMaxPriority;
    private final int mediumMaxPriority;

    private ScoringPolicy(Builder builder) {
        this.penalties = new EnumMap<>(builder.penalties);
        this.criticalMaxPriority = builder.criticalMaxPriority;
        this.highMaxPriority = builder.highMaxPriority;
        this.mediumMaxPriority = builder.mediumMaxPriority;

        if (criticalMaxPriority < 1
                || highMaxPriority <= criticalMaxPriority
                || mediumMaxPriority <= highMaxPriority) {
            throw new IllegalArgumentException("Priority bands must satisfy 1 <= critical < high < medium, got "
                    + criticalMaxPriority + "/" + highMaxPriority + "/" + mediumMaxPriority);
        }
    }

    // =========================================================================
    //  Score
    // =========================================================================

    public int penalty(Severity severity) {
        return penalties.get(severity);
    }

    /**
     * 100 minus the summed penalties, clamped to [0, 100].
     *
     * @throws IllegalStateException if the clamped score somehow falls outside the range
     */
    public int score(Map<Severity, Integer> counts) {
        long deductions = 0;
        for (Map.Entry<Severity, Integer> e : counts.entrySet()) {
            deductions += (long) penalty(e.getKey()) * e.getValue();
        }
        long score = Math.max(0, Math.min(MAX_SCORE, MAX_SCORE - deductions));
        if (score < 0 || score > MAX_SCORE) {
            throw new IllegalStateException("Compliance score out of range: " + score);
        }
        return (int) score;
    }

    // =========================================================================
    //  Priority bands
    // =========================================================================

    public int firstPriority(Severity severity) {
        return switch (severity) {
            case CRITICAL -> 1;
            case HIGH -> criticalMaxPriority + 1;
            case MEDIUM -> highMaxPriority + 1;
            case LOW -> mediumMaxPriority + 1;
        };
    }

    public int lastPriority(Severity severity) {
        return switch (severity) {
            case CRITICAL -> criticalMaxPriority;
            case HIGH -> highMaxPriority;
            case MEDIUM -> mediumMaxPriority;
            case LOW -> Integer.MAX_VALUE;
        };
    }

    /** The severity whose band contains {@code priority}. */
    public Severity bandOf(int priority) {
        if (priority <= criticalMaxPriority) return Severity.CRITICAL;
        if (priority <= highMaxPriority) return Severity.HIGH;
        if (priority <= mediumMaxPriority) return Severity.MEDIUM;
        return Severity.LOW;
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public static ScoringPolicy defaults() {
        return builder().build();
    }

    public static class Builder {
        private final Map<Severity, Integer> penalties = new EnumMap<>(Map.of(
                Severity.CRITICAL, 30,
                Severity.HIGH, 20,
                Severity.MEDIUM, 10,
                Severity.LOW, 5));
        private int criticalMaxPriority = 1;
        private int highMaxPriority = 4;
        private int mediumMaxPriority = 7;

        public Builder penalty(Severity severity, int penalty) {
            if (penalty < 0) {
                throw new IllegalArgumentException("penalty for " + severity + " must be >= 0, got " + penalty);
            }
            penalties.put(severity, penalty);
            return this;
        }

        public Builder criticalMaxPriority(int value) {
            this.criticalMaxPriority = value;
            return this;
        }

        public Builder highMaxPriority(int value) {
            this.highMaxPriority = value;
            return this;
        }

        public Builder mediumMaxPriority(int value) {
            this.mediumMaxPriority = value;
            return this;
        }

        public ScoringPolicy build() {
            return new ScoringPolicy(this);
        }
    }
}
