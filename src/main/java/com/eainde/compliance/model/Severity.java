package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ordinal urgency of a finding. Declaration order is the rank:
 * {@code CRITICAL} (0) is the most urgent, {@code LOW} (3) the least.
 */
public enum Severity {

    CRITICAL("critical"),
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** 0 for critical, 3 for low. */
    public int rank() {
        return ordinal();
    }

    /**
     * Lenient parse used for collaborator output ("High", " critical ", "MAJOR").
     * Unknown or blank text yields {@code fallback}.
     */
    public static Severity parse(String text, Severity fallback) {
        if (text == null || text.isBlank()) return fallback;
        String normalized = text.strip().toLowerCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.label.equals(normalized)) return severity;
        }
        return switch (normalized) {
            case "severe", "major", "blocker" -> CRITICAL;
            case "important", "urgent", "serious" -> HIGH;
            case "moderate" -> MEDIUM;
            case "minor", "trivial", "info" -> LOW;
            default -> fallback;
        };
    }

    @JsonCreator
    static Severity fromJson(String text) {
        return parse(text, MEDIUM);
    }

    @Override
    public String toString() {
        return label;
    }
}
