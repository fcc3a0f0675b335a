package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single detected deviation from a compliance rule, as produced by the scanner.
 *
 * @param kind        dotted tag {@code <family>.<rule>}, e.g. {@code "gdpr.cookie_banner"}
 * @param severity    fixed per rule
 * @param subject     short description of the offending element(s), e.g. {@code "3 images"}
 * @param description human-readable statement of the problem
 * @param regulation  primary regulation citation for the kind
 * @param suggestion  one-line recommendation
 */
public record Violation(
        @JsonProperty("kind")        String kind,
        @JsonProperty("severity")    Severity severity,
        @JsonProperty("subject")     String subject,
        @JsonProperty("description") String description,
        @JsonProperty("regulation")  String regulation,
        @JsonProperty("suggestion")  String suggestion
) {

    /** Prefix of {@link #kind()} before the first dot ({@code "gdpr"} for {@code "gdpr.cookie_banner"}). */
    public String family() {
        return familyOf(kind);
    }

    public static String familyOf(String kind) {
        if (kind == null) return "";
        int dot = kind.indexOf('.');
        return dot < 0 ? kind : kind.substring(0, dot);
    }
}
