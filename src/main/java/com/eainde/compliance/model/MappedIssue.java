package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A violation resolved to a concrete element, citation set and fix priority.
 *
 * @param kind            violation kind
 * @param severity        violation severity
 * @param subject         violation subject
 * @param description     violation description
 * @param regulation      primary citation
 * @param suggestion      violation suggestion
 * @param elementPath     {@code tag[index]} steps from the document root to the element
 * @param elementSelector {@code #id}, {@code tag.class1.class2} or bare {@code tag}
 * @param businessImpact  consequence statement for the severity
 * @param fixPriority     1 = most urgent; monotonic with severity
 * @param estimatedEffort free-text effort estimate, e.g. {@code "2-4 hours"}
 * @param citations       every citation known for the kind
 * @param source          {@code technical} or one of the narrative sources
 */
public record MappedIssue(
        @JsonProperty("kind")             String kind,
        @JsonProperty("severity")         Severity severity,
        @JsonProperty("subject")          String subject,
        @JsonProperty("description")      String description,
        @JsonProperty("regulation")       String regulation,
        @JsonProperty("suggestion")       String suggestion,
        @JsonProperty("element_path")     List<String> elementPath,
        @JsonProperty("element_selector") String elementSelector,
        @JsonProperty("business_impact")  String businessImpact,
        @JsonProperty("fix_priority")     int fixPriority,
        @JsonProperty("estimated_effort") String estimatedEffort,
        @JsonProperty("citations")        List<String> citations,
        @JsonProperty("source")           RecordSource source
) {

    public MappedIssue {
        elementPath = elementPath == null ? List.of() : List.copyOf(elementPath);
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    /** Merge identity: two issues with the same kind and subject describe the same finding. */
    public IssueKey key() {
        return new IssueKey(kind, subject);
    }

    /** XPath-like rendering of {@link #elementPath()}, e.g. {@code /html[1]/body[1]/img[2]}. */
    @JsonProperty("element_xpath")
    public String elementXPath() {
        return "/" + String.join("/", elementPath);
    }

    /** Deduplication key. */
    public record IssueKey(String kind, String subject) {}
}
