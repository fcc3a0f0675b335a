package com.eainde.compliance.narrative;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Case-insensitive whole-word keyword matcher. A keyword also matches with a common
 * inflection ({@code s}, {@code es}, {@code ed}, {@code ing}, {@code ly}), so {@code "label"}
 * matches "labels" and "labeled" while {@code "ada"} does not match "adaptive".
 */
final class KeywordSet {

    private final List<String> keywords;
    private final Pattern pattern;

    private KeywordSet(List<String> keywords) {
        this.keywords = List.copyOf(keywords);
        this.pattern = Pattern.compile(
                keywords.stream().map(Pattern::quote).collect(Collectors.joining("|", "\\b(?:", ")(?:s|es|ed|ing|ly)?\\b")),
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    static KeywordSet of(String... keywords) {
        return new KeywordSet(List.of(keywords));
    }

    boolean matches(String text) {
        return text != null && pattern.matcher(text).find();
    }

    List<String> keywords() {
        return keywords;
    }
}
