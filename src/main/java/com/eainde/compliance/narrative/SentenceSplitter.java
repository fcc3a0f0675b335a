package com.eainde.compliance.narrative;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits narrative text into sentence units for keyword classification. Bullet markers and
 * list numbering are stripped, fragments shorter than the minimum length are dropped and
 * duplicates removed, keeping first occurrence order.
 *
 * <pre>
 * SentenceSplitter splitter = SentenceSplitter.builder().minLength(20).build();
 * List&lt;String&gt; units = splitter.split(text);
 * </pre>
 */
public class SentenceSplitter {

    private static final Pattern BOUNDARY = Pattern.compile("(?<=[.!?])\\s+|\\R+");
    private static final Pattern LEADING_MARKER = Pattern.compile("^(?:[-*•>#]+|\\d+[.)])\\s*");

    private final int minLength;
    private final int maxLength;

    private SentenceSplitter(Builder builder) {
        this.minLength = builder.minLength;
        this.maxLength = builder.maxLength;
        if (maxLength < minLength) {
            throw new IllegalArgumentException(
                    "maxLength (" + maxLength + ") must be >= minLength (" + minLength + ")");
        }
    }

    public List<String> split(String text) {
        if (text == null || text.isBlank()) return List.of();
        Set<String> units = new LinkedHashSet<>();
        for (String raw : BOUNDARY.split(text)) {
            String unit = clean(raw);
            if (unit.length() < minLength) continue;
            units.add(unit.length() > maxLength ? unit.substring(0, maxLength).strip() : unit);
        }
        return new ArrayList<>(units);
    }

    /** Non-blank lines with surrounding whitespace removed, markers kept. */
    public static List<String> lines(String text) {
        if (text == null || text.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String stripped = line.strip();
            if (!stripped.isEmpty()) out.add(stripped);
        }
        return out;
    }

    static String clean(String raw) {
        String unit = raw.strip();
        String previous;
        do {
            previous = unit;
            unit = LEADING_MARKER.matcher(unit).replaceFirst("").strip();
        } while (!unit.equals(previous));
        unit = unit.replace("**", "").replace("`", "");
        return unit.strip();
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public static SentenceSplitter withDefaults() {
        return builder().build();
    }

    public static class Builder {
        private int minLength = 15;
        private int maxLength = 400;

        /** Shortest unit kept. Default: 15. */
        public Builder minLength(int minLength) {
            if (minLength < 1) throw new IllegalArgumentException("minLength must be >= 1");
            this.minLength = minLength;
            return this;
        }

        /** Longer units are truncated. Default: 400. */
        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public SentenceSplitter build() {
            return new SentenceSplitter(this);
        }
    }
}
