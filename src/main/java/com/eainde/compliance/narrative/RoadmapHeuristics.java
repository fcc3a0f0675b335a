package com.eainde.compliance.narrative;

import java.util.Locale;

/**
 * Derives the reason, effort and validation of a roadmap action from its wording when the
 * narrator did not supply them.
 */
final class RoadmapHeuristics {

    private static final KeywordSet LARGE = KeywordSet.of("implement", "framework", "system", "establish");
    private static final KeywordSet SMALL = KeywordSet.of("add", "fix", "update", "replace", "remove");
    private static final KeywordSet REVIEW = KeywordSet.of("review", "audit", "test", "assess");

    private RoadmapHeuristics() {}

    static String reasonFor(String action) {
        String a = action.toLowerCase(Locale.ROOT);
        if (a.contains("cookie") || a.contains("consent")) {
            return "Required by GDPR Article 7 for lawful consent mechanisms";
        }
        if (a.contains("alt") || a.contains("image")) {
            return "WCAG 2.1 Success Criterion 1.1.1 requires alternative text for images";
        }
        if (a.contains("ssl") || a.contains("https") || a.contains("tls")) {
            return "Security compliance and data protection requirement";
        }
        if (a.contains("label") || a.contains("form")) {
            return "WCAG 2.1 Success Criterion 1.3.1 requires proper form labeling";
        }
        return "Improves overall compliance and user experience";
    }

    static String effortFor(String action) {
        if (LARGE.matches(action)) return "3-5 days";
        if (SMALL.matches(action)) return "4-8 hours";
        if (REVIEW.matches(action)) return "1-2 days";
        return "2-4 hours";
    }

    static String validationFor(String action) {
        String a = action.toLowerCase(Locale.ROOT);
        if (a.contains("cookie")) return "Test consent banner functionality and verify cookie compliance";
        if (a.contains("alt")) return "Use a screen reader to verify all images have proper descriptions";
        if (a.contains("ssl") || a.contains("https")) return "Verify certificate validity and HTTPS redirect";
        if (a.contains("label")) return "Test form navigation with keyboard and screen reader";
        return "Perform compliance testing and user acceptance testing";
    }
}
