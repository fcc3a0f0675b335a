package com.eainde.compliance.scanner;

import com.eainde.compliance.document.DocumentTree;
import com.eainde.compliance.document.LocatedElement;
import com.eainde.compliance.model.Severity;
import com.eainde.compliance.model.Violation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The standard rule battery. Each method is a {@link ComplianceRule}; rules that check a
 * per-element property emit one aggregated violation whose subject carries the count.
 */
public final class ComplianceRules {

    private static final Pattern CONTACT_TEXT = Pattern.compile("contact|email|phone", Pattern.CASE_INSENSITIVE);

    private ComplianceRules() {}

    // =========================================================================
    //  GDPR
    // =========================================================================

    static List<Violation> consentMechanism(RuleInput in) {
        if (in.tree().first(ElementChecks::isConsentMarker).isPresent()) return List.of();
        return List.of(in.violation("gdpr.cookie_banner", Severity.CRITICAL, "document",
                "Missing cookie consent banner required by GDPR Article 7",
                "Implement a cookie consent banner with accept and reject options"));
    }

    static List<Violation> privacyPolicy(RuleInput in) {
        if (in.tree().first(ElementChecks::isPrivacyLink).isPresent()) return List.of();
        return List.of(in.violation("gdpr.privacy_policy", Severity.HIGH, "navigation",
                "Missing privacy policy link required by GDPR Article 13",
                "Add a visible privacy policy link in the footer or header"));
    }

    static List<Violation> contactInformation(RuleInput in) {
        boolean hasContactLink = in.tree().first(n -> n.is("a") && isContactHref(n.attr("href"))).isPresent();
        if (hasContactLink || CONTACT_TEXT.matcher(in.tree().root().textContent()).find()) return List.of();
        return List.of(in.violation("gdpr.contact_info", Severity.MEDIUM, "document",
                "Missing data controller contact information",
                "Provide clear contact information for data protection queries"));
    }

    // =========================================================================
    //  WCAG
    // =========================================================================

    static List<Violation> imageAltText(RuleInput in) {
        int missing = in.tree().find(ElementChecks::isImageMissingAlt).size();
        if (missing == 0) return List.of();
        return List.of(in.violation("wcag.missing_alt", Severity.HIGH, plural(missing, "image"),
                "Images missing alt text: " + missing + " violations",
                "Add descriptive alt text to all images"));
    }

    static List<Violation> headingStructure(RuleInput in) {
        int h1Count = in.tree().byTag("h1").size();
        if (h1Count == 0) {
            return List.of(in.violation("wcag.missing_h1", Severity.HIGH, "document",
                    "Missing main heading (h1) element",
                    "Add a descriptive h1 heading to the page"));
        }
        if (h1Count > 1) {
            return List.of(in.violation("wcag.multiple_h1", Severity.MEDIUM, "document",
                    "Multiple h1 elements found (" + h1Count + ")",
                    "Use only one h1 element per page"));
        }
        return List.of();
    }

    static List<Violation> formLabels(RuleInput in) {
        DocumentTree tree = in.tree();
        long unlabeled = tree.elements().stream().filter(e -> ElementChecks.isUnlabeledInput(tree, e)).count();
        if (unlabeled == 0) return List.of();
        return List.of(in.violation("wcag.unlabeled_inputs", Severity.HIGH, plural((int) unlabeled, "form input"),
                "Form inputs without proper labels: " + unlabeled + " violations",
                "Add proper labels or aria-label attributes to all form inputs"));
    }

    static List<Violation> linkPurpose(RuleInput in) {
        int generic = in.tree().find(ElementChecks::isGenericLink).size();
        if (generic == 0) return List.of();
        return List.of(in.violation("wcag.generic_links", Severity.MEDIUM, plural(generic, "link"),
                "Links with non-descriptive text: " + generic + " violations",
                "Use descriptive link text that indicates the link's purpose"));
    }

    // =========================================================================
    //  ADA
    // =========================================================================

    static List<Violation> keyboardOperability(RuleInput in) {
        int inaccessible = in.tree().find(ElementChecks::isKeyboardInaccessible).size();
        if (inaccessible == 0) return List.of();
        return List.of(in.violation("ada.keyboard_access", Severity.HIGH, plural(inaccessible, "interactive element"),
                "Interactive elements not accessible via keyboard",
                "Ensure all interactive elements are keyboard accessible"));
    }

    static List<Violation> landmarkRegions(RuleInput in) {
        if (in.tree().find(ElementChecks::isLandmark).size() >= 2) return List.of();
        return List.of(in.violation("ada.missing_landmarks", Severity.MEDIUM, "document structure",
                "Insufficient ARIA landmarks for screen reader navigation",
                "Add semantic HTML5 elements or ARIA landmark roles"));
    }

    // =========================================================================
    //  Security
    // =========================================================================

    static List<Violation> transportEncryption(RuleInput in) {
        if (in.context().isHttps()) return List.of();
        return List.of(in.violation("security.no_encryption", Severity.CRITICAL, "protocol",
                "Website not served over HTTPS",
                "Install a TLS certificate and redirect HTTP to HTTPS"));
    }

    static List<Violation> externalScripts(RuleInput in) {
        String host = in.context().host();
        int external = in.tree().find(n -> ElementChecks.isExternalScript(n, host)).size();
        if (external == 0) return List.of();
        return List.of(in.violation("security.external_scripts", Severity.MEDIUM, plural(external, "external script"),
                "External scripts may pose security risks",
                "Review and validate all external script sources"));
    }

    // =========================================================================
    //  SEO
    // =========================================================================

    static List<Violation> metadata(RuleInput in) {
        List<Violation> out = new ArrayList<>();
        Optional<LocatedElement> description = in.tree().first(
                n -> n.is("meta") && "description".equalsIgnoreCase(n.attr("name")));
        if (description.isEmpty() || !description.get().node().hasNonBlankAttr("content")) {
            out.add(in.violation("seo.missing_meta_description", Severity.LOW, "meta tags",
                    "Missing meta description",
                    "Add a descriptive meta description (150-160 characters)"));
        }
        Optional<LocatedElement> title = in.tree().first(n -> n.is("title"));
        if (title.isEmpty() || title.get().node().textContent().isBlank()) {
            out.add(in.violation("seo.missing_title", Severity.MEDIUM, "title tag",
                    "Missing or empty title tag",
                    "Add a descriptive page title"));
        }
        return out;
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    private static boolean isContactHref(String href) {
        if (href == null) return false;
        String h = href.strip().toLowerCase(Locale.ROOT);
        return h.startsWith("mailto:") || h.startsWith("tel:");
    }

    private static String plural(int count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }
}
