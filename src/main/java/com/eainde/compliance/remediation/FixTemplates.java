package com.eainde.compliance.remediation;

import com.eainde.compliance.model.MappedIssue;
import com.eainde.compliance.model.RemediationFix;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Fix templates keyed by a kind substring. Lookup walks the table in insertion order and the
 * first marker contained in the issue kind wins; unmatched kinds get {@link #generic(MappedIssue)}.
 */
final class FixTemplates {

    private final Map<String, Function<MappedIssue, RemediationFix>> templates = new LinkedHashMap<>();

    FixTemplates() {
        templates.put("cookie_banner", FixTemplates::cookieBanner);
        templates.put("privacy_policy", FixTemplates::privacyPolicy);
        templates.put("contact_info", FixTemplates::contactInfo);
        templates.put("missing_alt", FixTemplates::altText);
        templates.put("h1", FixTemplates::headings);
        templates.put("unlabeled_inputs", FixTemplates::formLabels);
        templates.put("generic_links", FixTemplates::linkText);
        templates.put("keyboard_access", FixTemplates::keyboardAccess);
        templates.put("missing_landmarks", FixTemplates::landmarks);
        templates.put("no_encryption", FixTemplates::https);
        templates.put("external_scripts", FixTemplates::externalScripts);
        templates.put("missing_meta", FixTemplates::metaTags);
        templates.put("missing_title", FixTemplates::metaTags);
    }

    RemediationFix fixFor(MappedIssue issue) {
        for (Map.Entry<String, Function<MappedIssue, RemediationFix>> e : templates.entrySet()) {
            if (issue.kind() != null && issue.kind().contains(e.getKey())) {
                return e.getValue().apply(issue);
            }
        }
        return generic(issue);
    }

    static RemediationFix generic(MappedIssue issue) {
        String description = issue.suggestion() != null && !issue.suggestion().isBlank()
                ? issue.suggestion()
                : "General compliance improvement needed";
        return new RemediationFix(issue.kind(), "General Compliance Fix", description,
                "<!-- Review and update this element for compliance -->",
                List.of("Review issue details", "Apply appropriate fix", "Test implementation"),
                "Verify compliance using accessibility testing tools",
                EffortEstimate.format(EffortEstimate.DEFAULT_HOURS));
    }

    // =========================================================================
    //  GDPR
    // =========================================================================

    private static RemediationFix cookieBanner(MappedIssue issue) {
        return new RemediationFix(issue.kind(), "GDPR Cookie Consent Banner",
                "Implement a GDPR-compliant cookie consent banner with accept and reject options",
                """
                <div id="cookie-consent" role="dialog" aria-labelledby="cookie-title" hidden>
                  <h2 id="cookie-title">We use cookies</h2>
                  <p>We use cookies for analytics. Necessary cookies are always on.</p>
                  <button type="button" data-consent="all">Accept all</button>
                  <button type="button" data-consent="necessary">Accept necessary only</button>
                  <a href="/privacy#cookies">Manage preferences</a>
                </div>""",
                List.of("Add a consent banner or consent management library",
                        "Configure consent categories (necessary, analytics, marketing)",
                        "Block non-essential cookies until consent is given",
                        "Persist the visitor's choice and allow withdrawal",
                        "Update the privacy policy with cookie information",
                        "Test accept and reject paths"),
                "Verify no non-essential cookies are set before consent and that both buttons work",
                "4 hours");
    }

    private static RemediationFix privacyPolicy(MappedIssue issue) {
        return new RemediationFix(issue.kind(), "Privacy Policy Link",
                "Publish a privacy policy and link it from every page",
                """
                <footer>
                  <a href="/privacy">Privacy Policy</a>
                </footer>""",
                List.of("Draft or update the privacy policy with controller identity and purposes",
                        "Publish it at a stable URL",
                        "Link it from the global footer",
                        "Link it near every data-collection form"),
                "Check that the link is visible on every page and resolves",
                "4 hours");
    }

    private static RemediationFix contactInfo(MappedIssue issue) {
        return new RemediationFix(issue.kind(), "Data Controller Contact Details",
                "Provide contact details for data protection queries",
                """
                <address>
                  Data protection contact: <a href="mailto:privacy@example.com">privacy@example.com</a>
                </address>""",
                List.of("Name the data controller",
                        "Add an email address or form for data protection requests",
                        "Reference the contact in the privacy policy"),
                "Confirm the contact details are reachable from the home page",
                "1 hour");
    }

    // =========================================================================
    //  Accessibility
    // =========================================================================

    private static RemediationFix altText(MappedIssue issue) {
        return new RemediationFix(issue.kind(), "Image Alt Text",
                "Add descriptive alt text to all images for screen reader accessibility",
                """
                <!-- Before -->
                <img src="product-image.jpg">
                <!-- After -->
                <img src="product-image.jpg" alt="Blue wireless headphones with noise cancellation">
                <!-- Decorative -->
                <img src="border.jpg" alt="" role="presentation">""",
                List.of("Audit all images on the page",
                        "Separate decorative from informative images",
                        "Write descriptive alt text for informative images",
                        "Use alt=\"\" with role=\"presentation\" for decorative images",
                        "Test with a screen reader"),
                "Use NVDA or JAWS to verify alt text is announced correctly",
                "3 hours");
    }

    private static RemediationFix headings(MappedIssue issue) {
        return new RemediationFix(issue.kind(), "Heading Structure",
                "Give the page exactly one h1 that describes its purpose",
                """
                <h1>Product catalogue</h1>
                <h2>Headphones</h2>""",
                List.of("Identify the main topic of the page",
                        "Mark it up as the single h1",
                        "Demote other top-level headings to h2"),
                "Inspect the heading outline with a browser accessibility tool",
                "1 hour");
    }

    private static RemediationFix formLabels(MappedIssue issue) {
        return new RemediationFix(issue.kind(), "Form Input Labels",
                "Add proper labels to all form inputs",
                """
                <label for="email">Email address</label>
                <input type="email" id="email" name="email" required>

                <input type="search" aria-label="Search products">""",
                List.of("Identify all form inputs without labels",
                        "Add explicit labels using for/id attributes",
                        "Use aria-label for inputs without visible labels",
                        "Group related inputs with fieldset and legend",
                        "Test tab navigation with a screen reader"),
                "Navigate the form by keyboard and verify every field is announced",
                "2 hours");
    }

    private static RemediationFix linkText(MappedIssue issue) {
        return new RemediationFix(issue.kind(), "Descriptive Link Text",
                "Replace generic link text with text that states the destination",
                """
                <!-- Before -->
                <a href="/pricing">Click here</a>
                <!-- After -->
                <a href="/pricing">View pricing plans</a>""",
                List.of("List links whose text is 'click here', 'read more' or similar",
                        "Rewrite each to describe its target",
                        "Use aria-label only where visible text cannot change"),
                "Review the screen reader links list for unambiguous entries",
                "2 hours");
    }

    private static RemediationFix keyboardAccess(MappedIssue issue) {
        return new RemediationFix(issue.kind(), "Keyboard Accessibility",
                "Ensure all interactive elements are reachable and operable by keyboard",
                """
                <a href="#main-content" class="skip-link">Skip to main content</a>
                <button type="button" onclick="toggleMenu()">Menu</button>
                <div role="button" tabindex="0" onkeydown="onKey(event)">Custom action</div>""",
                List.of("Give every link an href",
                        "Remove tabindex=\"-1\" from interactive elements",
                        "Add keyboard handlers to custom controls",
                        "Add visible focus indicators",
                        "Verify a logical tab order"),
                "Navigate the page using only Tab, Enter, Space and arrow keys",
                "4 hours");
    }

    private static RemediationFix landmarks(MappedIssue issue) {
        return new RemediationFix(issue.kind(), "Landmark Regions",
                "Mark up page regions with semantic elements or ARIA landmark roles",
                """
                <header>...</header>
                <nav aria-label="Main">...</nav>
                <main id="main-content">...</main>
                <footer>...</footer>""",
                List.of("Wrap the page banner in header",
                        "Wrap primary navigation in nav",
                        "Wrap the main content in main",
                        "Wrap the page footer in footer"),
                "List landmarks with a screen reader and check each region is reachable",
                "3 hours");
    }

    // =========================================================================
    //  Security and SEO
    // =========================================================================

    private static RemediationFix https(MappedIssue issue) {
        return new RemediationFix(issue.kind(), "HTTPS Security",
                "Serve the site over HTTPS with a valid certificate",
                """
                <VirtualHost *:80>
                    ServerName example.com
                    Redirect permanent / https://example.com/
                </VirtualHost>
                Header always set Strict-Transport-Security "max-age=31536000; includeSubDomains\"""",
                List.of("Obtain a certificate from a trusted CA or Let's Encrypt",
                        "Install it on the web server",
                        "Redirect HTTP to HTTPS",
                        "Update internal links to HTTPS",
                        "Enable HSTS"),
                "Use an SSL checker to verify the certificate chain and grade",
                "1 day");
    }

    private static RemediationFix externalScripts(MappedIssue issue) {
        return new RemediationFix(issue.kind(), "External Script Review",
                "Review third-party scripts and pin them with subresource integrity",
                """
                <script src="https://cdn.example.com/lib.min.js"
                        integrity="sha384-..." crossorigin="anonymous"></script>""",
                List.of("Inventory every third-party script",
                        "Remove scripts that are no longer needed",
                        "Self-host or add integrity hashes to the rest",
                        "Add a Content-Security-Policy restricting script sources"),
                "Check the browser console for CSP or integrity violations",
                "3 hours");
    }

    private static RemediationFix metaTags(MappedIssue issue) {
        return new RemediationFix(issue.kind(), "SEO Meta Tags",
                "Add a descriptive title and meta description",
                """
                <title>Descriptive Page Title - Brand Name</title>
                <meta name="description" content="Compelling description under 160 characters">""",
                List.of("Add a unique title to every page",
                        "Write a meta description under 160 characters",
                        "Add Open Graph tags for social sharing"),
                "Preview the page in a search snippet tool",
                "3 hours");
    }
}
