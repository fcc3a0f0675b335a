package com.eainde.compliance.scanner;

import com.eainde.compliance.document.DocumentNode;
import com.eainde.compliance.document.DocumentTree;
import com.eainde.compliance.document.LocatedElement;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Element-level predicates shared by the rules and by the issue mapper, so that the element
 * an issue is located at is always one the rule actually flagged.
 */
public final class ElementChecks {

    public static final Set<String> LABELLED_INPUT_TYPES = Set.of("text", "email", "password", "tel", "url", "search");
    public static final Set<String> GENERIC_LINK_TEXT = Set.of("click here", "read more", "more", "here", "link");
    public static final Set<String> LANDMARK_TAGS = Set.of("nav", "main", "header", "footer", "aside");

    private static final Pattern CONSENT_MARKER = Pattern.compile("cookie|consent|gdpr", Pattern.CASE_INSENSITIVE);
    private static final Pattern LANDMARK_ROLE =
            Pattern.compile("navigation|main|banner|contentinfo|complementary", Pattern.CASE_INSENSITIVE);
    private static final Set<String> INTERACTIVE_TAGS = Set.of("button", "a", "input", "select", "textarea");

    private ElementChecks() {}

    /** Element whose id or class mentions cookie, consent or gdpr. */
    public static boolean isConsentMarker(DocumentNode node) {
        return matches(CONSENT_MARKER, node.attr("id")) || matches(CONSENT_MARKER, node.attr("class"));
    }

    public static boolean isPrivacyLink(DocumentNode node) {
        if (!node.is("a")) return false;
        return containsIgnoreCase(node.textContent(), "privacy") || containsIgnoreCase(node.attr("href"), "privacy");
    }

    /**
     * Image with neither non-blank {@code alt} nor {@code aria-label}. An explicitly decorative
     * image ({@code role="presentation"} or {@code "none"} with an {@code alt} attribute) passes.
     */
    public static boolean isImageMissingAlt(DocumentNode node) {
        if (!node.is("img")) return false;
        if (node.hasNonBlankAttr("alt") || node.hasNonBlankAttr("aria-label")) return false;
        String role = lower(node.attr("role"));
        return !(node.hasAttr("alt") && (role.equals("presentation") || role.equals("none")));
    }

    /** Text-like input (or textarea) with no associated label, aria-label or aria-labelledby. */
    public static boolean isUnlabeledInput(DocumentTree tree, LocatedElement element) {
        DocumentNode node = element.node();
        if (!isLabelledControl(node)) return false;
        if (node.hasNonBlankAttr("aria-label") || node.hasNonBlankAttr("aria-labelledby")) return false;
        if (tree.hasAncestor(element, "label")) return false;
        String id = node.attr("id");
        if (id != null && !id.isBlank()) {
            String wanted = id.strip();
            return tree.first(n -> n.is("label") && wanted.equals(n.attr("for"))).isEmpty();
        }
        return true;
    }

    public static boolean isGenericLink(DocumentNode node) {
        return node.is("a") && node.hasAttr("href") && GENERIC_LINK_TEXT.contains(lower(node.textContent()));
    }

    /** Anchor without href, or interactive element removed from the tab order. */
    public static boolean isKeyboardInaccessible(DocumentNode node) {
        if (!INTERACTIVE_TAGS.contains(node.tag())) return false;
        if (node.is("a") && !node.hasNonBlankAttr("href")) return true;
        String tabindex = node.attr("tabindex");
        return tabindex != null && tabindex.strip().equals("-1");
    }

    public static boolean isLandmark(DocumentNode node) {
        return LANDMARK_TAGS.contains(node.tag()) || matches(LANDMARK_ROLE, node.attr("role"));
    }

    /** Script loaded from an absolute URL. */
    public static boolean isAbsoluteScript(DocumentNode node) {
        if (!node.is("script")) return false;
        String src = lower(node.attr("src"));
        return src.startsWith("http://") || src.startsWith("https://") || src.startsWith("//");
    }

    /** Absolute script whose host differs from {@code pageHost}. */
    public static boolean isExternalScript(DocumentNode node, String pageHost) {
        if (!isAbsoluteScript(node)) return false;
        String host = hostOf(lower(node.attr("src")));
        return pageHost == null || pageHost.isEmpty() || !host.equals(pageHost);
    }

    static String hostOf(String src) {
        String rest = src.startsWith("//") ? src.substring(2) : src.substring(src.indexOf("//") + 2);
        int end = rest.length();
        for (char stop : new char[]{'/', '?', '#', ':'}) {
            int i = rest.indexOf(stop);
            if (i >= 0 && i < end) end = i;
        }
        return rest.substring(0, end);
    }

    private static boolean isLabelledControl(DocumentNode node) {
        if (node.is("textarea")) return true;
        if (!node.is("input")) return false;
        String type = lower(node.attr("type"));
        return type.isEmpty() || LABELLED_INPUT_TYPES.contains(type);
    }

    private static boolean matches(Pattern pattern, String value) {
        return value != null && pattern.matcher(value).find();
    }

    private static boolean containsIgnoreCase(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static String lower(String value) {
        return value == null ? "" : value.strip().toLowerCase(Locale.ROOT);
    }
}
