package com.eainde.compliance.scanner;

import com.eainde.compliance.document.DocumentNode;
import com.eainde.compliance.document.DocumentTree;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.eainde.compliance.document.DocumentNode.element;
import static com.eainde.compliance.document.DocumentNode.text;
import static org.assertj.core.api.Assertions.assertThat;

class ElementChecksTest {

    @Test
    @DisplayName("decorative images with empty alt pass, unmarked empty alt fails")
    void imageAlt() {
        assertThat(ElementChecks.isImageMissingAlt(text("img", Map.of("alt", "", "role", "presentation"), ""))).isFalse();
        assertThat(ElementChecks.isImageMissingAlt(text("img", Map.of("aria-label", "Logo"), ""))).isFalse();
        assertThat(ElementChecks.isImageMissingAlt(text("img", Map.of("alt", " "), ""))).isTrue();
        assertThat(ElementChecks.isImageMissingAlt(text("img", Map.of("role", "presentation"), ""))).isTrue();
    }

    @Test
    @DisplayName("inputs are labelled by a wrapping label, label[for], or aria attributes")
    void inputLabels() {
        DocumentNode doc = element("form",
                element("label", text("input", Map.of("type", "text"), "")),
                text("label", Map.of("for", "q"), "Search"),
                text("input", Map.of("id", "q", "type", "search"), ""),
                text("input", Map.of("aria-labelledby", "hint"), ""),
                text("input", Map.of("type", "hidden", "name", "csrf"), ""),
                text("input", Map.of("id", "orphan", "type", "email"), ""));
        DocumentTree tree = DocumentTree.of(doc);

        List<String> unlabeled = tree.elements().stream()
                .filter(e -> ElementChecks.isUnlabeledInput(tree, e))
                .map(e -> e.node().attr("id"))
                .toList();

        assertThat(unlabeled).containsExactly("orphan");
    }

    @Test
    @DisplayName("scripts are external when their host differs from the page host")
    void externalScripts() {
        assertThat(ElementChecks.isExternalScript(text("script", Map.of("src", "//cdn.net/a.js"), ""), "shop.example.com"))
                .isTrue();
        assertThat(ElementChecks.isExternalScript(text("script", Map.of("src", "https://shop.example.com:443/a.js"), ""),
                "shop.example.com")).isFalse();
        assertThat(ElementChecks.isExternalScript(text("script", Map.of("src", "/local.js"), ""), "shop.example.com"))
                .isFalse();
        assertThat(ElementChecks.hostOf("https://cdn.net/path?q=1")).isEqualTo("cdn.net");
    }

    @Test
    @DisplayName("landmarks are recognised by tag or role")
    void landmarks() {
        assertThat(ElementChecks.isLandmark(text("nav", ""))).isTrue();
        assertThat(ElementChecks.isLandmark(text("div", Map.of("role", "navigation"), ""))).isTrue();
        assertThat(ElementChecks.isLandmark(text("div", ""))).isFalse();
    }

    @Test
    @DisplayName("generic link text is matched after trimming and lower-casing")
    void genericLinks() {
        assertThat(ElementChecks.isGenericLink(text("a", Map.of("href", "/x"), "  Click Here "))).isTrue();
        assertThat(ElementChecks.isGenericLink(text("a", Map.of("href", "/x"), "Click here for pricing"))).isFalse();
        assertThat(ElementChecks.isGenericLink(text("a", "here"))).isFalse();
    }
}
