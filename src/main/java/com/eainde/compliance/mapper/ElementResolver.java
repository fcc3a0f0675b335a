package com.eainde.compliance.mapper;

import com.eainde.compliance.document.DocumentTree;
import com.eainde.compliance.document.ElementLocator;
import com.eainde.compliance.document.LocatedElement;
import com.eainde.compliance.document.RequestContext;
import com.eainde.compliance.scanner.ElementChecks;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Finds the element that best represents a violation kind: the first element the
 * corresponding rule flags, or a structural fallback. Kinds with no element of their own
 * resolve to {@code body}, or to the root when the document has no body. Resolvers see the
 * request context so host-dependent checks match what the rule flagged.
 */
final class ElementResolver {

    private final Map<String, BiFunction<DocumentTree, RequestContext, Optional<LocatedElement>>> resolvers = new LinkedHashMap<>();

    ElementResolver() {
        resolvers.put("wcag.missing_alt", (t, c) -> t.first(ElementChecks::isImageMissingAlt));
        resolvers.put("wcag.unlabeled_inputs",
                (t, c) -> t.elements().stream().filter(e -> ElementChecks.isUnlabeledInput(t, e)).findFirst());
        resolvers.put("wcag.generic_links", (t, c) -> t.first(ElementChecks::isGenericLink));
        resolvers.put("wcag.multiple_h1", (t, c) -> t.elements().stream().filter(e -> e.node().is("h1")).skip(1).findFirst());
        resolvers.put("ada.keyboard_access", (t, c) -> t.first(ElementChecks::isKeyboardInaccessible));
        resolvers.put("security.external_scripts", (t, c) -> t.first(n -> ElementChecks.isExternalScript(n, c.host())));
        resolvers.put("security.no_encryption", (t, c) -> Optional.of(t.elements().get(0)));
        resolvers.put("seo.missing_meta_description", (t, c) -> t.first(n -> n.is("head")));
        resolvers.put("seo.missing_title", (t, c) -> t.first(n -> n.is("head")));
    }

    ElementLocator resolve(DocumentTree tree, RequestContext context, String kind) {
        BiFunction<DocumentTree, RequestContext, Optional<LocatedElement>> resolver = resolvers.get(kind);
        Optional<LocatedElement> found = resolver == null ? Optional.empty() : resolver.apply(tree, context);
        return found.or(() -> tree.first(n -> n.is("body")))
                .map(ElementLocator::of)
                .orElseGet(() -> ElementLocator.documentRoot(tree));
    }
}
