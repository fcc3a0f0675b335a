package com.eainde.compliance.document;

import java.util.List;

/**
 * Where an issue lives in the document: a positional path and a CSS-style selector.
 *
 * <pre>
 *   path     = [html[1], body[1], form[1], input[2]]
 *   selector = #email | input.field.wide | input
 * </pre>
 */
public record ElementLocator(List<String> path, String selector) {

    public ElementLocator {
        path = List.copyOf(path);
    }

    public static ElementLocator of(LocatedElement element) {
        return new ElementLocator(element.path(), selectorOf(element.node()));
    }

    /** Locator of the document root, used for document-level findings. */
    public static ElementLocator documentRoot(DocumentTree tree) {
        return of(tree.elements().get(0));
    }

    /** {@code #id} when the element has one, else {@code tag.class1.class2}, else the bare tag. */
    public static String selectorOf(DocumentNode node) {
        String id = node.attr("id");
        if (id != null && !id.isBlank()) {
            return "#" + id.strip();
        }
        List<String> classes = node.classes();
        if (!classes.isEmpty()) {
            return node.tag() + "." + String.join(".", classes);
        }
        return node.tag();
    }
}
