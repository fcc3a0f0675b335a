package com.eainde.compliance.document;

import java.util.List;

/**
 * A node together with its position in a {@link DocumentTree}.
 *
 * @param node        the element
 * @param path        {@code tag[index]} steps from the root, index 1-based among same-tag siblings
 * @param index       pre-order position in the tree
 * @param parentIndex pre-order position of the parent, -1 for the root
 */
public record LocatedElement(DocumentNode node, List<String> path, int index, int parentIndex) {

    public LocatedElement {
        path = List.copyOf(path);
    }

    public String tag() {
        return node.tag();
    }

    public ElementLocator locator() {
        return ElementLocator.of(this);
    }
}
