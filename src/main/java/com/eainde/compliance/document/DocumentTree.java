package com.eainde.compliance.document;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Pre-order index over a {@link DocumentNode} tree with positional paths and parent links.
 * Built once per stage; immutable and safe to share.
 *
 * <p>Trees deeper than {@link #MAX_DEPTH} elements are rejected: every element stores its full
 * path, so depth bounds both the walk and the index size.
 */
public final class DocumentTree {

    /** Deepest root-to-element chain accepted, root included. */
    public static final int MAX_DEPTH = 512;

    private final DocumentNode root;
    private final List<LocatedElement> elements;

    private DocumentTree(DocumentNode root) {
        this.root = root;
        List<LocatedElement> collected = new ArrayList<>();
        collect(root, collected);
        this.elements = List.copyOf(collected);
    }

    /**
     * @throws IllegalArgumentException when {@code root} is null or nested deeper than {@link #MAX_DEPTH}
     */
    public static DocumentTree of(DocumentNode root) {
        if (root == null) {
            throw new IllegalArgumentException("document must not be null");
        }
        return new DocumentTree(root);
    }

    public DocumentNode root() {
        return root;
    }

    /** All elements in document (pre-order) order; the root is first. */
    public List<LocatedElement> elements() {
        return elements;
    }

    public List<LocatedElement> find(Predicate<DocumentNode> predicate) {
        return elements.stream().filter(e -> predicate.test(e.node())).toList();
    }

    public Optional<LocatedElement> first(Predicate<DocumentNode> predicate) {
        return elements.stream().filter(e -> predicate.test(e.node())).findFirst();
    }

    public List<LocatedElement> byTag(String... tags) {
        return find(n -> n.is(tags));
    }

    public Optional<LocatedElement> parentOf(LocatedElement element) {
        return element.parentIndex() < 0 ? Optional.empty() : Optional.of(elements.get(element.parentIndex()));
    }

    /** True when some ancestor of {@code element} has one of {@code tags}. */
    public boolean hasAncestor(LocatedElement element, String... tags) {
        Optional<LocatedElement> current = parentOf(element);
        while (current.isPresent()) {
            if (current.get().node().is(tags)) return true;
            current = parentOf(current.get());
        }
        return false;
    }

    private static void collect(DocumentNode root, List<LocatedElement> out) {
        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(root, List.of(root.tag() + "[1]"), -1));
        while (!stack.isEmpty()) {
            Pending next = stack.pop();
            if (next.path().size() > MAX_DEPTH) {
                throw new IllegalArgumentException("document nested deeper than " + MAX_DEPTH + " elements");
            }
            int index = out.size();
            out.add(new LocatedElement(next.node(), next.path(), index, next.parentIndex()));

            List<DocumentNode> children = next.node().children();
            List<Pending> pending = new ArrayList<>(children.size());
            Map<String, Integer> seen = new HashMap<>();
            for (DocumentNode child : children) {
                int position = seen.merge(child.tag(), 1, Integer::sum);
                List<String> childPath = new ArrayList<>(next.path());
                childPath.add(child.tag() + "[" + position + "]");
                pending.add(new Pending(child, childPath, index));
            }
            // reversed so the first child is popped first
            for (int i = pending.size() - 1; i >= 0; i--) {
                stack.push(pending.get(i));
            }
        }
    }

    private record Pending(DocumentNode node, List<String> path, int parentIndex) {
    }
}
