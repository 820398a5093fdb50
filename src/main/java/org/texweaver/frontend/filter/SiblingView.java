package org.texweaver.frontend.filter;

import org.texweaver.frontend.parser.ast.Node;

import java.util.List;
import java.util.stream.Stream;

/**
 * A read-only window onto the siblings that follow the node currently being filtered.
 */
public final class SiblingView {

    private static final SiblingView EMPTY = new SiblingView(List.of(), 0);

    private final List<Node> siblings;
    private final int from;

    SiblingView(List<Node> siblings, int from) {
        this.siblings = siblings;
        this.from = from;
    }

    /**
     * @return A view without siblings, as seen by the root of a traversal.
     */
    public static SiblingView empty() {
        return EMPTY;
    }

    /**
     * @return The number of remaining siblings.
     */
    public int size() {
        return siblings.size() - from;
    }

    /**
     * @return True if the current node is the last one of its list.
     */
    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * @param index Zero for the sibling directly after the current node.
     * @return The sibling.
     * @throws IndexOutOfBoundsException if fewer siblings remain.
     */
    public Node get(int index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfBoundsException("Sibling " + index + " of " + size());
        }
        return siblings.get(from + index);
    }

    /**
     * @return The remaining siblings in order.
     */
    public Stream<Node> stream() {
        return siblings.subList(from, siblings.size()).stream();
    }
}
