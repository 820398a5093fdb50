package org.texweaver.frontend.filter;

import org.texweaver.frontend.parser.ast.Node;

/**
 * A rewrite rule applied by the {@link TreeWalker} to every node of a tree.
 */
@FunctionalInterface
public interface NodeFilter {

    /**
     * Decides what happens to a node.
     *
     * @param node The node being visited.
     * @param remaining The siblings after {@code node} at the same level that have not been visited yet.
     * @return The decision; never null.
     */
    FilterResult apply(Node node, SiblingView remaining);
}
