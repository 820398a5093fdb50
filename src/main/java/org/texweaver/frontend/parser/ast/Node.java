package org.texweaver.frontend.parser.ast;

import org.texweaver.frontend.filter.NodeFilter;
import org.texweaver.frontend.filter.TreeWalker;
import org.texweaver.frontend.render.Renderer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The base interface for all nodes of the LaTeX syntax tree.
 * <p>
 * The set of variants is closed; operations over all variants are written as a
 * {@link NodeVisitor}. Nodes are immutable: every rewrite produces new nodes and
 * leaves the original tree untouched.
 */
public sealed interface Node
        permits Text, Comment, Command, Group, Environment, MathSpan, Placeholder, Document {

    /**
     * Returns the source range this node was parsed from. Nodes created or rebuilt by
     * filters and by macro expansion have no span.
     *
     * @return The span, or empty for synthesized nodes.
     */
    Optional<SourceSpan> span();

    /**
     * Dispatches to the visitor method of this variant.
     *
     * @param visitor The visitor.
     * @param <R> The result type.
     * @return The visitor's result.
     */
    <R> R accept(NodeVisitor<R> visitor);

    /**
     * Returns the independent sibling lists below this node: one per command argument,
     * plus the body for environments, groups, math spans and documents.
     * A generic traversal can walk the tree without knowing the variants.
     *
     * @return The child lists; empty for leaves.
     */
    default List<List<Node>> childLists() {
        return List.of();
    }

    /**
     * Creates a copy of this node with new child lists, in the order returned by
     * {@link #childLists()}. The copy has no span since its text no longer matches the source.
     *
     * @param newChildLists The new child lists.
     * @return The rebuilt node, or this node for leaves.
     */
    default Node reconstructWithChildLists(List<List<Node>> newChildLists) {
        return this;
    }

    /**
     * Returns all direct children, concatenated over all child lists.
     * @return The children in source order.
     */
    default List<Node> getChildren() {
        List<Node> children = new ArrayList<>();
        for (List<Node> list : childLists()) {
            children.addAll(list);
        }
        return children;
    }

    /**
     * Renders this node back into LaTeX source.
     * @return The source text.
     */
    default String render() {
        return Renderer.render(this);
    }

    /**
     * Rewrites this subtree with a filter rule. See {@link TreeWalker#filter(Node, NodeFilter)}.
     *
     * @param rule The rule applied to every node.
     * @return The rewritten tree.
     */
    default Node filter(NodeFilter rule) {
        return TreeWalker.filter(this, rule);
    }
}
