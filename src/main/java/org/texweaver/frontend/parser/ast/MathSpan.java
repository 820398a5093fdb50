package org.texweaver.frontend.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * A formula delimited by one of the {@link MathKind} pairs.
 *
 * @param kind The delimiter pair.
 * @param children The formula, parsed with the same grammar as text.
 * @param span The source range, empty for synthesized nodes.
 */
public record MathSpan(MathKind kind, List<Node> children, Optional<SourceSpan> span) implements Node {

    public MathSpan {
        children = List.copyOf(children);
        span = span == null ? Optional.empty() : span;
    }

    /**
     * Creates a synthesized formula.
     * @param kind The delimiter pair.
     * @param children The formula content.
     * @return The node.
     */
    public static MathSpan of(MathKind kind, List<Node> children) {
        return new MathSpan(kind, children, Optional.empty());
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitMath(this);
    }

    @Override
    public List<List<Node>> childLists() {
        return List.of(children);
    }

    @Override
    public Node reconstructWithChildLists(List<List<Node>> newChildLists) {
        return new MathSpan(kind, newChildLists.get(0), Optional.empty());
    }
}
