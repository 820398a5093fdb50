package org.texweaver.frontend.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * A brace group {@code {...}} that is not the argument of a known command.
 *
 * @param children The content between the braces.
 * @param span The source range, empty for synthesized nodes.
 */
public record Group(List<Node> children, Optional<SourceSpan> span) implements Node {

    public Group {
        children = List.copyOf(children);
        span = span == null ? Optional.empty() : span;
    }

    /**
     * Creates a synthesized group.
     * @param children The content.
     * @return The node.
     */
    public static Group of(List<Node> children) {
        return new Group(children, Optional.empty());
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitGroup(this);
    }

    @Override
    public List<List<Node>> childLists() {
        return List.of(children);
    }

    @Override
    public Node reconstructWithChildLists(List<List<Node>> newChildLists) {
        return new Group(newChildLists.get(0), Optional.empty());
    }
}
