package org.texweaver.frontend.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * The root of a parsed source.
 *
 * @param children The top-level nodes.
 * @param span The source range, covering the whole input; empty for synthesized documents.
 */
public record Document(List<Node> children, Optional<SourceSpan> span) implements Node {

    public Document {
        children = List.copyOf(children);
        span = span == null ? Optional.empty() : span;
    }

    /**
     * Creates a synthesized document.
     * @param children The top-level nodes.
     * @return The node.
     */
    public static Document of(List<Node> children) {
        return new Document(children, Optional.empty());
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitDocument(this);
    }

    @Override
    public List<List<Node>> childLists() {
        return List.of(children);
    }

    @Override
    public Node reconstructWithChildLists(List<List<Node>> newChildLists) {
        return new Document(newChildLists.get(0), Optional.empty());
    }
}
