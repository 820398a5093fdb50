package org.texweaver.frontend.parser.ast;

import java.util.Optional;

/**
 * A '%' comment. LaTeX ignores the comment, the line break that ends it and the
 * indentation of the following line; all three belong to this node.
 *
 * @param text The characters after '%' up to the end of the line.
 * @param trailing The line break and the following line's leading blanks; empty at end of input.
 * @param span The source range, empty for synthesized nodes.
 */
public record Comment(String text, String trailing, Optional<SourceSpan> span) implements Node {

    public Comment {
        span = span == null ? Optional.empty() : span;
    }

    /**
     * Creates a synthesized comment ending with a line break.
     * @param text The comment text without '%'.
     * @return The node.
     */
    public static Comment of(String text) {
        return new Comment(text, "\n", Optional.empty());
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitComment(this);
    }
}
