package org.texweaver.frontend.parser.ast;

import java.util.Optional;

/**
 * A macro parameter marker such as {@code #1}. Inside nested definitions the hashes are
 * doubled ({@code ##1}); each expansion level halves them.
 *
 * @param hashes The number of leading '#' characters.
 * @param index The parameter number, 1 to 9.
 * @param span The source range, empty for synthesized nodes.
 */
public record Placeholder(int hashes, int index, Optional<SourceSpan> span) implements Node {

    public Placeholder {
        span = span == null ? Optional.empty() : span;
    }

    /**
     * Creates a synthesized single-hash placeholder.
     * @param index The parameter number.
     * @return The node.
     */
    public static Placeholder of(int index) {
        return new Placeholder(1, index, Optional.empty());
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitPlaceholder(this);
    }
}
