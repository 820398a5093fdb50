package org.texweaver.frontend.parser.ast;

import java.util.Optional;

/**
 * A run of literal characters, whitespace included.
 *
 * @param text The characters exactly as they appear in the source.
 * @param span The source range, empty for synthesized nodes.
 */
public record Text(String text, Optional<SourceSpan> span) implements Node {

    public Text {
        span = span == null ? Optional.empty() : span;
    }

    /**
     * Creates a synthesized text node.
     * @param text The characters. No escaping is applied.
     * @return The node.
     */
    public static Text of(String text) {
        return new Text(text, Optional.empty());
    }

    /**
     * @return True if the text consists of whitespace only.
     */
    public boolean isBlank() {
        return text.isBlank();
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitText(this);
    }
}
