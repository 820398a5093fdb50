package org.texweaver.frontend.parser.ast;

/**
 * The delimiter pair of a {@link MathSpan}.
 */
public enum MathKind {
    /** {@code $...$} */
    INLINE("$", "$", false),
    /** {@code $$...$$} */
    DISPLAY("$$", "$$", true),
    /** {@code \[...\]} */
    BRACKET_DISPLAY("\\[", "\\]", true),
    /** {@code \(...\)} */
    PAREN_INLINE("\\(", "\\)", false);

    private final String open;
    private final String close;
    private final boolean display;

    MathKind(String open, String close, boolean display) {
        this.open = open;
        this.close = close;
        this.display = display;
    }

    /** @return The opening delimiter. */
    public String open() {
        return open;
    }

    /** @return The closing delimiter. */
    public String close() {
        return close;
    }

    /** @return True for display math. */
    public boolean isDisplay() {
        return display;
    }
}
