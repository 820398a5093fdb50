package org.texweaver.api;

/**
 * A pure data class representing a position in the LaTeX source.
 * It is part of the public API and free of implementation details.
 *
 * @param offset The zero-based character offset into the source text.
 * @param line The one-based line number.
 * @param column The one-based column number.
 */
public record SourceInfo(int offset, int line, int column) {

    /** The position of the first character of any source. */
    public static final SourceInfo START = new SourceInfo(0, 1, 1);

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
