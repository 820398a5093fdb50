package org.texweaver.frontend.parser.ast;

import org.texweaver.api.SourceInfo;

/**
 * The range of source text a node was parsed from, from start (inclusive) to end (exclusive).
 *
 * @param start The offset of the first character.
 * @param end The offset just past the last character.
 * @param line The line of the first character.
 * @param column The column of the first character.
 */
public record SourceSpan(int start, int end, int line, int column) {

    /**
     * @return The position of the first character.
     */
    public SourceInfo position() {
        return new SourceInfo(start, line, column);
    }

    /**
     * @return The number of characters covered.
     */
    public int length() {
        return end - start;
    }

    /**
     * Returns the covered text.
     * @param source The text this span was parsed from.
     * @return The substring of the source.
     */
    public String extract(String source) {
        return source.substring(start, end);
    }

    @Override
    public String toString() {
        return line + ":" + column + "[" + start + ".." + end + ")";
    }
}
