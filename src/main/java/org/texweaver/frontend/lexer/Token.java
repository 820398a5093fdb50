package org.texweaver.frontend.lexer;

import org.texweaver.api.SourceInfo;

/**
 * Represents a single token extracted from the source text by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source, so that concatenating all
 *             token texts reproduces the input.
 * @param value The processed value of the token: the command name without the backslash
 *              for {@link TokenType#COMMAND}, the parameter index for {@link TokenType#PARAMETER},
 *              otherwise null.
 * @param offset The zero-based offset of the first character.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int offset,
        int line,
        int column
) {
    /**
     * @return The position of the first character of this token.
     */
    public SourceInfo position() {
        return new SourceInfo(offset, line, column);
    }

    /**
     * @return The offset just past the last character of this token.
     */
    public int endOffset() {
        return offset + text.length();
    }

    /**
     * Returns the command name of a {@link TokenType#COMMAND} token.
     * @return The name without the leading backslash.
     */
    public String commandName() {
        return (String) value;
    }

    /**
     * @return True if this is a command token with the given name.
     */
    public boolean isCommand(String name) {
        return type == TokenType.COMMAND && name.equals(value);
    }
}
