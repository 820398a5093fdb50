package org.texweaver.api;

/**
 * Thrown when the tree builder finds structural malformation in the input.
 * Always fatal to the parse call; the position tells callers where to report it.
 */
public class ParseException extends LatexException {

    private final ParseErrorKind kind;
    private final SourceInfo position;

    /**
     * Constructs a new parse exception.
     * @param kind The error code.
     * @param message The detail message.
     * @param position The position of the offending token.
     */
    public ParseException(ParseErrorKind kind, String message, SourceInfo position) {
        super(message, position);
        this.kind = kind;
        this.position = position;
    }

    /**
     * @return The error code.
     */
    public ParseErrorKind getKind() {
        return kind;
    }

    /**
     * @return The position of the offending token.
     */
    public SourceInfo getPosition() {
        return position;
    }
}
