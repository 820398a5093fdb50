package org.texweaver.api;

/**
 * The common base of all errors raised by the LaTeX pipeline.
 * <p>
 * It is part of the public API and hides the internal exception types of the parser
 * and the macro expander.
 */
public class LatexException extends Exception {

    /**
     * Constructs a new exception with the specified detail message.
     * @param message The detail message.
     */
    public LatexException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public LatexException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new exception with the specified detail message and source information.
     * @param message The detail message.
     * @param sourceInfo The position the error refers to.
     */
    public LatexException(String message, SourceInfo sourceInfo) {
        super(String.format("%s at %s", message, sourceInfo), null);
    }
}
