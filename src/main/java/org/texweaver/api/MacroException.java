package org.texweaver.api;

import java.util.Optional;

/**
 * Thrown when de-macroing a tree fails. A failed call returns no partial tree and leaves
 * the macro table as it was before the call.
 */
public class MacroException extends LatexException {

    private final MacroErrorKind kind;
    private final SourceInfo position;

    /**
     * Constructs a new macro exception without a source position, used for synthesized nodes.
     * @param kind The error code.
     * @param message The detail message.
     */
    public MacroException(MacroErrorKind kind, String message) {
        super(message);
        this.kind = kind;
        this.position = null;
    }

    /**
     * Constructs a new macro exception pointing at the invocation that failed.
     * @param kind The error code.
     * @param message The detail message.
     * @param position The position of the invocation.
     */
    public MacroException(MacroErrorKind kind, String message, SourceInfo position) {
        super(message, position);
        this.kind = kind;
        this.position = position;
    }

    /**
     * Constructs a new macro exception caused by another error, e.g. a body that does not parse.
     * @param kind The error code.
     * @param message The detail message.
     * @param cause The cause.
     */
    public MacroException(MacroErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.position = null;
    }

    /**
     * @return The error code.
     */
    public MacroErrorKind getKind() {
        return kind;
    }

    /**
     * @return The position of the failed invocation, if it came from parsed source.
     */
    public Optional<SourceInfo> getPosition() {
        return Optional.ofNullable(position);
    }
}
