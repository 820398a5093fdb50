package org.texweaver.diagnostics;

import org.texweaver.api.SourceInfo;

import java.util.Optional;

/**
 * Represents a single non-fatal finding (warning, info) reported while
 * processing a document, e.g. a macro that was redefined with \newcommand.
 *
 * @param type The type of the diagnostic (e.g., WARNING).
 * @param message The diagnostic message.
 * @param position The source position the finding refers to, absent for synthesized nodes.
 */
public record Diagnostic(
        Type type,
        String message,
        Optional<SourceInfo> position
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A problem that the caller most likely wants to fix. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return position
                .map(p -> String.format("[%s] %s: %s", type, p, message))
                .orElseGet(() -> String.format("[%s] %s", type, message));
    }
}
