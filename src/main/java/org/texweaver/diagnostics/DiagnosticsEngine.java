package org.texweaver.diagnostics;

import org.texweaver.api.SourceInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An engine for collecting non-fatal diagnostic messages that occur while
 * documents are processed.
 * <p>
 * This decouples reporting from the actual pipeline logic. Fatal problems are
 * never reported here; they are thrown as exceptions.
 */
public class DiagnosticsEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DiagnosticsEngine.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a warning.
     *
     * @param message  The warning message.
     * @param position The position the warning refers to, may be empty.
     */
    public void reportWarning(String message, Optional<SourceInfo> position) {
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Type.WARNING, message, position);
        diagnostics.add(diagnostic);
        LOG.warn("{}", diagnostic);
    }

    /**
     * Reports an informational message.
     *
     * @param message  The message.
     * @param position The position the message refers to, may be empty.
     */
    public void reportInfo(String message, Optional<SourceInfo> position) {
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Type.INFO, message, position);
        diagnostics.add(diagnostic);
        LOG.debug("{}", diagnostic);
    }

    /**
     * Checks if warnings have been reported.
     *
     * @return {@code true} if at least one warning exists, otherwise {@code false}.
     */
    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.WARNING);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Adds all diagnostics of another engine to this one, without logging them again.
     *
     * @param other The engine whose diagnostics are taken over.
     */
    public void absorb(DiagnosticsEngine other) {
        diagnostics.addAll(other.diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
