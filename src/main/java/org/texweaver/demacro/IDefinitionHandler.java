package org.texweaver.demacro;

import org.texweaver.api.MacroException;
import org.texweaver.diagnostics.DiagnosticsEngine;
import org.texweaver.frontend.parser.ast.Command;

/**
 * The base interface for all definition handlers.
 * Each handler is responsible for one definition command (e.g., {@code \newcommand}).
 * The expander removes the definition from the tree after the handler has run.
 */
public interface IDefinitionHandler {

    /**
     * Registers the definition made by a command.
     *
     * @param definition The definition command with its captured arguments.
     * @param table The table to register the definition in.
     * @param diagnostics The engine for reporting redefinitions.
     * @throws MacroException if the definition is malformed.
     */
    void define(Command definition, MacroTable table, DiagnosticsEngine diagnostics) throws MacroException;
}
