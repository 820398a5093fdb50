package org.texweaver.demacro.features.environment;

import org.texweaver.api.LatexException;
import org.texweaver.api.MacroErrorKind;
import org.texweaver.api.MacroException;
import org.texweaver.demacro.EnvironmentDefinition;
import org.texweaver.demacro.MacroTable;
import org.texweaver.diagnostics.DiagnosticsEngine;
import org.texweaver.frontend.parser.Parser;
import org.texweaver.frontend.parser.ParserOptions;
import org.texweaver.frontend.parser.ast.Command;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for the {@link NewEnvironmentHandler}.
 * These are unit tests and do not require external resources.
 */
public class NewEnvironmentHandlerTest {

    private static Command definition(String source) throws LatexException {
        return (Command) Parser.parse(source, ParserOptions.DEFAULT).children().get(0);
    }

    /**
     * Verifies that an environment definition with a default is registered with both code parts.
     * This is a unit test for the \newenvironment handler.
     */
    @Test
    @Tag("unit")
    void testDefinition() throws LatexException {
        // Arrange
        MacroTable table = new MacroTable();
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        new NewEnvironmentHandler(NewEnvironmentHandler.Mode.NEW)
                .define(definition("\\newenvironment{ note }[1][Note]{\\textbf{#1}: }{\\par}"), table, diagnostics);

        // Assert
        EnvironmentDefinition note = table.getEnvironment("note").orElseThrow();
        assertThat(note.arity()).isEqualTo(1);
        assertThat(note.mandatoryArity()).isZero();
        assertThat(note.begin()).hasSize(3);
        assertThat(note.end()).hasSize(1);
        assertThat(table.signatures().environment("note")).contains(0);
    }

    /**
     * Verifies that \renewenvironment of an unknown name is registered with a warning.
     */
    @Test
    @Tag("unit")
    void testRenewUnknown() throws LatexException {
        // Arrange
        MacroTable table = new MacroTable();
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        new NewEnvironmentHandler(NewEnvironmentHandler.Mode.RENEW)
                .define(definition("\\renewenvironment{box}{[}{]}"), table, diagnostics);

        // Assert
        assertThat(table.getEnvironment("box")).isPresent();
        assertThat(diagnostics.hasWarnings()).isTrue();
        assertThat(diagnostics.summary()).contains("defines unknown environment box");
    }

    /**
     * Verifies that the end code may not refer to parameters.
     * This is a unit test for the \newenvironment handler.
     */
    @Test
    @Tag("unit")
    void testParameterInEndCode() throws LatexException {
        // Arrange
        Command command = definition("\\newenvironment{e}[1]{<#1>}{</#1>}");

        // Act
        MacroException e = catchThrowableOfType(() -> new NewEnvironmentHandler(NewEnvironmentHandler.Mode.NEW)
                .define(command, new MacroTable(), new DiagnosticsEngine()), MacroException.class);

        // Assert
        assertThat(e.getKind()).isEqualTo(MacroErrorKind.MALFORMED_DEFINITION);
    }
}
