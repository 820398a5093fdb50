package org.texweaver.demacro.features.environment;

import org.texweaver.api.MacroException;
import org.texweaver.demacro.DefinitionSyntax;
import org.texweaver.demacro.EnvironmentDefinition;
import org.texweaver.demacro.IDefinitionHandler;
import org.texweaver.demacro.MacroTable;
import org.texweaver.diagnostics.DiagnosticsEngine;
import org.texweaver.frontend.parser.EnvironmentFolder;
import org.texweaver.frontend.parser.ast.Command;
import org.texweaver.frontend.parser.ast.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Handles {@code \newenvironment} and {@code \renewenvironment}, starred or not.
 * The syntax is {@code \newenvironment{name}[n][default]{begin code}{end code}}.
 */
public class NewEnvironmentHandler implements IDefinitionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(NewEnvironmentHandler.class);

    /**
     * How an existing definition of the same name is treated.
     */
    public enum Mode {
        /** Expects a new name. */
        NEW,
        /** Expects an existing name. */
        RENEW
    }

    private final Mode mode;

    /**
     * @param mode How an existing definition of the same name is treated.
     */
    public NewEnvironmentHandler(Mode mode) {
        this.mode = mode;
    }

    @Override
    public void define(Command definition, MacroTable table, DiagnosticsEngine diagnostics) throws MacroException {
        DefinitionSyntax.Parts parts = DefinitionSyntax.split(definition, 3);
        String name = DefinitionSyntax.environmentName(parts.mandatory().get(0), definition);
        int arity = DefinitionSyntax.argumentCount(parts.argumentCount(), definition);
        Optional<List<Node>> defaultArgument = parts.defaultValue()
                .map(a -> DefinitionSyntax.unwrapSingleGroup(a.children()));
        if (defaultArgument.isPresent() && arity == 0) {
            throw DefinitionSyntax.malformed("Environment " + name + " has a default but no arguments", definition);
        }
        List<Node> begin = EnvironmentFolder.fold(parts.mandatory().get(1).children());
        List<Node> end = EnvironmentFolder.fold(parts.mandatory().get(2).children());
        DefinitionSyntax.checkPlaceholders(begin, arity, definition);
        DefinitionSyntax.checkPlaceholders(end, 0, definition);

        boolean exists = table.getEnvironment(name).isPresent();
        if (mode == Mode.NEW && exists) {
            diagnostics.reportWarning("\\" + definition.name() + " redefines existing environment " + name,
                    definition.span().map(s -> s.position()));
        } else if (mode == Mode.RENEW && !exists) {
            diagnostics.reportWarning("\\" + definition.name() + " defines unknown environment " + name,
                    definition.span().map(s -> s.position()));
        }
        table.registerEnvironment(new EnvironmentDefinition(name, arity, defaultArgument, begin, end));
        LOG.debug("Registered environment {} with {} arguments", name, arity);
    }
}
