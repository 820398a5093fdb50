package org.texweaver.demacro.features.command;

import org.texweaver.api.MacroException;
import org.texweaver.demacro.DefinitionSyntax;
import org.texweaver.demacro.IDefinitionHandler;
import org.texweaver.demacro.MacroBody;
import org.texweaver.demacro.MacroDefinition;
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
 * Handles {@code \newcommand}, {@code \renewcommand} and {@code \providecommand}, starred
 * or not. The syntax is {@code \newcommand{\name}[n][default]{body}}; the name may also be
 * given without braces.
 */
public class NewCommandHandler implements IDefinitionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(NewCommandHandler.class);

    /**
     * How an existing definition of the same name is treated.
     */
    public enum Mode {
        /** Expects a new name; redefining is reported. */
        NEW,
        /** Expects an existing name; defining a new one is reported. */
        RENEW,
        /** Keeps an existing definition. */
        PROVIDE
    }

    private final Mode mode;

    /**
     * @param mode How an existing definition of the same name is treated.
     */
    public NewCommandHandler(Mode mode) {
        this.mode = mode;
    }

    @Override
    public void define(Command definition, MacroTable table, DiagnosticsEngine diagnostics) throws MacroException {
        DefinitionSyntax.Parts parts = DefinitionSyntax.split(definition, 2);
        String name = DefinitionSyntax.commandName(parts.mandatory().get(0), definition);
        int arity = DefinitionSyntax.argumentCount(parts.argumentCount(), definition);
        Optional<List<Node>> defaultArgument = parts.defaultValue()
                .map(a -> DefinitionSyntax.unwrapSingleGroup(a.children()));
        if (defaultArgument.isPresent() && arity == 0) {
            throw DefinitionSyntax.malformed("\\" + name + " has a default but no arguments", definition);
        }
        List<Node> body = EnvironmentFolder.fold(parts.mandatory().get(1).children());
        DefinitionSyntax.checkPlaceholders(body, arity, definition);

        boolean exists = table.getMacro(name).isPresent();
        switch (mode) {
            case PROVIDE:
                if (exists) {
                    diagnostics.reportInfo("\\providecommand keeps the existing definition of \\" + name,
                            definition.span().map(s -> s.position()));
                    return;
                }
                break;
            case NEW:
                if (exists) {
                    diagnostics.reportWarning("\\" + definition.name() + " redefines existing command \\" + name,
                            definition.span().map(s -> s.position()));
                }
                break;
            case RENEW:
                if (!exists) {
                    diagnostics.reportWarning("\\" + definition.name() + " defines unknown command \\" + name,
                            definition.span().map(s -> s.position()));
                }
                break;
            default:
                throw new IllegalStateException("Unknown mode " + mode);
        }
        table.registerMacro(new MacroDefinition(name, arity, defaultArgument, new MacroBody.Template(body)));
        LOG.debug("Registered macro \\{} with {} arguments", name, arity);
    }
}
