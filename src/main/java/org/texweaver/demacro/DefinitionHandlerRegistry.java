package org.texweaver.demacro;

import org.texweaver.demacro.features.command.NewCommandHandler;
import org.texweaver.demacro.features.environment.NewEnvironmentHandler;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for definition handlers. This class holds a map of command names
 * to their corresponding handlers.
 */
public class DefinitionHandlerRegistry {
    private final Map<String, IDefinitionHandler> handlers = new HashMap<>();

    /**
     * Registers a new definition handler.
     * @param commandName The name of the definition command without backslash (e.g., "newcommand").
     * @param handler The handler for the command.
     */
    public void register(String commandName, IDefinitionHandler handler) {
        handlers.put(commandName, handler);
    }

    /**
     * Gets the handler for a given command name.
     * @param commandName The name of the command.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IDefinitionHandler> get(String commandName) {
        return Optional.ofNullable(handlers.get(commandName));
    }

    /**
     * Initializes the registry with the handlers of the LaTeX definition commands.
     * @return A new instance of {@link DefinitionHandlerRegistry} with all handlers registered.
     */
    public static DefinitionHandlerRegistry initialize() {
        DefinitionHandlerRegistry registry = new DefinitionHandlerRegistry();
        registry.register("newcommand", new NewCommandHandler(NewCommandHandler.Mode.NEW));
        registry.register("renewcommand", new NewCommandHandler(NewCommandHandler.Mode.RENEW));
        registry.register("providecommand", new NewCommandHandler(NewCommandHandler.Mode.PROVIDE));
        registry.register("newenvironment", new NewEnvironmentHandler(NewEnvironmentHandler.Mode.NEW));
        registry.register("renewenvironment", new NewEnvironmentHandler(NewEnvironmentHandler.Mode.RENEW));
        return registry;
    }
}
