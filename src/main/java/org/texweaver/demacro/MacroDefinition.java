package org.texweaver.demacro;

import org.texweaver.frontend.parser.ast.Node;

import java.util.List;
import java.util.Optional;

/**
 * A data structure that stores a single macro definition.
 *
 * @param name The command name without backslash.
 * @param arity The number of parameters, 0 to 9.
 * @param defaultArgument If present, the first parameter is optional and this is its value.
 * @param body The body.
 */
public record MacroDefinition(
        String name,
        int arity,
        Optional<List<Node>> defaultArgument,
        MacroBody body
) {
    public MacroDefinition {
        defaultArgument = defaultArgument == null ? Optional.empty() : defaultArgument.map(List::copyOf);
    }

    /**
     * @return The number of parameters that must be given as {...} groups.
     */
    public int mandatoryArity() {
        return defaultArgument.isPresent() ? arity - 1 : arity;
    }
}
