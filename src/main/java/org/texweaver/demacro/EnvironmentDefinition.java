package org.texweaver.demacro;

import org.texweaver.frontend.parser.ast.Node;

import java.util.List;
import java.util.Optional;

/**
 * A data structure that stores a single custom environment definition.
 *
 * @param name The environment name.
 * @param arity The number of parameters of the begin code, 0 to 9.
 * @param defaultArgument If present, the first parameter is optional and this is its value.
 * @param begin The template that replaces {@code \begin{name}} and its arguments.
 * @param end The template that replaces {@code \end{name}}; it takes no parameters.
 */
public record EnvironmentDefinition(
        String name,
        int arity,
        Optional<List<Node>> defaultArgument,
        List<Node> begin,
        List<Node> end
) {
    public EnvironmentDefinition {
        defaultArgument = defaultArgument == null ? Optional.empty() : defaultArgument.map(List::copyOf);
        begin = List.copyOf(begin);
        end = List.copyOf(end);
    }

    /**
     * @return The number of parameters that must be given as {...} groups.
     */
    public int mandatoryArity() {
        return defaultArgument.isPresent() ? arity - 1 : arity;
    }
}
