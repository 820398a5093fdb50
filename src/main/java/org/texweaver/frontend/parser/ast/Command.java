package org.texweaver.frontend.parser.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A command invocation such as {@code \section*[short]{Long title}}.
 *
 * @param name The command name without backslash.
 * @param starred Whether a '*' directly follows the name.
 * @param arguments The captured arguments in source order.
 * @param span The source range, empty for synthesized nodes.
 */
public record Command(
        String name,
        boolean starred,
        List<Argument> arguments,
        Optional<SourceSpan> span
) implements Node {

    public Command {
        arguments = List.copyOf(arguments);
        span = span == null ? Optional.empty() : span;
    }

    /**
     * Creates a synthesized command.
     * @param name The command name without backslash.
     * @param arguments The arguments.
     * @return The node.
     */
    public static Command of(String name, Argument... arguments) {
        return new Command(name, false, Arrays.asList(arguments), Optional.empty());
    }

    /**
     * @return The [...] arguments in order.
     */
    public List<Argument> optionalArguments() {
        return arguments.stream()
                .filter(a -> a.kind() == Argument.Kind.OPTIONAL)
                .collect(Collectors.toList());
    }

    /**
     * @return The {...} and bare arguments in order.
     */
    public List<Argument> mandatoryArguments() {
        return arguments.stream()
                .filter(a -> a.kind() != Argument.Kind.OPTIONAL)
                .collect(Collectors.toList());
    }

    /**
     * @param newName The new name.
     * @return A synthesized copy with another name.
     */
    public Command withName(String newName) {
        return new Command(newName, starred, arguments, Optional.empty());
    }

    /**
     * @param newArguments The new arguments.
     * @return A synthesized copy with other arguments.
     */
    public Command withArguments(List<Argument> newArguments) {
        return new Command(name, starred, newArguments, Optional.empty());
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCommand(this);
    }

    @Override
    public List<List<Node>> childLists() {
        List<List<Node>> lists = new ArrayList<>();
        for (Argument argument : arguments) {
            lists.add(argument.children());
        }
        return lists;
    }

    @Override
    public Node reconstructWithChildLists(List<List<Node>> newChildLists) {
        List<Argument> newArguments = new ArrayList<>();
        for (int i = 0; i < arguments.size(); i++) {
            newArguments.add(arguments.get(i).withChildren(newChildLists.get(i)));
        }
        return new Command(name, starred, newArguments, Optional.empty());
    }
}
