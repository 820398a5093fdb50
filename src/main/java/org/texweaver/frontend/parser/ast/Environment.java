package org.texweaver.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A {@code \begin{name}...\end{name}} block.
 *
 * @param name The environment name as written between the braces.
 * @param beginGap The whitespace between {@code \begin} and the name group.
 * @param arguments The arguments following {@code \begin{name}}, in source order.
 * @param body The content of the environment.
 * @param endGap The whitespace between {@code \end} and the name group.
 * @param span The source range, empty for synthesized nodes.
 */
public record Environment(
        String name,
        String beginGap,
        List<Argument> arguments,
        List<Node> body,
        String endGap,
        Optional<SourceSpan> span
) implements Node {

    public Environment {
        beginGap = beginGap == null ? "" : beginGap;
        endGap = endGap == null ? "" : endGap;
        arguments = List.copyOf(arguments);
        body = List.copyOf(body);
        span = span == null ? Optional.empty() : span;
    }

    /**
     * Creates a synthesized environment without arguments.
     * @param name The environment name.
     * @param body The content.
     * @return The node.
     */
    public static Environment of(String name, List<Node> body) {
        return new Environment(name, "", List.of(), body, "", Optional.empty());
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
     * @return The {...} arguments in order.
     */
    public List<Argument> mandatoryArguments() {
        return arguments.stream()
                .filter(a -> a.kind() != Argument.Kind.OPTIONAL)
                .collect(Collectors.toList());
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitEnvironment(this);
    }

    @Override
    public List<List<Node>> childLists() {
        List<List<Node>> lists = new ArrayList<>();
        for (Argument argument : arguments) {
            lists.add(argument.children());
        }
        lists.add(body);
        return lists;
    }

    @Override
    public Node reconstructWithChildLists(List<List<Node>> newChildLists) {
        List<Argument> newArguments = new ArrayList<>();
        for (int i = 0; i < arguments.size(); i++) {
            newArguments.add(arguments.get(i).withChildren(newChildLists.get(i)));
        }
        List<Node> newBody = newChildLists.get(arguments.size());
        return new Environment(name, beginGap, newArguments, newBody, endGap, Optional.empty());
    }
}
