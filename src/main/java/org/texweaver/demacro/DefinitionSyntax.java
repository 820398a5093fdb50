package org.texweaver.demacro;

import org.texweaver.api.MacroErrorKind;
import org.texweaver.api.MacroException;
import org.texweaver.frontend.parser.ast.Argument;
import org.texweaver.frontend.parser.ast.Command;
import org.texweaver.frontend.parser.ast.Comment;
import org.texweaver.frontend.parser.ast.Group;
import org.texweaver.frontend.parser.ast.Node;
import org.texweaver.frontend.parser.ast.Nodes;
import org.texweaver.frontend.parser.ast.Placeholder;
import org.texweaver.frontend.parser.ast.Text;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the parts of {@code \newcommand}-style definitions and checks templates.
 */
public final class DefinitionSyntax {

    /** The largest number of parameters a macro can have. */
    public static final int MAX_ARITY = 9;

    private DefinitionSyntax() {
    }

    /**
     * Splits the arguments of a definition command into its mandatory parts and the
     * optional {@code [n]} and {@code [default]} between the first and second mandatory part.
     *
     * @param definition The definition command.
     * @param mandatoryParts How many mandatory parts the command needs.
     * @return The mandatory parts followed by at most two optional parts.
     * @throws MacroException if the arguments do not have this shape.
     */
    public static Parts split(Command definition, int mandatoryParts) throws MacroException {
        List<Argument> mandatory = new ArrayList<>();
        List<Argument> optional = new ArrayList<>();
        for (Argument argument : definition.arguments()) {
            if (argument.kind() == Argument.Kind.OPTIONAL) {
                if (mandatory.size() != 1) {
                    throw malformed("Misplaced [...] in \\" + definition.name(), definition);
                }
                optional.add(argument);
            } else {
                mandatory.add(argument);
            }
        }
        if (mandatory.size() != mandatoryParts) {
            throw malformed("\\" + definition.name() + " expects " + mandatoryParts
                    + " arguments but has " + mandatory.size(), definition);
        }
        if (optional.size() > 2) {
            throw malformed("\\" + definition.name() + " has more than two [...] arguments", definition);
        }
        return new Parts(mandatory, optional);
    }

    /**
     * The arguments of a definition command, grouped by kind.
     * @param mandatory The mandatory parts in order.
     * @param optional The optional parts in order: the argument count, then the default.
     */
    public record Parts(List<Argument> mandatory, List<Argument> optional) {

        /** @return The {@code [n]} part, if given. */
        public Optional<Argument> argumentCount() {
            return optional.isEmpty() ? Optional.empty() : Optional.of(optional.get(0));
        }

        /** @return The {@code [default]} part, if given. */
        public Optional<Argument> defaultValue() {
            return optional.size() < 2 ? Optional.empty() : Optional.of(optional.get(1));
        }
    }

    /**
     * Reads the name of the macro being defined from {@code {\name}} or a bare {@code \name}.
     * @param argument The name part.
     * @param definition The definition, for error positions.
     * @return The command name without backslash.
     * @throws MacroException if the part is not a single command.
     */
    public static String commandName(Argument argument, Command definition) throws MacroException {
        List<Node> content = withoutBlanks(argument.children());
        if (content.size() == 1 && content.get(0) instanceof Command command && command.arguments().isEmpty()) {
            return command.name();
        }
        throw malformed("Expected a command name in \\" + definition.name(), definition);
    }

    /**
     * Reads an environment name from {@code {name}}.
     * @param argument The name part.
     * @param definition The definition, for error positions.
     * @return The name.
     * @throws MacroException if the part is not plain text.
     */
    public static String environmentName(Argument argument, Command definition) throws MacroException {
        List<Node> content = withoutBlanks(argument.children());
        if (content.size() == 1 && content.get(0) instanceof Text text) {
            return text.text().strip();
        }
        throw malformed("Expected an environment name in \\" + definition.name(), definition);
    }

    /**
     * Reads the {@code [n]} part.
     * @param argument The part, if present.
     * @param definition The definition, for error positions.
     * @return The number of parameters, 0 if the part is absent.
     * @throws MacroException if the part is not a number from 0 to 9.
     */
    public static int argumentCount(Optional<Argument> argument, Node definition) throws MacroException {
        if (argument.isEmpty()) {
            return 0;
        }
        for (Node child : argument.get().children()) {
            if (!(child instanceof Text) && !(child instanceof Comment)) {
                throw malformed("The number of arguments must be a number", definition);
            }
        }
        return parseArity(Nodes.textContent(argument.get().children()), definition);
    }

    /**
     * @param text The text of an argument count.
     * @param at The node errors refer to, may be null.
     * @return The count.
     * @throws MacroException if the text is not a number from 0 to 9.
     */
    public static int parseArity(String text, Node at) throws MacroException {
        int arity;
        try {
            arity = Integer.parseInt(text.strip());
        } catch (NumberFormatException e) {
            throw new MacroException(MacroErrorKind.MALFORMED_DEFINITION,
                    "The number of arguments must be a number, was '" + text + "'", e);
        }
        checkArity(arity, at);
        return arity;
    }

    /**
     * @param arity A number of parameters.
     * @param at The node errors refer to, may be null.
     * @throws MacroException if the number is outside 0 to 9.
     */
    public static void checkArity(int arity, Node at) throws MacroException {
        if (arity < 0 || arity > MAX_ARITY) {
            throw malformed("The number of arguments must be between 0 and " + MAX_ARITY + ", was " + arity, at);
        }
    }

    /**
     * Returns the content of an optional argument, unwrapping a single group so that
     * {@code [{a]b}]} can pass a bracket.
     * @param nodes The content of the argument.
     * @return The unwrapped content.
     */
    public static List<Node> unwrapSingleGroup(List<Node> nodes) {
        List<Node> content = new ArrayList<>();
        for (Node node : nodes) {
            if (!(node instanceof Comment)) {
                content.add(node);
            }
        }
        if (content.size() == 1 && content.get(0) instanceof Group group) {
            return group.children();
        }
        return nodes;
    }

    /**
     * Checks the placeholders of a template: single-hash placeholders must refer to one
     * of the parameters, and deeper ones must have an even number of hashes.
     *
     * @param template The template.
     * @param arity The number of parameters.
     * @param at The node errors refer to, may be null.
     * @throws MacroException if a placeholder is out of range.
     */
    public static void checkPlaceholders(List<Node> template, int arity, Node at) throws MacroException {
        for (Node node : template) {
            if (node instanceof Placeholder placeholder) {
                if (placeholder.hashes() == 1 && placeholder.index() > arity) {
                    throw malformed("#" + placeholder.index() + " used in a template with "
                            + arity + " arguments", at);
                }
                if (placeholder.hashes() > 1 && placeholder.hashes() % 2 != 0) {
                    throw malformed("Odd number of '#' in " + placeholder.render(), at);
                }
            }
            for (List<Node> children : node.childLists()) {
                checkPlaceholders(children, arity, at);
            }
        }
    }

    /**
     * Creates a {@link MacroErrorKind#MALFORMED_DEFINITION} error.
     * @param message The message.
     * @param at The node the error refers to, may be null.
     * @return The exception.
     */
    public static MacroException malformed(String message, Node at) {
        if (at != null && at.span().isPresent()) {
            return new MacroException(MacroErrorKind.MALFORMED_DEFINITION, message, at.span().get().position());
        }
        return new MacroException(MacroErrorKind.MALFORMED_DEFINITION, message);
    }

    private static List<Node> withoutBlanks(List<Node> nodes) {
        List<Node> content = new ArrayList<>();
        for (Node node : nodes) {
            if (!Nodes.isBlank(node)) {
                content.add(node);
            }
        }
        return content;
    }
}
