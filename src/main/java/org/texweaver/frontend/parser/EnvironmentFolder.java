package org.texweaver.frontend.parser;

import org.texweaver.frontend.parser.ast.Argument;
import org.texweaver.frontend.parser.ast.Command;
import org.texweaver.frontend.parser.ast.Environment;
import org.texweaver.frontend.parser.ast.MathKind;
import org.texweaver.frontend.parser.ast.MathSpan;
import org.texweaver.frontend.parser.ast.Node;
import org.texweaver.frontend.parser.ast.Nodes;
import org.texweaver.frontend.parser.ast.Text;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns flat {@code \begin{name}} / {@code \end{name}} commands that pair up within one
 * sibling list into {@link Environment} nodes, and flat {@code \[ \]} and {@code \( \)}
 * commands into {@link MathSpan} nodes.
 * <p>
 * Flat commands come from template mode: a macro body like {@code \begin{quote}} is kept
 * as a plain command, and only once begin and end templates are spliced next to each
 * other can the pair be recognized. Commands without a partner are left as they are.
 */
public final class EnvironmentFolder {

    private EnvironmentFolder() {
    }

    /**
     * Folds a sibling list and, recursively, all lists below it.
     * @param nodes The nodes.
     * @return The folded list, or the same instance if nothing was folded.
     */
    public static List<Node> fold(List<Node> nodes) {
        List<Node> out = new ArrayList<>(nodes.size());
        boolean changed = false;
        int i = 0;
        while (i < nodes.size()) {
            Node node = nodes.get(i);
            int close = findPartner(nodes, i);
            if (close > i) {
                out.add(build((Command) node, fold(nodes.subList(i + 1, close)), (Command) nodes.get(close)));
                changed = true;
                i = close + 1;
                continue;
            }
            Node folded = foldChildren(node);
            changed |= folded != node;
            out.add(folded);
            i++;
        }
        return changed ? out : nodes;
    }

    /**
     * @param node A node.
     * @return True if the node is a flat \begin, \end or math delimiter command.
     */
    public static boolean isFlatDelimiter(Node node) {
        if (!(node instanceof Command command)) {
            return false;
        }
        switch (command.name()) {
            case "begin", "end":
                return environmentName(command).isPresent();
            case "[", "]", "(", ")":
                return command.arguments().isEmpty();
            default:
                return false;
        }
    }

    /**
     * Returns the name of a flat \begin or \end command.
     * @param command The command.
     * @return The name, if the first argument is a text-only group.
     */
    public static Optional<String> environmentName(Command command) {
        if (command.arguments().isEmpty()) {
            return Optional.empty();
        }
        Argument first = command.arguments().get(0);
        if (first.kind() != Argument.Kind.MANDATORY || first.children().isEmpty()) {
            return Optional.empty();
        }
        for (Node child : first.children()) {
            if (!(child instanceof Text)) {
                return Optional.empty();
            }
        }
        return Optional.of(Nodes.textContent(first.children()));
    }

    private static Node foldChildren(Node node) {
        List<List<Node>> lists = node.childLists();
        if (lists.isEmpty()) {
            return node;
        }
        List<List<Node>> folded = new ArrayList<>(lists.size());
        boolean changed = false;
        for (List<Node> list : lists) {
            List<Node> result = fold(list);
            changed |= result != list;
            folded.add(result);
        }
        return changed ? node.reconstructWithChildLists(folded) : node;
    }

    /**
     * @return The index of the closing partner of the opener at {@code start}, or -1.
     */
    private static int findPartner(List<Node> nodes, int start) {
        Optional<Delimiter> opener = delimiter(nodes.get(start));
        if (opener.isEmpty() || !opener.get().opening()) {
            return -1;
        }
        int depth = 0;
        for (int i = start; i < nodes.size(); i++) {
            Optional<Delimiter> delimiter = delimiter(nodes.get(i));
            if (delimiter.isEmpty() || !delimiter.get().key().equals(opener.get().key())) {
                continue;
            }
            depth += delimiter.get().opening() ? 1 : -1;
            if (depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private record Delimiter(String key, boolean opening) {}

    private static Optional<Delimiter> delimiter(Node node) {
        if (!isFlatDelimiter(node)) {
            return Optional.empty();
        }
        Command command = (Command) node;
        switch (command.name()) {
            case "begin":
                return Optional.of(new Delimiter("env:" + environmentName(command).get(), true));
            case "end":
                return Optional.of(new Delimiter("env:" + environmentName(command).get(), false));
            case "[":
                return Optional.of(new Delimiter("[]", true));
            case "]":
                return Optional.of(new Delimiter("[]", false));
            case "(":
                return Optional.of(new Delimiter("()", true));
            default:
                return Optional.of(new Delimiter("()", false));
        }
    }

    private static Node build(Command open, List<Node> body, Command close) {
        switch (open.name()) {
            case "[":
                return MathSpan.of(MathKind.BRACKET_DISPLAY, body);
            case "(":
                return MathSpan.of(MathKind.PAREN_INLINE, body);
            default:
                List<Argument> arguments = open.arguments();
                return new Environment(
                        environmentName(open).get(),
                        arguments.get(0).leading(),
                        arguments.subList(1, arguments.size()),
                        body,
                        close.arguments().get(0).leading(),
                        Optional.empty());
        }
    }
}
