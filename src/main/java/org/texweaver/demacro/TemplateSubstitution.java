package org.texweaver.demacro;

import org.texweaver.api.MacroErrorKind;
import org.texweaver.api.MacroException;
import org.texweaver.frontend.parser.ast.Node;
import org.texweaver.frontend.parser.ast.Nodes;
import org.texweaver.frontend.parser.ast.Placeholder;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Instantiates a template with bound arguments. The result is a fresh tree: every
 * placeholder occurrence gets its own copy of the argument, and nested definitions
 * lose one level of '#' doubling.
 */
final class TemplateSubstitution {

    private TemplateSubstitution() {
    }

    /**
     * @param template The template nodes.
     * @param arguments The bound arguments; {@code #k} is replaced by element k-1.
     * @return The instantiated nodes.
     * @throws MacroException if a placeholder refers to a missing argument.
     */
    static List<Node> substitute(List<Node> template, List<List<Node>> arguments) throws MacroException {
        List<Node> result = new ArrayList<>(template.size());
        for (Node node : template) {
            if (node instanceof Placeholder placeholder) {
                result.addAll(replace(placeholder, arguments));
                continue;
            }
            List<List<Node>> lists = node.childLists();
            if (lists.isEmpty()) {
                result.add(Nodes.deepCopy(node));
                continue;
            }
            List<List<Node>> substituted = new ArrayList<>(lists.size());
            for (List<Node> list : lists) {
                substituted.add(substitute(list, arguments));
            }
            result.add(node.reconstructWithChildLists(substituted));
        }
        return result;
    }

    private static List<Node> replace(Placeholder placeholder, List<List<Node>> arguments) throws MacroException {
        if (placeholder.hashes() > 1) {
            return List.of(new Placeholder(placeholder.hashes() / 2, placeholder.index(), Optional.empty()));
        }
        if (placeholder.index() > arguments.size()) {
            throw new MacroException(MacroErrorKind.MALFORMED_DEFINITION,
                    "#" + placeholder.index() + " refers to a missing argument");
        }
        return Nodes.deepCopy(arguments.get(placeholder.index() - 1));
    }
}
