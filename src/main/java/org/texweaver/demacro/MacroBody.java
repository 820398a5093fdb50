package org.texweaver.demacro;

import org.texweaver.frontend.parser.ast.Node;

import java.util.List;
import java.util.Objects;

/**
 * The body of a {@link MacroDefinition}: a parsed LaTeX template or a Java function.
 */
public sealed interface MacroBody permits MacroBody.Template, MacroBody.Computed {

    /**
     * A body whose {@code #k} placeholders are replaced by the bound arguments.
     * @param nodes The template nodes.
     */
    record Template(List<Node> nodes) implements MacroBody {
        public Template {
            nodes = List.copyOf(nodes);
        }
    }

    /**
     * A body computed from the bound arguments.
     * @param function The function.
     */
    record Computed(MacroFunction function) implements MacroBody {
        public Computed {
            Objects.requireNonNull(function, "function");
        }
    }
}
