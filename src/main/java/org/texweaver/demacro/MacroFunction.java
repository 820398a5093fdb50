package org.texweaver.demacro;

import org.texweaver.api.MacroException;
import org.texweaver.frontend.parser.ast.Node;

import java.util.List;

/**
 * A macro body computed by Java code instead of a LaTeX template.
 */
@FunctionalInterface
public interface MacroFunction {

    /**
     * Produces the expansion of one invocation. The result is spliced in place of the
     * invocation and scanned for further macros.
     *
     * @param arguments The bound arguments, one node list per parameter. They are copies
     *                  the function may keep or rearrange.
     * @return The expansion.
     * @throws MacroException if the arguments are not acceptable.
     */
    List<Node> expand(List<List<Node>> arguments) throws MacroException;
}
