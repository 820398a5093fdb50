package org.texweaver.frontend.parser.ast;

/**
 * A visitor over the closed set of {@link Node} variants.
 *
 * @param <R> The return type of the visit methods.
 */
public interface NodeVisitor<R> {
    R visitText(Text node);
    R visitComment(Comment node);
    R visitCommand(Command node);
    R visitGroup(Group node);
    R visitEnvironment(Environment node);
    R visitMath(MathSpan node);
    R visitPlaceholder(Placeholder node);
    R visitDocument(Document node);
}
