package org.texweaver.frontend.render;

import org.texweaver.frontend.parser.ast.Argument;
import org.texweaver.frontend.parser.ast.Command;
import org.texweaver.frontend.parser.ast.Comment;
import org.texweaver.frontend.parser.ast.Document;
import org.texweaver.frontend.parser.ast.Environment;
import org.texweaver.frontend.parser.ast.Group;
import org.texweaver.frontend.parser.ast.MathSpan;
import org.texweaver.frontend.parser.ast.Node;
import org.texweaver.frontend.parser.ast.NodeVisitor;
import org.texweaver.frontend.parser.ast.Placeholder;
import org.texweaver.frontend.parser.ast.Text;

import java.util.List;

/**
 * Turns a node tree back into LaTeX source.
 * <p>
 * Output is always produced from the node fields. Since parsed nodes keep every gap,
 * comment trailer and delimiter, an untouched subtree renders to exactly its source span.
 * No escaping is added to text.
 */
public final class Renderer implements NodeVisitor<Void> {

    private final StringBuilder out = new StringBuilder();

    private Renderer() {
    }

    /**
     * Renders a subtree.
     * @param node The root of the subtree.
     * @return The LaTeX source.
     */
    public static String render(Node node) {
        Renderer renderer = new Renderer();
        node.accept(renderer);
        return renderer.out.toString();
    }

    /**
     * Renders a sibling list.
     * @param nodes The nodes.
     * @return The concatenated LaTeX source.
     */
    public static String render(List<Node> nodes) {
        Renderer renderer = new Renderer();
        renderer.renderAll(nodes);
        return renderer.out.toString();
    }

    @Override
    public Void visitText(Text node) {
        out.append(node.text());
        return null;
    }

    @Override
    public Void visitComment(Comment node) {
        out.append('%').append(node.text()).append(node.trailing());
        return null;
    }

    @Override
    public Void visitCommand(Command node) {
        out.append('\\').append(node.name());
        if (node.starred()) {
            out.append('*');
        }
        renderArguments(node.arguments());
        return null;
    }

    @Override
    public Void visitGroup(Group node) {
        out.append('{');
        renderAll(node.children());
        out.append('}');
        return null;
    }

    @Override
    public Void visitEnvironment(Environment node) {
        out.append("\\begin").append(node.beginGap()).append('{').append(node.name()).append('}');
        renderArguments(node.arguments());
        renderAll(node.body());
        out.append("\\end").append(node.endGap()).append('{').append(node.name()).append('}');
        return null;
    }

    @Override
    public Void visitMath(MathSpan node) {
        out.append(node.kind().open());
        renderAll(node.children());
        out.append(node.kind().close());
        return null;
    }

    @Override
    public Void visitPlaceholder(Placeholder node) {
        out.append("#".repeat(node.hashes())).append(node.index());
        return null;
    }

    @Override
    public Void visitDocument(Document node) {
        renderAll(node.children());
        return null;
    }

    private void renderArguments(List<Argument> arguments) {
        for (Argument argument : arguments) {
            out.append(argument.leading()).append(argument.kind().open());
            renderAll(argument.children());
            out.append(argument.kind().close());
        }
    }

    private void renderAll(List<Node> nodes) {
        for (Node node : nodes) {
            node.accept(this);
        }
    }
}
