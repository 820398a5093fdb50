package org.texweaver.frontend.render;

import org.texweaver.api.ParseException;
import org.texweaver.frontend.filter.FilterResult;
import org.texweaver.frontend.parser.Parser;
import org.texweaver.frontend.parser.ParserOptions;
import org.texweaver.frontend.parser.ast.Argument;
import org.texweaver.frontend.parser.ast.Command;
import org.texweaver.frontend.parser.ast.Comment;
import org.texweaver.frontend.parser.ast.Document;
import org.texweaver.frontend.parser.ast.Environment;
import org.texweaver.frontend.parser.ast.Group;
import org.texweaver.frontend.parser.ast.MathKind;
import org.texweaver.frontend.parser.ast.MathSpan;
import org.texweaver.frontend.parser.ast.Node;
import org.texweaver.frontend.parser.ast.Placeholder;
import org.texweaver.frontend.parser.ast.Text;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Renderer}.
 * Parsed trees must render to their exact input; trees built in code must render to
 * canonical LaTeX.
 * These are unit tests and do not require external resources.
 */
public class RendererTest {

    /**
     * Verifies the canonical form of each synthesized node variant.
     * This is a unit test for the renderer.
     */
    @Test
    @Tag("unit")
    void testSynthesizedNodes() {
        assertThat(Command.of("textbf", Argument.mandatory(List.of(Text.of("x")))).render())
                .isEqualTo("\\textbf{x}");
        assertThat(new Command("section", true,
                List.of(Argument.optional(List.of(Text.of("s"))), Argument.mandatory(List.of(Text.of("L")))),
                Optional.empty()).render())
                .isEqualTo("\\section*[s]{L}");
        assertThat(Environment.of("quote", List.of(Text.of("Hi"))).render()).isEqualTo("\\begin{quote}Hi\\end{quote}");
        assertThat(MathSpan.of(MathKind.BRACKET_DISPLAY, List.of(Text.of("x"))).render()).isEqualTo("\\[x\\]");
        assertThat(MathSpan.of(MathKind.INLINE, List.of(Text.of("x"))).render()).isEqualTo("$x$");
        assertThat(Group.of(List.of()).render()).isEqualTo("{}");
        assertThat(Comment.of("note").render()).isEqualTo("%note\n");
        assertThat(new Placeholder(2, 1, Optional.empty()).render()).isEqualTo("##1");
    }

    /**
     * Verifies that a sibling list renders as the concatenation of its nodes.
     */
    @Test
    @Tag("unit")
    void testRenderList() {
        // Arrange
        List<Node> nodes = List.of(Text.of("a "), Command.of("LaTeX"), Text.of(" b"));

        // Act
        String rendered = Renderer.render(nodes);

        // Assert
        assertThat(rendered).isEqualTo("a \\LaTeX b");
    }

    /**
     * Verifies that after a rewrite the untouched parts keep their original spelling,
     * including whitespace inside argument gaps and environment names.
     * This is a unit test for the renderer.
     */
    @Test
    @Tag("unit")
    void testEditedTreeKeepsUntouchedText() throws ParseException {
        // Arrange
        Document document = Parser.parse("a  \\foo{b} \\begin {x}  c\\end {x}%k\n", ParserOptions.DEFAULT);

        // Act
        Node edited = document.filter((node, siblings) -> node instanceof Command command && command.name().equals("foo")
                ? FilterResult.replace(command.withName("bar"))
                : FilterResult.unchanged());

        // Assert
        assertThat(edited.render()).isEqualTo("a  \\bar{b} \\begin {x}  c\\end {x}%k\n");
        assertThat(edited.span()).isEmpty();
    }
}
