package org.texweaver.frontend.parser.ast;

import org.texweaver.api.ParseException;
import org.texweaver.frontend.parser.Parser;
import org.texweaver.frontend.parser.ParserOptions;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Nodes} helpers and the generic child access of {@link Node}.
 * These are unit tests and do not require external resources.
 */
public class NodesTest {

    /**
     * Verifies that text content skips comments, command names and delimiters.
     * This is a unit test for the node helpers.
     */
    @Test
    @Tag("unit")
    void testTextContent() throws ParseException {
        // Arrange
        Document document = Parser.parse("foo%comment\n  bar \\emph{baz} $x$", ParserOptions.DEFAULT);

        // Act
        String content = Nodes.textContent(document);

        // Assert
        assertThat(content).isEqualTo("foobar baz x");
    }

    /**
     * Verifies that a deep copy renders the same, shares no instance and has no spans.
     * This is a unit test for the node helpers.
     */
    @Test
    @Tag("unit")
    void testDeepCopy() throws ParseException {
        // Arrange
        Document document = Parser.parse("\\begin{a}[o]{x \\y{z}}\\end{a}", ParserOptions.DEFAULT);
        Environment original = (Environment) document.children().get(0);

        // Act
        Environment copy = (Environment) Nodes.deepCopy(original);

        // Assert
        assertThat(copy.render()).isEqualTo(original.render());
        assertThat(copy).isNotSameAs(original);
        assertThat(copy.span()).isEmpty();
        assertThat(copy.body().get(0)).isNotSameAs(original.body().get(0));
        assertThat(copy.body().get(0).span()).isEmpty();
    }

    /**
     * Verifies which nodes count as blank.
     */
    @Test
    @Tag("unit")
    void testIsBlank() {
        assertThat(Nodes.isBlank(Text.of(" \n\t"))).isTrue();
        assertThat(Nodes.isBlank(Comment.of("x"))).isTrue();
        assertThat(Nodes.isBlank(Text.of(" x "))).isFalse();
        assertThat(Nodes.isBlank(Group.of(List.of()))).isFalse();
    }

    /**
     * Verifies that child lists follow argument order and that rebuilding drops the span.
     * This is a unit test for the node helpers.
     */
    @Test
    @Tag("unit")
    void testChildListsAndReconstruct() throws ParseException {
        // Arrange
        Document document = Parser.parse("\\begin{a}[o]b\\end{a}", ParserOptions.DEFAULT);
        Environment environment = (Environment) document.children().get(0);

        // Act
        List<List<Node>> lists = environment.childLists();
        Node rebuilt = environment.reconstructWithChildLists(List.of(List.of(Text.of("p")), List.of(Text.of("q"))));

        // Assert
        assertThat(lists).hasSize(2);
        assertThat(Nodes.textContent(lists.get(0))).isEqualTo("o");
        assertThat(Nodes.textContent(lists.get(1))).isEqualTo("b");
        assertThat(rebuilt.render()).isEqualTo("\\begin{a}[p]q\\end{a}");
        assertThat(rebuilt.span()).isEmpty();
        assertThat(environment.getChildren()).hasSize(2);
    }

    /**
     * Verifies that a space is inserted only where a control word would run into letters.
     * This is a unit test for the node helpers.
     */
    @Test
    @Tag("unit")
    void testFixWhitespace() throws ParseException {
        // Arrange
        Document edited = Document.of(List.of(
                Command.of("alpha"), Text.of("b"),
                Command.of("x", Argument.mandatory(List.of(Text.of("y")))), Text.of("c"),
                Command.of("beta"), Text.of("1"),
                Group.of(List.of(Command.of("LaTeX"), Text.of("x")))));
        Document parsed = Parser.parse("\\alpha b \\x{y}c", ParserOptions.DEFAULT);

        // Act
        Node fixed = Nodes.fixWhitespace(edited);

        // Assert
        assertThat(fixed.render()).isEqualTo("\\alpha b\\x{y}c\\beta1{\\LaTeX x}");
        assertThat(Nodes.fixWhitespace(parsed)).isSameAs(parsed);
    }
}
