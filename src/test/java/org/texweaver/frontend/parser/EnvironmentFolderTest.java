package org.texweaver.frontend.parser;

import org.texweaver.frontend.parser.ast.Argument;
import org.texweaver.frontend.parser.ast.Command;
import org.texweaver.frontend.parser.ast.Environment;
import org.texweaver.frontend.parser.ast.Group;
import org.texweaver.frontend.parser.ast.MathKind;
import org.texweaver.frontend.parser.ast.MathSpan;
import org.texweaver.frontend.parser.ast.Node;
import org.texweaver.frontend.parser.ast.Text;
import org.texweaver.frontend.render.Renderer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link EnvironmentFolder}, which pairs flat \begin and \end
 * commands left behind by macro bodies.
 * These are unit tests and do not require external resources.
 */
public class EnvironmentFolderTest {

    private static Command begin(String name) {
        return Command.of("begin", Argument.mandatory(List.of(Text.of(name))));
    }

    private static Command end(String name) {
        return Command.of("end", Argument.mandatory(List.of(Text.of(name))));
    }

    /**
     * Verifies that a flat pair becomes one environment holding the nodes in between.
     * This is a unit test for the environment folder.
     */
    @Test
    @Tag("unit")
    void testFoldsPair() {
        // Arrange
        List<Node> nodes = List.of(Text.of("a"), begin("quote"), Text.of("Hi"), end("quote"), Text.of("b"));

        // Act
        List<Node> folded = EnvironmentFolder.fold(nodes);

        // Assert
        assertThat(folded).hasSize(3);
        assertThat(folded.get(1)).isInstanceOfSatisfying(Environment.class, env -> {
            assertThat(env.name()).isEqualTo("quote");
            assertThat(env.body()).containsExactly(Text.of("Hi"));
        });
        assertThat(Renderer.render(folded)).isEqualTo("a\\begin{quote}Hi\\end{quote}b");
    }

    /**
     * Verifies that nested pairs of the same name are matched by depth.
     */
    @Test
    @Tag("unit")
    void testNestedPairs() {
        // Arrange
        List<Node> nodes = List.of(begin("x"), begin("x"), Text.of("in"), end("x"), end("x"));

        // Act
        List<Node> folded = EnvironmentFolder.fold(nodes);

        // Assert
        assertThat(folded).singleElement().isInstanceOfSatisfying(Environment.class,
                outer -> assertThat(outer.body()).singleElement().isInstanceOf(Environment.class));
    }

    /**
     * Verifies that a flat command without partner is kept and the list instance is reused.
     * This is a unit test for the environment folder.
     */
    @Test
    @Tag("unit")
    void testUnpairedIsUnchanged() {
        // Arrange
        List<Node> nodes = List.of(begin("quote"), Text.of("Hi"), end("other"));

        // Act
        List<Node> folded = EnvironmentFolder.fold(nodes);

        // Assert
        assertThat(folded).isSameAs(nodes);
    }

    /**
     * Verifies that flat math delimiters are folded into math spans, also below other nodes.
     * This is a unit test for the environment folder.
     */
    @Test
    @Tag("unit")
    void testFoldsMathInsideGroup() {
        // Arrange
        Group group = Group.of(List.of(Command.of("["), Text.of("x"), Command.of("]")));

        // Act
        List<Node> folded = EnvironmentFolder.fold(List.of(group));

        // Assert
        Group result = (Group) folded.get(0);
        assertThat(result.children()).singleElement().isInstanceOfSatisfying(MathSpan.class,
                math -> assertThat(math.kind()).isEqualTo(MathKind.BRACKET_DISPLAY));
        assertThat(result.render()).isEqualTo("{\\[x\\]}");
    }

    /**
     * Verifies which commands count as flat delimiters.
     */
    @Test
    @Tag("unit")
    void testIsFlatDelimiter() {
        assertThat(EnvironmentFolder.isFlatDelimiter(begin("a"))).isTrue();
        assertThat(EnvironmentFolder.isFlatDelimiter(Command.of("begin"))).isFalse();
        assertThat(EnvironmentFolder.isFlatDelimiter(Command.of(")"))).isTrue();
        assertThat(EnvironmentFolder.isFlatDelimiter(Command.of("item"))).isFalse();
        assertThat(EnvironmentFolder.isFlatDelimiter(Text.of("\\begin{a}"))).isFalse();
    }
}
