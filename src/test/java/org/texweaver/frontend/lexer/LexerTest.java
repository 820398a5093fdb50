package org.texweaver.frontend.lexer;

import org.texweaver.frontend.parser.ParserOptions;
import org.texweaver.frontend.parser.CommandSignatures;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that LaTeX source is split into tokens without losing a single character,
 * and that brackets, math delimiters and comments are classified by context.
 * These are unit tests and do not require external resources.
 */
public class LexerTest {

    /**
     * Verifies that a starred command with an optional and a mandatory argument is tokenized
     * with the brackets recognized as argument delimiters.
     * This is a unit test for the lexer.
     */
    @Test
    @Tag("unit")
    void testCommandWithArguments() {
        // Arrange
        Lexer lexer = new Lexer("\\section*[short]{Long}");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens).hasSize(9);
        assertThat(tokens.get(0)).extracting(Token::type, Token::text, Token::value)
                .containsExactly(TokenType.COMMAND, "\\section", "section");
        assertThat(tokens.get(1)).extracting(Token::type, Token::text).containsExactly(TokenType.TEXT, "*");
        assertThat(tokens.get(2)).extracting(Token::type).isEqualTo(TokenType.BEGIN_OPTIONAL);
        assertThat(tokens.get(3)).extracting(Token::type, Token::text).containsExactly(TokenType.TEXT, "short");
        assertThat(tokens.get(4)).extracting(Token::type).isEqualTo(TokenType.END_OPTIONAL);
        assertThat(tokens.get(5)).extracting(Token::type).isEqualTo(TokenType.BEGIN_GROUP);
        assertThat(tokens.get(6)).extracting(Token::type, Token::text).containsExactly(TokenType.TEXT, "Long");
        assertThat(tokens.get(7)).extracting(Token::type).isEqualTo(TokenType.END_GROUP);
        assertThat(tokens.get(8)).extracting(Token::type).isEqualTo(TokenType.END_OF_FILE);
    }

    /**
     * Verifies that brackets which do not follow a command are ordinary text.
     * This is a unit test for the lexer.
     */
    @Test
    @Tag("unit")
    void testBracketsOutsideArgumentPositionAreText() {
        // Arrange
        Lexer lexer = new Lexer("a [b] c");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.TEXT, TokenType.WHITESPACE, TokenType.TEXT,
                TokenType.WHITESPACE, TokenType.TEXT, TokenType.END_OF_FILE);
        assertThat(tokens.get(2).text()).isEqualTo("[b]");
    }

    /**
     * Verifies that escaped special characters are text and do not open comments or math.
     * This is a unit test for the lexer.
     */
    @Test
    @Tag("unit")
    void testEscapedSpecialCharacters() {
        // Arrange
        Lexer lexer = new Lexer("50\\% of \\$5 \\{x\\}");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type)
                .doesNotContain(TokenType.COMMENT, TokenType.MATH_SHIFT, TokenType.BEGIN_GROUP, TokenType.END_GROUP);
        assertThat(tokens).extracting(Token::text).contains("\\%", "\\$", "\\{", "\\}");
    }

    /**
     * Verifies that a comment token includes its line break and the indentation of the next line.
     * This is a unit test for the lexer.
     */
    @Test
    @Tag("unit")
    void testCommentSwallowsNewlineAndIndentation() {
        // Arrange
        Lexer lexer = new Lexer("foo%comment\n  bar");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.TEXT, "foo"),
                tuple(TokenType.COMMENT, "%comment\n  "),
                tuple(TokenType.TEXT, "bar"),
                tuple(TokenType.END_OF_FILE, ""));
    }

    /**
     * Verifies the four math delimiter forms.
     * This is a unit test for the lexer.
     */
    @Test
    @Tag("unit")
    void testMathDelimiters() {
        // Arrange
        Lexer lexer = new Lexer("$x$ $$y$$ \\[z\\] \\(w\\)");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.MATH_SHIFT, TokenType.TEXT, TokenType.MATH_SHIFT, TokenType.WHITESPACE,
                TokenType.DISPLAY_MATH_SHIFT, TokenType.TEXT, TokenType.DISPLAY_MATH_SHIFT, TokenType.WHITESPACE,
                TokenType.BEGIN_DISPLAY_MATH, TokenType.TEXT, TokenType.END_DISPLAY_MATH, TokenType.WHITESPACE,
                TokenType.BEGIN_INLINE_MATH, TokenType.TEXT, TokenType.END_INLINE_MATH,
                TokenType.END_OF_FILE);
    }

    /**
     * Verifies that two adjacent inline formulas are not mistaken for display math.
     */
    @Test
    @Tag("unit")
    void testAdjacentInlineMath() {
        // Act
        List<Token> tokens = new Lexer("$x$$y$").scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.MATH_SHIFT, TokenType.TEXT, TokenType.MATH_SHIFT,
                TokenType.MATH_SHIFT, TokenType.TEXT, TokenType.MATH_SHIFT,
                TokenType.END_OF_FILE);
    }

    /**
     * Verifies that parameter tokens carry their index and that a lone '#' is text.
     * This is a unit test for the lexer.
     */
    @Test
    @Tag("unit")
    void testParameters() {
        // Arrange
        Lexer lexer = new Lexer("#1 ##2 #x");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(tokens.get(0)).extracting(Token::type, Token::text, Token::value)
                .containsExactly(TokenType.PARAMETER, "#1", 1);
        assertThat(tokens.get(2)).extracting(Token::type, Token::text, Token::value)
                .containsExactly(TokenType.PARAMETER, "##2", 2);
        assertThat(tokens.get(4)).extracting(Token::type, Token::text).containsExactly(TokenType.TEXT, "#");
    }

    /**
     * Verifies that '@' only belongs to command names when the option says so.
     * This is a unit test for the lexer.
     */
    @Test
    @Tag("unit")
    void testAtLetterOption() {
        // Arrange
        ParserOptions atLetter = new ParserOptions(true, true, CommandSignatures.builtIn());

        // Act
        List<Token> plain = new Lexer("\\a@b").scanTokens();
        List<Token> internal = new Lexer("\\a@b", atLetter).scanTokens();

        // Assert
        assertThat(plain).extracting(Token::type, Token::text).startsWith(
                tuple(TokenType.COMMAND, "\\a"),
                tuple(TokenType.TEXT, "@b"));
        assertThat(internal.get(0)).extracting(Token::type, Token::value).containsExactly(TokenType.COMMAND, "a@b");
    }

    /**
     * Verifies that '%' inside math is text when math comments are disabled, while it still
     * starts a comment outside math.
     * This is a unit test for the lexer.
     */
    @Test
    @Tag("unit")
    void testPercentInMathWithoutMathComments() {
        // Arrange
        ParserOptions options = ParserOptions.DEFAULT.withMathComments(false);

        // Act
        List<Token> tokens = new Lexer("$a%b$ %c", options).scanTokens();

        // Assert
        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.MATH_SHIFT, "$"),
                tuple(TokenType.TEXT, "a"),
                tuple(TokenType.TEXT, "%b"),
                tuple(TokenType.MATH_SHIFT, "$"),
                tuple(TokenType.WHITESPACE, " "),
                tuple(TokenType.COMMENT, "%c"),
                tuple(TokenType.END_OF_FILE, ""));
    }

    /**
     * Verifies that the concatenated token texts reproduce an input mixing all constructs.
     * This is a unit test for the lexer.
     */
    @Test
    @Tag("unit")
    void testTokensCoverEveryCharacter() {
        // Arrange
        String source = "\\documentclass[a4paper]{article}\n"
                + "% preamble\n"
                + "\\begin{document}\n"
                + "Text with $x^2$ and \\[ y \\] [not an arg] ] #1 \\\\ \\,\n"
                + "\\end{document}\n";

        // Act
        List<Token> tokens = new Lexer(source).scanTokens();

        // Assert
        String joined = tokens.stream().map(Token::text).collect(Collectors.joining());
        assertThat(joined).isEqualTo(source);
    }

    /**
     * Verifies that tokens report their offset, line and column.
     * This is a unit test for the lexer.
     */
    @Test
    @Tag("unit")
    void testTokenPositions() {
        // Act
        List<Token> tokens = new Lexer("a\n\\foo").scanTokens();

        // Assert
        assertThat(tokens.get(2)).extracting(Token::type, Token::offset, Token::line, Token::column)
                .containsExactly(TokenType.COMMAND, 2, 2, 1);
        assertThat(tokens.get(2).endOffset()).isEqualTo(6);
    }
}
