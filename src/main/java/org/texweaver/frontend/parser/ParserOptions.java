package org.texweaver.frontend.parser;

import com.typesafe.config.Config;

/**
 * Options of the lexer and parser.
 *
 * @param mathComments Whether '%' starts a comment inside math mode. Some inline math
 *                     dialects treat it as a literal percent sign.
 * @param atLetter Whether '@' is a letter in command names, as inside package code.
 * @param signatures The command and environment arities the parser may rely on.
 */
public record ParserOptions(
        boolean mathComments,
        boolean atLetter,
        CommandSignatures signatures
) {
    /** The default options: comments everywhere, '@' is not a letter, built-in signatures only. */
    public static final ParserOptions DEFAULT = new ParserOptions(true, false, CommandSignatures.builtIn());

    private static final String MATH_COMMENTS_KEY = "math-comments";
    private static final String AT_LETTER_KEY = "at-letter";

    /**
     * Reads the options from the {@code texweaver.parser} section of a configuration.
     * Missing keys keep their default values.
     *
     * @param parserConfig The parser section.
     * @return The options.
     */
    public static ParserOptions fromConfig(Config parserConfig) {
        boolean mathComments = parserConfig.hasPath(MATH_COMMENTS_KEY)
                ? parserConfig.getBoolean(MATH_COMMENTS_KEY)
                : DEFAULT.mathComments();
        boolean atLetter = parserConfig.hasPath(AT_LETTER_KEY)
                ? parserConfig.getBoolean(AT_LETTER_KEY)
                : DEFAULT.atLetter();
        return new ParserOptions(mathComments, atLetter, CommandSignatures.builtIn());
    }

    /**
     * Returns a copy whose signature table additionally contains the given entries.
     * @param additional Signatures to overlay on the current ones.
     * @return The new options.
     */
    public ParserOptions withSignatures(CommandSignatures additional) {
        return new ParserOptions(mathComments, atLetter, signatures.merge(additional));
    }

    /**
     * @param mathComments See {@link #mathComments()}.
     * @return A copy with the flag changed.
     */
    public ParserOptions withMathComments(boolean mathComments) {
        return new ParserOptions(mathComments, atLetter, signatures);
    }
}
