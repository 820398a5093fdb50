package org.texweaver.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Commands.
    /** A control word (\section) or control symbol (\\, \,). */
    COMMAND,
    /** A macro parameter such as #1 or ##2. */
    PARAMETER,

    // Groups and arguments.
    /** The '{' character. */
    BEGIN_GROUP,
    /** The '}' character. */
    END_GROUP,
    /** A '[' in argument position. */
    BEGIN_OPTIONAL,
    /** A ']' closing an open optional argument. */
    END_OPTIONAL,

    // Math delimiters.
    /** A single '$'. */
    MATH_SHIFT,
    /** A '$$' pair. */
    DISPLAY_MATH_SHIFT,
    /** The '\[' delimiter. */
    BEGIN_DISPLAY_MATH,
    /** The '\]' delimiter. */
    END_DISPLAY_MATH,
    /** The '\(' delimiter. */
    BEGIN_INLINE_MATH,
    /** The '\)' delimiter. */
    END_INLINE_MATH,

    // Miscellaneous.
    /** A '%' comment including its line break and the next line's indentation. */
    COMMENT,
    /** A run of blanks and line breaks. */
    WHITESPACE,
    /** Literal characters, including escaped specials such as \%. */
    TEXT,
    /** Represents the end of the source. */
    END_OF_FILE
}
