package org.texweaver.api;

/**
 * Error codes of the macro expander.
 */
public enum MacroErrorKind {
    /** Fewer argument groups follow an invocation than the macro's arity requires. */
    MISSING_ARGUMENT,
    /** A \begin or \end of a custom environment could not be paired with its partner. */
    UNTERMINATED_ENVIRONMENT,
    /** A macro re-expanded itself at the same position with identical arguments. */
    EXPANSION_CYCLE,
    /** Nested expansion went deeper than the configured limit. */
    DEPTH_LIMIT_EXCEEDED,
    /** A \newcommand, \newenvironment or programmatic definition is not well formed. */
    MALFORMED_DEFINITION
}
