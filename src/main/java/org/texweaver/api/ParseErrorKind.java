package org.texweaver.api;

/**
 * Defines unique, testable error codes for structural malformations found while building a tree.
 * This decouples the test logic from the error messages.
 */
public enum ParseErrorKind {
    /** A '{' without a matching '}', or a '}' without a matching '{'. */
    UNBALANCED_GROUP,
    /** A \begin{name} whose \end{name} never appears. */
    UNTERMINATED_ENVIRONMENT,
    /** A \end{name} that does not close the innermost open environment. */
    ENVIRONMENT_NAME_MISMATCH,
    /** A command or environment with a registered arity lacks one of its argument groups. */
    MISSING_MANDATORY_ARGUMENT,
    /** A math delimiter without its partner, e.g. an unclosed '$' or a stray '\]'. */
    UNBALANCED_MATH
}
