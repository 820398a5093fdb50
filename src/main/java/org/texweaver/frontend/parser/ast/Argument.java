package org.texweaver.frontend.parser.ast;

import java.util.List;

/**
 * One argument of a {@link Command} or {@link Environment}. Arguments are not nodes
 * themselves; their children form an independent sibling list.
 *
 * @param kind How the argument is delimited.
 * @param leading The whitespace between the preceding part of the command and this argument.
 * @param children The content between the delimiters.
 */
public record Argument(Kind kind, String leading, List<Node> children) {

    /**
     * The delimiters of an argument.
     */
    public enum Kind {
        /** A [...] argument. */
        OPTIONAL("[", "]"),
        /** A {...} argument. */
        MANDATORY("{", "}"),
        /** A single undelimited token, as in {@code \newcommand\foo{...}}. */
        BARE("", "");

        private final String open;
        private final String close;

        Kind(String open, String close) {
            this.open = open;
            this.close = close;
        }

        /** @return The opening delimiter. */
        public String open() {
            return open;
        }

        /** @return The closing delimiter. */
        public String close() {
            return close;
        }
    }

    public Argument {
        leading = leading == null ? "" : leading;
        children = List.copyOf(children);
    }

    /**
     * Creates a {...} argument without leading whitespace.
     * @param children The content.
     * @return The argument.
     */
    public static Argument mandatory(List<Node> children) {
        return new Argument(Kind.MANDATORY, "", children);
    }

    /**
     * Creates a [...] argument without leading whitespace.
     * @param children The content.
     * @return The argument.
     */
    public static Argument optional(List<Node> children) {
        return new Argument(Kind.OPTIONAL, "", children);
    }

    /**
     * @param newChildren The new content.
     * @return A copy with the same delimiters and leading whitespace.
     */
    public Argument withChildren(List<Node> newChildren) {
        return new Argument(kind, leading, newChildren);
    }
}
