package org.texweaver.frontend.filter;

import org.texweaver.frontend.parser.ast.Node;

import java.util.Objects;

/**
 * The decision of a {@link NodeFilter} for one node.
 */
public sealed interface FilterResult
        permits FilterResult.Unchanged, FilterResult.Replace, FilterResult.Delete, FilterResult.Consume {

    /**
     * Keep the node and continue into its children.
     * @return The shared instance.
     */
    static FilterResult unchanged() {
        return Unchanged.INSTANCE;
    }

    /**
     * Substitute the node. The replacement is not filtered again.
     * @param replacement The new node.
     * @return The result.
     */
    static FilterResult replace(Node replacement) {
        return new Replace(replacement);
    }

    /**
     * Drop the node.
     * @return The shared instance.
     */
    static FilterResult delete() {
        return Delete.INSTANCE;
    }

    /**
     * Substitute the node and the next {@code count} siblings with one node.
     * @param replacement The new node.
     * @param count The number of following siblings to swallow.
     * @return The result.
     */
    static FilterResult consume(Node replacement, int count) {
        return new Consume(replacement, count);
    }

    /** Keep the node. */
    enum Unchanged implements FilterResult {
        INSTANCE
    }

    /** Drop the node. */
    enum Delete implements FilterResult {
        INSTANCE
    }

    /**
     * @param replacement The node put in place of the visited one.
     */
    record Replace(Node replacement) implements FilterResult {
        public Replace {
            Objects.requireNonNull(replacement, "replacement");
        }
    }

    /**
     * @param replacement The node put in place of the visited one and the swallowed siblings.
     * @param count The number of following siblings swallowed.
     */
    record Consume(Node replacement, int count) implements FilterResult {
        public Consume {
            Objects.requireNonNull(replacement, "replacement");
            if (count < 0) {
                throw new IllegalArgumentException("Consume count must not be negative: " + count);
            }
        }
    }
}
