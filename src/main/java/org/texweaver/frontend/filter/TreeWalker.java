package org.texweaver.frontend.filter;

import org.texweaver.frontend.parser.ast.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites a tree with a {@link NodeFilter}.
 * <p>
 * The traversal is pre-order, depth-first and left to right. Every command argument,
 * group, environment body and math body is its own sibling list, so a
 * {@link FilterResult.Consume} never reaches across such a boundary. The input is never
 * modified; a node whose children all come back identical is returned as the same instance.
 */
public final class TreeWalker {

    private TreeWalker() {
    }

    /**
     * Applies a rule to a tree. The root is offered to the rule with an empty sibling view.
     *
     * @param root The root of the tree.
     * @param rule The rule.
     * @return The rewritten tree.
     * @throws IllegalArgumentException if the rule consumes more siblings than exist, or
     *                                  deletes the root.
     */
    public static Node filter(Node root, NodeFilter rule) {
        FilterResult result = rule.apply(root, SiblingView.empty());
        if (result instanceof FilterResult.Replace replace) {
            return replace.replacement();
        }
        if (result instanceof FilterResult.Consume consume) {
            checkCount(consume.count(), 0);
            return consume.replacement();
        }
        if (result == FilterResult.Delete.INSTANCE) {
            throw new IllegalArgumentException("The root of a tree cannot be deleted");
        }
        return descend(root, rule);
    }

    /**
     * Applies a rule to a sibling list.
     *
     * @param nodes The list.
     * @param rule The rule.
     * @return The rewritten list, or the same list instance if nothing changed.
     */
    public static List<Node> filterList(List<Node> nodes, NodeFilter rule) {
        List<Node> output = new ArrayList<>(nodes.size());
        boolean changed = false;
        int i = 0;
        while (i < nodes.size()) {
            Node node = nodes.get(i);
            FilterResult result = rule.apply(node, new SiblingView(nodes, i + 1));
            if (result == null) {
                throw new IllegalStateException("Filter returned null for " + node.render());
            }
            if (result instanceof FilterResult.Replace replace) {
                output.add(replace.replacement());
                changed = true;
                i++;
            } else if (result instanceof FilterResult.Consume consume) {
                checkCount(consume.count(), nodes.size() - i - 1);
                output.add(consume.replacement());
                changed = true;
                i += 1 + consume.count();
            } else if (result == FilterResult.Delete.INSTANCE) {
                changed = true;
                i++;
            } else {
                Node filtered = descend(node, rule);
                changed |= filtered != node;
                output.add(filtered);
                i++;
            }
        }
        return changed ? output : nodes;
    }

    private static Node descend(Node node, NodeFilter rule) {
        List<List<Node>> lists = node.childLists();
        if (lists.isEmpty()) {
            return node;
        }
        List<List<Node>> newLists = new ArrayList<>(lists.size());
        boolean changed = false;
        for (List<Node> list : lists) {
            List<Node> filtered = filterList(list, rule);
            changed |= filtered != list;
            newLists.add(filtered);
        }
        return changed ? node.reconstructWithChildLists(newLists) : node;
    }

    private static void checkCount(int count, int available) {
        if (count > available) {
            throw new IllegalArgumentException(
                    "Cannot consume " + count + " siblings, only " + available + " remain");
        }
    }
}
