package org.texweaver.frontend.parser.ast;

import org.texweaver.frontend.filter.FilterResult;
import org.texweaver.frontend.filter.TreeWalker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Static helpers over node trees.
 */
public final class Nodes {

    private Nodes() {
    }

    /**
     * Copies a subtree. The copy shares no node instance with the original and has no spans,
     * so it can be inserted several times into one tree.
     *
     * @param node The root of the subtree.
     * @return The copy.
     */
    public static Node deepCopy(Node node) {
        return node.accept(COPIER);
    }

    /**
     * Copies every node of a list with {@link #deepCopy(Node)}.
     * @param nodes The nodes.
     * @return A new list of copies.
     */
    public static List<Node> deepCopy(List<Node> nodes) {
        List<Node> copies = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            copies.add(deepCopy(node));
        }
        return copies;
    }

    /**
     * Concatenates the {@link Text} content of a subtree in document order. Comments,
     * command names and delimiters contribute nothing.
     *
     * @param node The root of the subtree.
     * @return The text content.
     */
    public static String textContent(Node node) {
        StringBuilder sb = new StringBuilder();
        appendText(node, sb);
        return sb.toString();
    }

    /**
     * @param nodes A sibling list.
     * @return The concatenated text content of all nodes.
     */
    public static String textContent(List<Node> nodes) {
        StringBuilder sb = new StringBuilder();
        for (Node node : nodes) {
            appendText(node, sb);
        }
        return sb.toString();
    }

    /**
     * @param node A node.
     * @return True for whitespace-only text and for comments, which LaTeX skips when it looks for arguments.
     */
    public static boolean isBlank(Node node) {
        if (node instanceof Text text) {
            return text.isBlank();
        }
        return node instanceof Comment;
    }

    /**
     * Inserts a space between a command that ends in a control word and a following text
     * that starts with a letter. Without it, {@code \alpha} followed by {@code b} would render
     * as {@code \alphab}, a different command. Such neighbours only arise from edits, never
     * from parsing.
     *
     * @param root The root of the tree.
     * @return The padded tree, or the root itself if no pair needed a space.
     */
    public static Node fixWhitespace(Node root) {
        Set<Node> needsSpace = Collections.newSetFromMap(new IdentityHashMap<>());
        return TreeWalker.filter(root, (node, siblings) -> {
            if (node instanceof Text text && needsSpace.contains(text)) {
                return FilterResult.replace(new Text(" " + text.text(), Optional.empty()));
            }
            if (node instanceof Command command && !siblings.isEmpty()
                    && siblings.get(0) instanceof Text next
                    && endsWithControlWord(command) && startsWithLetter(next.text())) {
                needsSpace.add(next);
            }
            return FilterResult.unchanged();
        });
    }

    private static boolean endsWithControlWord(Command command) {
        String rendered = command.render();
        return isAsciiLetter(rendered.charAt(rendered.length() - 1));
    }

    private static boolean startsWithLetter(String text) {
        return !text.isEmpty() && isAsciiLetter(text.charAt(0));
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static void appendText(Node node, StringBuilder sb) {
        if (node instanceof Text text) {
            sb.append(text.text());
            return;
        }
        for (List<Node> list : node.childLists()) {
            for (Node child : list) {
                appendText(child, sb);
            }
        }
    }

    private static final NodeVisitor<Node> COPIER = new NodeVisitor<>() {
        @Override
        public Node visitText(Text node) {
            return new Text(node.text(), Optional.empty());
        }

        @Override
        public Node visitComment(Comment node) {
            return new Comment(node.text(), node.trailing(), Optional.empty());
        }

        @Override
        public Node visitCommand(Command node) {
            return node.reconstructWithChildLists(copyLists(node.childLists()));
        }

        @Override
        public Node visitGroup(Group node) {
            return node.reconstructWithChildLists(copyLists(node.childLists()));
        }

        @Override
        public Node visitEnvironment(Environment node) {
            return node.reconstructWithChildLists(copyLists(node.childLists()));
        }

        @Override
        public Node visitMath(MathSpan node) {
            return node.reconstructWithChildLists(copyLists(node.childLists()));
        }

        @Override
        public Node visitPlaceholder(Placeholder node) {
            return new Placeholder(node.hashes(), node.index(), Optional.empty());
        }

        @Override
        public Node visitDocument(Document node) {
            return node.reconstructWithChildLists(copyLists(node.childLists()));
        }

        private List<List<Node>> copyLists(List<List<Node>> lists) {
            List<List<Node>> copies = new ArrayList<>(lists.size());
            for (List<Node> list : lists) {
                copies.add(deepCopy(list));
            }
            return copies;
        }
    };
}
