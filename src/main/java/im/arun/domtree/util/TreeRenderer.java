package im.arun.domtree.util;

import im.arun.domtree.model.HtmlNode;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Text views of a node tree: identifiers, ASCII tree and breadcrumb path.
 */
public final class TreeRenderer {

    public static final String LAST_BRANCH = "└── ";
    public static final String MIDDLE_BRANCH = "├── ";
    public static final String CONTINUATION_INDENT = "│   ";
    public static final String BLANK_INDENT = "    ";
    public static final String BREADCRUMB_SEPARATOR = " > ";

    private TreeRenderer() {}

    /**
     * {@code tag (class1 class2)} when the node has classes, otherwise just the tag.
     */
    public static String formatIdentifier(HtmlNode node) {
        if (node.getClasses().isEmpty()) {
            return node.getTag();
        }
        return node.getTag() + " (" + String.join(" ", node.getClasses()) + ")";
    }

    /**
     * One line per node, pre-order. The given node is drawn as a last child.
     */
    public static String renderTree(HtmlNode node) {
        StringBuilder out = new StringBuilder();
        renderTree(node, "", true, out);
        return out.toString();
    }

    private static void renderTree(HtmlNode node, String prefix, boolean isLast, StringBuilder out) {
        if (out.length() > 0) {
            out.append('\n');
        }
        out.append(prefix).append(isLast ? LAST_BRANCH : MIDDLE_BRANCH).append(formatIdentifier(node));

        String childPrefix = prefix + (isLast ? BLANK_INDENT : CONTINUATION_INDENT);
        int count = node.getChildren().size();
        for (int i = 0; i < count; i++) {
            renderTree(node.getChildren().get(i), childPrefix, i == count - 1, out);
        }
    }

    /**
     * Identifiers from the root down to {@code node}, joined with {@code " > "}.
     */
    public static String breadcrumbs(HtmlNode node) {
        Deque<String> path = new ArrayDeque<>();
        for (HtmlNode step = node; step != null; step = step.getParent()) {
            path.addFirst(formatIdentifier(step));
        }
        return String.join(BREADCRUMB_SEPARATOR, path);
    }

    public static int countNodes(HtmlNode node) {
        int total = 1;
        for (HtmlNode child : node.getChildren()) {
            total += countNodes(child);
        }
        return total;
    }
}
