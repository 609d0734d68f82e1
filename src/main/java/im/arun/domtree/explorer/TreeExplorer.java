package im.arun.domtree.explorer;

import im.arun.domtree.model.HtmlNode;
import im.arun.domtree.util.TreeRenderer;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Cursor over a built tree. Commands move the cursor or read the tree; none of them
 * change the tree itself.
 */
public class TreeExplorer {
    private static final Logger logger = LoggerFactory.getLogger(TreeExplorer.class);

    public static final String PARENT = "..";

    @Getter
    private HtmlNode current;

    public TreeExplorer(HtmlNode start) {
        if (start == null) {
            throw new IllegalArgumentException("Explorer needs a node to start from");
        }
        this.current = start;
    }

    public List<HtmlNode> listChildren() {
        return current.getChildren();
    }

    /**
     * Move to the parent ({@code ..}), to the child at a numeric index, or to the first
     * child whose space-joined classes contain {@code arg}.
     */
    public NavigationResult changeDirectory(String arg) {
        if (PARENT.equals(arg)) {
            if (current.getParent() == null) {
                return NavigationResult.ALREADY_AT_ROOT;
            }
            return moveTo(current.getParent());
        }

        List<HtmlNode> children = current.getChildren();
        Integer index = parseIndex(arg);
        if (index != null) {
            if (index >= 0 && index < children.size()) {
                return moveTo(children.get(index));
            }
            return NavigationResult.INDEX_OUT_OF_RANGE;
        }

        for (HtmlNode child : children) {
            if (String.join(" ", child.getClasses()).contains(arg)) {
                return moveTo(child);
            }
        }
        return NavigationResult.NO_MATCHING_CLASS;
    }

    public String expand() {
        return TreeRenderer.renderTree(current);
    }

    /**
     * Case-insensitive match of {@code query} against the identifier of every node under
     * the cursor, cursor included, in pre-order.
     */
    public List<HtmlNode> search(String query) {
        String needle = query == null ? "" : query.toLowerCase(Locale.ROOT);
        List<HtmlNode> results = new ArrayList<>();
        searchTree(current, needle, results);
        logger.debug("Search '{}' under <{}> matched {} nodes", needle, current.getTag(), results.size());
        return results;
    }

    public String breadcrumbs() {
        return TreeRenderer.breadcrumbs(current);
    }

    private void searchTree(HtmlNode node, String needle, List<HtmlNode> results) {
        if (TreeRenderer.formatIdentifier(node).toLowerCase(Locale.ROOT).contains(needle)) {
            results.add(node);
        }
        for (HtmlNode child : node.getChildren()) {
            searchTree(child, needle, results);
        }
    }

    private NavigationResult moveTo(HtmlNode target) {
        current = target;
        return NavigationResult.MOVED;
    }

    private Integer parseIndex(String arg) {
        try {
            return Integer.parseInt(arg.strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
