package im.arun.domtree.tree;

import im.arun.domtree.dom.ParsedNode;
import im.arun.domtree.model.HtmlNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Builds an {@link HtmlNode} tree from a parsed document, depth-first in pre-order.
 *
 * <p>Nodes without an element name (text, comments, the document wrapper) do not become
 * tree nodes, but their children are still visited so nested elements are attached to the
 * nearest element ancestor.
 */
public class HtmlTreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(HtmlTreeBuilder.class);

    /**
     * Build the tree rooted at the first element of {@code documentRoot}.
     *
     * @return the root node, or empty when the document holds no element at all
     */
    public Optional<HtmlNode> build(ParsedNode documentRoot) {
        if (documentRoot == null) {
            return Optional.empty();
        }

        List<HtmlNode> topLevel = new ArrayList<>();
        collect(documentRoot, null, topLevel::add);

        if (topLevel.isEmpty()) {
            logger.info("No elements found in document, nothing to build");
            return Optional.empty();
        }
        if (topLevel.size() > 1) {
            logger.warn("Document has {} top-level elements, keeping the first <{}> and dropping {}",
                topLevel.size(), topLevel.get(0).getTag(), topLevel.size() - 1);
        }
        return Optional.of(topLevel.get(0));
    }

    private void collect(ParsedNode source, HtmlNode parent, Consumer<HtmlNode> sink) {
        Optional<String> name = source.elementName().filter(n -> !n.isEmpty());

        if (name.isEmpty()) {
            for (ParsedNode child : source.children()) {
                collect(child, parent, sink);
            }
            return;
        }

        HtmlNode node = new HtmlNode(name.get(), source.classList(), parent);
        for (ParsedNode child : source.children()) {
            collect(child, node, node::addChild);
        }
        sink.accept(node);
    }
}
