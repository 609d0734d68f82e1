package im.arun.domtree.dom;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Exposes a jsoup node through {@link ParsedNode}.
 */
public final class JsoupParsedNode implements ParsedNode {

    private final Node node;

    private JsoupParsedNode(Node node) {
        this.node = node;
    }

    public static JsoupParsedNode of(Node node) {
        if (node == null) {
            throw new IllegalArgumentException("node must not be null");
        }
        return new JsoupParsedNode(node);
    }

    @Override
    public Optional<String> elementName() {
        if (node instanceof Element && !(node instanceof Document)) {
            return Optional.of(((Element) node).normalName());
        }
        return Optional.empty();
    }

    @Override
    public List<String> classList() {
        if (!(node instanceof Element)) {
            return List.of();
        }
        // Element.classNames() collapses duplicates, so split the raw attribute instead
        String raw = node.attr("class").strip();
        if (raw.isEmpty()) {
            return List.of();
        }
        return List.of(raw.split("\\s+"));
    }

    @Override
    public List<JsoupParsedNode> children() {
        List<Node> childNodes = node.childNodes();
        List<JsoupParsedNode> wrapped = new ArrayList<>(childNodes.size());
        for (Node child : childNodes) {
            wrapped.add(new JsoupParsedNode(child));
        }
        return wrapped;
    }
}
