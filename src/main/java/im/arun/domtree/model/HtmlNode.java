package im.arun.domtree.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One element of the built tree.
 * Children are owned by this node in document order; the parent link is a
 * back-reference only and is never serialized.
 */
@Getter
public class HtmlNode {

    private final String tag;

    private final List<String> classes;

    @Getter(AccessLevel.NONE)
    private final List<HtmlNode> children = new ArrayList<>();

    private final HtmlNode parent;

    public HtmlNode(String tag, List<String> classes, HtmlNode parent) {
        if (tag == null || tag.isEmpty()) {
            throw new IllegalArgumentException("Node tag must not be empty");
        }
        this.tag = tag;
        this.classes = classes == null ? List.of() : List.copyOf(classes);
        this.parent = parent;
    }

    public List<HtmlNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Appends a child built against this node. The child's parent link must already
     * point here, otherwise the tree would disagree with its back-references.
     */
    public void addChild(HtmlNode child) {
        if (child.parent != this) {
            throw new IllegalArgumentException(
                "Child <" + child.tag + "> was built for a different parent than <" + tag + ">");
        }
        children.add(child);
    }

    public boolean isRoot() {
        return parent == null;
    }

    @Override
    public String toString() {
        return "HtmlNode{tag='" + tag + "', classes=" + classes + ", children=" + children.size() + "}";
    }
}
