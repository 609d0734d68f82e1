package im.arun.domtree.dom;

import java.util.List;
import java.util.Optional;

/**
 * Capability set the tree builder needs from a parsed markup document.
 * Text, comments and the document wrapper itself report no element name.
 */
public interface ParsedNode {

    Optional<String> elementName();

    /**
     * Values of the class attribute in source order, duplicates kept.
     */
    List<String> classList();

    List<? extends ParsedNode> children();
}
