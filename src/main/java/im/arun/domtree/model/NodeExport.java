package im.arun.domtree.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Acyclic form of a node subtree as written to JSON.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"tag", "classes", "children"})
public class NodeExport {

    @JsonProperty("tag")
    private String tag;

    @JsonProperty("classes")
    private List<String> classes = new ArrayList<>();

    @JsonProperty("children")
    private List<NodeExport> children = new ArrayList<>();

    public static NodeExport from(HtmlNode node) {
        List<NodeExport> exportedChildren = new ArrayList<>(node.getChildren().size());
        for (HtmlNode child : node.getChildren()) {
            exportedChildren.add(from(child));
        }
        return new NodeExport(node.getTag(), new ArrayList<>(node.getClasses()), exportedChildren);
    }
}
