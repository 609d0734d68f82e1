package im.arun.domtree.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import im.arun.domtree.model.HtmlNode;
import im.arun.domtree.model.NodeExport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes node subtrees as JSON without parent links, and reads exported files back.
 * Output uses two-space indentation for both objects and arrays, {@code "key": value}
 * field spacing and {@code []} for empty arrays.
 */
public class TreeExporter {
    private static final Logger logger = LoggerFactory.getLogger(TreeExporter.class);

    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;

    public TreeExporter() {
        this.objectMapper = new ObjectMapper();

        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        Separators separators = Separators.createDefaultInstance()
                .withObjectFieldValueSpacing(Separators.Spacing.AFTER)
                .withArrayEmptySeparator("")
                .withObjectEmptySeparator("");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter(separators);
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        this.writer = objectMapper.writer(printer);
    }

    public String toJson(HtmlNode node) {
        return toJson(NodeExport.from(node));
    }

    public String toJson(NodeExport export) {
        try {
            return writer.writeValueAsString(export);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize tree rooted at <" + export.getTag() + ">", e);
        }
    }

    /**
     * Write the subtree rooted at {@code node} to {@code destination}, creating parent
     * directories as needed.
     *
     * @throws IOException if the destination cannot be written
     */
    public void write(HtmlNode node, Path destination) throws IOException {
        Path parent = destination.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(destination, toJson(node), StandardCharsets.UTF_8);
        logger.info("Exported tree rooted at <{}> to {}", node.getTag(), destination);
    }

    public NodeExport read(Path source) throws IOException {
        return objectMapper.readValue(source.toFile(), NodeExport.class);
    }

    public NodeExport fromJson(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, NodeExport.class);
    }
}
