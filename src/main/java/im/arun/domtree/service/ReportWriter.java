package im.arun.domtree.service;

import im.arun.domtree.model.TextBlocks;
import im.arun.domtree.util.TreeRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Plain text report: page sentences, block text grouped by tag, then the rendered class tree.
 */
public class ReportWriter {
    private static final Logger logger = LoggerFactory.getLogger(ReportWriter.class);

    static final String SEPARATOR = "-".repeat(50);

    public String render(PageAnalysis analysis) {
        StringBuilder report = new StringBuilder();
        report.append("Processed Text:\n");
        for (String sentence : analysis.getSentences()) {
            report.append(sentence).append('\n');
        }
        report.append("\n---\nExtracted Text Blocks:\n");
        TextBlocks blocks = analysis.getTextBlocks();
        for (Map.Entry<String, List<String>> entry : blocks.asMap().entrySet()) {
            report.append(entry.getKey()).append(":\n");
            for (String text : entry.getValue()) {
                report.append("  - ").append(text).append('\n');
            }
            report.append(SEPARATOR).append('\n');
        }
        report.append("\nClass Tree:\n").append(TreeRenderer.renderTree(analysis.getRoot()));
        return report.toString();
    }

    public void write(PageAnalysis analysis, Path destination) throws IOException {
        Path parent = destination.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(destination, render(analysis), StandardCharsets.UTF_8);
        logger.info("Results written to {}", destination);
    }
}
