package im.arun.domtree.service;

import im.arun.domtree.config.DomTreeConfig;
import im.arun.domtree.dom.JsoupParsedNode;
import im.arun.domtree.dom.MarkupParser;
import im.arun.domtree.export.TreeExporter;
import im.arun.domtree.fetch.PageFetcher;
import im.arun.domtree.model.HtmlNode;
import im.arun.domtree.model.TextBlocks;
import im.arun.domtree.tree.HtmlTreeBuilder;
import im.arun.domtree.tree.TextBlockExtractor;
import im.arun.domtree.util.TextUtils;
import im.arun.domtree.util.TreeRenderer;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs the parse, build, extract and export steps for one page.
 */
public class DomTreeService {
    private static final Logger logger = LoggerFactory.getLogger(DomTreeService.class);

    private final DomTreeConfig config;
    private final MarkupParser markupParser;
    private final HtmlTreeBuilder treeBuilder;
    private final TextBlockExtractor textBlockExtractor;
    private final TreeExporter treeExporter;
    private final ReportWriter reportWriter;
    private PageFetcher pageFetcher;

    public DomTreeService(DomTreeConfig config) {
        this.config = config;
        this.markupParser = new MarkupParser(config.getParseMode());
        this.treeBuilder = new HtmlTreeBuilder();
        this.textBlockExtractor = new TextBlockExtractor(config.getBlockTags(), config.getTextMode());
        this.treeExporter = new TreeExporter();
        this.reportWriter = new ReportWriter();
    }

    public PageAnalysis analyze(String markup) {
        Element source = markupParser.parse(markup);
        HtmlNode root = treeBuilder.build(JsoupParsedNode.of(source)).orElse(null);
        TextBlocks blocks = textBlockExtractor.extract(source);
        List<String> sentences = TextUtils.splitSentences(textBlockExtractor.fullText(source));

        if (root != null) {
            logger.info("Built tree of {} nodes rooted at <{}>", TreeRenderer.countNodes(root), root.getTag());
        } else {
            logger.warn("No elements found in markup ({} chars)", markup.length());
        }
        return new PageAnalysis(source, root, blocks, sentences);
    }

    public PageAnalysis analyzeUrl(String url) {
        return analyze(fetcher().fetch(url));
    }

    /**
     * Write the JSON export and the text report. A missing tree writes nothing.
     *
     * @return true if outputs were written
     */
    public boolean writeOutputs(PageAnalysis analysis, Path jsonPath, Path reportPath) throws IOException {
        if (analysis.getRoot() == null) {
            logger.warn("Skipping export, document produced no tree");
            return false;
        }
        if (jsonPath != null) {
            treeExporter.write(analysis.getRoot(), jsonPath);
        }
        if (reportPath != null) {
            reportWriter.write(analysis, reportPath);
        }
        return true;
    }

    private PageFetcher fetcher() {
        if (pageFetcher == null) {
            pageFetcher = new PageFetcher(
                config.getMaxRetries(),
                config.getRetryDelayMs(),
                config.getProxy(),
                config.getUserAgent(),
                config.getConnectTimeoutSeconds(),
                config.getReadTimeoutSeconds());
        }
        return pageFetcher;
    }
}
