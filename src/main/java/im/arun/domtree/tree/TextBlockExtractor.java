package im.arun.domtree.tree;

import im.arun.domtree.model.TextBlocks;
import im.arun.domtree.util.TextUtils;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Collects stripped text per block tag from the parsed document.
 * Works on jsoup elements because {@link im.arun.domtree.model.HtmlNode} keeps no text.
 */
public class TextBlockExtractor {
    private static final Logger logger = LoggerFactory.getLogger(TextBlockExtractor.class);

    public static final List<String> DEFAULT_BLOCK_TAGS = List.of("div", "p", "span");

    private final Set<String> blockTags;
    private final TextMode mode;

    public TextBlockExtractor() {
        this(DEFAULT_BLOCK_TAGS, TextMode.EXCLUSIVE);
    }

    public TextBlockExtractor(List<String> blockTags, TextMode mode) {
        this.blockTags = new LinkedHashSet<>();
        for (String tag : blockTags == null ? DEFAULT_BLOCK_TAGS : blockTags) {
            this.blockTags.add(tag.toLowerCase(Locale.ROOT));
        }
        this.mode = mode == null ? TextMode.EXCLUSIVE : mode;
    }

    public TextBlocks extract(Element root) {
        TextBlocks blocks = new TextBlocks();
        if (root == null) {
            return blocks;
        }

        int matched = 0;
        for (Element element : root.getAllElements()) {
            if (!blockTags.contains(element.normalName())) {
                continue;
            }
            matched++;
            StringBuilder text = new StringBuilder();
            appendText(element, text);
            if (text.length() > 0) {
                blocks.add(element.normalName(), text.toString());
            }
        }

        logger.debug("Scanned {} block elements ({} mode)", matched, mode);
        return blocks;
    }

    /**
     * Stripped text of every text node under {@code root}, concatenated in document order.
     */
    public String fullText(Element root) {
        if (root == null) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode) {
                text.append(TextUtils.strip(((TextNode) node).getWholeText()));
            }
        }, root);
        return text.toString();
    }

    private void appendText(Element element, StringBuilder out) {
        for (Node child : element.childNodes()) {
            if (child instanceof TextNode) {
                out.append(TextUtils.strip(((TextNode) child).getWholeText()));
            } else if (child instanceof Element) {
                Element nested = (Element) child;
                if (mode == TextMode.EXCLUSIVE && blockTags.contains(nested.normalName())) {
                    continue;
                }
                appendText(nested, out);
            }
        }
    }
}
