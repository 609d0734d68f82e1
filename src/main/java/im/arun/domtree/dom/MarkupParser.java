package im.arun.domtree.dom;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw markup into a jsoup structure. The returned element is the root handed
 * to the tree builder and to text block extraction.
 */
public class MarkupParser {
    private static final Logger logger = LoggerFactory.getLogger(MarkupParser.class);

    private final ParseMode mode;

    public MarkupParser() {
        this(ParseMode.FRAGMENT);
    }

    public MarkupParser(ParseMode mode) {
        this.mode = mode == null ? ParseMode.FRAGMENT : mode;
    }

    public Element parse(String markup) {
        if (markup == null) {
            throw new IllegalArgumentException("markup must not be null");
        }

        if (mode == ParseMode.DOCUMENT) {
            Document document = Jsoup.parse(markup);
            logger.debug("Parsed {} chars as full document", markup.length());
            return document;
        }

        Document fragment = Jsoup.parseBodyFragment(markup);
        Element body = fragment.body();
        Element single = singleTopLevelElement(body);
        logger.debug("Parsed {} chars as fragment, root <{}>", markup.length(),
            single != null ? single.normalName() : body.normalName());
        return single != null ? single : body;
    }

    public ParseMode getMode() {
        return mode;
    }

    private Element singleTopLevelElement(Element body) {
        Element found = null;
        for (Node child : body.childNodes()) {
            if (child instanceof Element) {
                if (found != null) {
                    return null;
                }
                found = (Element) child;
            } else if (child instanceof TextNode && !((TextNode) child).isBlank()) {
                return null;
            }
        }
        return found;
    }
}
