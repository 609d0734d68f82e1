package im.arun.domtree.service;

import im.arun.domtree.model.HtmlNode;
import im.arun.domtree.model.TextBlocks;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.jsoup.nodes.Element;

import java.util.List;

/**
 * Parsed source, the tree built from it, its block text and its sentences.
 */
@Getter
@AllArgsConstructor
public class PageAnalysis {

    private final Element source;

    private final HtmlNode root;

    private final TextBlocks textBlocks;

    /** Stripped page text split into sentences. */
    private final List<String> sentences;
}
