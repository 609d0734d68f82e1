package im.arun.domtree.dom;

/**
 * How markup is handed to jsoup.
 */
public enum ParseMode {
    /** Full HTML document; jsoup adds implied html, head and body elements. */
    DOCUMENT,
    /** Body fragment; a lone top-level element becomes the root as written. */
    FRAGMENT
}
