package im.arun.domtree.tree;

/**
 * Which text a block element is credited with during extraction.
 */
public enum TextMode {
    /** Skip text inside nested block elements; each fragment is reported once. */
    EXCLUSIVE,
    /** All descendant text; an outer block repeats the text of the blocks it contains. */
    NESTED
}
