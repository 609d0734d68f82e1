package im.arun.domtree.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Block text grouped by tag name. Tags keep the order in which they were first seen,
 * texts keep document order.
 */
public class TextBlocks {

    private final Map<String, List<String>> blocks = new LinkedHashMap<>();

    public void add(String tag, String text) {
        blocks.computeIfAbsent(tag, key -> new ArrayList<>()).add(text);
    }

    public List<String> get(String tag) {
        List<String> texts = blocks.get(tag);
        return texts == null ? List.of() : Collections.unmodifiableList(texts);
    }

    public Map<String, List<String>> asMap() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        blocks.forEach((tag, texts) -> copy.put(tag, List.copyOf(texts)));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return blocks.toString();
    }
}
