package im.arun.domtree.explorer;

/**
 * Outcome of a {@code cd} command. Anything but {@link #MOVED} leaves the cursor in place.
 */
public enum NavigationResult {
    MOVED(null),
    ALREADY_AT_ROOT("Already at the root."),
    INDEX_OUT_OF_RANGE("Index out of range."),
    NO_MATCHING_CLASS("No matching class found.");

    private final String message;

    NavigationResult(String message) {
        this.message = message;
    }

    public boolean moved() {
        return this == MOVED;
    }

    public String getMessage() {
        return message;
    }
}
