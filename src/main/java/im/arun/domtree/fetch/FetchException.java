package im.arun.domtree.fetch;

import lombok.Getter;

/**
 * Raised when a page could not be fetched within the configured number of attempts.
 */
@Getter
public class FetchException extends RuntimeException {

    private final String url;
    private final int attempts;

    public FetchException(String url, int attempts, Throwable cause) {
        super("Failed to fetch " + url + " after " + attempts + " attempts", cause);
        this.url = url;
        this.attempts = attempts;
    }
}
