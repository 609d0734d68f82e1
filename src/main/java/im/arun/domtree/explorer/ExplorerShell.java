package im.arun.domtree.explorer;

import im.arun.domtree.model.HtmlNode;
import im.arun.domtree.util.TreeRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;

/**
 * Line-oriented session around a {@link TreeExplorer}: one command per line until
 * {@code exit} or end of input.
 */
public class ExplorerShell {
    private static final Logger logger = LoggerFactory.getLogger(ExplorerShell.class);

    static final String PROMPT = "Command (ls, cd <index/class>, cd .., expand, search <text>, exit): ";

    private final TreeExplorer explorer;
    private final BufferedReader in;
    private final PrintWriter out;

    public ExplorerShell(TreeExplorer explorer, BufferedReader in, PrintWriter out) {
        this.explorer = explorer;
        this.in = in;
        this.out = out;
    }

    /**
     * Run until {@code exit} or end of input.
     *
     * @return number of commands processed
     * @throws IOException if reading a command fails
     */
    public int run() throws IOException {
        int processed = 0;
        while (true) {
            out.println();
            out.println("Path: " + explorer.breadcrumbs());
            printChildren();
            out.println();
            out.print(PROMPT);
            out.flush();

            String line = in.readLine();
            if (line == null) {
                logger.debug("Input closed after {} commands", processed);
                break;
            }
            processed++;
            if (!execute(line.strip())) {
                break;
            }
        }
        out.flush();
        return processed;
    }

    /**
     * @return false when the session should end
     */
    boolean execute(String command) {
        String lower = command.toLowerCase(Locale.ROOT);

        if (lower.equals("ls")) {
            return true;
        } else if (lower.startsWith("cd ")) {
            NavigationResult result = explorer.changeDirectory(command.substring(3).strip());
            if (!result.moved()) {
                out.println(result.getMessage());
            }
        } else if (lower.equals("expand")) {
            out.println();
            out.println("Subtree from current node:");
            out.println(explorer.expand());
        } else if (lower.equals("search") || lower.startsWith("search ")) {
            printSearchResults(explorer.search(command.substring("search".length()).strip()));
        } else if (lower.equals("exit")) {
            out.println("Exiting explorer.");
            return false;
        } else {
            out.println("Unknown command.");
        }
        return true;
    }

    private void printChildren() {
        List<HtmlNode> children = explorer.listChildren();
        if (children.isEmpty()) {
            out.println("No children.");
            return;
        }
        out.println("Children:");
        for (int i = 0; i < children.size(); i++) {
            out.println("  [" + i + "] " + TreeRenderer.formatIdentifier(children.get(i)));
        }
    }

    private void printSearchResults(List<HtmlNode> results) {
        if (results.isEmpty()) {
            out.println("No matches found.");
            return;
        }
        out.println("Search Results:");
        for (int i = 0; i < results.size(); i++) {
            out.println("  [" + i + "] " + TreeRenderer.formatIdentifier(results.get(i)));
        }
    }
}
