package im.arun.domtree.explorer;

import static org.assertj.core.api.Assertions.assertThat;

import im.arun.domtree.dom.JsoupParsedNode;
import im.arun.domtree.dom.MarkupParser;
import im.arun.domtree.model.HtmlNode;
import im.arun.domtree.tree.HtmlTreeBuilder;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ExplorerShell Tests")
class ExplorerShellTest {

    private HtmlNode root;

    @BeforeEach
    void setUp() {
        String markup = "<div class=\"a\"><p>X</p><span class=\"b\">Y</span></div>";
        root = new HtmlTreeBuilder().build(JsoupParsedNode.of(new MarkupParser().parse(markup))).orElseThrow();
    }

    @Test
    @DisplayName("should print path and children before each prompt")
    void shouldPrintPathAndChildren() throws IOException {
        String output = run("ls\nexit\n");

        assertThat(output).contains("Path: div (a)", "Children:", "  [0] p", "  [1] span (b)", ExplorerShell.PROMPT);
        assertThat(output).endsWith("Exiting explorer.\n");
    }

    @Test
    @DisplayName("should navigate with cd and report misses")
    void shouldNavigate() throws IOException {
        String output = run("cd ..\ncd 7\ncd nope\ncd b\ncd ..\nCD 0\nexit\n");

        assertThat(output).contains(
            "Already at the root.",
            "Index out of range.",
            "No matching class found.",
            "Path: div (a) > span (b)",
            "Path: div (a) > p",
            "No children.");
    }

    @Test
    @DisplayName("should expand and search from the cursor")
    void shouldExpandAndSearch() throws IOException {
        String output = run("expand\nsearch SPAN\nsearch zzz\nsearch\nexit\n");

        assertThat(output).contains(
            "Subtree from current node:",
            "└── div (a)\n    ├── p\n    └── span (b)",
            "Search Results:\n  [0] span (b)",
            "No matches found.",
            "Search Results:\n  [0] div (a)\n  [1] p\n  [2] span (b)");
    }

    @Test
    @DisplayName("should report unknown commands and stop at end of input")
    void shouldHandleUnknownCommandAndEof() throws IOException {
        StringWriter buffer = new StringWriter();
        ExplorerShell shell = new ExplorerShell(new TreeExplorer(root),
            new BufferedReader(new StringReader("dance\n\n")), new PrintWriter(buffer));

        int processed = shell.run();

        assertThat(processed).isEqualTo(2);
        assertThat(buffer.toString()).contains("Unknown command.").doesNotContain("Exiting explorer.");
    }

    @Test
    @DisplayName("should never change the tree while navigating")
    void shouldLeaveTreeUntouched() throws IOException {
        run("cd 1\nexpand\nsearch p\ncd ..\nexit\n");

        assertThat(root.getChildren()).hasSize(2);
        assertThat(root.getChildren()).allSatisfy(child -> assertThat(child.getParent()).isSameAs(root));
    }

    private String run(String input) throws IOException {
        StringWriter buffer = new StringWriter();
        PrintWriter out = new PrintWriter(buffer);
        new ExplorerShell(new TreeExplorer(root), new BufferedReader(new StringReader(input)), out).run();
        return buffer.toString();
    }
}
