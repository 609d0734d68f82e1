package im.arun.domtree.cli;

import im.arun.domtree.config.ConfigLoader;
import im.arun.domtree.config.DomTreeConfig;
import im.arun.domtree.explorer.ExplorerShell;
import im.arun.domtree.explorer.TreeExplorer;
import im.arun.domtree.service.DomTreeService;
import im.arun.domtree.service.PageAnalysis;
import im.arun.domtree.util.TreeRenderer;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for domtree using Picocli.
 */
@Command(
    name = "domtree",
    description = "Build an element tree from HTML, export it as JSON and explore it interactively",
    mixinStandardHelpOptions = true,
    version = "domtree 1.0"
)
public class DomTreeCLI implements Callable<Integer> {

    static final int EXIT_EMPTY_TREE = 2;

    @Spec
    private CommandSpec spec;

    @Option(names = {"--input"}, description = "HTML file to read, or - for standard input")
    private String inputPath;

    @Option(names = {"--url"}, description = "Fetch the page from this URL instead of reading a file")
    private String url;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--json"}, description = "Output JSON file path (default from config)")
    private String jsonOutput;

    @Option(names = {"--report"}, description = "Output text report path (default from config)")
    private String reportOutput;

    @Option(names = {"--parse-mode"}, description = "fragment or document")
    private String parseMode;

    @Option(names = {"--text-mode"}, description = "exclusive or nested")
    private String textMode;

    @Option(names = {"--block-tags"}, description = "Comma separated tags to collect text for")
    private String blockTags;

    @Option(names = {"--proxy"}, description = "HTTP proxy as host:port")
    private String proxy;

    @Option(names = {"--explore"}, description = "Open the interactive explorer after export")
    private boolean explore;

    private final InputStream stdin;

    public DomTreeCLI() {
        this(System.in);
    }

    DomTreeCLI(InputStream stdin) {
        this.stdin = stdin;
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if ((inputPath == null) == (url == null)) {
            err.println("Error: exactly one of --input or --url must be given");
            return 1;
        }
        if ("-".equals(inputPath) && explore) {
            err.println("Error: --explore reads commands from standard input, so --input - cannot be used with it");
            return 1;
        }

        DomTreeConfig config = new ConfigLoader(configPath).load(userOptions());
        DomTreeService service = new DomTreeService(config);

        PageAnalysis analysis;
        try {
            if (url != null) {
                analysis = service.analyzeUrl(url);
            } else {
                String markup = readInput();
                if (markup == null) {
                    err.println("Error: HTML file not found: " + inputPath);
                    return 1;
                }
                analysis = service.analyze(markup);
            }
        } catch (Exception e) {
            err.println("Error processing document: " + e.getMessage());
            return 1;
        }

        if (analysis.getRoot() == null) {
            err.println("No elements found, nothing to export.");
            return EXIT_EMPTY_TREE;
        }

        Path jsonPath = Paths.get(config.getJsonOutput());
        Path reportPath = Paths.get(config.getReportOutput());
        try {
            service.writeOutputs(analysis, jsonPath, reportPath);
        } catch (IOException e) {
            err.println("Error: could not write output: " + e.getMessage());
            return 1;
        }

        out.println("Tree: " + TreeRenderer.countNodes(analysis.getRoot()) + " nodes, root "
            + TreeRenderer.formatIdentifier(analysis.getRoot()));
        out.println("JSON written to: " + jsonPath);
        out.println("Report written to: " + reportPath);
        out.flush();

        if (explore) {
            BufferedReader in = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8));
            new ExplorerShell(new TreeExplorer(analysis.getRoot()), in, out).run();
        }
        return 0;
    }

    private Map<String, Object> userOptions() {
        Map<String, Object> options = new HashMap<>();
        options.put("json_output", jsonOutput);
        options.put("report_output", reportOutput);
        options.put("parse_mode", parseMode);
        options.put("text_mode", textMode);
        options.put("block_tags", blockTags);
        options.put("proxy", proxy);
        return options;
    }

    private String readInput() throws IOException {
        if ("-".equals(inputPath)) {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        Path path = Paths.get(inputPath);
        if (!Files.exists(path)) {
            return null;
        }
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DomTreeCLI()).execute(args);
        System.exit(exitCode);
    }
}
