package im.arun.domtree.config;

import static org.assertj.core.api.Assertions.assertThat;

import im.arun.domtree.dom.ParseMode;
import im.arun.domtree.tree.TextMode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ConfigLoader Tests")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should load bundled defaults")
    void shouldLoadBundledDefaults() {
        DomTreeConfig config = new ConfigLoader().load(null);

        assertThat(config.getBlockTags()).containsExactly("div", "p", "span");
        assertThat(config.getTextMode()).isEqualTo(TextMode.EXCLUSIVE);
        assertThat(config.getParseMode()).isEqualTo(ParseMode.FRAGMENT);
        assertThat(config.getJsonOutput()).isEqualTo("output.json");
        assertThat(config.getMaxRetries()).isEqualTo(3);
    }

    @Test
    @DisplayName("should prefer an explicit config file")
    void shouldPreferExplicitFile() throws IOException {
        Path file = tempDir.resolve("custom.yaml");
        Files.writeString(file, "block_tags: [li, td]\ntext_mode: nested\nparse_mode: DOCUMENT\nmax_retries: 5\n");

        DomTreeConfig config = new ConfigLoader(file.toString()).load(Map.of());

        assertThat(config.getBlockTags()).containsExactly("li", "td");
        assertThat(config.getTextMode()).isEqualTo(TextMode.NESTED);
        assertThat(config.getParseMode()).isEqualTo(ParseMode.DOCUMENT);
        assertThat(config.getMaxRetries()).isEqualTo(5);
        assertThat(config.getReportOutput()).isEqualTo("scraped_output.txt");
    }

    @Test
    @DisplayName("should fall back to defaults when the config file is missing")
    void shouldFallBackWhenFileMissing() {
        DomTreeConfig config = new ConfigLoader(tempDir.resolve("missing.yaml").toString()).load(null);

        assertThat(config.getBlockTags()).containsExactly("div", "p", "span");
    }

    @Test
    @DisplayName("should merge user options in snake and camel case")
    void shouldMergeUserOptions() {
        Map<String, Object> options = new HashMap<>();
        options.put("block_tags", "h1, h2 ,p");
        options.put("textMode", "nested");
        options.put("json_output", "out/tree.json");
        options.put("retryDelayMs", 10);
        options.put("proxy", null);
        options.put("unknown_key", "ignored");

        DomTreeConfig config = new ConfigLoader().load(options);

        assertThat(config.getBlockTags()).containsExactly("h1", "h2", "p");
        assertThat(config.getTextMode()).isEqualTo(TextMode.NESTED);
        assertThat(config.getJsonOutput()).isEqualTo("out/tree.json");
        assertThat(config.getRetryDelayMs()).isEqualTo(10);
        assertThat(config.getProxy()).isNull();
    }

    @Test
    @DisplayName("should keep the previous value when an option is invalid")
    void shouldIgnoreInvalidOption() {
        DomTreeConfig config = new ConfigLoader().load(Map.of("parse_mode", "sideways", "max_retries", "many"));

        assertThat(config.getParseMode()).isEqualTo(ParseMode.FRAGMENT);
        assertThat(config.getMaxRetries()).isEqualTo(3);
    }

    @Test
    @DisplayName("should not leak changes between loads")
    void shouldReturnIndependentCopies() {
        ConfigLoader loader = new ConfigLoader();
        DomTreeConfig first = loader.load(null);
        first.getBlockTags().add("li");

        assertThat(loader.load(null).getBlockTags()).isEqualTo(List.of("div", "p", "span"));
    }
}
