package im.arun.domtree.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.domtree.dom.ParseMode;
import im.arun.domtree.tree.TextMode;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class DomTreeConfig {
    @JsonProperty("block_tags")
    private List<String> blockTags = new ArrayList<>(List.of("div", "p", "span"));

    @JsonProperty("text_mode")
    private TextMode textMode = TextMode.EXCLUSIVE;

    @JsonProperty("parse_mode")
    private ParseMode parseMode = ParseMode.FRAGMENT;

    @JsonProperty("json_output")
    private String jsonOutput = "output.json";

    @JsonProperty("report_output")
    private String reportOutput = "scraped_output.txt";

    @JsonProperty("max_retries")
    private int maxRetries = 3;

    @JsonProperty("retry_delay_ms")
    private long retryDelayMs = 2000;

    @JsonProperty("proxy")
    private String proxy;

    @JsonProperty("user_agent")
    private String userAgent = "domtree/1.0";

    @JsonProperty("connect_timeout_seconds")
    private int connectTimeoutSeconds = 30;

    @JsonProperty("read_timeout_seconds")
    private int readTimeoutSeconds = 60;
}
