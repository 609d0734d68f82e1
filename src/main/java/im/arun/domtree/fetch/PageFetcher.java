package im.arun.domtree.fetch;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.util.concurrent.TimeUnit;

/**
 * Fetches raw page markup over HTTP with a fixed number of attempts and an optional proxy.
 */
public class PageFetcher {
    private static final Logger logger = LoggerFactory.getLogger(PageFetcher.class);

    private final OkHttpClient httpClient;
    private final int maxRetries;
    private final long retryDelayMs;
    private final String userAgent;

    public PageFetcher(int maxRetries, long retryDelayMs, String proxy, String userAgent,
                       int connectTimeoutSeconds, int readTimeoutSeconds) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1, got " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.retryDelayMs = Math.max(0, retryDelayMs);
        this.userAgent = userAgent;

        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .connectTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(readTimeoutSeconds, TimeUnit.SECONDS)
                .followRedirects(true);
        if (proxy != null && !proxy.isBlank()) {
            builder.proxy(parseProxy(proxy));
        }
        this.httpClient = builder.build();
    }

    /**
     * GET {@code url} and return the body as text.
     *
     * @throws FetchException when every attempt failed
     */
    public String fetch(String url) {
        IOException lastFailure = null;
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            try {
                String body = executeRequest(url);
                logger.info("Successfully fetched the page: {}", url);
                return body;
            } catch (IOException e) {
                lastFailure = e;
                logger.error("Attempt {}/{} to fetch {} failed: {}", attempt + 1, maxRetries, url, e.getMessage());
                if (attempt < maxRetries - 1) {
                    sleepBeforeRetry();
                }
            }
        }
        throw new FetchException(url, maxRetries, lastFailure);
    }

    private String executeRequest(String url) throws IOException {
        Request.Builder request = new Request.Builder().url(url).get();
        if (userAgent != null && !userAgent.isBlank()) {
            request.header("User-Agent", userAgent);
        }

        try (Response response = httpClient.newCall(request.build()).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code() + " from " + url);
            }
            ResponseBody body = response.body();
            return body != null ? body.string() : "";
        }
    }

    private void sleepBeforeRetry() {
        try {
            Thread.sleep(retryDelayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during retry wait", ie);
        }
    }

    static Proxy parseProxy(String proxy) {
        String hostPort = proxy.replaceFirst("^[a-zA-Z]+://", "");
        int colon = hostPort.lastIndexOf(':');
        if (colon <= 0 || colon == hostPort.length() - 1) {
            throw new IllegalArgumentException("Proxy must be host:port, got: " + proxy);
        }
        String host = hostPort.substring(0, colon);
        int port;
        try {
            port = Integer.parseInt(hostPort.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Proxy port is not a number: " + proxy, e);
        }
        return new Proxy(Proxy.Type.HTTP, InetSocketAddress.createUnresolved(host, port));
    }
}
