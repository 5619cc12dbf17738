package com.marketbot.data.http;

import com.marketbot.pk.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Locale;

/**
 * Plain GET client shared by every scraper. One timeout and one header set for all requests;
 * failures come back as {@link FetchResult} values so batch callers can keep going.
 */
public class HttpFetcher {
    private static final Logger LOG = LogManager.getLogger(HttpFetcher.class);

    private final HttpClient client;
    private final int timeoutSec;
    private final String userAgent;

    public HttpFetcher(Config config) {
        this.timeoutSec = Math.max(3, config.getInt("fetch.timeout_sec", 30));
        int connectTimeoutSec = Math.max(1, config.getInt("fetch.connect_timeout_sec", 15));
        this.userAgent = config.getString("fetch.user_agent", "marketbot-pk/1.0");
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(connectTimeoutSec))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public FetchResult fetch(String url) {
        long started = System.nanoTime();
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(timeoutSec))
                    .header("User-Agent", userAgent)
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header("Accept-Language", "en-US,en;q=0.9")
                    .header("Cache-Control", "no-cache")
                    .GET()
                    .build();
        } catch (IllegalArgumentException | NullPointerException e) {
            return FetchResult.failed(url, "invalid url: " + e.getMessage(), FetchResult.CATEGORY_INVALID_URL, 0, 0L);
        }

        try {
            HttpResponse<String> resp = client.send(request, HttpResponse.BodyHandlers.ofString());
            long elapsed = elapsedMs(started);
            int status = resp.statusCode();
            if (status >= 200 && status < 300) {
                LOG.debug("GET {} -> {} in {}ms", url, status, elapsed);
                return FetchResult.success(url, resp.body(), status, elapsed);
            }
            LOG.warn("GET {} -> HTTP {}", url, status);
            return FetchResult.failed(url, "HTTP " + status, FetchResult.CATEGORY_HTTP_STATUS, status, elapsed);
        } catch (HttpTimeoutException e) {
            LOG.warn("GET {} timed out after {}s", url, timeoutSec);
            return FetchResult.failed(url, "timed out", FetchResult.CATEGORY_TIMEOUT, 0, elapsedMs(started));
        } catch (IOException e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            LOG.warn("GET {} failed: {}", url, message);
            return FetchResult.failed(url, message, classify(message), 0, elapsedMs(started));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failed(url, "interrupted", FetchResult.CATEGORY_INTERRUPTED, 0, elapsedMs(started));
        }
    }

    static String classify(String message) {
        String msg = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (msg.contains("timed out") || msg.contains("timeout")) {
            return FetchResult.CATEGORY_TIMEOUT;
        }
        return FetchResult.CATEGORY_NETWORK;
    }

    private long elapsedMs(long startedNanos) {
        return Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
    }
}
