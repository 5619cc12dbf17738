package com.marketbot.data.http;

import com.marketbot.pk.config.Config;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpFetcherTest {

    @Test
    void fetch_shouldReportInvalidUrlWithoutThrowing() {
        HttpFetcher fetcher = new HttpFetcher(Config.of(Map.of()));

        FetchResult result = fetcher.fetch("not a url");

        assertFalse(result.success);
        assertEquals(FetchResult.CATEGORY_INVALID_URL, result.errorCategory);
        assertEquals("", result.body);
    }

    @Test
    void fetch_shouldRejectNonHttpScheme() {
        FetchResult result = new HttpFetcher(Config.of(Map.of())).fetch("ftp://dps.psx.com.pk/market-watch");

        assertFalse(result.success);
        assertEquals(FetchResult.CATEGORY_INVALID_URL, result.errorCategory);
    }

    @Test
    void classify_shouldSeparateTimeoutsFromNetworkErrors() {
        assertEquals(FetchResult.CATEGORY_TIMEOUT, HttpFetcher.classify("Connect timed out"));
        assertEquals(FetchResult.CATEGORY_TIMEOUT, HttpFetcher.classify("read timeout"));
        assertEquals(FetchResult.CATEGORY_NETWORK, HttpFetcher.classify("Connection refused"));
        assertEquals(FetchResult.CATEGORY_NETWORK, HttpFetcher.classify(null));
    }

    @Test
    void requireBody_shouldRaiseFailureAsException() throws FetchException {
        FetchResult ok = FetchResult.success("https://x", "<html></html>", 200, 12L);
        assertEquals("<html></html>", ok.requireBody());

        FetchResult failed = FetchResult.failed("https://x", "HTTP 503", FetchResult.CATEGORY_HTTP_STATUS, 503, 40L);
        FetchException e = assertThrows(FetchException.class, failed::requireBody);
        assertEquals("https://x", e.url());
        assertEquals(503, e.statusCode());
        assertEquals(FetchResult.CATEGORY_HTTP_STATUS, e.category());
        assertTrue(e.getMessage().contains("HTTP 503"));
    }
}
