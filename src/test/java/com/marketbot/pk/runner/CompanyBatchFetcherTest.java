package com.marketbot.pk.runner;

import com.marketbot.pk.model.BatchFetchResult;
import com.marketbot.pk.parse.CompanyPageParser;
import com.marketbot.pk.parse.LogoResolver;
import com.marketbot.pk.support.FakeHttpFetcher;
import com.marketbot.pk.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompanyBatchFetcherTest {
    private static final String TEMPLATE = "https://psx.test/company/%s";

    @Test
    void fetchAll_shouldSkipFailingSymbolAndKeepOrder() {
        String page = Fixtures.read("company_abc.html");
        FakeHttpFetcher fetcher = new FakeHttpFetcher();
        for (String symbol : List.of("AAA", "BBB", "DDD", "EEE")) {
            fetcher.respond(String.format(TEMPLATE, symbol), page);
        }
        CompanyBatchFetcher batchFetcher = newFetcher(fetcher);

        BatchFetchResult result = batchFetcher.fetchAll(List.of("AAA", "BBB", "CCC", "DDD", "EEE"), 2, 0L, 0L);

        assertFalse(result.interrupted);
        assertEquals(List.of("AAA", "BBB", "DDD", "EEE"), List.copyOf(result.companies.keySet()));
        assertEquals(1, result.errors.size());
        assertTrue(result.errors.get(0).startsWith("CCC: "), result.errors.get(0));
        assertTrue(result.errors.get(0).contains("HTTP 404"), result.errors.get(0));
        assertEquals(5, fetcher.requested().size());
        assertEquals("ABC Cement Limited", result.companies.get("DDD").info.getName());
    }

    @Test
    void fetchAll_shouldNameSymbolWhenLoadThrowsError() {
        String page = Fixtures.read("company_abc.html");
        FakeHttpFetcher fetcher = new FakeHttpFetcher()
                .respond(String.format(TEMPLATE, "AAA"), page)
                .crash(String.format(TEMPLATE, "CCC"), new StackOverflowError("deep page"))
                .respond(String.format(TEMPLATE, "DDD"), page);

        BatchFetchResult result = newFetcher(fetcher).fetchAll(List.of("AAA", "CCC", "DDD"), 3, 0L, 0L);

        assertEquals(List.of("AAA", "DDD"), List.copyOf(result.companies.keySet()));
        assertEquals(List.of("CCC: java.lang.StackOverflowError: deep page"), result.errors);
    }

    @Test
    void fetchAll_shouldReturnEmptyForNoSymbols() {
        BatchFetchResult result = newFetcher(new FakeHttpFetcher()).fetchAll(List.of(), 5, 0L, 0L);

        assertTrue(result.companies.isEmpty());
        assertTrue(result.errors.isEmpty());
        assertFalse(result.interrupted);
    }

    @Test
    void fetchAll_shouldKeepEmptyPageAsEmptyRecord() {
        FakeHttpFetcher fetcher = new FakeHttpFetcher()
                .respond(String.format(TEMPLATE, "AAA"), "<html><body>maintenance</body></html>");

        BatchFetchResult result = newFetcher(fetcher).fetchAll(List.of("AAA"), 1, 0L, 0L);

        assertEquals(1, result.companies.size());
        assertTrue(result.companies.get("AAA").fundamentals.isEmpty());
    }

    @Test
    void shouldLogProgress_shouldLogEveryNthAndLast() {
        assertTrue(CompanyBatchFetcher.shouldLogProgress(50, 120, 50));
        assertFalse(CompanyBatchFetcher.shouldLogProgress(51, 120, 50));
        assertTrue(CompanyBatchFetcher.shouldLogProgress(120, 120, 50));
        assertFalse(CompanyBatchFetcher.shouldLogProgress(3, 10, 0));
        assertTrue(CompanyBatchFetcher.shouldLogProgress(10, 10, 0));
    }

    private static CompanyBatchFetcher newFetcher(FakeHttpFetcher fetcher) {
        CompanyPageParser parser = new CompanyPageParser(new LogoResolver("https://psx.test", Map.of()));
        return new CompanyBatchFetcher(fetcher, parser, TEMPLATE, 2);
    }
}
