package com.marketbot.pk.runner;

import com.marketbot.data.http.FetchException;
import com.marketbot.data.http.HttpFetcher;
import com.marketbot.pk.model.BatchFetchResult;
import com.marketbot.pk.model.CompanyFullData;
import com.marketbot.pk.parse.CompanyPageParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Fetches and parses company pages in fixed-size windows. Within a window the requests start
 * {@code perRequestDelayMs} apart; the next window starts only after the current one finished
 * and {@code interBatchDelayMs} passed. A failing symbol is recorded and skipped.
 */
public class CompanyBatchFetcher {
    private static final Logger LOG = LogManager.getLogger(CompanyBatchFetcher.class);

    private final HttpFetcher fetcher;
    private final CompanyPageParser parser;
    private final String companyUrlTemplate;
    private final int progressEvery;

    /**
     * @param companyUrlTemplate absolute URL with one {@code %s} for the symbol
     */
    public CompanyBatchFetcher(HttpFetcher fetcher, CompanyPageParser parser, String companyUrlTemplate, int progressEvery) {
        this.fetcher = fetcher;
        this.parser = parser;
        this.companyUrlTemplate = companyUrlTemplate;
        this.progressEvery = Math.max(0, progressEvery);
    }

    public BatchFetchResult fetchAll(List<String> symbols, int batchSize, long interBatchDelayMs, long perRequestDelayMs) {
        Map<String, CompanyFullData> companies = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        if (symbols == null || symbols.isEmpty()) {
            return new BatchFetchResult(companies, errors, false);
        }
        int window = Math.max(1, batchSize);
        int total = symbols.size();
        int completed = 0;
        long startedNanos = System.nanoTime();
        boolean interrupted = false;

        ExecutorService pool = Executors.newFixedThreadPool(window);
        try {
            for (int start = 0; start < total && !interrupted; start += window) {
                List<String> batch = symbols.subList(start, Math.min(start + window, total));
                CompletionService<Loaded> completion = new ExecutorCompletionService<>(pool);
                Map<Future<Loaded>, String> submitted = new HashMap<>();
                for (int j = 0; j < batch.size(); j++) {
                    String symbol = batch.get(j);
                    long delayMs = j * Math.max(0L, perRequestDelayMs);
                    submitted.put(completion.submit(() -> load(symbol, delayMs)), symbol);
                }

                Map<String, CompanyFullData> windowResults = new LinkedHashMap<>();
                for (int i = 0; i < batch.size(); i++) {
                    Future<Loaded> future;
                    try {
                        future = completion.take();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        interrupted = true;
                        break;
                    }
                    try {
                        Loaded loaded = future.get();
                        if (loaded.data != null) {
                            windowResults.put(loaded.symbol, loaded.data);
                        } else {
                            errors.add(loaded.symbol + ": " + loaded.error);
                            LOG.debug("company {} skipped: {}", loaded.symbol, loaded.error);
                        }
                    } catch (ExecutionException e) {
                        String symbol = submitted.get(future);
                        errors.add(symbol + ": " + e.getCause());
                        LOG.warn("company {} failed: {}", symbol, e.getCause().toString());
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        interrupted = true;
                        break;
                    }
                    completed++;
                    if (shouldLogProgress(completed, total, progressEvery)) {
                        LOG.info("company pages {}/{} fetched, ok={}, failed={}, elapsed_ms={}",
                                completed, total, companies.size() + windowResults.size(), errors.size(),
                                (System.nanoTime() - startedNanos) / 1_000_000L);
                    }
                }
                for (String symbol : batch) {
                    CompanyFullData data = windowResults.get(symbol);
                    if (data != null) {
                        companies.put(symbol, data);
                    }
                }

                boolean more = start + window < total;
                if (more && !interrupted && interBatchDelayMs > 0) {
                    try {
                        Thread.sleep(interBatchDelayMs);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        interrupted = true;
                    }
                }
            }
        } finally {
            if (interrupted) {
                pool.shutdownNow();
            } else {
                pool.shutdown();
            }
        }

        if (interrupted) {
            LOG.warn("company fetch interrupted after {}/{} symbols", completed, total);
        }
        return new BatchFetchResult(companies, errors, interrupted);
    }

    /**
     * Fetches and parses one company page.
     */
    public CompanyFullData fetchCompany(String symbol) throws FetchException {
        String url = String.format(Locale.ROOT, companyUrlTemplate, symbol);
        String html = fetcher.fetch(url).requireBody();
        return parser.parseCompanyPage(html, symbol);
    }

    private Loaded load(String symbol, long delayMs) throws InterruptedException {
        if (delayMs > 0) {
            Thread.sleep(delayMs);
        }
        try {
            return Loaded.ok(symbol, fetchCompany(symbol));
        } catch (FetchException e) {
            return Loaded.failed(symbol, e.getMessage());
        } catch (RuntimeException e) {
            return Loaded.failed(symbol, "parse failed: " + e);
        }
    }

    static boolean shouldLogProgress(int completed, int total, int logEvery) {
        if (completed >= total) {
            return true;
        }
        if (logEvery <= 0) {
            return false;
        }
        return completed % logEvery == 0;
    }

    private static final class Loaded {
        final String symbol;
        final CompanyFullData data;
        final String error;

        private Loaded(String symbol, CompanyFullData data, String error) {
            this.symbol = symbol;
            this.data = data;
            this.error = error;
        }

        static Loaded ok(String symbol, CompanyFullData data) {
            return new Loaded(symbol, data, null);
        }

        static Loaded failed(String symbol, String error) {
            return new Loaded(symbol, null, error);
        }
    }
}
