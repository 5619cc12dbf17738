package com.marketbot.pk.runner;

import com.marketbot.data.http.FetchException;
import com.marketbot.data.http.HttpFetcher;
import com.marketbot.pk.config.Config;
import com.marketbot.pk.db.CompanyDao;
import com.marketbot.pk.db.MetadataDao;
import com.marketbot.pk.db.StockDao;
import com.marketbot.pk.db.mybatis.CompanyRow;
import com.marketbot.pk.model.BatchFetchResult;
import com.marketbot.pk.model.CompanyFullData;
import com.marketbot.pk.model.MarketWatchRow;
import com.marketbot.pk.model.ScrapeResult;
import com.marketbot.pk.parse.LogoResolver;
import com.marketbot.pk.parse.MarketWatchParser;
import com.marketbot.pk.writer.MarketDataWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Runs the PSX jobs: daily listing refresh, full detail scrape, single-company scrape and
 * listing seed. A listing page that cannot be fetched or read fails the whole run.
 */
public class PsxScrapeRunner {
    private static final Logger LOG = LogManager.getLogger(PsxScrapeRunner.class);

    private final HttpFetcher fetcher;
    private final MarketWatchParser listingParser;
    private final CompanyBatchFetcher batchFetcher;
    private final MarketDataWriter writer;
    private final CompanyDao companyDao;
    private final StockDao stockDao;
    private final MetadataDao metadataDao;
    private final Clock clock;

    private final String listingUrl;
    private final int batchSize;
    private final long batchDelayMs;
    private final long requestDelayMs;

    public PsxScrapeRunner(
            Config config,
            HttpFetcher fetcher,
            MarketWatchParser listingParser,
            CompanyBatchFetcher batchFetcher,
            MarketDataWriter writer,
            CompanyDao companyDao,
            StockDao stockDao,
            MetadataDao metadataDao,
            Clock clock
    ) {
        this.fetcher = fetcher;
        this.listingParser = listingParser;
        this.batchFetcher = batchFetcher;
        this.writer = writer;
        this.companyDao = companyDao;
        this.stockDao = stockDao;
        this.metadataDao = metadataDao;
        this.clock = clock == null
                ? Clock.system(ZoneId.of(config.getString("schedule.zone", "Asia/Karachi")))
                : clock;

        this.listingUrl = trimSlash(config.getString("psx.base_url")) + config.getString("psx.market_watch_path");
        this.batchSize = Math.max(1, config.getInt("batch.size", 5));
        this.batchDelayMs = Math.max(0L, config.getLong("batch.delay_ms", 1000L));
        this.requestDelayMs = Math.max(0L, config.getLong("batch.request_delay_ms", 300L));
    }

    public ScrapeResult runDaily() throws FetchException {
        long started = System.nanoTime();
        ScrapeResult result = new ScrapeResult(ScrapeResult.MODE_PRICES);

        List<MarketWatchRow> rows = fetchListing();
        result.setSymbolsFound(rows.size());
        result.merge(writer.applyDaily(rows, LocalDate.now(clock)));

        result.setDurationMs(elapsedMs(started));
        markRun(MetadataDao.LAST_DAILY_AT);
        LOG.info("daily scrape done: symbols={}, prices={}, history={}, skipped={}, errors={}, elapsed_ms={}",
                result.symbolsFound(), result.pricesUpdated(), result.historySaved(),
                result.skipped(), result.errors().size(), result.durationMs());
        return result;
    }

    /**
     * Listing refresh followed by detail pages for {@code symbols}, or for every listed symbol
     * when none are given.
     */
    public ScrapeResult runFull(List<String> symbols) throws FetchException {
        long started = System.nanoTime();
        ScrapeResult result = new ScrapeResult(ScrapeResult.MODE_FULL);

        List<MarketWatchRow> rows = fetchListing();
        result.setSymbolsFound(rows.size());
        result.merge(writer.applyDaily(rows, LocalDate.now(clock)));
        LOG.info("full scrape listing phase: symbols={}, prices={}", rows.size(), result.pricesUpdated());

        List<String> targets = normalizeSymbols(symbols);
        if (targets.isEmpty()) {
            List<String> listed = new ArrayList<>();
            for (MarketWatchRow row : rows) {
                listed.add(row.getSymbol());
            }
            targets = normalizeSymbols(listed);
        }
        LOG.info("full scrape detail phase: {} companies, batch_size={}", targets.size(), batchSize);

        BatchFetchResult batch = batchFetcher.fetchAll(targets, batchSize, batchDelayMs, requestDelayMs);
        result.addErrors(batch.errors);
        result.merge(writer.applyFull(batch.companies.values()));

        result.setDurationMs(elapsedMs(started));
        if (!batch.interrupted) {
            markRun(MetadataDao.LAST_FULL_AT);
        }
        LOG.info("full scrape done: symbols={}, details={}, companies={}, fundamentals={}, financials={}, errors={}, elapsed_ms={}",
                result.symbolsFound(), batch.companies.size(), result.companiesUpdated(),
                result.fundamentalsUpdated(), result.financialsSaved(), result.errors().size(), result.durationMs());
        return result;
    }

    public Optional<CompanyFullData> scrapeCompany(String symbol) {
        List<String> normalized = normalizeSymbols(List.of(symbol == null ? "" : symbol));
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(batchFetcher.fetchCompany(normalized.get(0)));
        } catch (FetchException e) {
            LOG.warn("company {} unavailable: {}", normalized.get(0), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Inserts a company and an empty stock row for every listed symbol not yet stored.
     */
    public ScrapeResult seedListing() throws FetchException {
        long started = System.nanoTime();
        ScrapeResult result = new ScrapeResult(ScrapeResult.MODE_SEED);
        List<MarketWatchRow> rows = fetchListing();
        result.setSymbolsFound(rows.size());

        for (MarketWatchRow row : rows) {
            String symbol = row.getSymbol();
            try {
                Optional<Long> created = companyDao.insertIfAbsent(
                        symbol, row.getName(), row.getSectorName(), row.getSectorCode(), LogoResolver.placeholderUrl(symbol));
                Optional<CompanyRow> company = companyDao.findBySymbol(symbol);
                if (company.isPresent()) {
                    stockDao.insertIfAbsent(company.get().getId());
                }
                if (created.isPresent()) {
                    result.incCompaniesCreated();
                } else {
                    result.incSkipped();
                }
            } catch (SQLException | RuntimeException e) {
                result.addError(symbol + " seed: " + e.getMessage());
            }
        }
        result.setDurationMs(elapsedMs(started));
        LOG.info("listing seed done: symbols={}, created={}, existing={}, errors={}",
                result.symbolsFound(), result.companiesCreated(), result.skipped(), result.errors().size());
        return result;
    }

    List<MarketWatchRow> fetchListing() throws FetchException {
        String html = fetcher.fetch(listingUrl).requireBody();
        List<MarketWatchRow> rows = listingParser.parseListing(html);
        LOG.info("market-watch parsed {} rows from {}", rows.size(), listingUrl);
        return rows;
    }

    static List<String> normalizeSymbols(List<String> symbols) {
        if (symbols == null) {
            return List.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String symbol : symbols) {
            if (symbol == null) {
                continue;
            }
            String s = symbol.trim().toUpperCase(Locale.ROOT);
            if (!s.isEmpty()) {
                out.add(s);
            }
        }
        return new ArrayList<>(out);
    }

    private void markRun(String key) {
        try {
            metadataDao.put(key, Instant.now(clock).toString());
        } catch (SQLException e) {
            LOG.warn("failed to record {}: {}", key, e.getMessage());
        }
    }

    private static long elapsedMs(long startedNanos) {
        return Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
    }

    private static String trimSlash(String url) {
        String out = url == null ? "" : url.trim();
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
