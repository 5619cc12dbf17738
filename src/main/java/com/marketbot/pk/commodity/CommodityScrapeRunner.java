package com.marketbot.pk.commodity;

import com.marketbot.data.http.FetchResult;
import com.marketbot.data.http.HttpFetcher;
import com.marketbot.pk.config.Config;
import com.marketbot.pk.db.CommodityDao;
import com.marketbot.pk.model.CommodityRate;
import com.marketbot.pk.model.ScrapeResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.List;
import java.util.function.Function;

/**
 * Refreshes gold and silver rates. A failing source is recorded and the other still runs.
 */
public class CommodityScrapeRunner {
    private static final Logger LOG = LogManager.getLogger(CommodityScrapeRunner.class);

    private final HttpFetcher fetcher;
    private final CommodityRateParser parser;
    private final CommodityDao commodityDao;
    private final String goldUrl;
    private final String silverUrl;

    public CommodityScrapeRunner(Config config, HttpFetcher fetcher, CommodityRateParser parser, CommodityDao commodityDao) {
        this.fetcher = fetcher;
        this.parser = parser;
        this.commodityDao = commodityDao;
        this.goldUrl = config.getString("commodity.gold_url");
        this.silverUrl = config.getString("commodity.silver_url");
    }

    public ScrapeResult run() {
        long started = System.nanoTime();
        ScrapeResult result = new ScrapeResult(ScrapeResult.MODE_COMMODITIES);

        refresh("gold", goldUrl, parser::parseGold, result);
        refresh("silver", silverUrl, parser::parseSilver, result);

        result.setDurationMs((System.nanoTime() - started) / 1_000_000L);
        LOG.info("commodity scrape done: found={}, updated={}, skipped={}, errors={}",
                result.symbolsFound(), result.commoditiesUpdated(), result.skipped(), result.errors().size());
        return result;
    }

    private void refresh(String label, String url, Function<String, List<CommodityRate>> parse, ScrapeResult result) {
        if (url == null || url.trim().isEmpty()) {
            LOG.info("{} source not configured", label);
            return;
        }
        FetchResult fetched = fetcher.fetch(url);
        if (!fetched.success) {
            result.addError(label + ": " + fetched.errorCategory + " " + fetched.error);
            LOG.warn("{} rates unavailable: {}", label, fetched.error);
            return;
        }
        List<CommodityRate> rates = parse.apply(fetched.body);
        if (rates.isEmpty()) {
            result.addError(label + ": no rates found at " + url);
            return;
        }
        result.setSymbolsFound(result.symbolsFound() + rates.size());
        for (CommodityRate rate : rates) {
            try {
                if (commodityDao.updatePrice(rate.getName(), rate.getPrice(), rate.getSource())) {
                    result.incCommoditiesUpdated();
                } else {
                    result.incSkipped();
                    LOG.debug("no commodity row named {}", rate.getName());
                }
            } catch (SQLException | RuntimeException e) {
                result.addError(rate.getName() + ": " + e.getMessage());
            }
        }
    }
}
