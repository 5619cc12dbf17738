package com.marketbot.pk.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one job run, stored in the job log as JSON counts.
 */
public final class ScrapeResult {
    public static final String MODE_PRICES = "prices";
    public static final String MODE_FULL = "full";
    public static final String MODE_COMMODITIES = "commodities";
    public static final String MODE_SEED = "seed";

    private final String mode;
    private int symbolsFound;
    private int pricesUpdated;
    private int historySaved;
    private int companiesUpdated;
    private int fundamentalsUpdated;
    private int financialsSaved;
    private int skipped;
    private int commoditiesUpdated;
    private int companiesCreated;
    private final List<String> errors = new ArrayList<>();
    private long durationMs;

    public ScrapeResult(String mode) {
        this.mode = mode;
    }

    public void setSymbolsFound(int symbolsFound) {
        this.symbolsFound = symbolsFound;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = Math.max(0L, durationMs);
    }

    public void incCommoditiesUpdated() {
        commoditiesUpdated++;
    }

    public void incCompaniesCreated() {
        companiesCreated++;
    }

    public void incSkipped() {
        skipped++;
    }

    public void addError(String error) {
        if (error != null && !error.trim().isEmpty()) {
            errors.add(error);
        }
    }

    public void addErrors(List<String> more) {
        if (more == null) {
            return;
        }
        for (String error : more) {
            addError(error);
        }
    }

    /**
     * Adds the writer tallies and errors into this result.
     */
    public void merge(WriteCounts counts) {
        if (counts == null) {
            return;
        }
        pricesUpdated += counts.pricesUpdated();
        historySaved += counts.historySaved();
        companiesUpdated += counts.companiesUpdated();
        fundamentalsUpdated += counts.fundamentalsUpdated();
        financialsSaved += counts.financialsSaved();
        skipped += counts.skipped();
        addErrors(counts.errors());
    }

    public String mode() {
        return mode;
    }

    public int symbolsFound() {
        return symbolsFound;
    }

    public int pricesUpdated() {
        return pricesUpdated;
    }

    public int historySaved() {
        return historySaved;
    }

    public int companiesUpdated() {
        return companiesUpdated;
    }

    public int fundamentalsUpdated() {
        return fundamentalsUpdated;
    }

    public int financialsSaved() {
        return financialsSaved;
    }

    public int skipped() {
        return skipped;
    }

    public int commoditiesUpdated() {
        return commoditiesUpdated;
    }

    public int companiesCreated() {
        return companiesCreated;
    }

    public List<String> errors() {
        return Collections.unmodifiableList(errors);
    }

    public long durationMs() {
        return durationMs;
    }

    public Map<String, Object> toCounts() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("mode", mode);
        out.put("symbols_found", symbolsFound);
        out.put("prices_updated", pricesUpdated);
        out.put("history_saved", historySaved);
        out.put("companies_updated", companiesUpdated);
        out.put("fundamentals_updated", fundamentalsUpdated);
        out.put("financials_saved", financialsSaved);
        out.put("skipped", skipped);
        if (MODE_COMMODITIES.equals(mode)) {
            out.put("commodities_updated", commoditiesUpdated);
        }
        if (MODE_SEED.equals(mode)) {
            out.put("companies_created", companiesCreated);
        }
        out.put("errors", errors.size());
        out.put("duration_ms", durationMs);
        return out;
    }

    @Override
    public String toString() {
        return "ScrapeResult" + toCounts();
    }
}
